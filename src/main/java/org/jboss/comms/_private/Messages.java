/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2017 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.jboss.comms._private;

import static org.jboss.logging.Logger.Level.*;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.RejectedExecutionException;

import org.jboss.comms.CommException;
import org.jboss.comms.CommTimeoutException;
import org.jboss.comms.DecodeException;
import org.jboss.comms.NoSuchCallException;
import org.jboss.logging.BasicLogger;
import org.jboss.logging.Logger;
import org.jboss.logging.annotations.Cause;
import org.jboss.logging.annotations.LogMessage;
import org.jboss.logging.annotations.Message;
import org.jboss.logging.annotations.MessageLogger;

/**
 * All messages.
 */
@MessageLogger(projectCode = "COMMS")
public interface Messages extends BasicLogger {
    Messages log = Logger.getMessageLogger(Messages.class, "org.jboss.comms");
    Messages calls = Logger.getMessageLogger(Messages.class, "org.jboss.comms.calls");
    Messages channels = Logger.getMessageLogger(Messages.class, "org.jboss.comms.channels");

    // exceptions

    @Message(id = 100, value = "The comm is not connected")
    CommException channelNotOpen();

    @Message(id = 101, value = "No such call type: %s")
    NoSuchCallException noSuchCall(String callName);

    @Message(id = 102, value = "Timeout while waiting for the reply to %s (call id %s)")
    CommTimeoutException replyTimeout(String callName, String callId);

    @Message(id = 103, value = "Interrupted while waiting for the reply to %s")
    InterruptedIOException replyWaitInterrupted(String callName);

    @Message(id = 104, value = "Failed to decode the payload of a %s message")
    DecodeException decodeFailed(String kind, @Cause Throwable cause);

    @Message(id = 105, value = "Exception in comms call %s: %s: %s")
    String remoteCallFailed(String callName, String kind, String message);

    @Message(id = 106, value = "Codec version %d is outside of the supported range %d to %d")
    IllegalArgumentException invalidCodecVersion(int version, int min, int max);

    @Message(id = 107, value = "The endpoint is closed")
    CommException endpointClosed();

    @Message(id = 108, value = "A comm with id %s is already registered")
    IllegalArgumentException duplicateChannel(String channelId);

    @Message(id = 109, value = "Payload of type %s cannot be encoded")
    CommException notEncodable(String type, @Cause Throwable cause);

    @Message(id = 110, value = "Codec version %d is not supported; supported versions are %d to %d")
    CommException unsupportedCodecVersion(int version, int min, int max);

    @Message(id = 111, value = "Failed to decode payload")
    DecodeException undecodablePayload(@Cause Throwable cause);

    // logged errors

    @LogMessage(level = ERROR)
    @Message(id = 200, value = "Unclaimed error reply from the other side:%n%s")
    void asyncRemoteError(String formattedError);

    @LogMessage(level = ERROR)
    @Message(id = 201, value = "An exception occurred while handling a message on comm %s")
    void exceptionInReceiver(@Cause Throwable throwable, String channelId);

    @LogMessage(level = WARN)
    @Message(id = 202, value = "Failed to send the reply to %s [%s]")
    void replyFailed(@Cause IOException cause, String callName, String callId);

    @LogMessage(level = ERROR)
    @Message(id = 203, value = "Close handler %s failed")
    void closeHandlerFailed(@Cause Throwable throwable, Object handler);

    @LogMessage(level = WARN)
    @Message(id = 204, value = "Comm %s failed")
    void channelError(@Cause IOException cause, String channelId);

    @LogMessage(level = WARN)
    @Message(id = 205, value = "Ignoring repeated handshake on comm %s; codec version stays at %d")
    void duplicateHandshake(String channelId, int codecVersion);

    @LogMessage(level = WARN)
    @Message(id = 206, value = "Failed to send the handshake on comm %s")
    void handshakeFailed(@Cause IOException cause, String channelId);

    @LogMessage(level = WARN)
    @Message(id = 207, value = "Failed to close comm %s")
    void closeFailed(@Cause IOException cause, String channelId);

    @LogMessage(level = WARN)
    @Message(id = 208, value = "Rejected comm %s opened as \"%s\"")
    void channelRejected(@Cause Exception cause, String channelId, String name);

    @LogMessage(level = WARN)
    @Message(id = 209, value = "Dropped call %s received on comm %s; the endpoint is not accepting work")
    void callRejected(@Cause RejectedExecutionException cause, String callName, String channelId);

    // non i18n

    @LogMessage(level = DEBUG)
    @Message(value = "Call to unconnected comm: %s")
    void callToUnconnectedComm(String callName);

    @LogMessage(level = DEBUG)
    @Message(value = "Got an unexpected reply %s, id: %s")
    void unexpectedReply(String callName, String callId);

    @LogMessage(level = DEBUG)
    @Message(value = "Dropped a call received on comm %s")
    void callDropped(@Cause DecodeException cause, String channelId);

    @LogMessage(level = DEBUG)
    @Message(value = "No such message kind: %s")
    void unknownMessageKind(Object kind);

    @LogMessage(level = DEBUG)
    @Message(value = "Registered comm %s")
    void channelRegistered(String channelId);

    @LogMessage(level = DEBUG)
    @Message(value = "Removed comm %s")
    void channelRemoved(String channelId);

    @LogMessage(level = DEBUG)
    @Message(value = "Comm %s is ready (codec version %d)")
    void channelReady(String channelId, int codecVersion);

    @LogMessage(level = TRACE)
    @Message(value = "Received %s on comm %s")
    void messageReceived(Object header, String channelId);

    @LogMessage(level = TRACE)
    @Message(value = "Sent %s on comm %s")
    void messageSent(Object header, String channelId);
}
