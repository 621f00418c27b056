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

package org.jboss.comms;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jboss.comms._private.Messages;
import org.wildfly.common.Assert;

/**
 * A description of an error which was raised while executing a call on the other side.  It is captured where the
 * error is caught, travels in the payload of an error reply, and holds enough information to rebuild a throwable of
 * the same kind on the calling side.
 */
public final class ErrorDescriptor implements Serializable {

    private static final long serialVersionUID = -4305216432946508866L;

    private final String callName;
    private final String callId;
    private final String kind;
    private final String message;
    private final ArrayList<FrameDescriptor> frames;

    /**
     * Construct a new instance.
     *
     * @param callName the name of the call which failed
     * @param callId the identifier of the call which failed
     * @param kind the stable error kind identifier
     * @param message the error message, or {@code null} if there is none
     * @param frames the stack frames, innermost first
     */
    public ErrorDescriptor(final String callName, final String callId, final String kind, final String message, final List<FrameDescriptor> frames) {
        Assert.checkNotNullParam("callName", callName);
        Assert.checkNotNullParam("kind", kind);
        Assert.checkNotNullParam("frames", frames);
        this.callName = callName;
        this.callId = callId;
        this.kind = kind;
        this.message = message;
        this.frames = new ArrayList<>(frames);
    }

    /**
     * Capture the given throwable.
     *
     * @param callName the name of the call during which it was thrown
     * @param callId the identifier of that call
     * @param throwable the throwable
     * @return the descriptor
     */
    public static ErrorDescriptor capture(final String callName, final String callId, final Throwable throwable) {
        Assert.checkNotNullParam("throwable", throwable);
        final String kind = throwable instanceof UnknownRemoteException
            ? ((UnknownRemoteException) throwable).getKind()
            : throwable.getClass().getName();
        final StackTraceElement[] stackTrace = throwable.getStackTrace();
        final List<FrameDescriptor> frames = new ArrayList<>(stackTrace.length);
        for (StackTraceElement element : stackTrace) {
            frames.add(FrameDescriptor.of(element));
        }
        return new ErrorDescriptor(callName, callId, kind, throwable.getMessage(), frames);
    }

    public String getCallName() {
        return callName;
    }

    public String getCallId() {
        return callId;
    }

    /**
     * Get the error kind identifier.  By default this is the class name of the original throwable.
     *
     * @return the error kind
     */
    public String getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Get the remote stack frames, innermost first.
     *
     * @return the frames
     */
    public List<FrameDescriptor> getFrames() {
        return Collections.unmodifiableList(frames);
    }

    /**
     * Rebuild a throwable of the original kind, carrying the original message and the remote frames as its
     * stack trace.
     *
     * @param registry the registry used to resolve the kind
     * @return the rebuilt throwable
     */
    public Throwable toThrowable(final ErrorKindRegistry registry) {
        final Throwable throwable = registry.create(kind, message);
        final StackTraceElement[] stackTrace = new StackTraceElement[frames.size()];
        for (int i = 0; i < stackTrace.length; i++) {
            stackTrace[i] = frames.get(i).toStackTraceElement();
        }
        throwable.setStackTrace(stackTrace);
        return throwable;
    }

    /**
     * Build the exception which is thrown to a blocking caller when this error comes back.
     *
     * @param registry the registry used to resolve the kind
     * @return the exception
     */
    public RemoteCallException toException(final ErrorKindRegistry registry) {
        return new RemoteCallException(Messages.log.remoteCallFailed(callName, kind, message), this, toThrowable(registry));
    }

    /**
     * Format this error the way a stack trace is printed.
     *
     * @return the lines of the formatted error
     */
    public List<String> formatError() {
        final List<String> lines = new ArrayList<>(frames.size() + 2);
        lines.add("Exception in comms call " + callName + ":");
        for (FrameDescriptor frame : frames) {
            lines.add("\tat " + frame);
        }
        lines.add(message == null ? kind : kind + ": " + message);
        return lines;
    }

    /**
     * Format this error as a single string.
     *
     * @return the formatted error
     */
    public String format() {
        return String.join(System.lineSeparator(), formatError());
    }

    public String toString() {
        return message == null ? kind : kind + ": " + message;
    }
}
