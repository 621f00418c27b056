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

package org.jboss.comms.util;

import java.io.IOException;
import java.util.Collections;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.jboss.comms.AsyncErrorHandler;
import org.jboss.comms.CallCallback;
import org.jboss.comms.ErrorDescriptor;
import org.jboss.comms.ErrorKindRegistry;
import org.jboss.comms._private.Messages;
import org.jboss.comms.protocol.ReplyEnvelope;
import org.wildfly.common.Assert;

/**
 * A call tracker, which correlates replies with the calls that are waiting for them.
 * <p>
 * Only calls which are blocking or carry a callback are tracked; fire-and-forget calls cost nothing here and can
 * never be matched to a reply.  Each tracked call is resolved at most once: the entry is atomically removed by
 * whichever of the reply or the timeout gets to it first, and anything arriving later for that id is treated as
 * unmatched.
 */
public final class CallTracker {

    private final ConcurrentMap<String, PendingCall> waitlist = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReplySlot> inbox = new ConcurrentHashMap<>();
    private final AsyncErrorHandler asyncErrorHandler;
    private final ErrorKindRegistry errorKindRegistry;

    /**
     * Construct a new instance.
     *
     * @param asyncErrorHandler the handler for error replies no caller is waiting for
     * @param errorKindRegistry the registry used to rebuild remote errors for blocking callers
     */
    public CallTracker(final AsyncErrorHandler asyncErrorHandler, final ErrorKindRegistry errorKindRegistry) {
        Assert.checkNotNullParam("asyncErrorHandler", asyncErrorHandler);
        Assert.checkNotNullParam("errorKindRegistry", errorKindRegistry);
        this.asyncErrorHandler = asyncErrorHandler;
        this.errorKindRegistry = errorKindRegistry;
    }

    /**
     * Generate a fresh call identifier.
     *
     * @return the call identifier
     */
    public String issueCallId() {
        String callId;
        do {
            callId = UUID.randomUUID().toString().replace("-", "");
        } while (waitlist.containsKey(callId) || inbox.containsKey(callId));
        return callId;
    }

    /**
     * Register interest in the reply to a call.  This must happen before the call is sent.
     *
     * @param callId the call identifier
     * @param callName the call name
     * @param blocking {@code true} if the caller will wait for the reply
     * @param callback the callback to run on a successful reply, or {@code null} for none
     * @return {@code true} if the call is tracked, {@code false} if it is fire-and-forget
     */
    public boolean register(final String callId, final String callName, final boolean blocking, final CallCallback callback) {
        Assert.checkNotNullParam("callId", callId);
        if (! blocking && callback == null) {
            return false;
        }
        if (blocking) {
            inbox.put(callId, new ReplySlot());
        }
        waitlist.put(callId, new PendingCall(callId, callName, blocking, callback));
        return true;
    }

    /**
     * Deliver a reply.  Never throws, except when a callback throws; in that case all bookkeeping for the call has
     * already been completed.
     *
     * @param reply the reply envelope
     * @param value the decoded reply payload (the return value, or an error descriptor)
     * @return {@code true} if the reply matched an outstanding call
     */
    public boolean dispatchReply(final ReplyEnvelope reply, final Object value) {
        final String callId = reply.getCallId();
        final PendingCall call = waitlist.remove(callId);
        if (call == null) {
            if (reply.isError()) {
                asyncError(reply, value);
            } else {
                Messages.calls.unexpectedReply(reply.getCallName(), callId);
            }
            return false;
        }
        if (reply.isError() && ! call.isBlocking()) {
            asyncError(reply, value);
            return true;
        }
        final ReplySlot slot = call.isBlocking() ? inbox.get(callId) : null;
        try {
            final CallCallback callback = call.getCallback();
            if (callback != null && ! reply.isError()) {
                callback.handleReply(value);
            }
        } finally {
            if (slot != null) {
                slot.fill(reply, value);
            }
        }
        return true;
    }

    /**
     * Wait for the reply to a blocking call and consume it.
     *
     * @param callId the call identifier
     * @param callName the call name, for diagnostics
     * @param timeoutMillis the maximum time to wait, in milliseconds
     * @return the return value of the call
     * @throws org.jboss.comms.CommTimeoutException if no reply arrived in time
     * @throws org.jboss.comms.RemoteCallException if the call failed on the other side
     * @throws java.io.InterruptedIOException if the thread was interrupted while waiting
     * @throws IOException if waiting failed for another reason
     */
    public Object waitAndConsume(final String callId, final String callName, final long timeoutMillis) throws IOException {
        final ReplySlot slot = inbox.get(callId);
        if (slot == null) {
            throw new IllegalStateException("Call " + callId + " is not a tracked blocking call");
        }
        boolean filled;
        try {
            filled = slot.await(timeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            remove(callId);
            throw Messages.calls.replyWaitInterrupted(callName);
        }
        if (! filled) {
            remove(callId);
            // the reply may have won the race with the removal
            if (! slot.isFilled()) {
                throw Messages.calls.replyTimeout(callName, callId);
            }
        }
        inbox.remove(callId, slot);
        final Object value = slot.getValue();
        if (slot.isError()) {
            throw toDescriptor(slot.getEnvelope(), value).toException(errorKindRegistry);
        }
        return value;
    }

    /**
     * Unconditionally forget a call.  Used when the caller gives up, or when the outbound call definitely failed to
     * be written.
     *
     * @param callId the call identifier
     */
    public void remove(final String callId) {
        waitlist.remove(callId);
        inbox.remove(callId);
    }

    /**
     * Get the number of calls currently waiting for a reply.
     *
     * @return the number of outstanding calls
     */
    public int getPendingCount() {
        return waitlist.size();
    }

    /**
     * Determine whether a call is still waiting for its reply.
     *
     * @param callId the call identifier
     * @return {@code true} if the call is outstanding
     */
    public boolean isPending(final String callId) {
        return waitlist.containsKey(callId);
    }

    private void asyncError(final ReplyEnvelope reply, final Object value) {
        asyncErrorHandler.handleAsyncError(toDescriptor(reply, value));
    }

    private static ErrorDescriptor toDescriptor(final ReplyEnvelope reply, final Object value) {
        if (value instanceof ErrorDescriptor) {
            return (ErrorDescriptor) value;
        }
        // the other side sent something we cannot interpret as an error
        return new ErrorDescriptor(reply.getCallName(), reply.getCallId(), "unknown", String.valueOf(value), Collections.emptyList());
    }
}
