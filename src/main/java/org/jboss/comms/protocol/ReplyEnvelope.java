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

package org.jboss.comms.protocol;

import org.wildfly.common.Assert;

/**
 * The content of a {@link MessageKind#REMOTE_CALL_REPLY} message.  The payload holds either the return value or,
 * if {@link #isError()}, an {@link org.jboss.comms.ErrorDescriptor ErrorDescriptor}.
 */
public final class ReplyEnvelope implements Envelope {

    private static final long serialVersionUID = 4477320863920142275L;

    private final String callName;
    private final String callId;
    private final boolean error;

    /**
     * Construct a new instance.
     *
     * @param callName the name of the called function (mostly for diagnostics)
     * @param callId the identifier of the call being replied to
     * @param error {@code true} if the payload is an error descriptor
     */
    public ReplyEnvelope(final String callName, final String callId, final boolean error) {
        Assert.checkNotNullParam("callName", callName);
        Assert.checkNotNullParam("callId", callId);
        this.callName = callName;
        this.callId = callId;
        this.error = error;
    }

    public String getCallName() {
        return callName;
    }

    public String getCallId() {
        return callId;
    }

    /**
     * Determine whether this reply carries an error.
     *
     * @return {@code true} if the payload is an error descriptor
     */
    public boolean isError() {
        return error;
    }

    /**
     * Get a copy of this envelope with the error flag set.
     *
     * @return the error envelope
     */
    public ReplyEnvelope asError() {
        return error ? this : new ReplyEnvelope(callName, callId, true);
    }

    public String toString() {
        return (error ? "error reply " : "reply ") + callName + " [" + callId + "]";
    }
}
