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

import org.jboss.comms.CallCallback;

/**
 * An outstanding call which is waiting for its reply.
 */
public final class PendingCall {

    private final String callId;
    private final String callName;
    private final boolean blocking;
    private final CallCallback callback;

    PendingCall(final String callId, final String callName, final boolean blocking, final CallCallback callback) {
        this.callId = callId;
        this.callName = callName;
        this.blocking = blocking;
        this.callback = callback;
    }

    public String getCallId() {
        return callId;
    }

    public String getCallName() {
        return callName;
    }

    public boolean isBlocking() {
        return blocking;
    }

    /**
     * Get the callback to run on a successful reply.
     *
     * @return the callback, or {@code null} if there is none
     */
    public CallCallback getCallback() {
        return callback;
    }

    public String toString() {
        return "pending call " + callName + " [" + callId + "]";
    }
}
