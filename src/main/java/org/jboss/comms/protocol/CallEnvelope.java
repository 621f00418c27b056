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

import org.jboss.comms.CallSettings;
import org.wildfly.common.Assert;

/**
 * The content of a {@link MessageKind#REMOTE_CALL} message.  The arguments travel in the encoded payload.
 */
public final class CallEnvelope implements Envelope {

    private static final long serialVersionUID = -3190375563785094620L;

    private final String callName;
    private final String callId;
    private final CallSettings settings;

    /**
     * Construct a new instance.
     *
     * @param callName the name of the function to call
     * @param callId the call identifier
     * @param settings the call settings
     */
    public CallEnvelope(final String callName, final String callId, final CallSettings settings) {
        Assert.checkNotNullParam("callName", callName);
        Assert.checkNotNullParam("callId", callId);
        Assert.checkNotNullParam("settings", settings);
        this.callName = callName;
        this.callId = callId;
        this.settings = settings;
    }

    public String getCallName() {
        return callName;
    }

    public String getCallId() {
        return callId;
    }

    /**
     * Get the call settings.
     *
     * @return the call settings
     */
    public CallSettings getSettings() {
        return settings;
    }

    public String toString() {
        return "call " + callName + " [" + callId + "] " + settings;
    }
}
