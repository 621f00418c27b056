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

import java.io.IOException;
import java.util.Map;

/**
 * A named call on the other side of one or more channels.
 */
public final class RemoteCall {

    private final RemoteCallFactory factory;
    private final String callName;

    RemoteCall(final RemoteCallFactory factory, final String callName) {
        this.factory = factory;
        this.callName = callName;
    }

    /**
     * Invoke this call with positional arguments.
     *
     * @param args the positional arguments
     * @return the return value for a blocking call, or {@code null} otherwise
     * @throws CommException if a blocking call targets a channel which is not open
     * @throws CommTimeoutException if a blocking call got no reply in time
     * @throws RemoteCallException if the call failed on the other side
     * @throws IOException if the call could not be sent
     */
    public Object invoke(final Object... args) throws IOException {
        return invoke(args, null);
    }

    /**
     * Invoke this call with positional and keyword arguments.
     *
     * @param args the positional arguments
     * @param kwargs the keyword arguments
     * @return the return value for a blocking call, or {@code null} otherwise
     * @throws IOException if the call fails, as for {@link #invoke(Object...)}
     */
    public Object invoke(final Object[] args, final Map<String, ?> kwargs) throws IOException {
        return factory.getEndpoint().sendCall(factory.getChannelId(), callName, factory.getSettings(), factory.getCallback(), new CallArguments(args, kwargs));
    }

    public String getCallName() {
        return callName;
    }

    public String toString() {
        return "remote call " + callName + (factory.getChannelId() == null ? " (broadcast)" : " on " + factory.getChannelId());
    }
}
