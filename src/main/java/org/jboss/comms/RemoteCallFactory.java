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

import org.wildfly.common.Assert;

/**
 * A source of remote calls bound to a target (one channel, or every open channel) and to a set of call settings.
 * Obtained from {@link CommEndpoint#remoteCall(String, CallSettings, CallCallback)} and its overloads.
 */
public final class RemoteCallFactory {

    private final CommEndpointImpl endpoint;
    private final String channelId;
    private final CallSettings settings;
    private final CallCallback callback;

    RemoteCallFactory(final CommEndpointImpl endpoint, final String channelId, final CallSettings settings, final CallCallback callback) {
        this.endpoint = endpoint;
        this.channelId = channelId;
        this.settings = settings;
        this.callback = callback;
    }

    /**
     * Get a call of the given name.
     *
     * @param callName the name of the call on the other side
     * @return the remote call
     */
    public RemoteCall call(final String callName) {
        Assert.checkNotNullParam("callName", callName);
        return new RemoteCall(this, callName);
    }

    /**
     * Invoke a call with positional arguments.
     *
     * @param callName the name of the call on the other side
     * @param args the positional arguments
     * @return the return value for a blocking call, or {@code null}
     * @throws IOException if the call fails
     */
    public Object invoke(final String callName, final Object... args) throws IOException {
        return call(callName).invoke(args);
    }

    /**
     * Get the target channel identifier.
     *
     * @return the channel identifier, or {@code null} if calls go to every open channel
     */
    public String getChannelId() {
        return channelId;
    }

    public CallSettings getSettings() {
        return settings;
    }

    public CallCallback getCallback() {
        return callback;
    }

    CommEndpointImpl getEndpoint() {
        return endpoint;
    }
}
