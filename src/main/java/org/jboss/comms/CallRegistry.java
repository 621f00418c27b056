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

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.jboss.comms._private.Messages;
import org.wildfly.common.Assert;

/**
 * The set of calls an endpoint exposes to the other side, keyed by call name.
 */
public final class CallRegistry {

    private final ConcurrentMap<String, CallHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Register a call handler, replacing any handler of the same name.
     *
     * @param callName the call name
     * @param handler the handler, or {@code null} to unregister
     */
    public void register(final String callName, final CallHandler handler) {
        Assert.checkNotNullParam("callName", callName);
        if (handler == null) {
            handlers.remove(callName);
        } else {
            handlers.put(callName, handler);
        }
    }

    public void unregister(final String callName) {
        Assert.checkNotNullParam("callName", callName);
        handlers.remove(callName);
    }

    public CallHandler getHandler(final String callName) {
        return handlers.get(callName);
    }

    public Set<String> getCallNames() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    /**
     * Run the handler registered under the given name.
     *
     * @param callName the call name
     * @param arguments the call arguments
     * @return the handler's return value
     * @throws NoSuchCallException if no handler is registered under that name
     * @throws Exception if the handler fails
     */
    public Object invoke(final String callName, final CallArguments arguments) throws Exception {
        final CallHandler handler = handlers.get(callName);
        if (handler == null) {
            throw Messages.log.noSuchCall(callName);
        }
        return handler.handleCall(arguments);
    }
}
