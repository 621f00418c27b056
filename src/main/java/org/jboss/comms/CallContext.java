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

/**
 * The context of the call being handled on the current thread.
 */
public final class CallContext {

    private static final ThreadLocal<String> CALLING_CHANNEL = new ThreadLocal<>();

    private CallContext() {
    }

    /**
     * Get the identifier of the channel on which the call currently being handled arrived.
     *
     * @return the channel identifier, or {@code null} if the current thread is not handling a call
     */
    public static String getCallingChannelId() {
        return CALLING_CHANNEL.get();
    }

    static String enter(final String channelId) {
        final String old = CALLING_CHANNEL.get();
        CALLING_CHANNEL.set(channelId);
        return old;
    }

    static void exit(final String previous) {
        if (previous == null) {
            CALLING_CHANNEL.remove();
        } else {
            CALLING_CHANNEL.set(previous);
        }
    }
}
