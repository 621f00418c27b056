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
import java.util.concurrent.TimeUnit;

import org.wildfly.common.Assert;

/**
 * The settings of a remote call.  Instances are immutable; the {@code with*} methods return modified copies.
 * <p>
 * The {@code sendReply} flag is not set by users; it is computed for each invocation from the blocking flag and
 * the presence of a callback, and travels with the call so the other side knows whether to reply.
 */
public final class CallSettings implements Serializable {

    private static final long serialVersionUID = 6251849236004337152L;

    /**
     * Timeout value meaning "use the endpoint default".
     */
    public static final long DEFAULT_TIMEOUT = -1L;

    /**
     * The settings of an asynchronous call with no explicit timeout.
     */
    public static final CallSettings ASYNC = new CallSettings(false, DEFAULT_TIMEOUT, false);

    private final boolean blocking;
    private final long timeoutMillis;
    private final boolean sendReply;

    private CallSettings(final boolean blocking, final long timeoutMillis, final boolean sendReply) {
        this.blocking = blocking;
        this.timeoutMillis = timeoutMillis;
        this.sendReply = sendReply;
    }

    /**
     * Get the settings of a blocking call which uses the endpoint's default timeout.
     *
     * @return the settings
     */
    public static CallSettings blocking() {
        return new CallSettings(true, DEFAULT_TIMEOUT, false);
    }

    /**
     * Get the settings of a blocking call with the given timeout.
     *
     * @param timeout the timeout
     * @param unit the timeout unit
     * @return the settings
     */
    public static CallSettings blocking(final long timeout, final TimeUnit unit) {
        return blocking().withTimeout(timeout, unit);
    }

    /**
     * Get a copy of these settings with the given blocking flag.
     *
     * @param blocking {@code true} to wait for the reply
     * @return the new settings
     */
    public CallSettings withBlocking(final boolean blocking) {
        return new CallSettings(blocking, timeoutMillis, sendReply);
    }

    /**
     * Get a copy of these settings with the given timeout.
     *
     * @param timeout the timeout
     * @param unit the timeout unit
     * @return the new settings
     */
    public CallSettings withTimeout(final long timeout, final TimeUnit unit) {
        Assert.checkMinimumParameter("timeout", 0L, timeout);
        Assert.checkNotNullParam("unit", unit);
        return new CallSettings(blocking, unit.toMillis(timeout), sendReply);
    }

    CallSettings withSendReply(final boolean sendReply) {
        return new CallSettings(blocking, timeoutMillis, sendReply);
    }

    /**
     * Determine whether the caller waits for the reply.
     *
     * @return {@code true} for a blocking call
     */
    public boolean isBlocking() {
        return blocking;
    }

    /**
     * Determine whether the other side should reply on success.  Failures are always replied to.
     *
     * @return {@code true} if a reply was requested
     */
    public boolean isSendReply() {
        return sendReply;
    }

    /**
     * Determine whether an explicit timeout was given.
     *
     * @return {@code true} if an explicit timeout was given
     */
    public boolean hasTimeout() {
        return timeoutMillis != DEFAULT_TIMEOUT;
    }

    /**
     * Get the timeout in milliseconds, or {@link #DEFAULT_TIMEOUT} if the endpoint default applies.
     *
     * @return the timeout in milliseconds
     */
    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public String toString() {
        return "CallSettings[blocking=" + blocking + ", sendReply=" + sendReply + ", timeout=" + (hasTimeout() ? timeoutMillis + "ms" : "default") + "]";
    }
}
