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

import java.util.concurrent.TimeUnit;

import org.jboss.comms.protocol.ReplyEnvelope;

/**
 * The inbox slot of a blocking call.  It is filled at most once, by the thread delivering the reply, and consumed
 * by the waiting caller.
 */
public final class ReplySlot {

    private final Object lock = new Object();
    private boolean filled;
    private ReplyEnvelope envelope;
    private Object value;

    ReplySlot() {
    }

    /**
     * Fill this slot and wake the waiter.  Only the first fill has any effect.
     *
     * @param envelope the reply envelope
     * @param value the decoded reply payload
     * @return {@code true} if the slot was filled by this call
     */
    boolean fill(final ReplyEnvelope envelope, final Object value) {
        synchronized (lock) {
            if (filled) {
                return false;
            }
            this.envelope = envelope;
            this.value = value;
            filled = true;
            lock.notifyAll();
            return true;
        }
    }

    /**
     * Wait for this slot to be filled.
     *
     * @param timeoutMillis the maximum time to wait, in milliseconds
     * @return {@code true} if the slot was filled, {@code false} if the time elapsed first
     * @throws InterruptedException if the thread was interrupted while waiting
     */
    boolean await(final long timeoutMillis) throws InterruptedException {
        final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        synchronized (lock) {
            while (! filled) {
                final long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0L) {
                    return false;
                }
                lock.wait(remaining);
            }
            return true;
        }
    }

    boolean isFilled() {
        synchronized (lock) {
            return filled;
        }
    }

    /**
     * Determine whether the reply carried an error.
     *
     * @return {@code true} if the reply carried an error
     */
    public boolean isError() {
        synchronized (lock) {
            return envelope != null && envelope.isError();
        }
    }

    /**
     * Get the decoded reply payload.
     *
     * @return the return value or error descriptor
     */
    public Object getValue() {
        synchronized (lock) {
            return value;
        }
    }

    /**
     * Get the raw reply envelope.
     *
     * @return the reply envelope, or {@code null} if the slot was not filled
     */
    public ReplyEnvelope getEnvelope() {
        synchronized (lock) {
            return envelope;
        }
    }
}
