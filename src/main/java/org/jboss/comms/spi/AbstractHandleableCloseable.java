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

package org.jboss.comms.spi;

import java.io.IOException;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.jboss.comms._private.Messages;
import org.jboss.logging.Logger;
import org.wildfly.common.Assert;

/**
 * A basic implementation of a closeable resource.  Use as a convenient base class for your closeable resources.
 * Ensures that the {@code close()} method is idempotent; implements the registry of close handlers.
 *
 * @param <T> the type of the closeable resource
 */
public abstract class AbstractHandleableCloseable<T extends HandleableCloseable<T>> implements HandleableCloseable<T> {

    private static final Logger log = Logger.getLogger("org.jboss.comms.resource");

    private final Executor executor;

    private final Object closeLock = new Object();
    private State state = State.OPEN;
    private Map<Key, CloseHandler<? super T>> closeHandlers = null;

    enum State {
        OPEN,
        CLOSING,
        CLOSED,
    }

    /**
     * Basic constructor.
     *
     * @param executor the executor used to execute close notifications
     */
    protected AbstractHandleableCloseable(final Executor executor) {
        Assert.checkNotNullParam("executor", executor);
        this.executor = executor;
    }

    /** {@inheritDoc} */
    public boolean isOpen() {
        synchronized (closeLock) {
            return state == State.OPEN;
        }
    }

    /**
     * Called exactly once when the {@code close()} method is invoked; the actual close operation should take place here.
     * This method <b>must</b> call {@link #closeComplete()}, directly or indirectly, for the close operation to finish.
     *
     * @throws IOException if the close failed
     */
    protected void closeAction() throws IOException {
        closeComplete();
    }

    /** {@inheritDoc} */
    public void close() throws IOException {
        synchronized (closeLock) {
            switch (state) {
                case OPEN: {
                    state = State.CLOSING;
                    break;
                }
                case CLOSING:
                case CLOSED: return;
                default: throw new IllegalStateException();
            }
        }
        log.tracef("Closing %s", this);
        try {
            closeAction();
        } catch (IOException e) {
            log.tracef(e, "Close of %s failed", this);
            finishClose(e);
            throw e;
        }
    }

    /**
     * Call when close is complete.
     */
    protected void closeComplete() {
        finishClose(null);
    }

    private void finishClose(final IOException cause) {
        final Map<Key, CloseHandler<? super T>> closeHandlers;
        synchronized (closeLock) {
            if (state == State.CLOSED) {
                return;
            }
            state = State.CLOSED;
            closeHandlers = this.closeHandlers;
            this.closeHandlers = null;
            closeLock.notifyAll();
        }
        log.tracef("Completed close of %s", this);
        if (closeHandlers != null) {
            for (final CloseHandler<? super T> handler : closeHandlers.values()) {
                runCloseTask(new CloseHandlerTask(handler, cause));
            }
        }
    }

    /** {@inheritDoc} */
    public Key addCloseHandler(final CloseHandler<? super T> handler) {
        Assert.checkNotNullParam("handler", handler);
        synchronized (closeLock) {
            if (state == State.OPEN || state == State.CLOSING) {
                final Key key = new KeyImpl();
                if (closeHandlers == null) {
                    closeHandlers = new IdentityHashMap<>();
                }
                closeHandlers.put(key, handler);
                return key;
            }
        }
        runCloseTask(new CloseHandlerTask(handler, null));
        return () -> {};
    }

    /**
     * Get the executor to use for close handlers.
     *
     * @return the executor
     */
    protected Executor getExecutor() {
        return executor;
    }

    private void runCloseTask(final Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException ree) {
            task.run();
        }
    }

    private final class KeyImpl implements Key {
        public void remove() {
            synchronized (closeLock) {
                final Map<Key, CloseHandler<? super T>> closeHandlers = AbstractHandleableCloseable.this.closeHandlers;
                if (closeHandlers != null) {
                    closeHandlers.remove(this);
                }
            }
        }
    }

    private final class CloseHandlerTask implements Runnable {

        private final CloseHandler<? super T> handler;
        private final IOException exception;

        CloseHandlerTask(final CloseHandler<? super T> handler, final IOException exception) {
            this.handler = handler;
            this.exception = exception;
        }

        @SuppressWarnings("unchecked")
        public void run() {
            try {
                handler.handleClose((T) AbstractHandleableCloseable.this, exception);
            } catch (Throwable t) {
                Messages.log.closeHandlerFailed(t, handler);
            }
        }
    }
}
