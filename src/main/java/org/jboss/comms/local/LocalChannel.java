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


package org.jboss.comms.local;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;

import org.jboss.comms._private.Messages;
import org.jboss.comms.protocol.MessageHeader;
import org.jboss.comms.spi.AbstractHandleableCloseable;
import org.jboss.comms.spi.CommChannel;

/**
 * One end of an in-VM channel.  Messages written on one end are queued on the other and handed to its receiver
 * through the executor, in write order.  Closing either end ends input on the other.
 */
final class LocalChannel extends AbstractHandleableCloseable<CommChannel> implements CommChannel {
    private final String channelId;
    private final LocalChannel otherSide;
    private final Queue<Message> messageQueue = new ArrayDeque<>();
    private final Object lock = new Object();

    private Receiver messageHandler;

    private boolean closed;

    private LocalChannel(final Executor executor, final String channelId, final LocalChannel otherSide) {
        super(executor);
        this.channelId = channelId;
        this.otherSide = otherSide;
    }

    LocalChannel(final Executor executor, final String channelId) {
        super(executor);
        this.channelId = channelId;
        otherSide = new LocalChannel(executor, channelId, this);
    }

    public String getChannelId() {
        return channelId;
    }

    public void send(final MessageHeader header, final byte[] payload) throws IOException {
        if (! isOpen()) {
            throw Messages.log.channelNotOpen();
        }
        final LocalChannel otherSide = this.otherSide;
        final Message message = new Message(header, payload.clone());
        synchronized (otherSide.lock) {
            if (otherSide.closed) {
                throw Messages.log.channelNotOpen();
            }
            final Receiver handler = otherSide.messageHandler;
            if (handler != null && otherSide.messageQueue.isEmpty()) {
                otherSide.messageHandler = null;
                otherSide.executeMessageTask(handler, message);
            } else {
                otherSide.messageQueue.add(message);
            }
        }
    }

    public void receiveMessage(final Receiver handler) {
        synchronized (lock) {
            if (messageHandler != null) {
                throw new IllegalStateException("Message handler already waiting");
            }
            final Message message = messageQueue.poll();
            if (message != null) {
                executeMessageTask(handler, message);
            } else if (closed) {
                executeEndTask(handler);
            } else {
                messageHandler = handler;
            }
        }
    }

    private void executeEndTask(final Receiver handler) {
        getExecutor().execute(() -> handler.handleEnd(this));
    }

    private void executeMessageTask(final Receiver handler, final Message message) {
        getExecutor().execute(() -> handler.handleMessage(this, message.header, message.payload));
    }

    private void inputShutdown() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            final Receiver handler = messageHandler;
            if (handler != null && messageQueue.isEmpty()) {
                messageHandler = null;
                executeEndTask(handler);
            }
        }
    }

    protected void closeAction() throws IOException {
        inputShutdown();
        otherSide.inputShutdown();
        closeComplete();
    }

    LocalChannel getOtherSide() {
        return otherSide;
    }

    public String toString() {
        return "local channel " + channelId;
    }

    static final class Message {
        final MessageHeader header;
        final byte[] payload;

        Message(final MessageHeader header, final byte[] payload) {
            this.header = header;
            this.payload = payload;
        }
    }
}
