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

import org.jboss.comms.protocol.MessageHeader;

/**
 * The most basic level of communications between two endpoints.  A comm channel simply sends and receives
 * messages, each made of a structured header and a single binary payload.  No request/reply correlation is
 * performed.  Messages are received in the order that they are written.
 */
public interface CommChannel extends HandleableCloseable<CommChannel> {

    /**
     * Get the identifier of this channel.  The identifier is unique among the currently open channels of an endpoint.
     *
     * @return the channel identifier
     */
    String getChannelId();

    /**
     * Send a message on this channel.
     *
     * @param header the message header
     * @param payload the encoded message payload
     * @throws IOException if the message cannot be written
     */
    void send(MessageHeader header, byte[] payload) throws IOException;

    /**
     * Initiate processing of the next message, when it comes in.  This method does not block;
     * instead the handler is called asynchronously (possibly in another thread) if/when the next message arrives.
     *
     * @param receiver the handler for the next incoming message
     */
    void receiveMessage(Receiver receiver);

    /**
     * A handler for an incoming message.
     */
    interface Receiver {

        /**
         * Handle an error condition on the channel.  The channel will no longer be readable.
         *
         * @param channel the channel
         * @param error the error condition
         */
        void handleError(CommChannel channel, IOException error);

        /**
         * Handle an end-of-input condition on a channel.  The channel will no longer be readable.
         *
         * @param channel the channel
         */
        void handleEnd(CommChannel channel);

        /**
         * Handle an incoming message.  To receive further messages, the {@link CommChannel#receiveMessage(Receiver)}
         * method must be called again.
         *
         * @param channel the channel
         * @param header the message header
         * @param payload the encoded message payload
         */
        void handleMessage(CommChannel channel, MessageHeader header, byte[] payload);
    }
}
