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
import java.util.Set;

import org.jboss.comms.spi.CommChannel;
import org.jboss.comms.spi.CommTransport;
import org.jboss.comms.spi.HandleableCloseable;
import org.jboss.comms.spi.OpenListener;

/**
 * One side of a set of comm channels.  An endpoint exposes its registered calls to the other side of every channel
 * it owns, and issues calls to the other side through {@link RemoteCallFactory} instances.
 * <p>
 * Closing the endpoint closes all of its channels.  {@link #isOpen()} reports whether the endpoint itself is still
 * open; use {@link #hasOpenChannels()} or {@link #isOpen(String)} to query channels.
 */
public interface CommEndpoint extends HandleableCloseable<CommEndpoint> {

    /**
     * The name of the built-in call which asks the other side to call {@link #PONG} back on the calling channel.
     */
    String PING = "ping";

    /**
     * The name of the built-in call which does nothing.
     */
    String PONG = "pong";

    /**
     * The name of the built-in handshake call, which negotiates the codec version and makes the session ready.
     */
    String SET_CODEC_VERSION = "_set_codec_version";

    /**
     * Get a new endpoint builder.
     *
     * @return the builder
     */
    static CommEndpointBuilder builder() {
        return new CommEndpointBuilder();
    }

    // channels

    /**
     * Take ownership of a channel and start receiving on it.  The handshake is sent to the other side immediately.
     *
     * @param channel the channel
     * @return the new session
     * @throws IOException if the endpoint is closed
     * @throws IllegalArgumentException if a channel with the same identifier is already registered
     */
    ChannelSession registerChannel(CommChannel channel) throws IOException;

    /**
     * Open a new channel through the given transport, using the configured comm name, and register it.
     *
     * @param transport the transport
     * @return the new session
     * @throws IOException if the channel could not be opened
     */
    ChannelSession openChannel(CommTransport transport) throws IOException;

    /**
     * Get a listener which registers channels opened by the other side with this endpoint.
     *
     * @return the open listener
     */
    OpenListener getOpenListener();

    /**
     * Close one channel.  Does nothing if no such channel is registered.  Outstanding calls sent on the channel are
     * not resolved; blocked callers wait for their timeout.
     *
     * @param channelId the channel identifier
     * @throws IOException if the channel failed to close
     */
    void closeChannel(String channelId) throws IOException;

    boolean isOpen(String channelId);

    /**
     * Determine whether at least one channel is open.
     *
     * @return {@code true} if a channel is open
     */
    boolean hasOpenChannels();

    /**
     * Determine whether the other side of a channel has completed the handshake.
     *
     * @param channelId the channel identifier
     * @return {@code true} if the channel is open and ready
     */
    boolean isReady(String channelId);

    /**
     * Determine whether every open channel is ready.  Returns {@code false} if no channel is open.
     *
     * @return {@code true} if there is at least one channel and all channels are ready
     */
    boolean isReady();

    Set<String> getChannelIds();

    /**
     * Get the session of an open channel.
     *
     * @param channelId the channel identifier
     * @return the session, or {@code null} if no such channel is open
     */
    ChannelSession getSession(String channelId);

    // calls

    /**
     * Register a call handler, replacing any handler of the same name.
     *
     * @param callName the call name
     * @param handler the handler, or {@code null} to unregister
     */
    void registerCallHandler(String callName, CallHandler handler);

    void unregisterCallHandler(String callName);

    /**
     * Get a factory for asynchronous calls with no callback.
     *
     * @param channelId the target channel identifier, or {@code null} to target all open channels
     * @return the call factory
     */
    RemoteCallFactory remoteCall(String channelId);

    /**
     * Get a factory for calls with the given settings.
     *
     * @param channelId the target channel identifier, or {@code null} to target all open channels
     * @param settings the call settings
     * @return the call factory
     */
    RemoteCallFactory remoteCall(String channelId, CallSettings settings);

    /**
     * Get a factory for calls with the given settings and callback.
     *
     * @param channelId the target channel identifier, or {@code null} to target all open channels
     * @param settings the call settings
     * @param callback the callback run with the return value of each successful call, or {@code null} for none
     * @return the call factory
     */
    RemoteCallFactory remoteCall(String channelId, CallSettings settings, CallCallback callback);

    /**
     * Get a factory for calls sent to every open channel.  The same call identifier is used on every channel, and the
     * first reply to arrive resolves the call; later replies are discarded.
     *
     * @param settings the call settings
     * @param callback the callback, or {@code null} for none
     * @return the call factory
     */
    RemoteCallFactory broadcastCall(CallSettings settings, CallCallback callback);

    ErrorKindRegistry getErrorKindRegistry();

    /**
     * Get the number of sent calls which are still waiting for a reply.
     *
     * @return the number of outstanding calls
     */
    int getPendingCallCount();
}
