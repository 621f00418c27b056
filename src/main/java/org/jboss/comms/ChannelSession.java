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

import org.jboss.comms._private.Messages;
import org.jboss.comms.spi.CommChannel;
import org.wildfly.common.Assert;

/**
 * The state an endpoint keeps for one open comm channel.
 * <p>
 * A session starts out {@link SessionStatus#OPENING OPENING} with the default codec version.  When the other side
 * runs the handshake call, the version is lowered to what both sides support and the session becomes
 * {@link SessionStatus#READY READY}.  Both changes happen exactly once; later handshakes are ignored.
 */
public final class ChannelSession {

    private final String channelId;
    private final CommChannel channel;
    private int codecVersion;
    private SessionStatus status = SessionStatus.OPENING;

    ChannelSession(final CommChannel channel, final int defaultCodecVersion) {
        Assert.checkNotNullParam("channel", channel);
        this.channelId = channel.getChannelId();
        this.channel = channel;
        this.codecVersion = defaultCodecVersion;
    }

    /**
     * Complete the handshake.
     *
     * @param requestedVersion the codec version requested by the other side
     * @param localMaxVersion the highest codec version supported locally
     * @return {@code true} if this call made the session ready, {@code false} if it already was
     */
    synchronized boolean acknowledge(final int requestedVersion, final int localMaxVersion) {
        if (status == SessionStatus.READY) {
            Messages.channels.duplicateHandshake(channelId, codecVersion);
            return false;
        }
        codecVersion = Math.min(requestedVersion, localMaxVersion);
        status = SessionStatus.READY;
        Messages.channels.channelReady(channelId, codecVersion);
        return true;
    }

    public String getChannelId() {
        return channelId;
    }

    /**
     * Get the channel owned by this session.
     *
     * @return the channel
     */
    public CommChannel getChannel() {
        return channel;
    }

    /**
     * Get the codec version used to encode payloads sent on this channel.
     *
     * @return the codec version
     */
    public synchronized int getCodecVersion() {
        return codecVersion;
    }

    public synchronized SessionStatus getStatus() {
        return status;
    }

    public synchronized boolean isReady() {
        return status == SessionStatus.READY;
    }

    public String toString() {
        return "session " + channelId + " (" + getStatus() + ", codec v" + getCodecVersion() + ")";
    }
}
