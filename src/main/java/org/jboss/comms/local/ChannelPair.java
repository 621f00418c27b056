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

import java.util.concurrent.Executor;

import org.jboss.comms.spi.CommChannel;
import org.wildfly.common.Assert;

/**
 * A pair of interconnected in-VM channels sharing one channel identifier.
 */
public final class ChannelPair {
    private final CommChannel leftChannel;
    private final CommChannel rightChannel;

    /**
     * Construct a new instance.
     *
     * @param leftChannel the left-hand channel
     * @param rightChannel the right-hand channel
     */
    public ChannelPair(final CommChannel leftChannel, final CommChannel rightChannel) {
        this.leftChannel = leftChannel;
        this.rightChannel = rightChannel;
    }

    /**
     * Create a new pair of connected channels.
     *
     * @param executor the executor used to deliver messages and close notifications
     * @param channelId the identifier of both channels
     * @return the channel pair
     */
    public static ChannelPair create(final Executor executor, final String channelId) {
        Assert.checkNotNullParam("executor", executor);
        Assert.checkNotNullParam("channelId", channelId);
        final LocalChannel left = new LocalChannel(executor, channelId);
        return new ChannelPair(left, left.getOtherSide());
    }

    /**
     * Get the left-hand channel.
     *
     * @return the left-hand channel
     */
    public CommChannel getLeftChannel() {
        return leftChannel;
    }

    /**
     * Get the right-hand channel.
     *
     * @return the right-hand channel
     */
    public CommChannel getRightChannel() {
        return rightChannel;
    }
}
