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
import java.util.UUID;
import java.util.concurrent.Executor;

import org.jboss.comms.spi.CommChannel;
import org.jboss.comms.spi.CommTransport;
import org.jboss.comms.spi.OpenListener;
import org.wildfly.common.Assert;

/**
 * A transport which connects two endpoints in the same VM.  Each channel opened here is paired with a channel handed
 * to the open listener of the other side.
 */
public final class LocalTransport implements CommTransport {

    private final Executor executor;
    private final OpenListener otherSide;

    /**
     * Construct a new instance.
     *
     * @param executor the executor used to deliver messages
     * @param otherSide the listener which receives the other end of each new channel
     */
    public LocalTransport(final Executor executor, final OpenListener otherSide) {
        Assert.checkNotNullParam("executor", executor);
        Assert.checkNotNullParam("otherSide", otherSide);
        this.executor = executor;
        this.otherSide = otherSide;
    }

    public CommChannel openChannel(final String name) throws IOException {
        Assert.checkNotNullParam("name", name);
        final ChannelPair pair = ChannelPair.create(executor, UUID.randomUUID().toString().replace("-", ""));
        otherSide.channelOpened(name, pair.getRightChannel());
        return pair.getLeftChannel();
    }
}
