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

package org.jboss.comms.protocol;

import java.io.Serializable;

import org.wildfly.common.Assert;

/**
 * The metadata of a comm message.
 */
public final class MessageHeader implements Serializable {

    private static final long serialVersionUID = -6806335040330987398L;

    private final MessageKind kind;
    private final Envelope content;
    private final int codecVersion;
    private final String senderDescriptor;

    /**
     * Construct a new instance.
     *
     * @param kind the message kind
     * @param content the call or reply envelope
     * @param codecVersion the codec version the payload was encoded with
     * @param senderDescriptor a free-form description of the sending runtime
     */
    public MessageHeader(final MessageKind kind, final Envelope content, final int codecVersion, final String senderDescriptor) {
        Assert.checkNotNullParam("kind", kind);
        Assert.checkNotNullParam("content", content);
        this.kind = kind;
        this.content = content;
        this.codecVersion = codecVersion;
        this.senderDescriptor = senderDescriptor;
    }

    public MessageKind getKind() {
        return kind;
    }

    public Envelope getContent() {
        return content;
    }

    public int getCodecVersion() {
        return codecVersion;
    }

    public String getSenderDescriptor() {
        return senderDescriptor;
    }

    public String toString() {
        return kind.getWireName() + " (" + content + ", codec v" + codecVersion + ")";
    }
}
