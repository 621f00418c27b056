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

/**
 * The kinds of message exchanged over a comm channel.
 */
public enum MessageKind {
    /**
     * A call of a function registered on the other side.  The content is a {@link CallEnvelope}.
     */
    REMOTE_CALL("remote_call"),
    /**
     * The reply to a previous call.  The content is a {@link ReplyEnvelope}.
     */
    REMOTE_CALL_REPLY("remote_call_reply"),
    ;

    private final String wireName;

    MessageKind(final String wireName) {
        this.wireName = wireName;
    }

    /**
     * Get the name of this kind as it appears in message metadata.
     *
     * @return the wire name
     */
    public String getWireName() {
        return wireName;
    }

    /**
     * Find the kind for a wire name.
     *
     * @param wireName the wire name
     * @return the kind, or {@code null} if there is no such kind
     */
    public static MessageKind forWireName(final String wireName) {
        for (MessageKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        return null;
    }
}
