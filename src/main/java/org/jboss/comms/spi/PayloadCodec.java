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

/**
 * A codec which turns call arguments, return values and error descriptors into transport-safe bytes.  A codec may
 * support several protocol versions; the version used on a channel is the lower of the two sides' maximums.
 */
public interface PayloadCodec {

    /**
     * Encode a value.
     *
     * @param value the value to encode (may be {@code null})
     * @param version the codec protocol version to use
     * @return the encoded bytes
     * @throws IOException if the value cannot be encoded
     */
    byte[] encode(Object value, int version) throws IOException;

    /**
     * Decode a value.
     *
     * @param bytes the encoded bytes
     * @param version the codec protocol version the bytes were written with
     * @return the decoded value (may be {@code null})
     * @throws IOException if the bytes cannot be decoded
     */
    Object decode(byte[] bytes, int version) throws IOException;

    /**
     * Get the highest protocol version this codec can read and write.
     *
     * @return the maximum supported version
     */
    int getMaxSupportedVersion();

    /**
     * Get the lowest protocol version this codec can read and write.
     *
     * @return the minimum supported version
     */
    default int getMinSupportedVersion() {
        return 1;
    }
}
