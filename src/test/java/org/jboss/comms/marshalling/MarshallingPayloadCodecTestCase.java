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


package org.jboss.comms.marshalling;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;

import org.jboss.comms.CallArguments;
import org.jboss.comms.CommException;
import org.jboss.comms.DecodeException;
import org.jboss.comms.ErrorDescriptor;
import org.junit.Test;

public final class MarshallingPayloadCodecTestCase {

    private final MarshallingPayloadCodec codec = new MarshallingPayloadCodec();

    @Test
    public void testVersions() {
        assertEquals(2, codec.getMinSupportedVersion());
        assertEquals(4, codec.getMaxSupportedVersion());
    }

    @Test
    public void testCallArguments() throws Exception {
        for (int version = MarshallingPayloadCodec.MIN_VERSION; version <= MarshallingPayloadCodec.MAX_VERSION; version++) {
            final CallArguments arguments = new CallArguments(new Object[] { Integer.valueOf(2), "three" }, Collections.singletonMap("scale", Double.valueOf(1.5)));
            final CallArguments decoded = (CallArguments) codec.decode(codec.encode(arguments, version), version);
            assertEquals(2, decoded.size());
            assertEquals(Integer.valueOf(2), decoded.get(0));
            assertEquals("three", decoded.get(1));
            assertEquals(Double.valueOf(1.5), decoded.getKeyword("scale"));
        }
    }

    @Test
    public void testErrorDescriptor() throws Exception {
        final ErrorDescriptor descriptor = ErrorDescriptor.capture("divide", "01", new ArithmeticException("division by zero"));
        final ErrorDescriptor decoded = (ErrorDescriptor) codec.decode(codec.encode(descriptor, 4), 4);
        assertEquals(descriptor.getKind(), decoded.getKind());
        assertEquals(descriptor.getMessage(), decoded.getMessage());
        assertEquals(descriptor.getFrames().size(), decoded.getFrames().size());
    }

    @Test
    public void testNull() throws Exception {
        assertNull(codec.decode(codec.encode(null, 2), 2));
    }

    @Test
    public void testGarbage() throws Exception {
        try {
            codec.decode(new byte[] { (byte) 0xff, 0x13, 0x37 }, 2);
            fail("Expected DecodeException");
        } catch (DecodeException expected) {
        }
        try {
            codec.decode(new byte[0], 2);
            fail("Expected DecodeException");
        } catch (DecodeException expected) {
        }
    }

    @Test
    public void testUnsupportedVersion() throws Exception {
        try {
            codec.encode("value", 9);
            fail("Expected CommException");
        } catch (CommException e) {
            assertTrue(e.getMessage().contains("9"));
        }
        try {
            codec.decode(codec.encode("value", 2), 1);
            fail("Expected DecodeException");
        } catch (DecodeException expected) {
        }
    }

    @Test
    public void testNotEncodable() throws Exception {
        try {
            codec.encode(new Object(), 2);
            fail("Expected CommException");
        } catch (CommException e) {
            assertTrue(e.getMessage().contains(Object.class.getName()));
        }
    }
}
