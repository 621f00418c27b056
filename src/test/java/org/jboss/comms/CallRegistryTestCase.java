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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;

import org.junit.Test;

public final class CallRegistryTestCase {

    @Test
    public void testInvoke() throws Exception {
        final CallRegistry registry = new CallRegistry();
        registry.register("add", args -> Integer.valueOf(args.get(0, Integer.class).intValue() + args.get(1, Integer.class).intValue()));
        assertEquals(Integer.valueOf(5), registry.invoke("add", CallArguments.of(2, 3)));
        assertTrue(registry.getCallNames().contains("add"));
    }

    @Test
    public void testKeywords() throws Exception {
        final CallRegistry registry = new CallRegistry();
        registry.register("greet", args -> args.getKeyword("greeting", String.class, "hello") + " " + args.get(0));
        assertEquals("hello world", registry.invoke("greet", CallArguments.of("world")));
        assertEquals("hi world", registry.invoke("greet", new CallArguments(new Object[] { "world" }, Collections.singletonMap("greeting", "hi"))));
    }

    @Test
    public void testNullHandlerUnregisters() throws Exception {
        final CallRegistry registry = new CallRegistry();
        registry.register("noop", args -> null);
        registry.register("noop", null);
        assertNull(registry.getHandler("noop"));
        assertFalse(registry.getCallNames().contains("noop"));
    }

    @Test
    public void testNoSuchCall() throws Exception {
        final CallRegistry registry = new CallRegistry();
        registry.register("noop", args -> null);
        registry.unregister("noop");
        try {
            registry.invoke("noop", CallArguments.of());
            fail("Expected NoSuchCallException");
        } catch (NoSuchCallException e) {
            assertTrue(e.getMessage().contains("noop"));
        }
    }

    @Test
    public void testHandlerFailurePropagates() throws Exception {
        final CallRegistry registry = new CallRegistry();
        registry.register("divide", args -> Integer.valueOf(args.get(0, Integer.class).intValue() / args.get(1, Integer.class).intValue()));
        try {
            registry.invoke("divide", CallArguments.of(1, 0));
            fail("Expected ArithmeticException");
        } catch (ArithmeticException expected) {
        }
    }
}
