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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.List;

import org.junit.Test;

public final class ErrorDescriptorTestCase {

    private static ErrorDescriptor divideByZero() {
        try {
            final int zero = Integer.parseInt("0");
            final int result = 1 / zero;
            throw new IllegalStateException("unreachable: " + result);
        } catch (ArithmeticException e) {
            return ErrorDescriptor.capture("divide", "0123", e);
        }
    }

    @Test
    public void testCapture() {
        final ErrorDescriptor descriptor = divideByZero();
        assertEquals("divide", descriptor.getCallName());
        assertEquals("0123", descriptor.getCallId());
        assertEquals(ArithmeticException.class.getName(), descriptor.getKind());
        assertEquals("/ by zero", descriptor.getMessage());
        assertFalse(descriptor.getFrames().isEmpty());
        assertEquals(ErrorDescriptorTestCase.class.getName(), descriptor.getFrames().get(0).getDeclaringClass());
        assertEquals("divideByZero", descriptor.getFrames().get(0).getMethodName());
    }

    @Test
    public void testRebuild() {
        final ErrorDescriptor descriptor = divideByZero();
        final Throwable throwable = descriptor.toThrowable(new ErrorKindRegistry());
        assertTrue(throwable instanceof ArithmeticException);
        assertEquals("/ by zero", throwable.getMessage());
        assertEquals(descriptor.getFrames().size(), throwable.getStackTrace().length);
        assertEquals("divideByZero", throwable.getStackTrace()[0].getMethodName());
    }

    @Test
    public void testRemoteCallException() {
        final ErrorDescriptor descriptor = divideByZero();
        final RemoteCallException exception = descriptor.toException(new ErrorKindRegistry());
        assertSame(descriptor, exception.getDescriptor());
        assertEquals(ArithmeticException.class.getName(), exception.getKind());
        assertTrue(exception.getMessage().contains("divide"));
        assertTrue(exception.getMessage().contains("/ by zero"));
        try {
            exception.rethrow(ArithmeticException.class);
            fail("Expected the cause to be rethrown");
        } catch (ArithmeticException e) {
            assertSame(exception.getCause(), e);
        }
        // no match, nothing thrown
        exception.rethrow(IllegalStateException.class);
    }

    @Test
    public void testFormat() {
        final ErrorDescriptor descriptor = new ErrorDescriptor("divide", "0123", "ZeroDivisionError", "division by zero",
            Collections.singletonList(new FrameDescriptor("calc", "divide", "calc.py", 12)));
        final List<String> lines = descriptor.formatError();
        assertEquals(3, lines.size());
        assertEquals("Exception in comms call divide:", lines.get(0));
        assertTrue(lines.get(1).startsWith("\tat calc.divide("));
        assertEquals("ZeroDivisionError: division by zero", lines.get(2));
        assertTrue(descriptor.format().endsWith("ZeroDivisionError: division by zero"));
    }

    @Test
    public void testUnknownRemoteExceptionKeepsKind() {
        final ErrorDescriptor descriptor = ErrorDescriptor.capture("parse", "0456", new UnknownRemoteException("ValueError", "bad value"));
        assertEquals("ValueError", descriptor.getKind());
        assertEquals("bad value", descriptor.getMessage());
    }

    @Test
    public void testNullMessage() {
        final ErrorDescriptor descriptor = ErrorDescriptor.capture("fail", "0789", new IllegalStateException());
        assertNull(descriptor.getMessage());
        assertEquals(IllegalStateException.class.getName(), descriptor.toString());
    }
}
