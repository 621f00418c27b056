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

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import org.jboss.comms.local.ChannelPair;
import org.jboss.comms.local.LocalTransport;
import org.jboss.comms.marshalling.MarshallingPayloadCodec;
import org.jboss.comms.spi.CommChannel;
import org.jboss.comms.spi.PayloadCodec;
import org.jboss.logging.Logger;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;
import org.xnio.OptionMap;

/**
 * Two endpoints, a "kernel" and a "frontend", connected through the in-VM transport.
 */
public final class CommEndpointTestCase {

    @Rule
    public TestName name = new TestName();

    private final BlockingQueue<ErrorDescriptor> asyncErrors = new LinkedBlockingQueue<>();
    private ExecutorService transportExecutor;
    private CommEndpoint kernel;
    private CommEndpoint frontend;
    private LocalTransport transport;
    private String channelId;

    @Before
    public void doBefore() throws Exception {
        Logger.getLogger("TEST").infof("Running test %s", name.getMethodName());
        transportExecutor = Executors.newCachedThreadPool();
        kernel = CommEndpoint.builder().setEndpointName("kernel").build();
        frontend = CommEndpoint.builder()
            .setEndpointName("frontend")
            .setAsyncErrorHandler(asyncErrors::add)
            .build();
        kernel.registerCallHandler("add", args -> Integer.valueOf(args.get(0, Integer.class).intValue() + args.get(1, Integer.class).intValue()));
        transport = new LocalTransport(transportExecutor, kernel.getOpenListener());
        channelId = frontend.openChannel(transport).getChannelId();
        awaitTrue(() -> frontend.isReady() && kernel.isReady());
    }

    @After
    public void doAfter() throws IOException {
        try {
            frontend.close();
            kernel.close();
        } finally {
            transportExecutor.shutdownNow();
        }
        Logger.getLogger("TEST").infof("Finished test %s", name.getMethodName());
    }

    private static void awaitTrue(final BooleanSupplier condition) throws InterruptedException {
        final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5L);
        while (! condition.getAsBoolean()) {
            if (System.nanoTime() - deadline > 0L) {
                fail("Condition not met in time");
            }
            Thread.sleep(10L);
        }
    }

    private RemoteCallFactory blocking() {
        return frontend.remoteCall(channelId, CallSettings.blocking(3L, TimeUnit.SECONDS));
    }

    @Test
    public void testReady() {
        assertTrue(frontend.isOpen(channelId));
        assertTrue(kernel.isOpen(channelId));
        assertTrue(frontend.isReady(channelId));
        assertTrue(kernel.isReady(channelId));
        assertTrue(frontend.hasOpenChannels());
        assertEquals(Collections.singleton(channelId), frontend.getChannelIds());
        assertEquals(SessionStatus.READY, frontend.getSession(channelId).getStatus());
        assertFalse(frontend.isReady("no-such-comm"));
    }

    @Test
    public void testNotReadyWithoutChannels() throws Exception {
        final CommEndpoint lonely = CommEndpoint.builder().build();
        try {
            assertFalse(lonely.isReady());
            assertFalse(lonely.hasOpenChannels());
        } finally {
            lonely.close();
        }
    }

    @Test
    public void testAdd() throws Exception {
        assertEquals(Integer.valueOf(5), blocking().invoke("add", 2, 3));
        assertEquals(0, frontend.getPendingCallCount());
    }

    @Test
    public void testCallFromKernelSide() throws Exception {
        frontend.registerCallHandler("echo", args -> args.get(0));
        assertEquals("hello", kernel.remoteCall(channelId, CallSettings.blocking()).invoke("echo", "hello"));
    }

    @Test
    public void testRemoteError() throws Exception {
        kernel.registerCallHandler("divide", args -> {
            throw new ArithmeticException("division by zero");
        });
        try {
            blocking().invoke("divide", 1, 0);
            fail("Expected RemoteCallException");
        } catch (RemoteCallException e) {
            assertEquals(ArithmeticException.class.getName(), e.getKind());
            assertTrue(e.getCause() instanceof ArithmeticException);
            assertEquals("division by zero", e.getCause().getMessage());
            assertTrue(e.getCause().getStackTrace().length > 0);
            assertEquals("divide", e.getDescriptor().getCallName());
        }
    }

    @Test
    public void testRemoteErrorAlias() throws Exception {
        kernel.registerCallHandler("divide", args -> {
            throw new UnknownRemoteException("ZeroDivisionError", "division by zero");
        });
        frontend.getErrorKindRegistry().register("ZeroDivisionError", ArithmeticException::new);
        try {
            blocking().invoke("divide", 1, 0);
            fail("Expected RemoteCallException");
        } catch (RemoteCallException e) {
            assertEquals("ZeroDivisionError", e.getKind());
            assertTrue(e.getCause() instanceof ArithmeticException);
            assertEquals("division by zero", e.getCause().getMessage());
        }
    }

    @Test
    public void testUnknownRemoteError() throws Exception {
        kernel.registerCallHandler("parse", args -> {
            throw new UnknownRemoteException("ValueError", "bad value");
        });
        try {
            blocking().invoke("parse", "x");
            fail("Expected RemoteCallException");
        } catch (RemoteCallException e) {
            assertTrue(e.getCause() instanceof UnknownRemoteException);
            assertEquals("ValueError", ((UnknownRemoteException) e.getCause()).getKind());
            assertEquals("bad value", e.getCause().getMessage());
        }
    }

    @Test
    public void testNoSuchCall() throws Exception {
        try {
            blocking().invoke("missing");
            fail("Expected RemoteCallException");
        } catch (RemoteCallException e) {
            assertEquals(NoSuchCallException.class.getName(), e.getKind());
            assertTrue(e.getCause() instanceof NoSuchCallException);
        }
    }

    @Test
    public void testHandlerThrowsError() throws Exception {
        kernel.registerCallHandler("broken", args -> {
            throw new AssertionError("invariant broken");
        });
        try {
            frontend.remoteCall(channelId, CallSettings.blocking(2L, TimeUnit.SECONDS)).invoke("broken");
            fail("Expected RemoteCallException");
        } catch (RemoteCallException e) {
            assertEquals(AssertionError.class.getName(), e.getKind());
            assertTrue(e.getCause() instanceof AssertionError);
            assertEquals("invariant broken", e.getDescriptor().getMessage());
            assertEquals("broken", e.getDescriptor().getCallName());
        }
        assertEquals(Integer.valueOf(3), blocking().invoke("add", 1, 2));
    }

    @Test
    public void testTimeout() throws Exception {
        final CountDownLatch release = new CountDownLatch(1);
        kernel.registerCallHandler("silent", args -> {
            release.await();
            return "late";
        });
        final long start = System.nanoTime();
        try {
            frontend.remoteCall(channelId, CallSettings.blocking(10L, TimeUnit.MILLISECONDS)).invoke("silent");
            fail("Expected CommTimeoutException");
        } catch (CommTimeoutException e) {
            assertTrue(e.getMessage().contains("silent"));
        } finally {
            release.countDown();
        }
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 500L);
        assertEquals(0, frontend.getPendingCallCount());
        // the late reply is discarded and the channel keeps working
        assertEquals(Integer.valueOf(3), blocking().invoke("add", 1, 2));
        assertTrue(asyncErrors.isEmpty());
    }

    @Test
    public void testDefaultTimeoutOption() throws Exception {
        final CommEndpoint impatient = CommEndpoint.builder()
            .setOptionMap(OptionMap.create(CommOptions.DEFAULT_CALL_TIMEOUT, Integer.valueOf(20)))
            .build();
        final CountDownLatch release = new CountDownLatch(1);
        kernel.registerCallHandler("silent", args -> {
            release.await();
            return null;
        });
        try {
            final String id = impatient.openChannel(new LocalTransport(transportExecutor, kernel.getOpenListener())).getChannelId();
            impatient.remoteCall(id, CallSettings.blocking()).invoke("silent");
            fail("Expected CommTimeoutException");
        } catch (CommTimeoutException expected) {
        } finally {
            release.countDown();
            impatient.close();
        }
    }

    @Test
    public void testClosedChannel() throws Exception {
        frontend.closeChannel(channelId);
        assertFalse(frontend.isOpen(channelId));
        assertNull(frontend.remoteCall(channelId).invoke("add", 1, 2));
        try {
            blocking().invoke("add", 1, 2);
            fail("Expected CommException");
        } catch (CommException e) {
            assertSame(CommException.class, e.getClass());
        }
        // the other side notices
        awaitTrue(() -> ! kernel.isOpen(channelId));
        assertFalse(kernel.isReady());
    }

    @Test
    public void testUnknownChannel() throws Exception {
        assertNull(frontend.remoteCall("no-such-comm").invoke("add", 1, 2));
        try {
            frontend.remoteCall("no-such-comm", CallSettings.blocking()).invoke("add", 1, 2);
            fail("Expected CommException");
        } catch (CommException expected) {
        }
    }

    @Test
    public void testRemoteClose() throws Exception {
        kernel.closeChannel(channelId);
        awaitTrue(() -> ! frontend.isOpen(channelId));
        assertFalse(frontend.hasOpenChannels());
    }

    @Test
    public void testEndpointClose() throws Exception {
        kernel.close();
        assertFalse(kernel.isOpen());
        awaitTrue(() -> ! frontend.isOpen(channelId));
        try {
            kernel.registerChannel(ChannelPair.create(transportExecutor, "late").getLeftChannel());
            fail("Expected CommException");
        } catch (CommException expected) {
        }
    }

    @Test
    public void testDuplicateChannel() throws Exception {
        final CommChannel channel = ChannelPair.create(transportExecutor, channelId).getLeftChannel();
        try {
            kernel.registerChannel(channel);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
        } finally {
            channel.close();
        }
        assertTrue(kernel.isOpen(channelId));
    }

    @Test
    public void testPingPong() throws Exception {
        final CountDownLatch pong = new CountDownLatch(1);
        frontend.registerCallHandler(CommEndpoint.PONG, args -> {
            pong.countDown();
            return null;
        });
        assertNull(blocking().invoke(CommEndpoint.PING));
        assertTrue(pong.await(5L, TimeUnit.SECONDS));
    }

    @Test
    public void testNestedCall() throws Exception {
        frontend.registerCallHandler("inner", args -> Integer.valueOf(7));
        kernel.registerCallHandler("outer", args -> {
            final Object inner = kernel.remoteCall(CallContext.getCallingChannelId(), CallSettings.blocking()).invoke("inner");
            return Integer.valueOf(((Integer) inner).intValue() + 1);
        });
        assertEquals(Integer.valueOf(8), blocking().invoke("outer"));
        assertNull(CallContext.getCallingChannelId());
    }

    @Test
    public void testCallback() throws Exception {
        final BlockingQueue<Object> values = new LinkedBlockingQueue<>();
        assertNull(frontend.remoteCall(channelId, CallSettings.ASYNC, values::add).invoke("add", 4, 5));
        assertEquals(Integer.valueOf(9), values.poll(5L, TimeUnit.SECONDS));
    }

    @Test
    public void testBlockingCallWithCallback() throws Exception {
        final BlockingQueue<Object> values = new LinkedBlockingQueue<>();
        assertEquals(Integer.valueOf(9), frontend.remoteCall(channelId, CallSettings.blocking(), values::add).invoke("add", 4, 5));
        assertEquals(Integer.valueOf(9), values.poll(5L, TimeUnit.SECONDS));
    }

    @Test
    public void testAsyncErrorWithCallback() throws Exception {
        kernel.registerCallHandler("divide", args -> {
            throw new ArithmeticException("division by zero");
        });
        final BlockingQueue<Object> values = new LinkedBlockingQueue<>();
        frontend.remoteCall(channelId, CallSettings.ASYNC, values::add).invoke("divide", 1, 0);
        final ErrorDescriptor descriptor = asyncErrors.poll(5L, TimeUnit.SECONDS);
        assertEquals(ArithmeticException.class.getName(), descriptor.getKind());
        assertEquals("division by zero", descriptor.getMessage());
        assertTrue(values.isEmpty());
    }

    @Test
    public void testFireAndForgetErrorIsReported() throws Exception {
        kernel.registerCallHandler("divide", args -> {
            throw new ArithmeticException("division by zero");
        });
        frontend.remoteCall(channelId).invoke("divide", 1, 0);
        final ErrorDescriptor descriptor = asyncErrors.poll(5L, TimeUnit.SECONDS);
        assertEquals(ArithmeticException.class.getName(), descriptor.getKind());
        assertEquals("divide", descriptor.getCallName());
    }

    @Test
    public void testKeywordArguments() throws Exception {
        kernel.registerCallHandler("greet", args -> args.getKeyword("greeting", String.class, "hello") + ", " + args.get(0));
        final RemoteCall greet = blocking().call("greet");
        assertEquals("hello, world", greet.invoke("world"));
        assertEquals("hi, world", greet.invoke(new Object[] { "world" }, Collections.singletonMap("greeting", "hi")));
    }

    @Test
    public void testUnregister() throws Exception {
        kernel.registerCallHandler("add", null);
        try {
            blocking().invoke("add", 1, 2);
            fail("Expected RemoteCallException");
        } catch (RemoteCallException e) {
            assertEquals(NoSuchCallException.class.getName(), e.getKind());
        }
    }

    @Test
    public void testCallingChannel() throws Exception {
        kernel.registerCallHandler("whoami", args -> CallContext.getCallingChannelId());
        assertEquals(channelId, blocking().invoke("whoami"));
    }

    @Test
    public void testBroadcast() throws Exception {
        final String second = frontend.openChannel(transport).getChannelId();
        awaitTrue(() -> frontend.isReady() && kernel.isReady(second));
        kernel.registerCallHandler("whoami", args -> CallContext.getCallingChannelId());
        final Set<String> ids = new HashSet<>();
        ids.add(channelId);
        ids.add(second);
        final Object first = frontend.broadcastCall(CallSettings.blocking(), null).invoke("whoami");
        assertTrue(ids.contains(first));
        assertEquals(0, frontend.getPendingCallCount());
        final CountDownLatch both = new CountDownLatch(2);
        kernel.registerCallHandler("count", args -> {
            both.countDown();
            return null;
        });
        frontend.broadcastCall(CallSettings.ASYNC, null).invoke("count");
        assertTrue(both.await(5L, TimeUnit.SECONDS));
    }

    @Test
    public void testUndecodableCallIsDropped() throws Exception {
        final AtomicBoolean called = new AtomicBoolean();
        kernel.registerCallHandler("swallow", args -> {
            called.set(true);
            return null;
        });
        try {
            frontend.remoteCall(channelId, CallSettings.blocking(200L, TimeUnit.MILLISECONDS)).invoke("swallow", new Poison());
            fail("Expected CommTimeoutException");
        } catch (CommTimeoutException expected) {
        }
        assertFalse(called.get());
        assertTrue(asyncErrors.isEmpty());
        assertEquals(Integer.valueOf(3), blocking().invoke("add", 1, 2));
    }

    @Test
    public void testUndecodableReply() throws Exception {
        kernel.registerCallHandler("poison", args -> new Poison());
        try {
            blocking().invoke("poison");
            fail("Expected RemoteCallException");
        } catch (RemoteCallException e) {
            assertEquals(DecodeException.class.getName(), e.getKind());
            assertTrue(e.getCause() instanceof DecodeException);
        }
    }

    @Test
    public void testUndecodableReplyLinkageError() throws Exception {
        kernel.registerCallHandler("missing_class", args -> new MissingClass());
        try {
            blocking().invoke("missing_class");
            fail("Expected RemoteCallException");
        } catch (RemoteCallException e) {
            assertEquals(DecodeException.class.getName(), e.getKind());
        }
        assertEquals(Integer.valueOf(3), blocking().invoke("add", 1, 2));
    }

    @Test
    public void testReturnValueNotEncodable() throws Exception {
        kernel.registerCallHandler("opaque", args -> new Object());
        try {
            blocking().invoke("opaque");
            fail("Expected RemoteCallException");
        } catch (RemoteCallException e) {
            assertEquals(CommException.class.getName(), e.getKind());
        }
    }

    @Test
    public void testCodecVersionNegotiation() throws Exception {
        final CommEndpoint older = CommEndpoint.builder()
            .setEndpointName("older")
            .setPayloadCodec(new CappedCodec(new MarshallingPayloadCodec(), 3))
            .build();
        try {
            final String id = frontend.openChannel(new LocalTransport(transportExecutor, older.getOpenListener())).getChannelId();
            awaitTrue(() -> frontend.isReady(id) && older.isReady(id));
            assertEquals(3, frontend.getSession(id).getCodecVersion());
            assertEquals(3, older.getSession(id).getCodecVersion());
            assertEquals(4, frontend.getSession(channelId).getCodecVersion());
            older.registerCallHandler("echo", args -> args.get(0));
            assertEquals("hello", frontend.remoteCall(id, CallSettings.blocking()).invoke("echo", "hello"));
        } finally {
            older.close();
        }
    }

    @Test
    public void testCodecVersionOptionAbovePeerMaximum() throws Exception {
        final CommEndpoint newer = CommEndpoint.builder()
            .setEndpointName("newer")
            .setOptionMap(OptionMap.create(CommOptions.DEFAULT_CODEC_VERSION, Integer.valueOf(4)))
            .build();
        final CommEndpoint older = CommEndpoint.builder()
            .setEndpointName("older")
            .setPayloadCodec(new CappedCodec(new MarshallingPayloadCodec(), 3))
            .build();
        try {
            final String id = newer.openChannel(new LocalTransport(transportExecutor, older.getOpenListener())).getChannelId();
            awaitTrue(() -> newer.isReady(id) && older.isReady(id));
            assertEquals(3, newer.getSession(id).getCodecVersion());
            assertEquals(3, older.getSession(id).getCodecVersion());
        } finally {
            newer.close();
            older.close();
        }
    }

    @Test
    public void testInvalidCodecVersionOption() {
        try {
            CommEndpoint.builder().setOptionMap(OptionMap.create(CommOptions.DEFAULT_CODEC_VERSION, Integer.valueOf(7))).build();
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
        }
    }

    @Test
    public void testCustomChannelName() throws Exception {
        final BlockingQueue<String> names = new LinkedBlockingQueue<>();
        final CommEndpoint named = CommEndpoint.builder()
            .setOptionMap(OptionMap.create(CommOptions.CHANNEL_NAME, "spyder_api"))
            .build();
        try {
            named.openChannel(new LocalTransport(transportExecutor, (name, channel) -> {
                names.add(name);
                kernel.getOpenListener().channelOpened(name, channel);
            }));
            assertEquals("spyder_api", names.poll(5L, TimeUnit.SECONDS));
        } finally {
            named.close();
        }
    }

    static final class Poison implements Serializable {
        private static final long serialVersionUID = 1L;

        private void readObject(final ObjectInputStream in) throws IOException, ClassNotFoundException {
            throw new InvalidObjectException("poisoned");
        }
    }

    static final class MissingClass implements Serializable {
        private static final long serialVersionUID = 1L;

        private void readObject(final ObjectInputStream in) throws IOException, ClassNotFoundException {
            throw new NoClassDefFoundError("org/example/Gone");
        }
    }

    static final class CappedCodec implements PayloadCodec {
        private final PayloadCodec delegate;
        private final int maxVersion;

        CappedCodec(final PayloadCodec delegate, final int maxVersion) {
            this.delegate = delegate;
            this.maxVersion = maxVersion;
        }

        public byte[] encode(final Object value, final int version) throws IOException {
            if (version > maxVersion) {
                throw new CommException("Version " + version + " not supported");
            }
            return delegate.encode(value, version);
        }

        public Object decode(final byte[] bytes, final int version) throws IOException {
            if (version > maxVersion) {
                throw new DecodeException("Version " + version + " not supported");
            }
            return delegate.decode(bytes, version);
        }

        public int getMaxSupportedVersion() {
            return maxVersion;
        }

        public int getMinSupportedVersion() {
            return delegate.getMinSupportedVersion();
        }
    }
}
