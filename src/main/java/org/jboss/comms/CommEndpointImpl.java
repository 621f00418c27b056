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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.jboss.comms._private.Messages;
import org.jboss.comms.protocol.CallEnvelope;
import org.jboss.comms.protocol.Envelope;
import org.jboss.comms.protocol.MessageHeader;
import org.jboss.comms.protocol.MessageKind;
import org.jboss.comms.protocol.ReplyEnvelope;
import org.jboss.comms.spi.AbstractHandleableCloseable;
import org.jboss.comms.spi.CommChannel;
import org.jboss.comms.spi.CommTransport;
import org.jboss.comms.spi.OpenListener;
import org.jboss.comms.spi.PayloadCodec;
import org.jboss.comms.util.CallTracker;
import org.wildfly.common.Assert;

final class CommEndpointImpl extends AbstractHandleableCloseable<CommEndpoint> implements CommEndpoint {

    private final String name;
    private final PayloadCodec codec;
    private final ExecutorService ownedExecutor;
    private final ErrorKindRegistry errorKindRegistry;
    private final CallTracker tracker;
    private final CallRegistry callRegistry = new CallRegistry();
    private final ConcurrentMap<String, ChannelSession> sessions = new ConcurrentHashMap<>();
    private final int defaultCodecVersion;
    private final long defaultTimeoutMillis;
    private final String channelName;
    private final String senderDescriptor;

    CommEndpointImpl(final String name, final PayloadCodec codec, final Executor executor, final ErrorKindRegistry errorKindRegistry, final AsyncErrorHandler asyncErrorHandler, final int defaultCodecVersion, final long defaultTimeoutMillis, final String channelName) {
        this(name, codec, executor == null ? createExecutor(name) : executor, executor == null, errorKindRegistry, asyncErrorHandler, defaultCodecVersion, defaultTimeoutMillis, channelName);
    }

    private CommEndpointImpl(final String name, final PayloadCodec codec, final Executor executor, final boolean ownsExecutor, final ErrorKindRegistry errorKindRegistry, final AsyncErrorHandler asyncErrorHandler, final int defaultCodecVersion, final long defaultTimeoutMillis, final String channelName) {
        super(executor);
        this.name = name;
        this.codec = codec;
        this.ownedExecutor = ownsExecutor ? (ExecutorService) executor : null;
        this.errorKindRegistry = errorKindRegistry;
        this.tracker = new CallTracker(asyncErrorHandler, errorKindRegistry);
        this.defaultCodecVersion = defaultCodecVersion;
        this.defaultTimeoutMillis = defaultTimeoutMillis;
        this.channelName = channelName;
        this.senderDescriptor = "Java " + System.getProperty("java.version") + " (" + System.getProperty("java.vm.name") + ")";
        callRegistry.register(PING, arguments -> {
            remoteCall(CallContext.getCallingChannelId()).invoke(PONG);
            return null;
        });
        callRegistry.register(PONG, arguments -> null);
        callRegistry.register(SET_CODEC_VERSION, arguments -> {
            final ChannelSession session = sessions.get(CallContext.getCallingChannelId());
            if (session != null) {
                session.acknowledge(arguments.get(0, Number.class).intValue(), codec.getMaxSupportedVersion());
            }
            return null;
        });
    }

    private static ExecutorService createExecutor(final String name) {
        final AtomicInteger count = new AtomicInteger();
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "comms-" + name + "-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }

    // channels

    public ChannelSession registerChannel(final CommChannel channel) throws IOException {
        Assert.checkNotNullParam("channel", channel);
        if (! isOpen()) {
            throw Messages.log.endpointClosed();
        }
        final String channelId = channel.getChannelId();
        final ChannelSession session = new ChannelSession(channel, defaultCodecVersion);
        if (sessions.putIfAbsent(channelId, session) != null) {
            throw Messages.log.duplicateChannel(channelId);
        }
        channel.addCloseHandler((closed, exception) -> {
            if (sessions.remove(channelId, session)) {
                Messages.channels.channelRemoved(channelId);
            }
        });
        Messages.channels.channelRegistered(channelId);
        channel.receiveMessage(new SessionReceiver(session));
        try {
            sendHandshake(session);
        } catch (IOException e) {
            Messages.channels.handshakeFailed(e, channelId);
        }
        return session;
    }

    public ChannelSession openChannel(final CommTransport transport) throws IOException {
        Assert.checkNotNullParam("transport", transport);
        if (! isOpen()) {
            throw Messages.log.endpointClosed();
        }
        return registerChannel(transport.openChannel(channelName));
    }

    public OpenListener getOpenListener() {
        return (name, channel) -> {
            try {
                registerChannel(channel);
            } catch (IOException | IllegalArgumentException e) {
                Messages.channels.channelRejected(e, channel.getChannelId(), name);
                safeClose(channel);
            }
        };
    }

    public void closeChannel(final String channelId) throws IOException {
        final ChannelSession session = sessions.remove(channelId);
        if (session != null) {
            Messages.channels.channelRemoved(channelId);
            session.getChannel().close();
        }
    }

    public boolean isOpen(final String channelId) {
        return channelId != null && sessions.containsKey(channelId);
    }

    public boolean hasOpenChannels() {
        return ! sessions.isEmpty();
    }

    public boolean isReady(final String channelId) {
        final ChannelSession session = channelId == null ? null : sessions.get(channelId);
        return session != null && session.isReady();
    }

    public boolean isReady() {
        final Collection<ChannelSession> current = sessions.values();
        if (current.isEmpty()) {
            return false;
        }
        for (ChannelSession session : current) {
            if (! session.isReady()) {
                return false;
            }
        }
        return true;
    }

    public Set<String> getChannelIds() {
        return Collections.unmodifiableSet(sessions.keySet());
    }

    public ChannelSession getSession(final String channelId) {
        return channelId == null ? null : sessions.get(channelId);
    }

    // calls

    public void registerCallHandler(final String callName, final CallHandler handler) {
        callRegistry.register(callName, handler);
    }

    public void unregisterCallHandler(final String callName) {
        callRegistry.unregister(callName);
    }

    public RemoteCallFactory remoteCall(final String channelId) {
        return remoteCall(channelId, CallSettings.ASYNC, null);
    }

    public RemoteCallFactory remoteCall(final String channelId, final CallSettings settings) {
        return remoteCall(channelId, settings, null);
    }

    public RemoteCallFactory remoteCall(final String channelId, final CallSettings settings, final CallCallback callback) {
        Assert.checkNotNullParam("settings", settings);
        return new RemoteCallFactory(this, channelId, settings, callback);
    }

    public RemoteCallFactory broadcastCall(final CallSettings settings, final CallCallback callback) {
        return remoteCall(null, settings, callback);
    }

    public ErrorKindRegistry getErrorKindRegistry() {
        return errorKindRegistry;
    }

    public int getPendingCallCount() {
        return tracker.getPendingCount();
    }

    Object sendCall(final String channelId, final String callName, final CallSettings settings, final CallCallback callback, final CallArguments arguments) throws IOException {
        final boolean blocking = settings.isBlocking();
        final List<ChannelSession> targets = getTargets(channelId);
        if (targets.isEmpty()) {
            if (blocking) {
                throw Messages.log.channelNotOpen();
            }
            Messages.calls.callToUnconnectedComm(callName);
            return null;
        }
        final String callId = tracker.issueCallId();
        final CallEnvelope envelope = new CallEnvelope(callName, callId, settings.withSendReply(blocking || callback != null));
        tracker.register(callId, callName, blocking, callback);
        try {
            for (ChannelSession session : targets) {
                send(session, MessageKind.REMOTE_CALL, envelope, arguments);
            }
        } catch (IOException e) {
            tracker.remove(callId);
            throw e;
        }
        if (! blocking) {
            return null;
        }
        return tracker.waitAndConsume(callId, callName, settings.hasTimeout() ? settings.getTimeoutMillis() : defaultTimeoutMillis);
    }

    // encoded at the lowest version, since the peer's range is not known yet
    private void sendHandshake(final ChannelSession session) throws IOException {
        final CallEnvelope envelope = new CallEnvelope(SET_CODEC_VERSION, tracker.issueCallId(), CallSettings.ASYNC);
        send(session, MessageKind.REMOTE_CALL, envelope, CallArguments.of(Integer.valueOf(codec.getMaxSupportedVersion())), codec.getMinSupportedVersion());
    }

    private List<ChannelSession> getTargets(final String channelId) {
        if (channelId == null) {
            return new ArrayList<>(sessions.values());
        }
        final ChannelSession session = sessions.get(channelId);
        return session == null ? Collections.emptyList() : Collections.singletonList(session);
    }

    private void send(final ChannelSession session, final MessageKind kind, final Envelope envelope, final Object value) throws IOException {
        send(session, kind, envelope, value, session.getCodecVersion());
    }

    private void send(final ChannelSession session, final MessageKind kind, final Envelope envelope, final Object value, final int version) throws IOException {
        final CommChannel channel = session.getChannel();
        if (! channel.isOpen()) {
            throw Messages.log.channelNotOpen();
        }
        final byte[] payload = codec.encode(value, version);
        final MessageHeader header = new MessageHeader(kind, envelope, version, senderDescriptor);
        channel.send(header, payload);
        Messages.channels.messageSent(header, session.getChannelId());
    }

    // incoming

    void handleCall(final ChannelSession session, final CallEnvelope envelope, final int version, final byte[] payload) {
        final String callName = envelope.getCallName();
        final String callId = envelope.getCallId();
        final CallArguments arguments;
        try {
            arguments = toArguments(codec.decode(payload, version));
        } catch (IOException e) {
            Messages.calls.callDropped(toDecodeException(MessageKind.REMOTE_CALL, e), session.getChannelId());
            return;
        }
        Object result;
        boolean error;
        final String previous = CallContext.enter(session.getChannelId());
        try {
            result = callRegistry.invoke(callName, arguments);
            error = false;
        } catch (Exception e) {
            Messages.calls.tracef(e, "Call %s [%s] failed", callName, callId);
            result = ErrorDescriptor.capture(callName, callId, e);
            error = true;
        } catch (Error e) {
            Messages.calls.tracef(e, "Call %s [%s] failed", callName, callId);
            sendReply(session, callName, callId, true, ErrorDescriptor.capture(callName, callId, e));
            throw e;
        } finally {
            CallContext.exit(previous);
        }
        if (! error && ! envelope.getSettings().isSendReply()) {
            return;
        }
        sendReply(session, callName, callId, error, result);
    }

    private void sendReply(final ChannelSession session, final String callName, final String callId, final boolean error, final Object result) {
        try {
            send(session, MessageKind.REMOTE_CALL_REPLY, new ReplyEnvelope(callName, callId, error), result);
        } catch (IOException e) {
            Messages.log.replyFailed(e, callName, callId);
            if (! error && session.getChannel().isOpen()) {
                // the return value could not be sent, so report that instead
                try {
                    send(session, MessageKind.REMOTE_CALL_REPLY, new ReplyEnvelope(callName, callId, true), ErrorDescriptor.capture(callName, callId, e));
                } catch (IOException e2) {
                    Messages.log.replyFailed(e2, callName, callId);
                }
            }
        }
    }

    void handleReply(final ChannelSession session, final ReplyEnvelope envelope, final int version, final byte[] payload) {
        ReplyEnvelope reply = envelope;
        Object value;
        try {
            value = codec.decode(payload, version);
        } catch (IOException e) {
            value = ErrorDescriptor.capture(envelope.getCallName(), envelope.getCallId(), toDecodeException(MessageKind.REMOTE_CALL_REPLY, e));
            reply = envelope.asError();
        }
        try {
            tracker.dispatchReply(reply, value);
        } catch (RuntimeException e) {
            Messages.log.exceptionInReceiver(e, session.getChannelId());
        }
    }

    private static CallArguments toArguments(final Object decoded) throws DecodeException {
        if (decoded == null) {
            return CallArguments.of();
        }
        if (decoded instanceof CallArguments) {
            return (CallArguments) decoded;
        }
        throw Messages.log.decodeFailed(MessageKind.REMOTE_CALL.getWireName(), new ClassCastException(decoded.getClass().getName()));
    }

    private static DecodeException toDecodeException(final MessageKind kind, final IOException e) {
        return e instanceof DecodeException ? (DecodeException) e : Messages.log.decodeFailed(kind.getWireName(), e);
    }

    // not IoUtils.safeClose, which only traces; a channel that fails to close is logged under its id
    private static void safeClose(final CommChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            Messages.log.closeFailed(e, channel.getChannelId());
        }
    }

    // lifecycle

    protected void closeAction() throws IOException {
        for (String channelId : new ArrayList<>(sessions.keySet())) {
            final ChannelSession session = sessions.remove(channelId);
            if (session != null) {
                Messages.channels.channelRemoved(channelId);
                safeClose(session.getChannel());
            }
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
        closeComplete();
    }

    public String toString() {
        return "comm endpoint \"" + name + "\"";
    }

    final class SessionReceiver implements CommChannel.Receiver {

        private final ChannelSession session;

        SessionReceiver(final ChannelSession session) {
            this.session = session;
        }

        public void handleError(final CommChannel channel, final IOException error) {
            Messages.channels.channelError(error, channel.getChannelId());
            safeClose(channel);
        }

        public void handleEnd(final CommChannel channel) {
            safeClose(channel);
        }

        public void handleMessage(final CommChannel channel, final MessageHeader header, final byte[] payload) {
            Messages.channels.messageReceived(header, channel.getChannelId());
            final Envelope content = header.getContent();
            final int version = header.getCodecVersion();
            if (header.getKind() == MessageKind.REMOTE_CALL && content instanceof CallEnvelope) {
                // hand off before asking for the next message, so calls start in arrival order
                try {
                    getExecutor().execute(() -> handleCall(session, (CallEnvelope) content, version, payload));
                } catch (RejectedExecutionException e) {
                    Messages.calls.callRejected(e, content.getCallName(), channel.getChannelId());
                }
                channel.receiveMessage(this);
            } else if (header.getKind() == MessageKind.REMOTE_CALL_REPLY && content instanceof ReplyEnvelope) {
                // a callback may itself block on a call, so keep receiving first
                channel.receiveMessage(this);
                handleReply(session, (ReplyEnvelope) content, version, payload);
            } else {
                Messages.log.unknownMessageKind(header.getKind());
                channel.receiveMessage(this);
            }
        }
    }
}
