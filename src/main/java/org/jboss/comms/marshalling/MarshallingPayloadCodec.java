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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.NotSerializableException;

import org.jboss.comms._private.Messages;
import org.jboss.comms.spi.PayloadCodec;
import org.jboss.marshalling.Marshaller;
import org.jboss.marshalling.MarshallerFactory;
import org.jboss.marshalling.Marshalling;
import org.jboss.marshalling.MarshallingConfiguration;
import org.jboss.marshalling.SimpleClassResolver;
import org.jboss.marshalling.Unmarshaller;
import org.jboss.marshalling.river.RiverMarshallerFactory;
import org.wildfly.common.Assert;
import org.xnio.IoUtils;

/**
 * A payload codec which wraps a JBoss Marshalling {@link MarshallerFactory}.  The codec version selects the wire
 * protocol version of the marshaller.
 */
public final class MarshallingPayloadCodec implements PayloadCodec {

    /**
     * The lowest River protocol version.
     */
    public static final int MIN_VERSION = 2;

    /**
     * The highest River protocol version.
     */
    public static final int MAX_VERSION = 4;

    private final MarshallerFactory marshallerFactory;
    private final ClassLoader classLoader;

    /**
     * Construct a new instance using River, resolving classes through this library's class loader.
     */
    public MarshallingPayloadCodec() {
        this(new RiverMarshallerFactory(), MarshallingPayloadCodec.class.getClassLoader());
    }

    /**
     * Construct a new instance.
     *
     * @param marshallerFactory the marshaller factory to use
     * @param classLoader the class loader used to resolve decoded classes
     */
    public MarshallingPayloadCodec(final MarshallerFactory marshallerFactory, final ClassLoader classLoader) {
        Assert.checkNotNullParam("marshallerFactory", marshallerFactory);
        Assert.checkNotNullParam("classLoader", classLoader);
        this.marshallerFactory = marshallerFactory;
        this.classLoader = classLoader;
    }

    public byte[] encode(final Object value, final int version) throws IOException {
        final MarshallingConfiguration config = buildConfig(version);
        final ByteArrayOutputStream os = new ByteArrayOutputStream();
        final Marshaller marshaller = marshallerFactory.createMarshaller(config);
        try {
            marshaller.start(Marshalling.createByteOutput(os));
            marshaller.writeObject(value);
            marshaller.finish();
        } catch (NotSerializableException e) {
            throw Messages.log.notEncodable(value.getClass().getName(), e);
        } finally {
            IoUtils.safeClose(marshaller);
        }
        return os.toByteArray();
    }

    public Object decode(final byte[] bytes, final int version) throws IOException {
        final MarshallingConfiguration config;
        try {
            config = buildConfig(version);
        } catch (IOException e) {
            throw Messages.log.undecodablePayload(e);
        }
        final Unmarshaller unmarshaller = marshallerFactory.createUnmarshaller(config);
        try {
            unmarshaller.start(Marshalling.createByteInput(new ByteArrayInputStream(bytes)));
            final Object value = unmarshaller.readObject();
            unmarshaller.finish();
            return value;
        } catch (ClassNotFoundException | IOException | RuntimeException e) {
            throw Messages.log.undecodablePayload(e);
        } catch (LinkageError | StackOverflowError e) {
            // a broken class or a runaway object graph only spoils this payload
            throw Messages.log.undecodablePayload(e);
        } finally {
            IoUtils.safeClose(unmarshaller);
        }
    }

    public int getMaxSupportedVersion() {
        return MAX_VERSION;
    }

    public int getMinSupportedVersion() {
        return MIN_VERSION;
    }

    private MarshallingConfiguration buildConfig(final int version) throws IOException {
        if (version < MIN_VERSION || version > MAX_VERSION) {
            throw Messages.log.unsupportedCodecVersion(version, MIN_VERSION, MAX_VERSION);
        }
        final MarshallingConfiguration config = new MarshallingConfiguration();
        config.setClassResolver(new SimpleClassResolver(classLoader));
        config.setVersion(version);
        return config;
    }
}
