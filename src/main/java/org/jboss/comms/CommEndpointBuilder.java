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

import java.util.concurrent.Executor;

import org.jboss.comms._private.Messages;
import org.jboss.comms.marshalling.MarshallingPayloadCodec;
import org.jboss.comms.spi.PayloadCodec;
import org.wildfly.common.Assert;
import org.xnio.OptionMap;

/**
 * A builder for comm endpoints.  Obtained from {@link CommEndpoint#builder()}.
 */
public final class CommEndpointBuilder {
    private String endpointName;
    private PayloadCodec payloadCodec;
    private Executor executor;
    private ErrorKindRegistry errorKindRegistry;
    private AsyncErrorHandler asyncErrorHandler;
    private OptionMap optionMap = OptionMap.EMPTY;

    CommEndpointBuilder() {
    }

    public CommEndpointBuilder setEndpointName(final String endpointName) {
        this.endpointName = endpointName;
        return this;
    }

    public CommEndpointBuilder setPayloadCodec(final PayloadCodec payloadCodec) {
        this.payloadCodec = payloadCodec;
        return this;
    }

    /**
     * Set the executor which runs incoming calls and close handlers.  If none is given, the endpoint creates its own
     * and shuts it down on close.
     *
     * @param executor the executor
     * @return this builder
     */
    public CommEndpointBuilder setExecutor(final Executor executor) {
        this.executor = executor;
        return this;
    }

    public CommEndpointBuilder setErrorKindRegistry(final ErrorKindRegistry errorKindRegistry) {
        this.errorKindRegistry = errorKindRegistry;
        return this;
    }

    public CommEndpointBuilder setAsyncErrorHandler(final AsyncErrorHandler asyncErrorHandler) {
        this.asyncErrorHandler = asyncErrorHandler;
        return this;
    }

    /**
     * Set the endpoint options.  See {@link CommOptions}.
     *
     * @param optionMap the option map
     * @return this builder
     */
    public CommEndpointBuilder setOptionMap(final OptionMap optionMap) {
        Assert.checkNotNullParam("optionMap", optionMap);
        this.optionMap = optionMap;
        return this;
    }

    /**
     * Build the endpoint.
     *
     * @return the new endpoint
     * @throws IllegalArgumentException if the options are not valid for the payload codec
     */
    public CommEndpoint build() {
        final PayloadCodec codec = payloadCodec == null ? new MarshallingPayloadCodec() : payloadCodec;
        final int codecVersion = optionMap.get(CommOptions.DEFAULT_CODEC_VERSION, CommOptions.DEFAULT_CODEC_VERSION_NUMBER);
        if (codecVersion < codec.getMinSupportedVersion() || codecVersion > codec.getMaxSupportedVersion()) {
            throw Messages.log.invalidCodecVersion(codecVersion, codec.getMinSupportedVersion(), codec.getMaxSupportedVersion());
        }
        final int timeout = optionMap.get(CommOptions.DEFAULT_CALL_TIMEOUT, CommOptions.DEFAULT_CALL_TIMEOUT_MILLIS);
        Assert.checkMinimumParameter("DEFAULT_CALL_TIMEOUT", 0, timeout);
        final ErrorKindRegistry registry = errorKindRegistry == null
            ? new ErrorKindRegistry(optionMap.get(CommOptions.RESOLVE_ERROR_CLASSES, true), CommEndpointBuilder.class.getClassLoader())
            : errorKindRegistry;
        return new CommEndpointImpl(
            endpointName == null ? "endpoint" : endpointName,
            codec,
            executor,
            registry,
            asyncErrorHandler == null ? AsyncErrorHandler.LOGGING : asyncErrorHandler,
            codecVersion,
            timeout,
            optionMap.get(CommOptions.CHANNEL_NAME, CommOptions.DEFAULT_CHANNEL_NAME)
        );
    }
}
