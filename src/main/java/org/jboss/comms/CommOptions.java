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

import org.xnio.Option;

/**
 * Common options for comm endpoint configuration.
 */
public final class CommOptions {

    private CommOptions() {
    }

    /**
     * The time in milliseconds a blocking call waits for its reply when the call does not specify a timeout.
     */
    public static final Option<Integer> DEFAULT_CALL_TIMEOUT = Option.simple(CommOptions.class, "DEFAULT_CALL_TIMEOUT", Integer.class);

    /**
     * The default call timeout.
     */
    public static final int DEFAULT_CALL_TIMEOUT_MILLIS = 3000;

    /**
     * The codec version a channel session starts with, before the handshake settles it.  The handshake itself is
     * always encoded at the codec's lowest version.
     */
    public static final Option<Integer> DEFAULT_CODEC_VERSION = Option.simple(CommOptions.class, "DEFAULT_CODEC_VERSION", Integer.class);

    /**
     * The default initial codec version.
     */
    public static final int DEFAULT_CODEC_VERSION_NUMBER = 2;

    /**
     * The comm name used when the endpoint opens channels through a transport.
     */
    public static final Option<String> CHANNEL_NAME = Option.simple(CommOptions.class, "CHANNEL_NAME", String.class);

    /**
     * The default comm name.
     */
    public static final String DEFAULT_CHANNEL_NAME = "comms_api";

    /**
     * Specify whether an error kind with no registered factory may be resolved by loading a {@code Throwable} class
     * of that name.
     */
    public static final Option<Boolean> RESOLVE_ERROR_CLASSES = Option.simple(CommOptions.class, "RESOLVE_ERROR_CLASSES", Boolean.class);
}
