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

import org.jboss.comms._private.Messages;

/**
 * A handler for errors raised on the other side which no caller is waiting for.  Implementations must not throw.
 */
@FunctionalInterface
public interface AsyncErrorHandler {

    /**
     * The default handler, which logs the formatted error.
     */
    AsyncErrorHandler LOGGING = descriptor -> Messages.log.asyncRemoteError(descriptor.format());

    /**
     * Handle an unclaimed remote error.
     *
     * @param descriptor the error descriptor
     */
    void handleAsyncError(ErrorDescriptor descriptor);
}
