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

/**
 * A handler for calls of one name, registered on an endpoint so that the other side can invoke it.
 */
@FunctionalInterface
public interface CallHandler {

    /**
     * Handle a call.  Any exception thrown here is sent back to the caller as an error reply.
     *
     * @param arguments the call arguments
     * @return the return value, which must be encodable by the endpoint's payload codec
     * @throws Exception if the call fails
     */
    Object handleCall(CallArguments arguments) throws Exception;
}
