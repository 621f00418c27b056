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
 * Exception thrown to a blocking caller when the called function failed on the other side.  The cause is a
 * throwable of the original kind, with the original message and the remote frames as its stack trace.
 */
public class RemoteCallException extends CommException {

    private static final long serialVersionUID = 3580395686019440048L;

    private final ErrorDescriptor descriptor;

    /**
     * Constructs a {@code RemoteCallException} with the specified detail message, descriptor and cause.
     *
     * @param msg the detail message
     * @param descriptor the descriptor of the remote error
     * @param cause the rebuilt remote error
     */
    public RemoteCallException(final String msg, final ErrorDescriptor descriptor, final Throwable cause) {
        super(msg, cause);
        this.descriptor = descriptor;
    }

    /**
     * Get the descriptor of the remote error.
     *
     * @return the descriptor
     */
    public ErrorDescriptor getDescriptor() {
        return descriptor;
    }

    /**
     * Get the kind of the remote error.
     *
     * @return the error kind
     */
    public String getKind() {
        return descriptor.getKind();
    }

    /**
     * Convenience method to rethrow the cause of a {@code RemoteCallException} as a specific type, in order
     * to simplify application exception handling.
     * <p>
     * A typical usage might look like this:
     * <pre>
     *   try {
     *     comm.remoteCall(id, CallSettings.blocking()).call("divide").invoke(1, 0);
     *   } catch (RemoteCallException rce) {
     *     rce.rethrow(ArithmeticException.class);
     *     throw rce;
     *   }
     * </pre>
     *
     * @param type the class of the exception
     * @param <T> the exception type
     * @throws T the exception, if it matches the given type
     */
    public <T extends Throwable> void rethrow(Class<T> type) throws T {
        final Throwable cause = getCause();
        if (cause != null && type.isInstance(cause)) {
            throw type.cast(cause);
        }
    }
}
