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
 * Stand-in for a remote error whose kind has no local counterpart.
 */
public class UnknownRemoteException extends Exception {

    private static final long serialVersionUID = -7843104637286119372L;

    private final String kind;

    /**
     * Construct a new instance.
     *
     * @param kind the remote error kind
     * @param msg the remote error message
     */
    public UnknownRemoteException(final String kind, final String msg) {
        super(msg);
        this.kind = kind;
    }

    /**
     * Get the remote error kind.
     *
     * @return the error kind
     */
    public String getKind() {
        return kind;
    }

    public String toString() {
        final String message = getLocalizedMessage();
        return message == null ? kind : kind + ": " + message;
    }
}
