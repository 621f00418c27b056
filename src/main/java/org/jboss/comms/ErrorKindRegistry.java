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

import java.lang.reflect.Constructor;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.jboss.comms._private.Messages;
import org.wildfly.common.Assert;

/**
 * A registry mapping stable error kind identifiers to local throwable types, used to rebuild remote errors.
 * <p>
 * A kind is resolved by, in order: an explicit registration (several kinds may map to one type, which allows
 * foreign kind names to be aliased to Java exceptions); a loadable {@code Throwable} class of that name, if class
 * resolution is enabled; and finally an {@link UnknownRemoteException} carrying the kind and message.
 */
public final class ErrorKindRegistry {

    private final Map<String, ErrorFactory> factories = new ConcurrentHashMap<>();
    private final boolean resolveClasses;
    private final ClassLoader classLoader;

    /**
     * Construct a new instance with class resolution enabled, using this class's class loader.
     */
    public ErrorKindRegistry() {
        this(true, ErrorKindRegistry.class.getClassLoader());
    }

    /**
     * Construct a new instance.
     *
     * @param resolveClasses {@code true} to rebuild unregistered kinds which name a loadable throwable class
     * @param classLoader the class loader to load throwable classes from
     */
    public ErrorKindRegistry(final boolean resolveClasses, final ClassLoader classLoader) {
        this.resolveClasses = resolveClasses;
        this.classLoader = classLoader;
        register(CommException.class.getName(), CommException::new);
        register(NoSuchCallException.class.getName(), NoSuchCallException::new);
        register(CommTimeoutException.class.getName(), CommTimeoutException::new);
        register(DecodeException.class.getName(), DecodeException::new);
    }

    /**
     * Register a factory for an error kind, replacing any previous registration.
     *
     * @param kind the error kind
     * @param factory the factory
     */
    public void register(final String kind, final ErrorFactory factory) {
        Assert.checkNotNullParam("kind", kind);
        Assert.checkNotNullParam("factory", factory);
        factories.put(kind, factory);
    }

    /**
     * Remove the registration of an error kind.
     *
     * @param kind the error kind
     */
    public void unregister(final String kind) {
        factories.remove(kind);
    }

    /**
     * Create a throwable for the given kind and message.  Never returns {@code null}.
     *
     * @param kind the error kind
     * @param message the error message
     * @return the throwable
     */
    public Throwable create(final String kind, final String message) {
        final ErrorFactory factory = factories.get(kind);
        if (factory != null) {
            final Throwable throwable = factory.create(message);
            if (throwable != null) {
                return throwable;
            }
        }
        if (resolveClasses) {
            final Throwable throwable = instantiate(kind, message);
            if (throwable != null) {
                return throwable;
            }
        }
        return new UnknownRemoteException(kind, message);
    }

    private Throwable instantiate(final String kind, final String message) {
        final Class<? extends Throwable> throwableClass;
        try {
            throwableClass = Class.forName(kind, false, classLoader).asSubclass(Throwable.class);
        } catch (ClassNotFoundException | ClassCastException | LinkageError e) {
            Messages.log.tracef("Error kind %s is not a loadable throwable class", kind);
            return null;
        }
        // try a few constructors
        try {
            final Constructor<? extends Throwable> constructor = throwableClass.getConstructor(String.class);
            return constructor.newInstance(message);
        } catch (ReflectiveOperationException e) {
            Messages.log.tracef(e, "No usable message constructor on %s", throwableClass);
        }
        try {
            return throwableClass.getConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            Messages.log.tracef(e, "No usable default constructor on %s", throwableClass);
        }
        // we tried!
        return null;
    }

    /**
     * A factory for the local counterpart of a remote error kind.
     */
    @FunctionalInterface
    public interface ErrorFactory {

        /**
         * Create the throwable.
         *
         * @param message the remote error message, or {@code null} if there was none
         * @return the throwable
         */
        Throwable create(String message);
    }
}
