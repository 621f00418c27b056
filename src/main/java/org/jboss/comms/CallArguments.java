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

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The positional and keyword arguments of a call.  This is what travels in the payload of a call message.
 */
public final class CallArguments implements Serializable {

    private static final long serialVersionUID = 2193049551750386261L;

    private static final Object[] NO_ARGS = new Object[0];

    private final Object[] positional;
    private final HashMap<String, Object> keywords;

    /**
     * Construct a new instance.
     *
     * @param positional the positional arguments ({@code null} for none)
     * @param keywords the keyword arguments ({@code null} for none)
     */
    public CallArguments(final Object[] positional, final Map<String, ?> keywords) {
        this.positional = positional == null ? NO_ARGS : positional.clone();
        this.keywords = keywords == null ? new HashMap<>() : new HashMap<>(keywords);
    }

    /**
     * Create an argument list with positional arguments only.
     *
     * @param positional the positional arguments
     * @return the argument list
     */
    public static CallArguments of(final Object... positional) {
        return new CallArguments(positional, null);
    }

    /**
     * Get the number of positional arguments.
     *
     * @return the number of positional arguments
     */
    public int size() {
        return positional.length;
    }

    /**
     * Get a positional argument.
     *
     * @param index the argument index
     * @return the argument value
     * @throws IndexOutOfBoundsException if there is no such argument
     */
    public Object get(final int index) {
        Objects.checkIndex(index, positional.length);
        return positional[index];
    }

    /**
     * Get a positional argument of the given type.
     *
     * @param index the argument index
     * @param type the expected type
     * @param <T> the expected type
     * @return the argument value
     * @throws ClassCastException if the argument is not of the expected type
     */
    public <T> T get(final int index, final Class<T> type) {
        return type.cast(get(index));
    }

    /**
     * Determine whether a keyword argument was given.
     *
     * @param name the keyword
     * @return {@code true} if the keyword argument is present
     */
    public boolean hasKeyword(final String name) {
        return keywords.containsKey(name);
    }

    /**
     * Get a keyword argument.
     *
     * @param name the keyword
     * @return the argument value, or {@code null} if it was not given
     */
    public Object getKeyword(final String name) {
        return keywords.get(name);
    }

    /**
     * Get a keyword argument, or a default value if it was not given.
     *
     * @param name the keyword
     * @param type the expected type
     * @param defaultValue the value to return when the keyword is absent
     * @param <T> the expected type
     * @return the argument value
     */
    public <T> T getKeyword(final String name, final Class<T> type, final T defaultValue) {
        return keywords.containsKey(name) ? type.cast(keywords.get(name)) : defaultValue;
    }

    public List<Object> getPositional() {
        return Collections.unmodifiableList(Arrays.asList(positional));
    }

    public Map<String, Object> getKeywords() {
        return Collections.unmodifiableMap(keywords);
    }

    public String toString() {
        return "args=" + Arrays.toString(positional) + ", kwargs=" + keywords;
    }
}
