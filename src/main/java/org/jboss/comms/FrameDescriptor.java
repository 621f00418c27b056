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

/**
 * One frame of a remote stack trace: a source location and a function name.
 */
public final class FrameDescriptor implements Serializable {

    private static final long serialVersionUID = 1940253867121465081L;

    private final String declaringClass;
    private final String methodName;
    private final String fileName;
    private final int lineNumber;

    /**
     * Construct a new instance.
     *
     * @param declaringClass the name of the class (or module) containing the function
     * @param methodName the function name
     * @param fileName the source file name, or {@code null} if unknown
     * @param lineNumber the line number, or a negative number if unknown
     */
    public FrameDescriptor(final String declaringClass, final String methodName, final String fileName, final int lineNumber) {
        this.declaringClass = declaringClass == null ? "" : declaringClass;
        this.methodName = methodName == null ? "" : methodName;
        this.fileName = fileName;
        this.lineNumber = lineNumber;
    }

    static FrameDescriptor of(final StackTraceElement element) {
        return new FrameDescriptor(element.getClassName(), element.getMethodName(), element.getFileName(), element.getLineNumber());
    }

    StackTraceElement toStackTraceElement() {
        return new StackTraceElement(declaringClass, methodName, fileName, lineNumber);
    }

    public String getDeclaringClass() {
        return declaringClass;
    }

    public String getMethodName() {
        return methodName;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String toString() {
        return toStackTraceElement().toString();
    }
}
