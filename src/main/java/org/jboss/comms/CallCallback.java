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
 * A callback which receives the return value of a call when its reply arrives.  Callbacks run on the thread which
 * delivered the reply and are only invoked for successful replies.
 */
@FunctionalInterface
public interface CallCallback {

    /**
     * Handle the return value of a call.
     *
     * @param value the decoded return value (may be {@code null})
     */
    void handleReply(Object value);
}
