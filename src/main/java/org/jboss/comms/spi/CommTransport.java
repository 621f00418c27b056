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

package org.jboss.comms.spi;

import java.io.IOException;

/**
 * A messaging substrate which is able to open comm channels to the other side.
 */
public interface CommTransport {

    /**
     * Open a new channel to the other side.  The remote side is notified through its {@link OpenListener}.
     *
     * @param name the comm name (target name) of the channel
     * @return the opened channel
     * @throws IOException if the channel could not be opened
     */
    CommChannel openChannel(String name) throws IOException;
}
