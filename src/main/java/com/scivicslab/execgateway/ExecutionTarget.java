/*
 * Copyright 2025 devteam@scivics-lab.com
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package com.scivicslab.execgateway;

import java.util.Map;

/**
 * What the execution engine needs to know about a host to contact it.
 *
 * @author devteam@scivicslab.com
 * @since 1.0.0
 */
public interface ExecutionTarget {

    /**
     * Gets the inventory name of the host.
     *
     * @return the host name
     */
    String getName();

    /**
     * Gets the network address used to connect.
     *
     * @return the address (IP or resolvable host name)
     */
    String getAddress();

    /**
     * Gets the SSH port.
     *
     * @return the port
     */
    int getPort();

    /**
     * Gets the connection and user variables of the host.
     *
     * @return an unmodifiable view of the variables
     */
    Map<String, Object> getVariables();
}
