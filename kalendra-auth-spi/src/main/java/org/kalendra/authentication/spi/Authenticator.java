// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.kalendra.authentication.spi;

import org.kalendra.authentication.AuthenticationException;
import org.kalendra.authentication.Credential;
import org.kalendra.authentication.Decision;

/**
 * Authenticator interface.
 *
 * <p>This is the single contract the host server calls into: it presents the
 * username and password it extracted from its own transport and receives an
 * accept/reject {@link Decision}.
 *
 * <p>Key design principles:
 * <ul>
 *   <li>Implementations are built once from configuration and are safe for
 *       concurrent use; every call is independent</li>
 *   <li>Per-request failures of any kind resolve to {@link Decision#rejected()};
 *       the host never learns why a credential failed</li>
 *   <li>Configuration and capability problems surface from {@link #initialize()},
 *       not from individual calls</li>
 * </ul>
 */
public interface Authenticator extends AutoCloseable {

    // ==================== Basic Information ====================

    /**
     * Authenticator type name, matching the factory that created it.
     * Example: "ldap"
     *
     * @return type name
     */
    String name();

    /**
     * Human readable description.
     *
     * @return description
     */
    default String description() {
        return "Authenticator: " + name();
    }

    // ==================== Authentication Execution ====================

    /**
     * Decides whether the credential is valid.
     *
     * <p>Never throws for per-request problems (bad input, unknown user, wrong
     * password, directory outage); those all yield {@link Decision#rejected()}.
     *
     * @param credential the credential presented by the client
     * @return the decision
     */
    Decision authenticate(Credential credential);

    /**
     * Convenience overload of {@link #authenticate(Credential)}.
     *
     * @param username the login name
     * @param password the clear text password
     * @return the decision
     */
    default Decision authenticate(String username, String password) {
        return authenticate(Credential.of(username, password));
    }

    // ==================== Lifecycle ====================

    /**
     * Verifies that the backing service can honour the configuration
     * (called once at startup, before the first request).
     *
     * @throws AuthenticationException if the configuration cannot work against the backing service
     */
    default void initialize() throws AuthenticationException {
        // Default: nothing to probe
    }

    /**
     * Releases resources (called on shutdown).
     */
    @Override
    default void close() {
        // Default: no cleanup needed
    }
}
