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

package org.kalendra.authentication.handler;

import org.kalendra.authentication.AuthenticationException;
import org.kalendra.authentication.Credential;
import org.kalendra.authentication.Decision;
import org.kalendra.authentication.spi.Authenticator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;

/**
 * Authentication service - the entry point the host server calls.
 *
 * <p>Wraps one configured {@link Authenticator}. {@link #authenticate(String, String)}
 * never throws: whatever goes wrong below it, the host gets
 * {@link Decision#rejected()} and can answer its client with a plain
 * "unauthorized".
 */
public class AuthenticationService implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(AuthenticationService.class);

    private final Authenticator authenticator;

    public AuthenticationService(Authenticator authenticator) {
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
    }

    /**
     * Builds a service around a freshly created and initialized authenticator.
     *
     * @param manager the authenticator manager
     * @param type authenticator type, e.g. "ldap"
     * @param options authenticator options
     * @return the service
     * @throws AuthenticationException if the authenticator cannot be created
     */
    public static AuthenticationService create(AuthenticatorManager manager, String type,
            Map<String, String> options) throws AuthenticationException {
        Objects.requireNonNull(manager, "manager");
        return new AuthenticationService(manager.create(type, options));
    }

    /**
     * Decides whether the username/password pair is valid.
     *
     * @param username login name
     * @param password clear text password
     * @return the decision, never null
     */
    public Decision authenticate(String username, String password) {
        Decision decision;
        try {
            decision = authenticator.authenticate(Credential.of(username, password));
        } catch (RuntimeException e) {
            LOG.error("Authenticator {} failed unexpectedly for user: {}", authenticator.name(), username, e);
            return Decision.rejected();
        }
        if (decision == null) {
            LOG.error("Authenticator {} returned no decision for user: {}", authenticator.name(), username);
            return Decision.rejected();
        }
        return decision;
    }

    public Authenticator getAuthenticator() {
        return authenticator;
    }

    @Override
    public void close() {
        authenticator.close();
    }
}
