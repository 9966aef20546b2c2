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
import org.kalendra.authentication.spi.Authenticator;
import org.kalendra.authentication.spi.AuthenticatorFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manager for authenticator factories.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Discover {@link AuthenticatorFactory} implementations on the classpath</li>
 *   <li>Create and initialize an {@link Authenticator} from a type name and options</li>
 * </ul>
 */
public class AuthenticatorManager {
    private static final Logger LOG = LogManager.getLogger(AuthenticatorManager.class);

    /** Factories by type name (e.g., "ldap") */
    private final Map<String, AuthenticatorFactory> factories = new ConcurrentHashMap<>();

    public AuthenticatorManager() {
        this(AuthenticatorManager.class.getClassLoader());
    }

    public AuthenticatorManager(ClassLoader classLoader) {
        ServiceLoader.load(AuthenticatorFactory.class, classLoader)
                .forEach(factory -> factories.put(factory.name(), factory));
        LOG.info("Discovered authenticator factories: {}", factories.keySet());
    }

    /**
     * Register/override a factory programmatically (useful for tests).
     *
     * @param factory the factory to register
     */
    public void registerFactory(AuthenticatorFactory factory) {
        Objects.requireNonNull(factory, "factory");
        factories.put(factory.name(), factory);
    }

    /**
     * Get a factory by type name.
     *
     * @param type the authenticator type
     * @return the factory, or empty if not found
     */
    public Optional<AuthenticatorFactory> getFactory(String type) {
        return Optional.ofNullable(factories.get(type));
    }

    public boolean hasFactory(String type) {
        return factories.containsKey(type);
    }

    public List<String> getRegisteredTypes() {
        return new ArrayList<>(factories.keySet());
    }

    /**
     * Creates an authenticator and runs its startup checks.
     *
     * @param type authenticator type, e.g. "ldap"
     * @param options authenticator options as read from the host configuration
     * @return an initialized authenticator
     * @throws AuthenticationException if the type is unknown, the options are invalid,
     *         or initialization fails
     */
    public Authenticator create(String type, Map<String, String> options) throws AuthenticationException {
        Objects.requireNonNull(options, "options");
        AuthenticatorFactory factory = factories.get(type);
        if (factory == null) {
            throw new AuthenticationException("No AuthenticatorFactory found for type: " + type
                    + ", available: " + factories.keySet());
        }

        Authenticator authenticator;
        try {
            authenticator = factory.create(options);
        } catch (IllegalArgumentException e) {
            throw new AuthenticationException("Invalid configuration for authenticator '" + type + "': "
                    + e.getMessage(), e);
        }

        try {
            authenticator.initialize();
        } catch (AuthenticationException e) {
            authenticator.close();
            throw e;
        }
        LOG.info("Created authenticator: {}", authenticator.description());
        return authenticator;
    }
}
