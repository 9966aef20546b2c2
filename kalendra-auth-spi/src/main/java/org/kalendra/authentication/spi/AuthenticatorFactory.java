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

import java.util.Map;

/**
 * Factory for {@link Authenticator} instances.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}; register
 * them in {@code META-INF/services/org.kalendra.authentication.spi.AuthenticatorFactory}.
 */
public interface AuthenticatorFactory {

    /**
     * Authenticator type name (globally unique), e.g. "ldap".
     *
     * @return type name
     */
    String name();

    /**
     * Creates an authenticator from the options the host read from its
     * configuration.
     *
     * @param options authenticator options, keyed by option name
     * @return new authenticator
     * @throws IllegalArgumentException if an option is unknown, missing or malformed
     */
    Authenticator create(Map<String, String> options);
}
