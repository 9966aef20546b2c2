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
import org.kalendra.authentication.FailureReason;
import org.kalendra.authentication.plugin.ldap.LdapAuthenticator;
import org.kalendra.authentication.spi.Authenticator;
import org.kalendra.authentication.spi.AuthenticatorFactory;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Unit tests for {@link AuthenticatorManager}.
 */
@DisplayName("AuthenticatorManager Unit Tests")
public class AuthenticatorManagerTest {

    private static final Map<String, String> LDAP_OPTIONS = ImmutableMap.of(
            "ldap_url", "ldap://localhost:389",
            "ldap_base", "ou=users,dc=example,dc=com",
            "ldap_support_extended", "false");

    private AuthenticatorManager manager;

    @BeforeEach
    void setUp() {
        manager = new AuthenticatorManager();
    }

    @Test
    @DisplayName("UT-HANDLER-AM-001: Factories loaded automatically from ServiceLoader")
    void testFactoriesAutoLoaded() {
        // When - factories are loaded in constructor automatically
        List<String> types = manager.getRegisteredTypes();

        // Then
        Assertions.assertTrue(types.contains("ldap"), "Should include the ldap authenticator");
        Assertions.assertTrue(manager.hasFactory("ldap"));
    }

    @Test
    @DisplayName("UT-HANDLER-AM-002: Create ldap authenticator from options")
    void testCreateLdap() throws AuthenticationException {
        // When - compatibility mode skips the capability probe, so no server is needed
        Authenticator authenticator = manager.create("ldap", LDAP_OPTIONS);

        // Then
        Assertions.assertInstanceOf(LdapAuthenticator.class, authenticator);
        Assertions.assertEquals("ldap", authenticator.name());
    }

    @Test
    @DisplayName("UT-HANDLER-AM-003: Unknown type throws exception")
    void testCreateUnknownType() {
        AuthenticationException e = Assertions.assertThrows(AuthenticationException.class,
                () -> manager.create("kerberos", Collections.emptyMap()));
        Assertions.assertTrue(e.getMessage().contains("kerberos"));
    }

    @Test
    @DisplayName("UT-HANDLER-AM-004: Invalid options are wrapped in AuthenticationException")
    void testCreateInvalidOptions() {
        AuthenticationException e = Assertions.assertThrows(AuthenticationException.class,
                () -> manager.create("ldap", ImmutableMap.of("ldap_url", "ldap://localhost")));

        Assertions.assertInstanceOf(IllegalArgumentException.class, e.getCause());
        Assertions.assertTrue(e.getMessage().contains("ldap_base"));
    }

    @Test
    @DisplayName("UT-HANDLER-AM-005: Register factory manually, duplicate replaces existing")
    void testRegisterFactory() {
        // Given
        AuthenticatorFactory first = mockFactory("test-manual", Mockito.mock(Authenticator.class));
        AuthenticatorFactory second = mockFactory("test-manual", Mockito.mock(Authenticator.class));

        // When
        manager.registerFactory(first);
        manager.registerFactory(second);

        // Then
        Optional<AuthenticatorFactory> retrieved = manager.getFactory("test-manual");
        Assertions.assertTrue(retrieved.isPresent());
        Assertions.assertSame(second, retrieved.get());
    }

    @Test
    @DisplayName("UT-HANDLER-AM-006: Created authenticator is initialized")
    void testCreateInitializes() throws AuthenticationException {
        Authenticator authenticator = Mockito.mock(Authenticator.class);
        manager.registerFactory(mockFactory("mock", authenticator));

        Assertions.assertSame(authenticator, manager.create("mock", Collections.emptyMap()));
        Mockito.verify(authenticator).initialize();
        Mockito.verify(authenticator, Mockito.never()).close();
    }

    @Test
    @DisplayName("UT-HANDLER-AM-007: Failed initialization closes the authenticator and propagates")
    void testCreateInitializationFails() throws AuthenticationException {
        Authenticator authenticator = Mockito.mock(Authenticator.class);
        Mockito.doThrow(new AuthenticationException("no who am i", FailureReason.PROTOCOL_MISMATCH))
                .when(authenticator).initialize();
        manager.registerFactory(mockFactory("mock", authenticator));

        AuthenticationException e = Assertions.assertThrows(AuthenticationException.class,
                () -> manager.create("mock", Collections.emptyMap()));

        Assertions.assertEquals(FailureReason.PROTOCOL_MISMATCH, e.getReason().get());
        Mockito.verify(authenticator).close();
    }

    @Test
    @DisplayName("UT-HANDLER-AM-008: Service built through the manager authenticates")
    void testServiceFromManager() throws AuthenticationException {
        Authenticator authenticator = Mockito.mock(Authenticator.class);
        Mockito.when(authenticator.authenticate(Mockito.any(Credential.class)))
                .thenReturn(Decision.accepted("alice", "uid=alice,dc=example,dc=com"));
        manager.registerFactory(mockFactory("mock", authenticator));

        try (AuthenticationService service = AuthenticationService.create(manager, "mock", Collections.emptyMap())) {
            Assertions.assertTrue(service.authenticate("alice", "pw").isAccepted());
        }
        Mockito.verify(authenticator).close();
    }

    private static AuthenticatorFactory mockFactory(String name, Authenticator authenticator) {
        AuthenticatorFactory factory = Mockito.mock(AuthenticatorFactory.class);
        Mockito.when(factory.name()).thenReturn(name);
        Mockito.when(factory.create(Mockito.anyMap())).thenReturn(authenticator);
        return factory;
    }
}
