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

package org.kalendra.authentication;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link AuthenticationException}.
 */
@DisplayName("AuthenticationException Unit Tests")
class AuthenticationExceptionTest {

    @Test
    @DisplayName("UT-API-AE-001: Create exception with message")
    void testCreateException_WithMessage() {
        AuthenticationException exception = new AuthenticationException("Authenticator type is unknown");

        Assertions.assertEquals("Authenticator type is unknown", exception.getMessage());
        Assertions.assertNull(exception.getCause());
        Assertions.assertFalse(exception.getReason().isPresent());
    }

    @Test
    @DisplayName("UT-API-AE-002: Create exception with message and cause")
    void testCreateException_WithMessageAndCause() {
        Throwable cause = new RuntimeException("Connection refused");

        AuthenticationException exception = new AuthenticationException("Directory probe failed", cause);

        Assertions.assertEquals("Directory probe failed", exception.getMessage());
        Assertions.assertSame(cause, exception.getCause());
        Assertions.assertFalse(exception.getReason().isPresent());
    }

    @Test
    @DisplayName("UT-API-AE-003: Create exception with cause only")
    void testCreateException_WithCause() {
        Throwable cause = new IllegalArgumentException("ldap_scope must be one of BASE, LEVEL, SUBTREE");

        AuthenticationException exception = new AuthenticationException(cause);

        Assertions.assertSame(cause, exception.getCause());
        Assertions.assertTrue(exception.getMessage().contains("ldap_scope"));
    }

    @Test
    @DisplayName("UT-API-AE-004: Reason is carried when classified")
    void testCreateException_WithReason() {
        AuthenticationException exception = new AuthenticationException(
                "Who am I? extended operation not supported", FailureReason.PROTOCOL_MISMATCH);

        Assertions.assertEquals(FailureReason.PROTOCOL_MISMATCH, exception.getReason().orElse(null));
        Assertions.assertTrue(exception.getReason().get().isInfrastructure());
    }

    @Test
    @DisplayName("UT-API-AE-005: Exception is checked")
    void testExceptionHierarchy() {
        AuthenticationException exception = new AuthenticationException("Test");

        Assertions.assertInstanceOf(Exception.class, exception);
        Assertions.assertFalse(RuntimeException.class.isAssignableFrom(exception.getClass()));
    }
}
