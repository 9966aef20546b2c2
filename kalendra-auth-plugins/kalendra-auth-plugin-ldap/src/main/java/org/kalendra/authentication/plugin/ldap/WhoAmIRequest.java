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

package org.kalendra.authentication.plugin.ldap;

import java.nio.charset.StandardCharsets;
import javax.naming.ldap.ExtendedRequest;
import javax.naming.ldap.ExtendedResponse;

/**
 * JNDI request for the "Who am I?" extended operation (RFC 4532).
 *
 * <p>The request has no value. The response value, when present, is the
 * authorization identity of the connection as a UTF-8 string such as
 * {@code dn:uid=alice,ou=users,dc=example,dc=com}; anonymous connections get
 * an empty identity.
 */
public final class WhoAmIRequest implements ExtendedRequest {

    public static final String OID = "1.3.6.1.4.1.4203.1.11.3";

    private static final long serialVersionUID = 1L;

    @Override
    public String getID() {
        return OID;
    }

    @Override
    public byte[] getEncodedValue() {
        return null;
    }

    @Override
    public ExtendedResponse createExtendedResponse(String id, byte[] berValue, int offset, int length) {
        String authzId = berValue == null || length == 0
                ? ""
                : new String(berValue, offset, length, StandardCharsets.UTF_8);
        return new Response(id, authzId);
    }

    /**
     * Response carrying the authorization identity.
     */
    public static final class Response implements ExtendedResponse {

        private static final long serialVersionUID = 1L;

        private final String id;
        private final String authzId;

        Response(String id, String authzId) {
            this.id = id;
            this.authzId = authzId;
        }

        @Override
        public String getID() {
            return id;
        }

        @Override
        public byte[] getEncodedValue() {
            return authzId.getBytes(StandardCharsets.UTF_8);
        }

        public String getAuthorizationId() {
            return authzId;
        }
    }
}
