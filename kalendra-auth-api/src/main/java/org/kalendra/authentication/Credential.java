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

import com.google.common.base.Strings;

/**
 * A username/password pair presented by a client for a single request.
 *
 * <p>Both values are untrusted input. The host server extracts them from its own
 * transport (for example an HTTP Basic authorization header) and hands them over
 * unmodified; validation happens in the authenticator.
 *
 * <p>The password is never rendered by {@link #toString()}, so a credential can
 * be passed to a logger without leaking it.
 */
public final class Credential {

    private final String username;
    private final String password;

    private Credential(String username, String password) {
        this.username = username;
        this.password = password;
    }

    /**
     * Creates a credential. Null values are kept as-is and treated as empty by
     * {@link #isBlank()}.
     *
     * @param username the login name, may be null
     * @param password the clear text password, may be null
     * @return new credential
     */
    public static Credential of(String username, String password) {
        return new Credential(username, password);
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    /**
     * Whether the username or the password is null or empty. Such a credential
     * must never reach the directory: an empty password turns a simple bind into
     * an unauthenticated bind that many servers report as successful.
     *
     * @return true if either part is missing
     */
    public boolean isBlank() {
        return Strings.isNullOrEmpty(username) || Strings.isNullOrEmpty(password);
    }

    @Override
    public String toString() {
        return "Credential{"
                + "username='" + username + '\''
                + ", password=" + (Strings.isNullOrEmpty(password) ? "<empty>" : "<redacted>")
                + '}';
    }
}
