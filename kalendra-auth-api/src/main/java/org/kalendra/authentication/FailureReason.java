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

/**
 * Why an authentication attempt was rejected.
 *
 * <p>Reasons are for internal diagnostics only. The host server only ever sees
 * {@link Decision#rejected()}, so a client cannot tell an unknown user from a
 * wrong password.
 *
 * <p>Each reason is either an <em>infrastructure</em> failure (directory down,
 * misconfigured service account, protocol mismatch) that operators should be
 * alerted about, or an <em>authentication</em> failure that is expected and
 * high-volume.
 */
public enum FailureReason {

    /** Empty username or password; rejected without contacting the directory. */
    INVALID_CREDENTIAL_INPUT(false),

    /** Connection or transport failure while reaching the directory. */
    DIRECTORY_UNREACHABLE(true),

    /** A directory round trip did not complete within the configured bound. */
    DIRECTORY_TIMEOUT(true),

    /** The service account used for the lookup bind was rejected. */
    LOOKUP_BIND_FAILED(true),

    /** No entry matched the login filter. */
    USER_NOT_FOUND(false),

    /** More than one entry matched the login filter. */
    AMBIGUOUS_USER(false),

    /** The user entry was found but the directory rejected the password. */
    VERIFY_BIND_FAILED(false),

    /** The directory does not support the configured extended-operation mode. */
    PROTOCOL_MISMATCH(true),

    /** Any other protocol-level error reported by the directory. */
    DIRECTORY_ERROR(true),

    /** The caller abandoned the attempt while it was in flight. */
    CANCELLED(true);

    private final boolean infrastructure;

    FailureReason(boolean infrastructure) {
        this.infrastructure = infrastructure;
    }

    /**
     * Returns whether this reason points at the directory or its configuration
     * rather than at the credential presented by the user.
     *
     * @return true for infrastructure failures
     */
    public boolean isInfrastructure() {
        return infrastructure;
    }
}
