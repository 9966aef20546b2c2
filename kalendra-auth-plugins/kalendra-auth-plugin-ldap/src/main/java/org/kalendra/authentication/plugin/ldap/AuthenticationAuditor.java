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

import org.kalendra.authentication.FailureReason;

/**
 * Receives the internal outcome of every authentication call.
 *
 * <p>This is where rejected calls keep their {@link FailureReason}; the caller
 * of the authenticator only ever sees an opaque rejection. Implementations
 * receive the username but never the password.
 */
public interface AuthenticationAuditor {

    /**
     * Called when a credential was accepted.
     *
     * @param username login name as presented
     * @param userDn DN of the entry the password was verified against
     */
    void accepted(String username, String userDn);

    /**
     * Called when a credential was rejected.
     *
     * @param username login name as presented, may be null or empty
     * @param reason classified reason
     * @param cause underlying directory failure, null when the directory answered normally
     */
    void rejected(String username, FailureReason reason, Throwable cause);
}
