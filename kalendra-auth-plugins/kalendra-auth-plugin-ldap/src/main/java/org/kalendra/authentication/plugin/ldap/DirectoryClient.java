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

/**
 * Directory protocol capability used by {@link LdapAuthenticator}.
 *
 * <p>Every method opens a new connection that belongs to the caller until it is
 * closed; connections are never shared between authentication calls.
 * Implementations must be safe for concurrent use.
 */
public interface DirectoryClient {

    /**
     * Connects and performs the lookup bind: as the configured service account,
     * or anonymously when none is configured.
     *
     * @return bound connection
     * @throws DirectoryException if the connection or the bind fails
     */
    DirectoryConnection openLookupConnection() throws DirectoryException;

    /**
     * Connects and binds as the given entry with a simple bind.
     *
     * @param userDn DN of the entry to bind as
     * @param password the user's password, never empty
     * @return bound connection
     * @throws DirectoryException if the connection or the bind fails; a rejected
     *         password is reported as {@link DirectoryException.Kind#INVALID_CREDENTIALS}
     */
    DirectoryConnection openUserConnection(String userDn, String password) throws DirectoryException;
}
