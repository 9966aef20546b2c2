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

import java.util.List;
import java.util.Set;

/**
 * A bound directory connection owned by one authentication call.
 */
public interface DirectoryConnection extends AutoCloseable {

    /**
     * Searches for entries and returns their DNs only; no attribute values are
     * requested.
     *
     * @param baseDn search base
     * @param scope search depth
     * @param filter encoded search filter
     * @param sizeLimit maximum number of entries to return
     * @return DNs of matching entries, at most {@code sizeLimit}
     * @throws DirectoryException if the search fails; more than {@code sizeLimit}
     *         matches are reported as {@link DirectoryException.Kind#SIZE_LIMIT_EXCEEDED}
     */
    List<String> searchDns(String baseDn, SearchScope scope, String filter, int sizeLimit)
            throws DirectoryException;

    /**
     * Issues the "Who am I?" extended operation (RFC 4532).
     *
     * @return the authorization identity of this connection, empty for anonymous
     * @throws DirectoryException if the server does not support the operation or it fails
     */
    String whoAmI() throws DirectoryException;

    /**
     * Reads the {@code supportedExtension} values of the root DSE.
     *
     * @return OIDs of the extended operations the server advertises
     * @throws DirectoryException if the root DSE cannot be read
     */
    Set<String> supportedExtensions() throws DirectoryException;

    /**
     * Unbinds and closes the connection. Safe to call more than once and from a
     * thread other than the one using the connection.
     */
    @Override
    void close();
}
