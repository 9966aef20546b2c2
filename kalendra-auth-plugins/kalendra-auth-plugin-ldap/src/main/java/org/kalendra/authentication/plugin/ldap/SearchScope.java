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

import java.util.Locale;
import javax.naming.directory.SearchControls;

/**
 * Depth of the user search under the base DN.
 */
public enum SearchScope {

    /** Only the base entry itself. */
    BASE(SearchControls.OBJECT_SCOPE),

    /** Immediate children of the base entry ("one level"). */
    LEVEL(SearchControls.ONELEVEL_SCOPE),

    /** The base entry and everything below it. */
    SUBTREE(SearchControls.SUBTREE_SCOPE);

    private final int jndiScope;

    SearchScope(int jndiScope) {
        this.jndiScope = jndiScope;
    }

    /**
     * Returns the matching {@link SearchControls} scope constant.
     *
     * @return JNDI search scope
     */
    public int toJndiScope() {
        return jndiScope;
    }

    /**
     * Parses a configured scope name, ignoring case and surrounding blanks.
     *
     * @param value configured value
     * @return the scope
     * @throws IllegalArgumentException if the value names no scope
     */
    public static SearchScope parse(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (SearchScope scope : values()) {
                if (scope.name().equals(normalized)) {
                    return scope;
                }
            }
        }
        throw new IllegalArgumentException(
                "ldap_scope must be one of BASE, LEVEL, SUBTREE but was '" + value + "'");
    }
}
