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

import com.google.common.base.Strings;
import org.springframework.ldap.filter.AndFilter;
import org.springframework.ldap.filter.EqualsFilter;
import org.springframework.ldap.filter.Filter;
import org.springframework.ldap.filter.HardcodedFilter;

/**
 * Builds the user search filter.
 *
 * <p>The username is always passed through {@link EqualsFilter}, which escapes
 * {@code * ( ) \} and NUL as RFC 4515 hex pairs. A username such as
 * {@code *)(uid=*} therefore stays a literal equality value and cannot widen the
 * match or add boolean terms.
 */
public final class LdapFilters {

    private LdapFilters() {
    }

    /**
     * Builds {@code (&(<attribute>=<escaped username>)<fragment>)}, or just the
     * equality term when no fragment is configured.
     *
     * @param loginAttribute attribute holding the login name
     * @param fragment configured filter fragment, may be empty
     * @param username untrusted login name
     * @return encoded filter
     */
    public static String loginFilter(String loginAttribute, String fragment, String username) {
        Filter equality = new EqualsFilter(loginAttribute, username);
        if (Strings.isNullOrEmpty(fragment)) {
            return equality.encode();
        }
        return new AndFilter()
                .and(equality)
                .and(new HardcodedFilter(fragment))
                .encode();
    }

    /**
     * Checks that a configured fragment is a sequence of parenthesized filter
     * items with balanced parentheses.
     *
     * @param fragment configured fragment
     * @throws IllegalArgumentException if the fragment is malformed
     */
    static void checkFragment(String fragment) {
        if (Strings.isNullOrEmpty(fragment)) {
            return;
        }
        if (fragment.charAt(0) != '(' || fragment.charAt(fragment.length() - 1) != ')') {
            throw new IllegalArgumentException(
                    "ldap_filter must be a parenthesized filter such as (objectClass=person): " + fragment);
        }
        int depth = 0;
        for (int i = 0; i < fragment.length(); i++) {
            char c = fragment.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    break;
                }
            }
        }
        if (depth != 0) {
            throw new IllegalArgumentException("ldap_filter has unbalanced parentheses: " + fragment);
        }
    }
}
