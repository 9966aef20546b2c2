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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Immutable LDAP authentication policy, built once at startup and shared
 * read-only by every authentication call.
 *
 * <p>Configuration example:
 * <pre>
 * ldap_url = ldap://ldap.example.com:389
 * ldap_base = ou=users,dc=example,dc=com
 * ldap_attribute = uid
 * ldap_filter = (objectClass=inetOrgPerson)
 * ldap_binddn = cn=reader,dc=example,dc=com
 * ldap_password = reader_password
 * ldap_scope = LEVEL
 * ldap_support_extended = yes
 * </pre>
 *
 * <p>Unknown option names and malformed values are rejected by
 * {@link #fromOptions(Map)} instead of surfacing on the first request.
 */
public final class LdapPolicy {

    public static final String URL = "ldap_url";
    public static final String BASE = "ldap_base";
    public static final String ATTRIBUTE = "ldap_attribute";
    public static final String FILTER = "ldap_filter";
    public static final String BIND_DN = "ldap_binddn";
    public static final String BIND_PASSWORD = "ldap_password";
    public static final String SCOPE = "ldap_scope";
    public static final String SUPPORT_EXTENDED = "ldap_support_extended";
    public static final String CONNECT_TIMEOUT = "ldap_connect_timeout";
    public static final String READ_TIMEOUT = "ldap_read_timeout";
    public static final String IDENTITY = "ldap_identity";

    public static final Set<String> OPTION_NAMES = ImmutableSet.of(URL, BASE, ATTRIBUTE, FILTER,
            BIND_DN, BIND_PASSWORD, SCOPE, SUPPORT_EXTENDED, CONNECT_TIMEOUT, READ_TIMEOUT, IDENTITY);

    static final String DEFAULT_ATTRIBUTE = "username";
    static final SearchScope DEFAULT_SCOPE = SearchScope.LEVEL;
    static final long DEFAULT_CONNECT_TIMEOUT_MS = 5000L;
    static final long DEFAULT_READ_TIMEOUT_MS = 10000L;

    // attribute descriptor: a name or a numeric OID
    private static final Pattern ATTRIBUTE_PATTERN =
            Pattern.compile("[A-Za-z][A-Za-z0-9-]*|[0-9]+(\\.[0-9]+)+");

    /**
     * Which value an accepted decision reports as the canonical identity.
     */
    public enum Identity {
        /** The username exactly as the client presented it. */
        LOGIN,
        /** The distinguished name of the matched directory entry. */
        DN
    }

    private final String url;
    private final String baseDn;
    private final String loginAttribute;
    private final String filterFragment;
    private final String bindDn;
    private final String bindPassword;
    private final SearchScope scope;
    private final boolean supportExtendedOperations;
    private final long connectTimeoutMillis;
    private final long readTimeoutMillis;
    private final Identity identity;

    private LdapPolicy(Builder builder) {
        this.url = builder.url;
        this.baseDn = builder.baseDn;
        this.loginAttribute = builder.loginAttribute;
        this.filterFragment = builder.filterFragment;
        this.bindDn = builder.bindDn;
        this.bindPassword = builder.bindPassword;
        this.scope = builder.scope;
        this.supportExtendedOperations = builder.supportExtendedOperations;
        this.connectTimeoutMillis = builder.connectTimeoutMillis;
        this.readTimeoutMillis = builder.readTimeoutMillis;
        this.identity = builder.identity;
    }

    /**
     * Builds a policy from configuration options.
     *
     * @param options option map as read by the host
     * @return validated policy
     * @throws IllegalArgumentException if an option is unknown, a required option is missing,
     *         or a value is malformed
     */
    public static LdapPolicy fromOptions(Map<String, String> options) {
        Objects.requireNonNull(options, "options");

        Set<String> unknown = new TreeSet<>(options.keySet());
        unknown.removeAll(OPTION_NAMES);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown LDAP option(s): " + unknown);
        }

        Builder builder = builder()
                .url(options.get(URL))
                .baseDn(options.get(BASE));
        if (options.containsKey(ATTRIBUTE)) {
            builder.loginAttribute(options.get(ATTRIBUTE));
        }
        if (options.containsKey(FILTER)) {
            builder.filterFragment(options.get(FILTER));
        }
        if (options.containsKey(BIND_DN)) {
            builder.bindDn(options.get(BIND_DN));
        }
        if (options.containsKey(BIND_PASSWORD)) {
            builder.bindPassword(options.get(BIND_PASSWORD));
        }
        if (options.containsKey(SCOPE)) {
            builder.scope(SearchScope.parse(options.get(SCOPE)));
        }
        if (options.containsKey(SUPPORT_EXTENDED)) {
            builder.supportExtendedOperations(parseBoolean(SUPPORT_EXTENDED, options.get(SUPPORT_EXTENDED)));
        }
        if (options.containsKey(CONNECT_TIMEOUT)) {
            builder.connectTimeoutMillis(parseMillis(CONNECT_TIMEOUT, options.get(CONNECT_TIMEOUT)));
        }
        if (options.containsKey(READ_TIMEOUT)) {
            builder.readTimeoutMillis(parseMillis(READ_TIMEOUT, options.get(READ_TIMEOUT)));
        }
        if (options.containsKey(IDENTITY)) {
            builder.identity(parseIdentity(options.get(IDENTITY)));
        }
        return builder.build();
    }

    public String getUrl() {
        return url;
    }

    public String getBaseDn() {
        return baseDn;
    }

    public String getLoginAttribute() {
        return loginAttribute;
    }

    /**
     * Returns the extra filter combined with the login equality term.
     *
     * @return fragment, empty string when none is configured
     */
    public String getFilterFragment() {
        return filterFragment;
    }

    /**
     * Returns the service account DN for the lookup bind.
     *
     * @return bind DN, empty string for anonymous lookup
     */
    public String getBindDn() {
        return bindDn;
    }

    public String getBindPassword() {
        return bindPassword;
    }

    public boolean isAnonymousLookup() {
        return bindDn.isEmpty();
    }

    public SearchScope getScope() {
        return scope;
    }

    public boolean isSupportExtendedOperations() {
        return supportExtendedOperations;
    }

    public long getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public long getReadTimeoutMillis() {
        return readTimeoutMillis;
    }

    public Identity getIdentity() {
        return identity;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("url", url)
                .add("baseDn", baseDn)
                .add("loginAttribute", loginAttribute)
                .add("filterFragment", filterFragment)
                .add("bindDn", bindDn)
                .add("bindPassword", bindPassword.isEmpty() ? "<empty>" : "<redacted>")
                .add("scope", scope)
                .add("supportExtendedOperations", supportExtendedOperations)
                .add("connectTimeoutMillis", connectTimeoutMillis)
                .add("readTimeoutMillis", readTimeoutMillis)
                .add("identity", identity)
                .toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String option, String value) {
        String normalized = Strings.nullToEmpty(value).trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "true":
            case "yes":
                return true;
            case "false":
            case "no":
                return false;
            default:
                throw new IllegalArgumentException(option + " must be one of true, false, yes, no but was '"
                        + value + "'");
        }
    }

    private static long parseMillis(String option, String value) {
        try {
            return Long.parseLong(Strings.nullToEmpty(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " must be a number of milliseconds but was '"
                    + value + "'", e);
        }
    }

    private static Identity parseIdentity(String value) {
        String normalized = Strings.nullToEmpty(value).trim().toUpperCase(Locale.ROOT);
        for (Identity candidate : Identity.values()) {
            if (candidate.name().equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException(IDENTITY + " must be one of login, dn but was '" + value + "'");
    }

    /**
     * Builder for {@link LdapPolicy}. {@link #build()} applies the same
     * validation as {@link LdapPolicy#fromOptions(Map)}.
     */
    public static final class Builder {
        private String url;
        private String baseDn;
        private String loginAttribute = DEFAULT_ATTRIBUTE;
        private String filterFragment = "";
        private String bindDn = "";
        private String bindPassword = "";
        private SearchScope scope = DEFAULT_SCOPE;
        private boolean supportExtendedOperations = true;
        private long connectTimeoutMillis = DEFAULT_CONNECT_TIMEOUT_MS;
        private long readTimeoutMillis = DEFAULT_READ_TIMEOUT_MS;
        private Identity identity = Identity.LOGIN;

        private Builder() {
        }

        /**
         * Sets the directory URL; trailing slashes are dropped.
         *
         * @param url scheme, host and port, e.g. ldap://localhost:389
         * @return this builder
         */
        public Builder url(String url) {
            String trimmed = Strings.nullToEmpty(url).trim();
            int end = trimmed.length();
            while (end > 0 && trimmed.charAt(end - 1) == '/') {
                end--;
            }
            this.url = trimmed.substring(0, end);
            return this;
        }

        public Builder baseDn(String baseDn) {
            this.baseDn = Strings.nullToEmpty(baseDn).trim();
            return this;
        }

        public Builder loginAttribute(String loginAttribute) {
            this.loginAttribute = Strings.nullToEmpty(loginAttribute).trim();
            return this;
        }

        public Builder filterFragment(String filterFragment) {
            this.filterFragment = Strings.nullToEmpty(filterFragment).trim();
            return this;
        }

        public Builder bindDn(String bindDn) {
            this.bindDn = Strings.nullToEmpty(bindDn).trim();
            return this;
        }

        public Builder bindPassword(String bindPassword) {
            this.bindPassword = Strings.nullToEmpty(bindPassword);
            return this;
        }

        public Builder scope(SearchScope scope) {
            this.scope = Objects.requireNonNull(scope, "scope");
            return this;
        }

        public Builder supportExtendedOperations(boolean supportExtendedOperations) {
            this.supportExtendedOperations = supportExtendedOperations;
            return this;
        }

        public Builder connectTimeoutMillis(long connectTimeoutMillis) {
            this.connectTimeoutMillis = connectTimeoutMillis;
            return this;
        }

        public Builder readTimeoutMillis(long readTimeoutMillis) {
            this.readTimeoutMillis = readTimeoutMillis;
            return this;
        }

        public Builder identity(Identity identity) {
            this.identity = Objects.requireNonNull(identity, "identity");
            return this;
        }

        /**
         * Validates and builds the policy.
         *
         * @return the policy
         * @throws IllegalArgumentException if the configuration is incomplete or malformed
         */
        public LdapPolicy build() {
            Preconditions.checkArgument(!Strings.isNullOrEmpty(url), "LDAP server URL (%s) is required", URL);
            String lowerUrl = url.toLowerCase(Locale.ROOT);
            Preconditions.checkArgument(lowerUrl.startsWith("ldap://") || lowerUrl.startsWith("ldaps://"),
                    "%s must use the ldap:// or ldaps:// scheme but was '%s'", URL, url);
            checkServerOnly(url);
            Preconditions.checkArgument(!Strings.isNullOrEmpty(baseDn), "LDAP base DN (%s) is required", BASE);
            Preconditions.checkArgument(ATTRIBUTE_PATTERN.matcher(loginAttribute).matches(),
                    "%s must be an attribute name but was '%s'", ATTRIBUTE, loginAttribute);
            LdapFilters.checkFragment(filterFragment);
            Preconditions.checkArgument(bindDn.isEmpty() || !bindPassword.isEmpty(),
                    "%s is required when %s is set", BIND_PASSWORD, BIND_DN);
            checkTimeout(CONNECT_TIMEOUT, connectTimeoutMillis);
            checkTimeout(READ_TIMEOUT, readTimeoutMillis);
            return new LdapPolicy(this);
        }

        // the base DN would be resolved relative to a DN in the URL path
        private static void checkServerOnly(String url) {
            URI uri;
            try {
                uri = new URI(url);
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException(URL + " is not a valid URL: '" + url + "'", e);
            }
            Preconditions.checkArgument(!Strings.isNullOrEmpty(uri.getHost()),
                    "%s must name a host but was '%s'", URL, url);
            Preconditions.checkArgument(Strings.isNullOrEmpty(uri.getRawPath())
                            && uri.getRawQuery() == null && uri.getRawFragment() == null,
                    "%s must only hold scheme, host and port but was '%s'; set the search base with %s",
                    URL, url, BASE);
        }

        // JNDI reads the timeout properties as int
        private static void checkTimeout(String option, long millis) {
            Preconditions.checkArgument(millis > 0 && millis <= Integer.MAX_VALUE,
                    "%s must be between 1 and %s milliseconds but was %s", option, Integer.MAX_VALUE, millis);
        }
    }
}
