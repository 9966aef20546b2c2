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

import org.kalendra.authentication.AuthenticationException;
import org.kalendra.authentication.Credential;
import org.kalendra.authentication.Decision;
import org.kalendra.authentication.FailureReason;
import org.kalendra.authentication.spi.Authenticator;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Set;

/**
 * LDAP authenticator.
 *
 * <p>Validates a username and password with search-then-bind: the entry of the
 * user is located with a lookup connection, then the password is verified by
 * binding a second connection as that entry. See {@link AuthenticationCall}.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Decide accept/reject for one credential per call</li>
 *   <li>Report the classified outcome to the {@link AuthenticationAuditor}</li>
 *   <li>Probe the directory for "Who am I?" support at startup</li>
 * </ul>
 *
 * <p>NOT responsibilities: group or role resolution, credential caching, session issuance.
 *
 * <p>Configuration example:
 * <pre>
 *   ldap_url = ldaps://ldap.example.com
 *   ldap_base = ou=people,dc=example,dc=com
 *   ldap_attribute = uid
 *   ldap_filter = (objectClass=inetOrgPerson)
 *   ldap_binddn = cn=reader,dc=example,dc=com
 *   ldap_password = secret
 *   ldap_scope = SUBTREE
 * </pre>
 *
 * <p>Instances are immutable and safe for concurrent use.
 */
public class LdapAuthenticator implements Authenticator {

    private static final Logger LOG = LogManager.getLogger(LdapAuthenticator.class);

    public static final String NAME = "ldap";

    private final LdapPolicy policy;
    private final DirectoryClient client;
    private final AuthenticationAuditor auditor;

    public LdapAuthenticator(LdapPolicy policy) {
        this(policy, new SpringLdapDirectoryClient(policy), new LoggingAuditor());
    }

    public LdapAuthenticator(LdapPolicy policy, DirectoryClient client, AuthenticationAuditor auditor) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.client = Objects.requireNonNull(client, "client");
        this.auditor = Objects.requireNonNull(auditor, "auditor");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "LDAP authenticator - validates credentials against " + policy.getUrl();
    }

    @Override
    public Decision authenticate(Credential credential) {
        return newCall(credential).call();
    }

    /**
     * Prepares an authentication attempt the caller can run on its own executor
     * and cancel from another thread.
     *
     * @param credential the credential to verify
     * @return a single-use call
     */
    public AuthenticationCall newCall(Credential credential) {
        return new AuthenticationCall(policy, client, auditor, credential);
    }

    /**
     * Checks that the directory advertises "Who am I?" when extended operations
     * are enabled.
     *
     * <p>An unreachable directory only logs a warning: outages are classified per
     * call. A rejected service account or a directory lacking the extension fails
     * startup.
     */
    @Override
    public void initialize() throws AuthenticationException {
        LOG.info("Initializing LDAP authenticator: {}", policy);
        if (!policy.isSupportExtendedOperations()) {
            LOG.info("LDAP extended operations disabled, skipping capability probe");
            return;
        }

        Set<String> extensions;
        try (DirectoryConnection connection = client.openLookupConnection()) {
            extensions = connection.supportedExtensions();
        } catch (DirectoryException e) {
            if (e.getKind() == DirectoryException.Kind.INVALID_CREDENTIALS) {
                throw new AuthenticationException("LDAP service account rejected by " + policy.getUrl(),
                        FailureReason.LOOKUP_BIND_FAILED, e);
            }
            LOG.warn("LDAP capability probe against {} failed, continuing: {}", policy.getUrl(), e.getMessage());
            return;
        }

        if (extensions.isEmpty()) {
            // root DSE hidden by access control
            LOG.warn("LDAP server {} does not expose supportedExtension, cannot confirm who am i support",
                    policy.getUrl());
            return;
        }
        if (!extensions.contains(WhoAmIRequest.OID)) {
            throw new AuthenticationException("LDAP server " + policy.getUrl()
                    + " does not support the who am i extended operation (" + WhoAmIRequest.OID
                    + "); set " + LdapPolicy.SUPPORT_EXTENDED + " = false for compatibility mode",
                    FailureReason.PROTOCOL_MISMATCH);
        }
        LOG.info("LDAP server {} supports who am i", policy.getUrl());
    }

    public LdapPolicy getPolicy() {
        return policy;
    }

    @Override
    public void close() {
        // Connections never outlive a call
        LOG.debug("LDAP authenticator closed");
    }
}
