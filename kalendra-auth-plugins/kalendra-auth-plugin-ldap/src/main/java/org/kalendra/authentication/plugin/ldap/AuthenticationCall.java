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

import org.kalendra.authentication.Credential;
import org.kalendra.authentication.Decision;
import org.kalendra.authentication.FailureReason;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One search-then-bind authentication attempt.
 *
 * <p>Flow:
 * <ol>
 *   <li>Open a lookup connection (service account or anonymous bind)</li>
 *   <li>Search the base DN for {@code (&(attribute=escaped username)fragment)},
 *       asking for DNs only and at most two entries</li>
 *   <li>Reject on zero or several matches; never pick the first of several</li>
 *   <li>Open a second connection bound as the matched DN with the user's password,
 *       and in extended mode confirm the bound identity with "Who am I?"</li>
 * </ol>
 *
 * <p>Every connection is closed on every exit path. A call is single-use and may be
 * {@linkplain #cancel() cancelled} from another thread, which closes the connection
 * currently in flight.
 */
public final class AuthenticationCall implements Callable<Decision> {

    private static final Logger LOG = LogManager.getLogger(AuthenticationCall.class);

    static final int SEARCH_SIZE_LIMIT = 2;

    /**
     * Where the call currently is.
     */
    public enum Stage {
        INIT,
        LOOKUP_BIND,
        SEARCH,
        VERIFY_BIND,
        VERIFY_IDENTITY,
        DONE
    }

    private final LdapPolicy policy;
    private final DirectoryClient client;
    private final AuthenticationAuditor auditor;
    private final Credential credential;

    private final AtomicReference<DirectoryConnection> inFlight = new AtomicReference<>();
    private volatile boolean cancelled;
    private volatile Stage stage = Stage.INIT;

    AuthenticationCall(LdapPolicy policy, DirectoryClient client, AuthenticationAuditor auditor,
            Credential credential) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.client = Objects.requireNonNull(client, "client");
        this.auditor = Objects.requireNonNull(auditor, "auditor");
        this.credential = Objects.requireNonNull(credential, "credential");
    }

    /**
     * Runs the attempt on the calling thread. Never throws; every failure
     * resolves to {@link Decision#rejected()} and is reported to the auditor.
     *
     * @return the decision
     */
    @Override
    public Decision call() {
        String username = credential.getUsername();
        if (credential.isBlank()) {
            return reject(username, FailureReason.INVALID_CREDENTIAL_INPUT, null);
        }
        if (cancelled) {
            return reject(username, FailureReason.CANCELLED, null);
        }

        try {
            List<String> dns = searchUser(username);
            if (dns.isEmpty()) {
                return reject(username, FailureReason.USER_NOT_FOUND, null);
            }
            if (dns.size() > 1) {
                return reject(username, FailureReason.AMBIGUOUS_USER, null);
            }

            String userDn = dns.get(0);
            if (!verifyPassword(userDn)) {
                return reject(username, FailureReason.VERIFY_BIND_FAILED, null);
            }

            stage = Stage.DONE;
            auditor.accepted(username, userDn);
            String identity = policy.getIdentity() == LdapPolicy.Identity.DN ? userDn : username;
            return Decision.accepted(identity, userDn);
        } catch (DirectoryException e) {
            return reject(username, reasonFor(e), e);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error during LDAP authentication for user: {} at stage {}",
                    LoggingAuditor.printable(username), stage, e);
            return reject(username, cancelled ? FailureReason.CANCELLED : FailureReason.DIRECTORY_ERROR, e);
        }
    }

    /**
     * Abandons the attempt. The connection in flight, if any, is closed right away
     * and the call resolves to a rejection.
     */
    public void cancel() {
        cancelled = true;
        DirectoryConnection connection = inFlight.getAndSet(null);
        if (connection != null) {
            LOG.debug("Closing in-flight LDAP connection of cancelled call at stage {}", stage);
            connection.close();
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Stage getStage() {
        return stage;
    }

    // ==================== Private Helper Methods ====================

    private List<String> searchUser(String username) throws DirectoryException {
        String filter = LdapFilters.loginFilter(policy.getLoginAttribute(), policy.getFilterFragment(), username);

        stage = Stage.LOOKUP_BIND;
        try (DirectoryConnection connection = track(client.openLookupConnection())) {
            stage = Stage.SEARCH;
            if (LOG.isDebugEnabled()) {
                LOG.debug("LDAP search under {} (scope {}) with filter {}",
                        policy.getBaseDn(), policy.getScope(), filter);
            }
            return connection.searchDns(policy.getBaseDn(), policy.getScope(), filter, SEARCH_SIZE_LIMIT);
        } finally {
            inFlight.set(null);
        }
    }

    private boolean verifyPassword(String userDn) throws DirectoryException {
        stage = Stage.VERIFY_BIND;
        try (DirectoryConnection connection = track(client.openUserConnection(userDn, credential.getPassword()))) {
            if (!policy.isSupportExtendedOperations()) {
                LOG.debug("LDAP bind as {} succeeded, skipping who am i", userDn);
                return true;
            }
            stage = Stage.VERIFY_IDENTITY;
            String authzId = connection.whoAmI();
            LOG.debug("LDAP who am i for {}: {}", userDn, authzId);
            return authzId != null && !authzId.isEmpty();
        } finally {
            inFlight.set(null);
        }
    }

    private DirectoryConnection track(DirectoryConnection connection) throws DirectoryException {
        inFlight.set(connection);
        if (cancelled) {
            connection.close();
            throw new DirectoryException(DirectoryException.Kind.OTHER, "Authentication call cancelled");
        }
        return connection;
    }

    private FailureReason reasonFor(DirectoryException e) {
        if (cancelled) {
            return FailureReason.CANCELLED;
        }
        if (e.getKind() == DirectoryException.Kind.INVALID_CREDENTIALS) {
            switch (stage) {
                case LOOKUP_BIND:
                    return FailureReason.LOOKUP_BIND_FAILED;
                case VERIFY_BIND:
                    return FailureReason.VERIFY_BIND_FAILED;
                default:
                    return FailureReason.DIRECTORY_ERROR;
            }
        }
        if (e.getKind() == DirectoryException.Kind.SIZE_LIMIT_EXCEEDED && stage == Stage.SEARCH) {
            return FailureReason.AMBIGUOUS_USER;
        }
        return e.getReason().orElse(FailureReason.DIRECTORY_ERROR);
    }

    private Decision reject(String username, FailureReason reason, Throwable cause) {
        stage = Stage.DONE;
        auditor.rejected(username, reason, cause);
        return Decision.rejected();
    }
}
