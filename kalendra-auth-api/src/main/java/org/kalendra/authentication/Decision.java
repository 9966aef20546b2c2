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

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an authentication attempt, as seen by the host server.
 *
 * <p>A decision is in one of two states:
 * <ul>
 *   <li>{@link Status#ACCEPTED} - the credential is valid; the canonical identity
 *       and the directory entry it was verified against are available</li>
 *   <li>{@link Status#REJECTED} - the credential was not accepted, for whatever reason</li>
 * </ul>
 *
 * <p>A rejected decision deliberately carries no reason. The host must not be able
 * to tell an unknown user from a wrong password or from a directory outage; that
 * distinction is reported through diagnostics only.
 *
 * <p>Use the static factory methods to create instances:
 * <pre>{@code
 * return Decision.accepted("alice", "uid=alice,ou=users,dc=example,dc=com");
 * return Decision.rejected();
 * }</pre>
 */
public final class Decision {

    /**
     * Decision status.
     */
    public enum Status {
        ACCEPTED,
        REJECTED
    }

    private static final Decision REJECTED = new Decision(Status.REJECTED, null, null);

    private final Status status;
    private final String identity;
    private final String distinguishedName;

    private Decision(Status status, String identity, String distinguishedName) {
        this.status = status;
        this.identity = identity;
        this.distinguishedName = distinguishedName;
    }

    /**
     * Creates an accepted decision.
     *
     * @param identity the canonical user identifier handed to the host
     * @param distinguishedName the DN of the directory entry the password was verified against
     * @return accepted decision
     * @throws NullPointerException if identity or distinguishedName is null
     */
    public static Decision accepted(String identity, String distinguishedName) {
        Objects.requireNonNull(identity, "identity is required for acceptance");
        Objects.requireNonNull(distinguishedName, "distinguishedName is required for acceptance");
        return new Decision(Status.ACCEPTED, identity, distinguishedName);
    }

    /**
     * Returns the shared rejected decision.
     *
     * @return rejected decision
     */
    public static Decision rejected() {
        return REJECTED;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }

    /**
     * Returns the canonical identity the host should key rights and storage off.
     *
     * @return identity, empty when rejected
     */
    public Optional<String> getIdentity() {
        return Optional.ofNullable(identity);
    }

    /**
     * Returns the distinguished name of the verified directory entry.
     *
     * @return DN, empty when rejected
     */
    public Optional<String> getDistinguishedName() {
        return Optional.ofNullable(distinguishedName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Decision that = (Decision) o;
        return status == that.status
                && Objects.equals(identity, that.identity)
                && Objects.equals(distinguishedName, that.distinguishedName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, identity, distinguishedName);
    }

    @Override
    public String toString() {
        if (status == Status.ACCEPTED) {
            return "Decision{ACCEPTED, identity=" + identity + ", dn=" + distinguishedName + "}";
        }
        return "Decision{REJECTED}";
    }
}
