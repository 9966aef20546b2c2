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

import java.util.Optional;

/**
 * Raised for internal or configuration errors around authentication
 * (misconfigured authenticator, unknown authenticator type, unsupported
 * directory capabilities, directory outages).
 *
 * <p>Expected per-request failures such as a wrong password are not
 * exceptions; they are reported as {@link Decision#rejected()}.
 */
public class AuthenticationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final FailureReason reason;

    public AuthenticationException(String message) {
        this(message, null, null);
    }

    public AuthenticationException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public AuthenticationException(Throwable cause) {
        super(cause);
        this.reason = null;
    }

    public AuthenticationException(String message, FailureReason reason) {
        this(message, reason, null);
    }

    public AuthenticationException(String message, FailureReason reason, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * Returns the classified failure reason, if the thrower classified it.
     *
     * @return optional failure reason
     */
    public Optional<FailureReason> getReason() {
        return Optional.ofNullable(reason);
    }
}
