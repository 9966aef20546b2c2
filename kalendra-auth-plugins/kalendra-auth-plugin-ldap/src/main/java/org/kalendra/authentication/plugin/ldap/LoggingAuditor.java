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

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

/**
 * Default {@link AuthenticationAuditor}: writes outcomes to Log4j.
 *
 * <p>Infrastructure failures are logged at ERROR with the
 * {@code DIRECTORY_INFRASTRUCTURE} marker so they can be routed to alerting.
 * Authentication failures are expected and high-volume; they go to INFO with the
 * {@code AUTHENTICATION_FAILURE} marker. Ambiguous matches are logged at WARN
 * as a data anomaly.
 */
public class LoggingAuditor implements AuthenticationAuditor {

    private static final Logger LOG = LogManager.getLogger(LoggingAuditor.class);

    public static final Marker INFRASTRUCTURE = MarkerManager.getMarker("DIRECTORY_INFRASTRUCTURE");
    public static final Marker AUTHENTICATION_FAILURE = MarkerManager.getMarker("AUTHENTICATION_FAILURE");

    @Override
    public void accepted(String username, String userDn) {
        LOG.info("LDAP authentication succeeded for user: {} ({})", printable(username), userDn);
    }

    @Override
    public void rejected(String rawUsername, FailureReason reason, Throwable cause) {
        String username = printable(rawUsername);
        if (reason.isInfrastructure()) {
            LOG.error(INFRASTRUCTURE, "LDAP authentication for user {} rejected by infrastructure failure {}: {}",
                    username, reason, cause != null ? cause.getMessage() : "-");
            if (cause != null) {
                LOG.debug(INFRASTRUCTURE, "Infrastructure failure details", cause);
            }
        } else if (reason == FailureReason.AMBIGUOUS_USER) {
            LOG.warn(AUTHENTICATION_FAILURE,
                    "LDAP login filter matched several entries for user {}; check ldap_attribute and ldap_filter",
                    username);
        } else {
            LOG.info(AUTHENTICATION_FAILURE, "LDAP authentication failed for user {}: {}", username, reason);
        }
    }

    /**
     * Replaces control characters in client-supplied text so it cannot forge log lines.
     */
    static String printable(String text) {
        return CharMatcher.javaIsoControl().replaceFrom(Strings.nullToEmpty(text), '?');
    }
}
