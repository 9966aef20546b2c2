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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

@DisplayName("FailureReason Unit Tests")
class FailureReasonTest {

    @Test
    @DisplayName("UT-API-FR-001: Only credential problems are authentication failures")
    void testClassification() {
        Set<FailureReason> authenticationFailures = EnumSet.of(
                FailureReason.INVALID_CREDENTIAL_INPUT,
                FailureReason.USER_NOT_FOUND,
                FailureReason.AMBIGUOUS_USER,
                FailureReason.VERIFY_BIND_FAILED);

        for (FailureReason reason : FailureReason.values()) {
            Assertions.assertEquals(!authenticationFailures.contains(reason), reason.isInfrastructure(),
                    "Unexpected classification for " + reason);
        }
    }
}
