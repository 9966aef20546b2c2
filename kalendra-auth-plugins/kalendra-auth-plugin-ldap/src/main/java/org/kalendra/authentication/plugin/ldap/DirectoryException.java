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
import org.kalendra.authentication.FailureReason;

/**
 * Failure of a single directory operation.
 *
 * <p>{@link Kind} describes what the directory reported; the authenticator maps
 * it to a {@link FailureReason} depending on which step of the flow failed (an
 * invalid-credentials bind means a broken service account during lookup, but a
 * wrong user password during verification).
 */
public class DirectoryException extends AuthenticationException {

    private static final long serialVersionUID = 1L;

    /**
     * What went wrong at the protocol level.
     */
    public enum Kind {
        /** The server rejected the bind credentials (result code 49). */
        INVALID_CREDENTIALS,
        /** The server could not be reached or dropped the connection. */
        UNREACHABLE,
        /** The operation did not complete in time. */
        TIMEOUT,
        /** The server does not support a requested operation or control. */
        UNSUPPORTED,
        /** The search matched more entries than the size limit allows. */
        SIZE_LIMIT_EXCEEDED,
        /** Anything else reported by the server or the client library. */
        OTHER
    }

    private final Kind kind;

    public DirectoryException(Kind kind, String message) {
        this(kind, message, null);
    }

    public DirectoryException(Kind kind, String message, Throwable cause) {
        super(message, defaultReason(kind), cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    private static FailureReason defaultReason(Kind kind) {
        switch (kind) {
            case UNREACHABLE:
                return FailureReason.DIRECTORY_UNREACHABLE;
            case TIMEOUT:
                return FailureReason.DIRECTORY_TIMEOUT;
            case UNSUPPORTED:
                return FailureReason.PROTOCOL_MISMATCH;
            default:
                return FailureReason.DIRECTORY_ERROR;
        }
    }
}
