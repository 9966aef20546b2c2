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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link DirectoryClient} for unit tests.
 *
 * <p>Users are matched by the {@code =login)} term of the filter the
 * authenticator sends. Every connection handed out is kept so tests can check
 * that it was closed.
 */
final class FakeDirectoryClient implements DirectoryClient {

    private static final class Entry {
        final String login;
        final String dn;
        final String password;

        Entry(String login, String dn, String password) {
            this.login = login;
            this.dn = dn;
            this.password = password;
        }
    }

    private final List<Entry> entries = new ArrayList<>();
    private final List<FakeConnection> connections = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger lookupConnections = new AtomicInteger();
    private final AtomicInteger userConnections = new AtomicInteger();
    private final AtomicInteger whoAmICalls = new AtomicInteger();

    private volatile DirectoryException lookupFailure;
    private volatile DirectoryException searchFailure;
    private volatile DirectoryException userBindFailure;
    private volatile DirectoryException whoAmIFailure;
    private volatile String whoAmIOverride;
    private volatile Set<String> extensions = new HashSet<>(Collections.singleton(WhoAmIRequest.OID));
    private volatile boolean blockSearch;
    private final CountDownLatch searchEntered = new CountDownLatch(1);

    volatile String lastFilter;
    volatile String lastBaseDn;
    volatile SearchScope lastScope;
    volatile int lastSizeLimit;

    FakeDirectoryClient addUser(String login, String dn, String password) {
        entries.add(new Entry(login, dn, password));
        return this;
    }

    FakeDirectoryClient failLookupWith(DirectoryException e) {
        this.lookupFailure = e;
        return this;
    }

    FakeDirectoryClient failSearchWith(DirectoryException e) {
        this.searchFailure = e;
        return this;
    }

    FakeDirectoryClient failUserBindWith(DirectoryException e) {
        this.userBindFailure = e;
        return this;
    }

    FakeDirectoryClient failWhoAmIWith(DirectoryException e) {
        this.whoAmIFailure = e;
        return this;
    }

    FakeDirectoryClient answerWhoAmI(String authzId) {
        this.whoAmIOverride = authzId;
        return this;
    }

    FakeDirectoryClient advertise(Set<String> oids) {
        this.extensions = oids;
        return this;
    }

    /**
     * Makes searches hang until their connection is closed.
     */
    FakeDirectoryClient blockSearches() {
        this.blockSearch = true;
        return this;
    }

    boolean awaitSearchEntered(long timeout, TimeUnit unit) throws InterruptedException {
        return searchEntered.await(timeout, unit);
    }

    int lookupConnections() {
        return lookupConnections.get();
    }

    int userConnections() {
        return userConnections.get();
    }

    int whoAmICalls() {
        return whoAmICalls.get();
    }

    int openedConnections() {
        return connections.size();
    }

    boolean allConnectionsClosed() {
        synchronized (connections) {
            for (FakeConnection connection : connections) {
                if (!connection.isClosed()) {
                    return false;
                }
            }
            return true;
        }
    }

    @Override
    public DirectoryConnection openLookupConnection() throws DirectoryException {
        lookupConnections.incrementAndGet();
        if (lookupFailure != null) {
            throw lookupFailure;
        }
        return register(new FakeConnection(""));
    }

    @Override
    public DirectoryConnection openUserConnection(String userDn, String password) throws DirectoryException {
        userConnections.incrementAndGet();
        if (userBindFailure != null) {
            throw userBindFailure;
        }
        for (Entry entry : entries) {
            if (entry.dn.equals(userDn) && entry.password.equals(password)) {
                return register(new FakeConnection("dn:" + userDn));
            }
        }
        throw new DirectoryException(DirectoryException.Kind.INVALID_CREDENTIALS,
                "LDAP user bind failed: [LDAP: error code 49 - Invalid Credentials]");
    }

    private FakeConnection register(FakeConnection connection) {
        connections.add(connection);
        return connection;
    }

    private final class FakeConnection implements DirectoryConnection {

        private final String authzId;
        private final CountDownLatch closed = new CountDownLatch(1);

        FakeConnection(String authzId) {
            this.authzId = authzId;
        }

        @Override
        public List<String> searchDns(String baseDn, SearchScope scope, String filter, int sizeLimit)
                throws DirectoryException {
            lastFilter = filter;
            lastBaseDn = baseDn;
            lastScope = scope;
            lastSizeLimit = sizeLimit;
            if (blockSearch) {
                searchEntered.countDown();
                try {
                    closed.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new DirectoryException(DirectoryException.Kind.UNREACHABLE, "connection closed");
            }
            if (searchFailure != null) {
                throw searchFailure;
            }
            Map<String, String> matches = new LinkedHashMap<>();
            for (Entry entry : entries) {
                if (filter.contains("=" + entry.login + ")")) {
                    matches.put(entry.dn, entry.login);
                }
            }
            if (matches.size() > sizeLimit) {
                throw new DirectoryException(DirectoryException.Kind.SIZE_LIMIT_EXCEEDED, "size limit exceeded");
            }
            return new ArrayList<>(matches.keySet());
        }

        @Override
        public String whoAmI() throws DirectoryException {
            whoAmICalls.incrementAndGet();
            if (whoAmIFailure != null) {
                throw whoAmIFailure;
            }
            return whoAmIOverride != null ? whoAmIOverride : authzId;
        }

        @Override
        public Set<String> supportedExtensions() {
            return extensions;
        }

        @Override
        public void close() {
            closed.countDown();
        }

        boolean isClosed() {
            return closed.getCount() == 0;
        }
    }
}
