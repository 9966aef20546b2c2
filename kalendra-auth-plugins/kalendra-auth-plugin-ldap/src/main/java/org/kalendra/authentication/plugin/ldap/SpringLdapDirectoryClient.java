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

import com.google.common.base.Throwables;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.ldap.AuthenticationException;
import org.springframework.ldap.CommunicationException;
import org.springframework.ldap.OperationNotSupportedException;
import org.springframework.ldap.ServiceUnavailableException;
import org.springframework.ldap.SizeLimitExceededException;
import org.springframework.ldap.TimeLimitExceededException;
import org.springframework.ldap.core.support.LdapContextSource;
import org.springframework.ldap.support.LdapUtils;

import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.PartialResultException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.DirContext;
import javax.naming.directory.SearchControls;
import javax.naming.directory.SearchResult;
import javax.naming.ldap.ExtendedResponse;
import javax.naming.ldap.LdapContext;

/**
 * {@link DirectoryClient} backed by Spring LDAP's {@link LdapContextSource} over JNDI.
 *
 * <p>Key properties:
 * <ul>
 *   <li>JNDI connection pooling is disabled: every call gets its own connection</li>
 *   <li>Connect and read timeouts from the policy bound every round trip</li>
 *   <li>{@code javax.naming} failures are translated through {@link LdapUtils} into
 *       Spring's exception hierarchy, then classified as {@link DirectoryException.Kind}</li>
 * </ul>
 */
public class SpringLdapDirectoryClient implements DirectoryClient {

    private static final Logger LOG = LogManager.getLogger(SpringLdapDirectoryClient.class);

    static final String CONNECT_TIMEOUT_ENV = "com.sun.jndi.ldap.connect.timeout";
    static final String READ_TIMEOUT_ENV = "com.sun.jndi.ldap.read.timeout";

    private static final String SUPPORTED_EXTENSION = "supportedExtension";

    private final LdapContextSource contextSource;

    public SpringLdapDirectoryClient(LdapPolicy policy) {
        this.contextSource = createContextSource(policy);
        LOG.info("LDAP directory client created: url={}, anonymousLookup={}, connectTimeout={}ms, readTimeout={}ms",
                policy.getUrl(), policy.isAnonymousLookup(), policy.getConnectTimeoutMillis(),
                policy.getReadTimeoutMillis());
    }

    @Override
    public DirectoryConnection openLookupConnection() throws DirectoryException {
        try {
            return new SpringLdapConnection(contextSource.getReadOnlyContext());
        } catch (org.springframework.ldap.NamingException e) {
            throw classify("lookup bind", e);
        }
    }

    @Override
    public DirectoryConnection openUserConnection(String userDn, String password) throws DirectoryException {
        try {
            return new SpringLdapConnection(contextSource.getContext(userDn, password));
        } catch (org.springframework.ldap.NamingException e) {
            throw classify("user bind", e);
        }
    }

    // ==================== Private Helper Methods ====================

    private static LdapContextSource createContextSource(LdapPolicy policy) {
        LdapContextSource contextSource = new LdapContextSource();
        contextSource.setUrl(policy.getUrl());
        contextSource.setPooled(false);

        if (policy.isAnonymousLookup()) {
            contextSource.setAnonymousReadOnly(true);
        } else {
            contextSource.setUserDn(policy.getBindDn());
            contextSource.setPassword(policy.getBindPassword());
        }

        Map<String, Object> environment = new HashMap<>();
        environment.put(CONNECT_TIMEOUT_ENV, String.valueOf(policy.getConnectTimeoutMillis()));
        environment.put(READ_TIMEOUT_ENV, String.valueOf(policy.getReadTimeoutMillis()));
        contextSource.setBaseEnvironmentProperties(environment);

        contextSource.afterPropertiesSet();
        return contextSource;
    }

    static DirectoryException translate(String operation, NamingException e) {
        return classify(operation, LdapUtils.convertLdapException(e));
    }

    static DirectoryException classify(String operation, org.springframework.ldap.NamingException e) {
        DirectoryException.Kind kind;
        if (isTimeout(e)) {
            kind = DirectoryException.Kind.TIMEOUT;
        } else if (e instanceof AuthenticationException) {
            kind = DirectoryException.Kind.INVALID_CREDENTIALS;
        } else if (e instanceof CommunicationException || e instanceof ServiceUnavailableException) {
            kind = DirectoryException.Kind.UNREACHABLE;
        } else if (e instanceof OperationNotSupportedException) {
            kind = DirectoryException.Kind.UNSUPPORTED;
        } else if (e instanceof SizeLimitExceededException) {
            kind = DirectoryException.Kind.SIZE_LIMIT_EXCEEDED;
        } else {
            kind = DirectoryException.Kind.OTHER;
        }
        return new DirectoryException(kind, "LDAP " + operation + " failed: " + e.getMessage(), e);
    }

    private static boolean isTimeout(Throwable e) {
        if (e instanceof TimeLimitExceededException) {
            return true;
        }
        for (Throwable t : Throwables.getCausalChain(e)) {
            if (t instanceof SocketTimeoutException || t instanceof javax.naming.TimeLimitExceededException) {
                return true;
            }
            String message = t.getMessage();
            // JNDI reports read timeouts as a plain NamingException
            if (message != null && message.toLowerCase(Locale.ROOT).contains("timed out")) {
                return true;
            }
        }
        return false;
    }

    /**
     * One JNDI context, bound when it was created.
     */
    static final class SpringLdapConnection implements DirectoryConnection {

        private final DirContext context;
        private final AtomicBoolean closed = new AtomicBoolean();

        SpringLdapConnection(DirContext context) {
            this.context = context;
        }

        @Override
        public List<String> searchDns(String baseDn, SearchScope scope, String filter, int sizeLimit)
                throws DirectoryException {
            SearchControls controls = new SearchControls();
            controls.setSearchScope(scope.toJndiScope());
            controls.setReturningAttributes(new String[0]);
            controls.setCountLimit(sizeLimit);

            List<String> dns = new ArrayList<>();
            NamingEnumeration<SearchResult> results = null;
            try {
                results = context.search(baseDn, filter, controls);
                while (results.hasMore()) {
                    dns.add(results.next().getNameInNamespace());
                }
            } catch (javax.naming.SizeLimitExceededException e) {
                throw new DirectoryException(DirectoryException.Kind.SIZE_LIMIT_EXCEEDED,
                        "LDAP search matched more than " + sizeLimit + " entries", e);
            } catch (PartialResultException e) {
                // unfollowed referrals; keep what the server returned itself
                LOG.debug("Ignoring partial result from LDAP search under {}", baseDn, e);
            } catch (NamingException e) {
                throw translate("search", e);
            } finally {
                closeEnumeration(results);
            }
            return dns;
        }

        @Override
        public String whoAmI() throws DirectoryException {
            if (!(context instanceof LdapContext)) {
                throw new DirectoryException(DirectoryException.Kind.UNSUPPORTED,
                        "LDAP context does not support extended operations: " + context.getClass().getName());
            }
            try {
                ExtendedResponse response = ((LdapContext) context).extendedOperation(new WhoAmIRequest());
                return ((WhoAmIRequest.Response) response).getAuthorizationId();
            } catch (NamingException e) {
                DirectoryException translated = translate("who am i", e);
                if (translated.getKind() == DirectoryException.Kind.TIMEOUT) {
                    throw translated;
                }
                // the bind on this connection already succeeded; servers without
                // RFC 4532 answer with protocolError or unwillingToPerform
                throw new DirectoryException(DirectoryException.Kind.UNSUPPORTED,
                        "LDAP who am i extended operation rejected: " + e.getMessage(), e);
            }
        }

        @Override
        public Set<String> supportedExtensions() throws DirectoryException {
            try {
                Attributes rootDse = context.getAttributes("", new String[] {SUPPORTED_EXTENSION});
                Attribute attribute = rootDse.get(SUPPORTED_EXTENSION);
                if (attribute == null) {
                    return Collections.emptySet();
                }
                Set<String> oids = new HashSet<>();
                NamingEnumeration<?> values = attribute.getAll();
                try {
                    while (values.hasMore()) {
                        oids.add(String.valueOf(values.next()));
                    }
                } finally {
                    closeEnumeration(values);
                }
                return oids;
            } catch (NamingException e) {
                throw translate("root DSE read", e);
            }
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                LdapUtils.closeContext(context);
            }
        }

        private static void closeEnumeration(NamingEnumeration<?> enumeration) {
            if (enumeration == null) {
                return;
            }
            try {
                enumeration.close();
            } catch (NamingException e) {
                LOG.debug("Failed to close LDAP enumeration", e);
            }
        }
    }
}
