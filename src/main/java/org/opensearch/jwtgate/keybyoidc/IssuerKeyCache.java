/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 *
 * Modifications Copyright OpenSearch Contributors. See
 * GitHub history for details.
 */

package org.opensearch.jwtgate.keybyoidc;

import java.security.Key;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.opensearch.jwtgate.support.WildcardMatcher;

/**
 * Keys by kid, shared between request threads and the background refresher.
 * <p>
 * Every cached key is attributed to the sources that supplied it: the JWKS URL it was fetched from or
 * {@link #INTERNAL_SOURCE} for configured keys. Storing the keys of a source replaces its previous attribution and
 * drops every key no source supplies any more.
 * <p>
 * Lookups only hold the read lock for the map access. Fetches run without any lock and only take the write lock to
 * store their result, so concurrent misses for the same new kid may fetch redundantly.
 */
public class IssuerKeyCache implements KeyProvider {
    private static final Logger log = LogManager.getLogger(IssuerKeyCache.class);

    public static final String INTERNAL_SOURCE = "internal";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Key> keys = new HashMap<>();
    private final Map<String, Set<String>> issuerKeys = new HashMap<>();

    private final KeySetRetriever keySetRetriever;
    private final List<String> issuers;
    private final WildcardMatcher issuerMatcher;
    private final Key fallbackKey;

    /**
     * @param issuers issuer patterns, canonicalized to end with {@code /}
     * @param staticKeys configured keys by kid, never purged
     * @param fallbackKey key used when no key can be resolved by kid, may be null
     */
    public IssuerKeyCache(KeySetRetriever keySetRetriever, Collection<String> issuers, Map<String, Key> staticKeys, Key fallbackKey) {
        this.keySetRetriever = keySetRetriever;
        this.issuers = canonicalize(issuers);
        this.issuerMatcher = WildcardMatcher.from(this.issuers);
        this.fallbackKey = fallbackKey;

        keys.putAll(staticKeys);
        issuerKeys.put(INTERNAL_SOURCE, ImmutableSet.copyOf(staticKeys.keySet()));
    }

    @Override
    public Key getKey(String kid, String issuer) throws BadCredentialsException {
        String error = "no secret configured";

        if (kid != null && (!issuers.isEmpty() || !isEmpty())) {
            String refreshed = null;

            for (boolean looped = false;; looped = true) {
                Key key = lookup(kid);
                if (key != null) {
                    return key;
                }

                if (looped) {
                    if (refreshed != null) {
                        log.warn("Key {}: refreshed keys from {} and still no match", kid, refreshed);
                    }
                    break;
                }

                if (issuer == null) {
                    break;
                }

                String canonicalIssuer = canonicalize(issuer);
                if (isValidIssuer(canonicalIssuer)) {
                    try {
                        refresh(canonicalIssuer);
                        refreshed = canonicalIssuer;
                    } catch (AuthenticatorUnavailableException e) {
                        log.warn("Failed to fetch keys for {}: {}", canonicalIssuer, e.getMessage());
                        error = e.getMessage();
                    }
                } else {
                    error = "issuer " + canonicalIssuer + " is not valid";
                }
            }
        }

        if (fallbackKey == null) {
            throw new BadCredentialsException(error);
        }
        return fallbackKey;
    }

    public Key lookup(String kid) {
        lock.readLock().lock();
        try {
            return keys.get(kid);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Fetches the keys of an issuer and stores them under the JWKS URL they came from.
     */
    public void refresh(String issuer) throws AuthenticatorUnavailableException {
        FetchedKeySet keySet = keySetRetriever.fetchKeys(issuer);
        store(keySet.jwksUri(), keySet.keys());
    }

    /**
     * Refreshes every configured issuer that is not a pattern. Failures are logged.
     */
    public void refreshAll() {
        for (String issuer : issuers) {
            if (!WildcardMatcher.isExact(issuer)) {
                continue;
            }
            try {
                refresh(issuer);
            } catch (RuntimeException e) {
                log.error("Failed to fetch keys for {}: {}", issuer, e.getMessage(), e);
            }
        }
    }

    public void store(String source, Map<String, Key> fetched) {
        lock.writeLock().lock();
        try {
            for (Map.Entry<String, Key> entry : fetched.entrySet()) {
                log.info("Fetched key {} from {}", entry.getKey(), source);
                keys.put(entry.getKey(), entry.getValue());
            }
            issuerKeys.put(source, ImmutableSet.copyOf(fetched.keySet()));
            purge();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // requires write lock
    private void purge() {
        Iterator<String> keyIds = keys.keySet().iterator();
        while (keyIds.hasNext()) {
            String kid = keyIds.next();
            if (!isIssued(kid)) {
                log.info("Key {} dropped", kid);
                keyIds.remove();
            }
        }
    }

    private boolean isIssued(String kid) {
        for (Set<String> sourceKeys : issuerKeys.values()) {
            if (sourceKeys.contains(kid)) {
                return true;
            }
        }
        return false;
    }

    public boolean isValidIssuer(String canonicalIssuer) {
        return issuerMatcher.test(canonicalIssuer);
    }

    public boolean isEmpty() {
        lock.readLock().lock();
        try {
            return keys.isEmpty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> getKeyIds() {
        lock.readLock().lock();
        try {
            return ImmutableSet.copyOf(keys.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> getKeyIds(String source) {
        lock.readLock().lock();
        try {
            Set<String> sourceKeys = issuerKeys.get(source);
            return sourceKeys == null ? ImmutableSet.of() : sourceKeys;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> getIssuers() {
        return issuers;
    }

    public static String canonicalize(String issuer) {
        return issuer.endsWith("/") ? issuer : issuer + "/";
    }

    static List<String> canonicalize(Collection<String> issuers) {
        if (issuers == null) {
            return ImmutableList.of();
        }
        List<String> result = new ArrayList<>(issuers.size());
        for (String issuer : issuers) {
            result.add(canonicalize(issuer));
        }
        return ImmutableList.copyOf(result);
    }
}
