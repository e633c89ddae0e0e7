package de.admir.unistore.core.secret;

import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.util.Xor;

import java.time.Duration;
import java.util.Objects;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps successfully fetched secrets for a fixed time after they were fetched. Failures are never cached.
 */
public class CachingSecretProvider implements SecretProvider {
    private static final Logger logger = LoggerFactory.getLogger(CachingSecretProvider.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private final SecretProvider delegate;
    private final Cache<String, String> secretsCache;

    public CachingSecretProvider(SecretProvider delegate) {
        this(delegate, DEFAULT_TTL);
    }

    public CachingSecretProvider(SecretProvider delegate, Duration ttl) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.secretsCache = CacheBuilder.newBuilder().expireAfterWrite(ttl).build();
    }

    @Override
    public Xor<StorageError, String> getSecret(String name) {
        String cachedResult = name == null ? null : secretsCache.getIfPresent(name);
        if (cachedResult != null) {
            return Xor.right(cachedResult);
        } else {
            logger.debug(String.format("Fetching secret: %s", name));
            return delegate.getSecret(name).peekRight(secret -> secretsCache.put(name, secret));
        }
    }

    public void invalidate(String name) {
        secretsCache.invalidate(name);
    }
}
