package kyc.core.service;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.lang.JoseException;

import kyc.core.config.IdentityProviderConfig;
import kyc.core.exception.TransientNetworkException;
import kyc.core.port.out.JwksCache;

/**
 * Caches the identity provider's JSON Web Key Sets.
 *
 * <p>Features:
 * <ul>
 *   <li>bounded Caffeine cache with a freshness TTL per key set</li>
 *   <li>request coalescing, so concurrent misses trigger one fetch</li>
 *   <li>stale key sets are served when a refresh fails</li>
 * </ul>
 *
 * <p>Entries are only evicted by size; a key set past its TTL stays available
 * as the stale fallback until a fetch replaces it.
 */
@ApplicationScoped
public class JwksCacheService implements JwksCache {

    private static final Logger LOG = Logger.getLogger(JwksCacheService.class);

    private final WebClient webClient;
    private final Cache<URI, CachedKeySet> cache;
    private final Map<URI, Uni<JsonWebKeySet>> inFlightFetches = new ConcurrentHashMap<>();
    private final Duration cacheTtl;
    private final Duration fetchTimeout;

    @Inject
    public JwksCacheService(Vertx vertx, IdentityProviderConfig config, MeterRegistry meterRegistry) {
        this.webClient = WebClient.create(vertx);
        this.cacheTtl = config.jwksCacheTtl();
        this.fetchTimeout = config.timeout();

        this.cache = Caffeine.newBuilder()
                .maximumSize(config.jwksMaxEntries())
                .recordStats()
                .build();

        CaffeineCacheMetrics.monitor(meterRegistry, cache, "kyc.jwks.cache");
    }

    @Override
    public Uni<JsonWebKeySet> getKeySet(URI jwksUri) {
        final var cached = cache.getIfPresent(jwksUri);
        if (cached != null && !cached.isExpired()) {
            LOG.debugf("Using cached JWKS for %s", jwksUri);
            return Uni.createFrom().item(cached.keySet());
        }
        return getOrCreateFetch(jwksUri);
    }

    @Override
    public Uni<JsonWebKeySet> refresh(URI jwksUri) {
        LOG.infof("Refreshing JWKS for %s", jwksUri);
        inFlightFetches.remove(jwksUri);
        return getOrCreateFetch(jwksUri);
    }

    private Uni<JsonWebKeySet> getOrCreateFetch(URI jwksUri) {
        return Uni.createFrom().deferred(() -> inFlightFetches.computeIfAbsent(jwksUri, this::createFetch));
    }

    private Uni<JsonWebKeySet> createFetch(URI jwksUri) {
        return fetchAndCache(jwksUri)
                .onTermination()
                .invoke(() -> inFlightFetches.remove(jwksUri))
                .memoize()
                .indefinitely();
    }

    private Uni<JsonWebKeySet> fetchAndCache(URI jwksUri) {
        LOG.infof("Fetching JWKS from %s", jwksUri);

        return webClient
                .getAbs(jwksUri.toString())
                .timeout(fetchTimeout.toMillis())
                .putHeader("Accept", "application/json")
                .send()
                .ifNoItem()
                .after(fetchTimeout)
                .failWith(() -> new TransientNetworkException("Timeout fetching JWKS from " + jwksUri))
                .map(this::parseResponse)
                .invoke(keySet -> {
                    cache.put(jwksUri, new CachedKeySet(keySet, Instant.now().plus(cacheTtl)));
                    LOG.infof("Cached %d keys from %s", keySet.getJsonWebKeys().size(), jwksUri);
                })
                .onFailure()
                .recoverWithUni(error -> {
                    final var stale = cache.getIfPresent(jwksUri);
                    if (stale != null) {
                        LOG.warnf("Using stale JWKS for %s: %s", jwksUri, error.getMessage());
                        return Uni.createFrom().item(stale.keySet());
                    }
                    LOG.errorf(error, "Failed to fetch JWKS from %s", jwksUri);
                    if (error instanceof JwksFetchException || error instanceof TransientNetworkException) {
                        return Uni.createFrom().failure(error);
                    }
                    return Uni.createFrom()
                            .failure(new TransientNetworkException(
                                    "JWKS endpoint unreachable: " + error.getMessage(), error));
                });
    }

    private JsonWebKeySet parseResponse(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            throw new JwksFetchException("JWKS endpoint returned status " + response.statusCode());
        }
        try {
            return new JsonWebKeySet(response.bodyAsString());
        } catch (JoseException e) {
            throw new JwksFetchException("Failed to parse JWKS response: " + e.getMessage(), e);
        }
    }

    private record CachedKeySet(JsonWebKeySet keySet, Instant expiresAt) {
        boolean isExpired() {
            return Instant.now().isAfter(expiresAt);
        }
    }

    /**
     * The JWKS endpoint answered, but not with a usable key set.
     */
    public static class JwksFetchException extends RuntimeException {
        public JwksFetchException(String message) {
            super(message);
        }

        public JwksFetchException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
