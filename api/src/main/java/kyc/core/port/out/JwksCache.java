package kyc.core.port.out;

import java.net.URI;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKeySet;

/**
 * Source of the identity provider's published signing keys.
 *
 * <p>Implementations may serve a key set that is past its freshness window
 * while the provider's JWKS endpoint is failing. Transport failures with
 * nothing to fall back on surface as
 * {@link kyc.core.exception.TransientNetworkException}.
 */
public interface JwksCache {

    /**
     * Key set published at {@code jwksUri}, fetched only when nothing fresh is held.
     */
    Uni<JsonWebKeySet> getKeySet(URI jwksUri);

    /**
     * Refetch {@code jwksUri} regardless of freshness. Callers use this when a
     * token names a kid the held set does not know, which is how provider key
     * rotation shows up.
     */
    Uni<JsonWebKeySet> refresh(URI jwksUri);
}
