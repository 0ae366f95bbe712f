package kyc.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for verification session storage.
 *
 * <p>Configuration prefix: {@code kyc.session}
 *
 * <p>A verification session correlates the {@code state} of an authorization
 * request with its nonce and PKCE verifier across the browser redirect.
 */
@ConfigMapping(prefix = "kyc.session")
public interface VerificationSessionConfig {

    /**
     * How long a session stays valid after the authorization URL is issued.
     *
     * @return Session TTL (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration ttl();

    /**
     * Storage configuration for sessions.
     */
    StorageConfig storage();

    /**
     * Storage configuration options.
     */
    interface StorageConfig {

        /**
         * Storage provider name.
         *
         * <p>Available providers: redis, memory, or custom SPI name.
         *
         * @return Provider name (default: memory)
         */
        @WithDefault("memory")
        String provider();

        /**
         * Redis-specific configuration.
         */
        RedisConfig redis();

        /**
         * Redis storage configuration.
         */
        interface RedisConfig {

            /**
             * Key prefix for sessions in Redis.
             *
             * @return Key prefix (default: kyc:session:)
             */
            @WithName("key-prefix")
            @WithDefault("kyc:session:")
            String keyPrefix();
        }
    }
}
