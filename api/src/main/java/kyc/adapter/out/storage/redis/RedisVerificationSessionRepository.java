package kyc.adapter.out.storage.redis;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import kyc.core.config.VerificationSessionConfig;
import kyc.core.exception.DuplicateStateException;
import kyc.core.exception.PersistenceException;
import kyc.core.model.VerificationSession;
import kyc.core.port.out.VerificationSessionRepository;

/**
 * Redis verification session storage.
 *
 * <p>Sessions are JSON values under {@code <prefix><state>}. {@code put} uses
 * {@code SET NX EX} so an existing state is never overwritten, and
 * {@code takeByState} uses {@code GETDEL} (Redis 6.2+) for an atomic take.
 */
public class RedisVerificationSessionRepository implements VerificationSessionRepository {

    private static final Logger LOG = Logger.getLogger(RedisVerificationSessionRepository.class);

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisVerificationSessionRepository(
            ReactiveRedisDataSource redisDataSource, ObjectMapper objectMapper, VerificationSessionConfig config) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.objectMapper = objectMapper;
        this.keyPrefix = config.storage().redis().keyPrefix();
    }

    @Override
    public Uni<Void> put(VerificationSession session) {
        final var key = keyPrefix + session.state();
        final String json;
        try {
            json = objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            return Uni.createFrom().failure(new PersistenceException("Failed to serialize verification session", e));
        }
        final var ttlSeconds = ttlSeconds(session);

        return redisDataSource
                .execute("SET", key, json, "NX", "EX", String.valueOf(ttlSeconds))
                .invoke(response -> {
                    if (response == null || !"OK".equals(response.toString())) {
                        throw new DuplicateStateException("A verification session already exists for this state");
                    }
                    LOG.debugf("Stored verification session for user %s with TTL %ds", session.userId(), ttlSeconds);
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<Optional<VerificationSession>> takeByState(String state) {
        final var key = keyPrefix + state;

        return valueCommands.getdel(key).map(json -> {
            if (json == null) {
                LOG.debug("No verification session found for state");
                return Optional.<VerificationSession>empty();
            }
            final var session = deserialize(json);
            if (session.isExpired(Instant.now())) {
                LOG.debugf("Verification session for user %s expired at %s", session.userId(), session.expiresAt());
                return Optional.<VerificationSession>empty();
            }
            return Optional.of(session);
        });
    }

    private VerificationSession deserialize(String json) {
        try {
            return objectMapper.readValue(json, VerificationSession.class);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Stored verification session is unreadable", e);
        }
    }

    static long ttlSeconds(VerificationSession session) {
        final var remaining = Duration.between(Instant.now(), session.expiresAt()).toSeconds();
        return Math.max(1, remaining);
    }
}
