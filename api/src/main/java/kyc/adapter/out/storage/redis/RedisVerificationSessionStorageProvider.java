package kyc.adapter.out.storage.redis;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import kyc.core.config.VerificationSessionConfig;
import kyc.core.port.out.VerificationSessionRepository;
import kyc.spi.VerificationSessionStorageProvider;

/**
 * Keeps verification sessions in Redis so any instance can serve the callback.
 *
 * <p>Reachability is checked once at startup and again, at most every
 * {@link #RECHECK_INTERVAL}, while the last check failed. Selection only reads
 * the last result and never waits on Redis.
 */
@ApplicationScoped
public class RedisVerificationSessionStorageProvider implements VerificationSessionStorageProvider {

    private static final Logger LOG = Logger.getLogger(RedisVerificationSessionStorageProvider.class);
    private static final int PRIORITY = 100;
    private static final Duration CHECK_TIMEOUT = Duration.ofSeconds(5);
    static final Duration RECHECK_INTERVAL = Duration.ofSeconds(30);

    /** Outcome of the last reachability check; {@code reachable} is null while one is pending. */
    record Reachability(Boolean reachable, Instant at, String detail) {

        static Reachability pending(Instant at) {
            return new Reachability(null, at, "check in progress");
        }

        boolean isUp() {
            return Boolean.TRUE.equals(reachable);
        }
    }

    private final ReactiveRedisDataSource redis;
    private final ObjectMapper objectMapper;
    private final VerificationSessionConfig config;
    private final Clock clock;

    private final AtomicReference<Reachability> lastCheck;
    private final AtomicBoolean checking = new AtomicBoolean(false);
    private volatile RedisVerificationSessionRepository repository;

    @Inject
    public RedisVerificationSessionStorageProvider(
            ReactiveRedisDataSource redis, ObjectMapper objectMapper, VerificationSessionConfig config) {
        this(redis, objectMapper, config, Clock.systemUTC());
    }

    RedisVerificationSessionStorageProvider(
            ReactiveRedisDataSource redis, ObjectMapper objectMapper, VerificationSessionConfig config, Clock clock) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.config = config;
        this.clock = clock;
        this.lastCheck = new AtomicReference<>(Reachability.pending(clock.instant()));
    }

    @PostConstruct
    void checkReachability() {
        if (!checking.compareAndSet(false, true)) {
            return;
        }
        final var checkKey = config.storage().redis().keyPrefix() + "reachability-check";
        redis.key(String.class)
                .exists(checkKey)
                .ifNoItem()
                .after(CHECK_TIMEOUT)
                .fail()
                .onTermination()
                .invoke(() -> checking.set(false))
                .subscribe()
                .with(
                        ignored -> {
                            final var previous =
                                    lastCheck.getAndSet(new Reachability(true, clock.instant(), "reachable"));
                            if (!previous.isUp()) {
                                LOG.infof("Redis session storage reachable, keys under %s", checkKey);
                            }
                        },
                        error -> {
                            lastCheck.set(new Reachability(false, clock.instant(), String.valueOf(error.getMessage())));
                            LOG.warnf("Redis session storage unreachable: %s", error.getMessage());
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return lastCheck.get().isUp();
    }

    @Override
    public synchronized VerificationSessionRepository createRepository() {
        if (repository == null) {
            repository = new RedisVerificationSessionRepository(redis, objectMapper, config);
            LOG.infof("Verification sessions stored in Redis under %s", config.storage().redis().keyPrefix());
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var reachability = lastCheck.get();
        if (Boolean.FALSE.equals(reachability.reachable())
                && Duration.between(reachability.at(), clock.instant()).compareTo(RECHECK_INTERVAL) >= 0) {
            checkReachability();
        }
        return Optional.of(HealthCheckResponse.named("kyc-session-storage-redis")
                .status(reachability.isUp())
                .withData("type", "redis")
                .withData("keyPrefix", config.storage().redis().keyPrefix())
                .withData("checkedAt", reachability.at().toString())
                .withData("detail", reachability.detail())
                .build());
    }
}
