package io.resumable.config;

import java.nio.file.Path;
import java.time.Duration;

public record EngineConfig(
        String store,
        Path stateDir,
        String jdbcUrl,
        int maxCheckpointBytes,
        int maxRetries,
        long backoffBaseMillis,
        long backoffMaxMillis,
        int breakerFailureThreshold,
        int breakerSuccessThreshold,
        Duration breakerCooldown,
        Duration lockWait
) {
    public static final String STORE_MEMORY = "memory";
    public static final String STORE_FILE = "file";
    public static final String STORE_JDBC = "jdbc";

    public EngineConfig {
        if (!STORE_MEMORY.equals(store) && !STORE_FILE.equals(store) && !STORE_JDBC.equals(store)) {
            throw new IllegalArgumentException("Unknown store kind: " + store);
        }
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (breakerFailureThreshold < 1 || breakerSuccessThreshold < 1) {
            throw new IllegalArgumentException("breaker thresholds must be >= 1");
        }
    }

    public static EngineConfig fromEnv() {
        String store = setting("resumable.store", "RESUMABLE_STORE", STORE_FILE);
        Path stateDir = Path.of(setting("resumable.state", "RESUMABLE_STATE", "./state"));
        String jdbc = setting("resumable.jdbc", "RESUMABLE_JDBC", "jdbc:h2:./state/checkpoints");
        int maxBytes = Integer.parseInt(setting("resumable.checkpoint.max", "RESUMABLE_CHECKPOINT_MAX", "9216"));
        int retries = Integer.parseInt(setting("resumable.retries", "RESUMABLE_RETRIES", "3"));
        long base = Long.parseLong(setting("resumable.backoff.base", "RESUMABLE_BACKOFF_BASE", "500"));
        long max = Long.parseLong(setting("resumable.backoff.max", "RESUMABLE_BACKOFF_MAX", "30000"));
        int failures = Integer.parseInt(setting("resumable.breaker.failures", "RESUMABLE_BREAKER_FAILURES", "5"));
        int successes = Integer.parseInt(setting("resumable.breaker.successes", "RESUMABLE_BREAKER_SUCCESSES", "3"));
        long cooldown = Long.parseLong(setting("resumable.breaker.cooldown", "RESUMABLE_BREAKER_COOLDOWN", "60000"));
        long lockWait = Long.parseLong(setting("resumable.lock.wait", "RESUMABLE_LOCK_WAIT", "10000"));
        return new EngineConfig(store, stateDir, jdbc, maxBytes, retries, base, max, failures, successes,
                Duration.ofMillis(cooldown), Duration.ofMillis(lockWait));
    }

    private static String setting(String property, String env, String fallback) {
        return System.getProperty(property, System.getenv().getOrDefault(env, fallback));
    }
}
