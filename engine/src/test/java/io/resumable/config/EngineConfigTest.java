package io.resumable.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class EngineConfigTest {
    @AfterEach
    void clearProperties() {
        System.clearProperty("resumable.store");
        System.clearProperty("resumable.state");
        System.clearProperty("resumable.breaker.cooldown");
    }

    @Test
    void system_properties_override_defaults() {
        System.setProperty("resumable.store", "memory");
        System.setProperty("resumable.state", "/tmp/resumable-test");
        System.setProperty("resumable.breaker.cooldown", "1500");
        EngineConfig config = EngineConfig.fromEnv();
        assertEquals(EngineConfig.STORE_MEMORY, config.store());
        assertEquals(Path.of("/tmp/resumable-test"), config.stateDir());
        assertEquals(Duration.ofMillis(1500), config.breakerCooldown());
    }

    @Test
    void unknown_store_kind_is_rejected() {
        System.setProperty("resumable.store", "redis");
        assertThrows(IllegalArgumentException.class, EngineConfig::fromEnv);
    }
}
