package io.resumable.store;

import io.resumable.checkpoint.Checkpoint;
import io.resumable.checkpoint.KeyValueCheckpointStore;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class JdbcKeyValueStoreTest {
    @Test
    void upserts_and_deletes_rows() {
        String url = "jdbc:h2:mem:kv_upsert;DB_CLOSE_DELAY=-1";
        JdbcKeyValueStore store = new JdbcKeyValueStore(url, null, null, "kv", 1024).initSchema();
        store.set("a", "1".getBytes(StandardCharsets.UTF_8));
        store.set("a", "2".getBytes(StandardCharsets.UTF_8));
        assertEquals("2", new String(store.get("a"), StandardCharsets.UTF_8));
        store.delete("a");
        assertNull(store.get("a"));
    }

    @Test
    void backs_a_checkpoint_store() {
        String url = "jdbc:h2:mem:kv_checkpoints;DB_CLOSE_DELAY=-1";
        KeyValueCheckpointStore checkpoints = new KeyValueCheckpointStore(
                new JdbcKeyValueStore(url, null, null, "checkpoints", 4096).initSchema());
        Instant now = Instant.parse("2024-06-01T12:00:00Z");
        checkpoints.save(Checkpoint.initial("rows", now).advanceTo(99, now));
        assertEquals(100, checkpoints.load("rows").orElseThrow().nextOffset());
    }
}
