package io.resumable.store;

import io.resumable.checkpoint.CheckpointStoreException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * JDBC-backed store with schema (k VARCHAR PRIMARY KEY, v VARBINARY). Upserts use {@code MERGE ... KEY},
 * which H2 understands; other databases need their own dialect.
 */
public class JdbcKeyValueStore implements KeyValueStore {
    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final String table;
    private final int maxValueBytes;

    public JdbcKeyValueStore(String jdbcUrl, String user, String password, String table, int maxValueBytes) {
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
        this.table = table;
        this.maxValueBytes = Math.max(0, maxValueBytes);
    }

    /** Creates the backing table when missing. */
    public JdbcKeyValueStore initSchema() {
        int width = maxValueBytes > 0 ? maxValueBytes : 65536;
        try (Connection c = getConnection(); Statement s = c.createStatement()) {
            s.execute("CREATE TABLE IF NOT EXISTS " + table + " (k VARCHAR(512) PRIMARY KEY, v VARBINARY(" + width + ") NOT NULL)");
        } catch (SQLException e) {
            throw new CheckpointStoreException("cannot create table " + table, e);
        }
        return this;
    }

    @Override
    public byte[] get(String key) {
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT v FROM " + table + " WHERE k = ?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getBytes(1) : null;
            }
        } catch (SQLException e) {
            throw new CheckpointStoreException("cannot read " + key, e);
        }
    }

    @Override
    public void set(String key, byte[] value) {
        if (maxValueBytes > 0 && value.length > maxValueBytes) {
            throw new CheckpointStoreException("value for " + key + " exceeds " + maxValueBytes + " bytes");
        }
        try (Connection c = getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement("MERGE INTO " + table + " (k, v) KEY (k) VALUES (?, ?)")) {
                ps.setString(1, key);
                ps.setBytes(2, value);
                ps.executeUpdate();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new CheckpointStoreException("cannot write " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM " + table + " WHERE k = ?")) {
            ps.setString(1, key);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new CheckpointStoreException("cannot delete " + key, e);
        }
    }

    @Override
    public int maxValueBytes() {
        return maxValueBytes;
    }

    private Connection getConnection() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }
}
