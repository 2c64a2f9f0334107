package com.camwatch.dao;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import ru.tinkoff.kora.common.Component;

@Component
public final class JdbcRegistryStore implements RegistryStore {
    private final DbClient dbClient;

    public JdbcRegistryStore(DbClient dbClient, MigrationRunner migrationRunner) {
        this.dbClient = dbClient;
    }

    @Override
    public void upsertUser(long chatId, String username, String firstName, String lastName) {
        String sql = """
            INSERT INTO registered_users(chat_id, username, first_name, last_name)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (chat_id)
            DO UPDATE SET username = EXCLUDED.username,
                          first_name = EXCLUDED.first_name,
                          last_name = EXCLUDED.last_name
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setLong(1, chatId);
            st.setString(2, username);
            st.setString(3, firstName);
            st.setString(4, lastName);
            st.executeUpdate();
        } catch (SQLException e) {
            throw SqlFailures.translate("upsertUser", e);
        }
    }

    @Override
    public void upsertDevice(String deviceId, String nickname) {
        String sql = """
            INSERT INTO devices(device_id, nickname)
            VALUES (?, ?)
            ON CONFLICT (device_id)
            DO UPDATE SET nickname = COALESCE(EXCLUDED.nickname, devices.nickname)
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setString(1, deviceId);
            st.setString(2, nickname);
            st.executeUpdate();
        } catch (SQLException e) {
            throw SqlFailures.translate("upsertDevice", e);
        }
    }

    @Override
    public void bind(long chatId, String deviceId) {
        String deviceSql = "INSERT INTO devices(device_id) VALUES (?) ON CONFLICT (device_id) DO NOTHING";
        String bindSql = """
            INSERT INTO user_devices(chat_id, device_id)
            VALUES (?, ?)
            ON CONFLICT (chat_id, device_id) DO NOTHING
            """;
        try (Connection connection = dbClient.getConnection()) {
            connection.setAutoCommit(false);
            try {
                try (PreparedStatement device = connection.prepareStatement(deviceSql)) {
                    device.setString(1, deviceId);
                    device.executeUpdate();
                }

                try (PreparedStatement bind = connection.prepareStatement(bindSql)) {
                    bind.setLong(1, chatId);
                    bind.setString(2, deviceId);
                    bind.executeUpdate();
                }

                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw SqlFailures.translate("bind", e);
        }
    }

    @Override
    public boolean unbind(long chatId, String deviceId) {
        String sql = "DELETE FROM user_devices WHERE chat_id=? AND device_id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setLong(1, chatId);
            st.setString(2, deviceId);
            return st.executeUpdate() > 0;
        } catch (SQLException e) {
            throw SqlFailures.translate("unbind", e);
        }
    }

    @Override
    public List<Long> listSubscribers(String deviceId) {
        String sql = "SELECT chat_id FROM user_devices WHERE device_id=?";
        List<Long> rows = new ArrayList<>();
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setString(1, deviceId);
            try (ResultSet rs = st.executeQuery()) {
                while (rs.next()) {
                    rows.add(rs.getLong("chat_id"));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw SqlFailures.translate("listSubscribers", e);
        }
    }

    @Override
    public List<String> listDevicesOfUser(long chatId) {
        String sql = "SELECT device_id FROM user_devices WHERE chat_id=? ORDER BY device_id";
        List<String> rows = new ArrayList<>();
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setLong(1, chatId);
            try (ResultSet rs = st.executeQuery()) {
                while (rs.next()) {
                    rows.add(rs.getString("device_id"));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw SqlFailures.translate("listDevicesOfUser", e);
        }
    }

    @Override
    public Optional<UserRow> findUser(long chatId) {
        String sql = """
            SELECT chat_id, username, first_name, last_name, registered_at
            FROM registered_users
            WHERE chat_id=?
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setLong(1, chatId);
            try (ResultSet rs = st.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                Timestamp registered = rs.getTimestamp("registered_at");
                return Optional.of(new UserRow(
                    rs.getLong("chat_id"),
                    rs.getString("username"),
                    rs.getString("first_name"),
                    rs.getString("last_name"),
                    registered == null ? null : registered.toInstant()
                ));
            }
        } catch (SQLException e) {
            throw SqlFailures.translate("findUser", e);
        }
    }

    @Override
    public Optional<DeviceRow> findDevice(String deviceId) {
        String sql = "SELECT device_id, nickname, registered_at FROM devices WHERE device_id=?";
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setString(1, deviceId);
            try (ResultSet rs = st.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                Timestamp registered = rs.getTimestamp("registered_at");
                return Optional.of(new DeviceRow(
                    rs.getString("device_id"),
                    rs.getString("nickname"),
                    registered == null ? null : registered.toInstant()
                ));
            }
        } catch (SQLException e) {
            throw SqlFailures.translate("findDevice", e);
        }
    }
}
