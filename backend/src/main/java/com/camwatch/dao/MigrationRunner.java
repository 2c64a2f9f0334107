package com.camwatch.dao;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.common.annotation.Root;

@Component
@Root
public final class MigrationRunner {
    private static final Logger logger = LoggerFactory.getLogger(MigrationRunner.class);

    static final List<String> REQUIRED_TABLES = List.of("registered_users", "devices", "user_devices");

    public MigrationRunner(DbClient dbClient) {
        var flyway = Flyway.configure()
            .dataSource(dbClient.dataSource())
            .locations("classpath:db/migration")
            .load();

        int executed = 0;
        try {
            var result = flyway.migrate();
            executed = result.migrationsExecuted;
        } catch (Exception e) {
            logger.warn("Flyway migration execution failed, fallback SQL migrator will be used: {}", e.getMessage());
        }
        logger.info("Flyway migrations executed: {}", executed);

        for (String table : REQUIRED_TABLES) {
            if (!tableExists(dbClient, table)) {
                logger.warn("Table {} is missing after Flyway, applying SQL fallback migrations", table);
                runSqlScript(dbClient, "/db/migration/V1__registry.sql");
                break;
            }
        }
    }

    private boolean tableExists(DbClient dbClient, String tableName) {
        String sql = """
            SELECT EXISTS (
              SELECT 1
              FROM information_schema.tables
              WHERE table_schema = current_schema() AND table_name = ?
            )
            """;
        try (Connection connection = dbClient.getConnection();
             PreparedStatement st = connection.prepareStatement(sql)) {
            st.setString(1, tableName);
            try (ResultSet rs = st.executeQuery()) {
                rs.next();
                return rs.getBoolean(1);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot verify migration table existence", e);
        }
    }

    private void runSqlScript(DbClient dbClient, String resourcePath) {
        String script;
        try (var in = MigrationRunner.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalStateException("Missing migration script: " + resourcePath);
            }
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read migration script: " + resourcePath, e);
        }

        List<String> statements = splitStatements(script);
        try (Connection connection = dbClient.getConnection()) {
            connection.setAutoCommit(false);
            for (String sql : statements) {
                try (PreparedStatement st = connection.prepareStatement(sql)) {
                    st.execute();
                }
            }
            connection.commit();
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot execute fallback migrations", e);
        }
    }

    static List<String> splitStatements(String script) {
        String cleaned = script.replaceAll("(?m)^\\s*--.*$", "");
        List<String> statements = new ArrayList<>();
        for (String raw : cleaned.split(";")) {
            String sql = raw.trim();
            if (!sql.isEmpty()) {
                statements.add(sql);
            }
        }
        return statements;
    }
}
