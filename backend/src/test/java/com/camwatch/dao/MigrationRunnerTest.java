package com.camwatch.dao;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class MigrationRunnerTest {

    @Test
    void fallbackScriptCreatesEveryRequiredTable() throws IOException {
        String script;
        try (var in = MigrationRunner.class.getResourceAsStream("/db/migration/V1__registry.sql")) {
            assertThat(in).isNotNull();
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        var statements = MigrationRunner.splitStatements(script);

        assertThat(statements).hasSize(4);
        assertThat(statements).noneMatch(s -> s.contains("--"));
        for (String table : MigrationRunner.REQUIRED_TABLES) {
            assertThat(statements).anyMatch(s -> s.startsWith("CREATE TABLE IF NOT EXISTS " + table + " "));
        }
    }
}
