package com.practiceacademy.tournament.repository;

import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class TournamentEngineMigrationFlywayTest {

    private static final String UNIQUE_VIOLATION = "23505";

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15");

    private String schemaName;

    @BeforeEach
    void migrateFreshSchema() throws SQLException {
        schemaName = ("engine_" + UUID.randomUUID().toString().replace("-", "")).toLowerCase(Locale.ROOT);
        execute("CREATE SCHEMA " + schemaName);
        Flyway.configure()
                .dataSource(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword())
                .locations("classpath:db/migration")
                .schemas(schemaName)
                .defaultSchema(schemaName)
                .baselineOnMigrate(true)
                .load()
                .migrate();
    }

    @AfterEach
    void dropSchema() throws SQLException {
        execute("DROP SCHEMA IF EXISTS " + schemaName + " CASCADE");
    }

    @Test
    void freshMigrationCreatesTablesUniqueKeysAndJsonbColumns() throws SQLException {
        assertTrue(tableExists("tournaments"));
        assertTrue(tableExists("tournament_enrollments"));
        assertTrue(tableExists("tournament_matches"));
        assertTrue(tableExists("tournament_rankings"));
        assertTrue(tableExists("tournament_qualifier_snapshots"));
        assertTrue(tableExists("reward_ledger_entries"));

        assertTrue(indexExists("uk_tournament_enrollments_tournament_participant"));
        assertTrue(indexExists("uk_tournament_rankings_tournament_participant"));
        assertTrue(indexExists("uk_tournament_rankings_tournament_rank"));
        assertTrue(indexExists("uk_reward_ledger_entries_idempotency_key"));
        assertTrue(indexExists("idx_reward_ledger_entries_tournament_participant"));

        assertTrue(columnUsesType("tournaments", "reward_config_json", "jsonb"));
        assertTrue(columnUsesType("tournament_matches", "outcome_json", "jsonb"));
        assertTrue(columnUsesType("reward_ledger_entries", "metadata_json", "jsonb"));
    }

    @Test
    void ledgerRejectsASecondRowWithTheSameIdempotencyKey() throws SQLException {
        UUID tournamentId = UUID.randomUUID();
        UUID participantId = UUID.randomUUID();
        String key = "reward:" + tournamentId + ":" + participantId + ":CREDIT:placement";
        insertLedgerRow(tournamentId, participantId, key);

        SQLException duplicate = assertThrows(SQLException.class, () -> insertLedgerRow(tournamentId, participantId, key));

        assertEquals(UNIQUE_VIOLATION, duplicate.getSQLState());
        assertEquals(1, countInSchema("reward_ledger_entries", "idempotency_key = '" + key + "'"));
    }

    @Test
    void participantEnrollsOncePerTournament() throws SQLException {
        UUID tournamentId = insertTournament();
        UUID participantId = UUID.randomUUID();
        insertEnrollment(tournamentId, participantId);

        SQLException duplicate = assertThrows(SQLException.class, () -> insertEnrollment(tournamentId, participantId));

        assertEquals(UNIQUE_VIOLATION, duplicate.getSQLState());
        insertEnrollment(insertTournament(), participantId);
    }

    @Test
    void rankingsAreUniquePerParticipantAndPerRank() throws SQLException {
        UUID tournamentId = insertTournament();
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        insertRanking(tournamentId, first, 1);

        SQLException sameParticipant = assertThrows(SQLException.class, () -> insertRanking(tournamentId, first, 2));
        SQLException sameRank = assertThrows(SQLException.class, () -> insertRanking(tournamentId, second, 1));

        assertEquals(UNIQUE_VIOLATION, sameParticipant.getSQLState());
        assertEquals(UNIQUE_VIOLATION, sameRank.getSQLState());
        insertRanking(tournamentId, second, 2);
        assertEquals(2, countInSchema("tournament_rankings", "tournament_id = '" + tournamentId + "'"));
    }

    @Test
    void generationMarkerFlipsOnlyOnce() throws SQLException {
        UUID tournamentId = insertTournament();
        String claim = "UPDATE " + schemaName + ".tournaments SET sessions_generated = TRUE, sessions_generated_at = NOW() "
                + "WHERE tournament_id = ? AND sessions_generated = FALSE";

        assertEquals(1, update(claim, tournamentId));
        assertEquals(0, update(claim, tournamentId));
    }

    @Test
    void generatedFlagRequiresATimestamp() throws SQLException {
        UUID tournamentId = insertTournament();

        SQLException violation = assertThrows(SQLException.class, () -> update(
                "UPDATE " + schemaName + ".tournaments SET sessions_generated = TRUE WHERE tournament_id = ?",
                tournamentId
        ));

        assertEquals("23514", violation.getSQLState());
    }

    private UUID insertTournament() throws SQLException {
        UUID tournamentId = UUID.randomUUID();
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "INSERT INTO " + schemaName + ".tournaments (tournament_id, name, format, head_to_head_type, "
                             + "max_enrollments) VALUES (?, 'Schema cup', 'HEAD_TO_HEAD', 'KNOCKOUT', 8)")) {
            statement.setObject(1, tournamentId);
            statement.executeUpdate();
        }
        return tournamentId;
    }

    private void insertEnrollment(UUID tournamentId, UUID participantId) throws SQLException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "INSERT INTO " + schemaName + ".tournament_enrollments (enrollment_id, tournament_id, participant_id) "
                             + "VALUES (?, ?, ?)")) {
            statement.setObject(1, UUID.randomUUID());
            statement.setObject(2, tournamentId);
            statement.setObject(3, participantId);
            statement.executeUpdate();
        }
    }

    private void insertRanking(UUID tournamentId, UUID participantId, int rank) throws SQLException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "INSERT INTO " + schemaName + ".tournament_rankings (ranking_id, tournament_id, participant_id, rank) "
                             + "VALUES (?, ?, ?, ?)")) {
            statement.setObject(1, UUID.randomUUID());
            statement.setObject(2, tournamentId);
            statement.setObject(3, participantId);
            statement.setInt(4, rank);
            statement.executeUpdate();
        }
    }

    private void insertLedgerRow(UUID tournamentId, UUID participantId, String key) throws SQLException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "INSERT INTO " + schemaName + ".reward_ledger_entries (entry_id, tournament_id, participant_id, "
                             + "reward_kind, reason, idempotency_key, amount) VALUES (?, ?, ?, 'CREDIT', 'placement', ?, 100)")) {
            statement.setObject(1, UUID.randomUUID());
            statement.setObject(2, tournamentId);
            statement.setObject(3, participantId);
            statement.setString(4, key);
            statement.executeUpdate();
        }
    }

    private int update(String sql, UUID tournamentId) throws SQLException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setObject(1, tournamentId);
            return statement.executeUpdate();
        }
    }

    private boolean tableExists(String tableName) throws SQLException {
        return countRows("information_schema.tables", "table_schema = ? AND table_name = ?", schemaName, tableName) == 1;
    }

    private boolean indexExists(String indexName) throws SQLException {
        return countRows("pg_indexes", "schemaname = ? AND indexname = ?", schemaName, indexName) == 1;
    }

    private boolean columnUsesType(String tableName, String columnName, String udtName) throws SQLException {
        return countRows(
                "information_schema.columns",
                "table_schema = ? AND table_name = ? AND column_name = ? AND udt_name = ?",
                schemaName,
                tableName,
                columnName,
                udtName
        ) == 1;
    }

    private int countInSchema(String tableName, String whereClause) throws SQLException {
        return countRows(schemaName + "." + tableName, whereClause);
    }

    private static int countRows(String tableName, String whereClause, String... parameters) throws SQLException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(
                     "SELECT COUNT(*) FROM " + tableName + " WHERE " + whereClause)) {
            for (int i = 0; i < parameters.length; i++) {
                statement.setString(i + 1, parameters[i]);
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                resultSet.next();
                return resultSet.getInt(1);
            }
        }
    }

    private static void execute(String sql) throws SQLException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    private static Connection openConnection() throws SQLException {
        return DriverManager.getConnection(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
    }
}
