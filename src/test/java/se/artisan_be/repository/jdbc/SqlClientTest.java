package se.artisan_be.repository.jdbc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class SqlClientTest {

    @Autowired
    private SqlClient sqlClient;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM crafts");
    }

    @Test
    void execute_insert_returnsGeneratedId() {
        SqlResult first = sqlClient.execute("INSERT INTO crafts (name) VALUES (?)", "Pottery");
        SqlResult second = sqlClient.execute("INSERT INTO crafts (name) VALUES (?)", "Weaving");

        assertNotNull(first.getInsertedId());
        assertEquals(1, first.getRowsAffected());
        assertTrue(second.getInsertedId() > first.getInsertedId());
    }

    @Test
    void execute_update_reportsRowsAffectedWithoutId() {
        sqlClient.execute("INSERT INTO crafts (name) VALUES (?)", "Pottery");
        sqlClient.execute("INSERT INTO crafts (name) VALUES (?)", "Weaving");

        SqlResult result = sqlClient.execute("UPDATE crafts SET is_active = ?", false);

        assertNull(result.getInsertedId());
        assertEquals(2, result.getRowsAffected());
    }

    @Test
    void queryOne_returnsFirstRowOrEmpty() {
        Long id = sqlClient.execute("INSERT INTO crafts (name) VALUES (?)", "Pottery").getInsertedId();

        Optional<Map<String, Object>> found = sqlClient.queryOne("SELECT name FROM crafts WHERE id = ?", id);
        Optional<Map<String, Object>> missing = sqlClient.queryOne("SELECT name FROM crafts WHERE id = ?", id + 100);

        assertEquals("Pottery", found.orElseThrow().get("name"));
        assertTrue(missing.isEmpty());
    }

    @Test
    void inTransaction_runsOperationsInOrder() {
        List<Supplier<?>> operations = List.of(
                () -> sqlClient.execute("INSERT INTO crafts (name) VALUES (?)", "Pottery"),
                () -> sqlClient.execute("INSERT INTO crafts (name) VALUES (?)", "Weaving"));

        List<Object> results = sqlClient.inTransaction(operations);

        assertEquals(2, results.size());
        List<Map<String, Object>> rows = sqlClient.queryAll("SELECT name FROM crafts ORDER BY id");
        assertEquals("Pottery", rows.get(0).get("name"));
        assertEquals("Weaving", rows.get(1).get("name"));
    }

    @Test
    void inTransaction_failure_rollsBackEarlierOperations() {
        List<Supplier<?>> operations = List.of(
                () -> sqlClient.execute("INSERT INTO crafts (name) VALUES (?)", "Pottery"),
                () -> sqlClient.execute("INSERT INTO crafts (name) VALUES (?)", (Object) null));

        assertThrows(DataIntegrityViolationException.class, () -> sqlClient.inTransaction(operations));

        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM crafts", Integer.class);
        assertEquals(0, count);
    }
}
