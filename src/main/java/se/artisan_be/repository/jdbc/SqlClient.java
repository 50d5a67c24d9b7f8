package se.artisan_be.repository.jdbc;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Positional-parameter SQL access for the artisan aggregate and the reporting queries.
 * Every statement is logged at DEBUG before it runs; datastore errors are passed through untouched.
 */
@Component
@Slf4j
public class SqlClient {

    private static final String[] ID_COLUMN = {"id"};

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public SqlClient(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public SqlResult execute(String sql, Object... params) {
        log.debug("DB execute: {} {}", sql, Arrays.toString(params));

        if (!isInsert(sql)) {
            int rows = jdbcTemplate.update(sql, params);
            return new SqlResult(null, rows);
        }

        KeyHolder keyHolder = new GeneratedKeyHolder();
        int rows = jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, ID_COLUMN);
            new ArgumentPreparedStatementSetter(params).setValues(ps);
            return ps;
        }, keyHolder);
        return new SqlResult(extractId(keyHolder), rows);
    }

    public List<Map<String, Object>> queryAll(String sql, Object... params) {
        log.debug("DB queryAll: {} {}", sql, Arrays.toString(params));
        return jdbcTemplate.queryForList(sql, params);
    }

    public Optional<Map<String, Object>> queryOne(String sql, Object... params) {
        log.debug("DB queryOne: {} {}", sql, Arrays.toString(params));
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, params);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Runs all operations in one transaction, in order. The first failure rolls everything back
     * and is rethrown unchanged.
     */
    public List<Object> inTransaction(List<Supplier<?>> operations) {
        return inTransaction(() -> {
            List<Object> results = new ArrayList<>(operations.size());
            for (Supplier<?> operation : operations) {
                results.add(operation.get());
            }
            return results;
        });
    }

    public <T> T inTransaction(Supplier<T> work) {
        log.debug("DB transaction: begin");
        try {
            T result = transactionTemplate.execute(status -> work.get());
            log.debug("DB transaction: commit");
            return result;
        } catch (RuntimeException | Error ex) {
            log.debug("DB transaction: rollback ({})", ex.getMessage());
            throw ex;
        }
    }

    private static boolean isInsert(String sql) {
        return sql.stripLeading().toLowerCase(Locale.ROOT).startsWith("insert");
    }

    private static Long extractId(KeyHolder keyHolder) {
        List<Map<String, Object>> keys = keyHolder.getKeyList();
        if (keys.isEmpty() || keys.get(0).isEmpty()) {
            return null;
        }
        Object key = keys.get(0).values().iterator().next();
        return key instanceof Number ? ((Number) key).longValue() : null;
    }
}
