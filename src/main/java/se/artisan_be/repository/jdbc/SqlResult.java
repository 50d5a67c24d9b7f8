package se.artisan_be.repository.jdbc;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Outcome of a write statement: the generated id (inserts only) and the number of touched rows.
 */
@Data
@AllArgsConstructor
public class SqlResult {
    private Long insertedId;
    private int rowsAffected;
}
