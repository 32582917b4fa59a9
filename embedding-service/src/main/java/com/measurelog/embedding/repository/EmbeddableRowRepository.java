package com.measurelog.embedding.repository;

import com.measurelog.common.entity.EmbeddingStatus;
import com.measurelog.common.exception.RowUpdateException;
import com.measurelog.common.vector.PgVectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Update-only access to the rows an embedding message names. Table and column names come
 * from the message, so they are checked against a plain identifier pattern before being
 * spliced into SQL; values always travel as bind parameters.
 *
 * Never inserts or deletes; only {@code <embeddingColumn>} and {@code embedding_status} change.
 */
@Slf4j
@Repository
public class EmbeddableRowRepository {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    static final String STATUS_COLUMN = "embedding_status";

    @Autowired
    private JdbcTemplate jdbcTemplate;

    public record EmbeddableRow(Long id, String content) {
    }

    /**
     * Rows among {@code ids} whose embedding column is still null, in id order.
     */
    public List<EmbeddableRow> findUnembedded(String table, String contentColumn, String embeddingColumn, List<Long> ids) {
        requireIdentifier(table);
        requireIdentifier(contentColumn);
        requireIdentifier(embeddingColumn);
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }

        String placeholders = String.join(",", Collections.nCopies(ids.size(), "?"));
        String sql = "SELECT id, " + contentColumn + " FROM " + table
                + " WHERE id IN (" + placeholders + ") AND " + embeddingColumn + " IS NULL ORDER BY id";

        return jdbcTemplate.query(sql,
                (rs, rowNum) -> new EmbeddableRow(rs.getLong(1), rs.getString(2)),
                ids.toArray());
    }

    /**
     * @throws RowUpdateException when the row is gone or the update fails
     */
    public void markStatus(String table, Long id, EmbeddingStatus status) {
        requireIdentifier(table);
        String sql = "UPDATE " + table + " SET " + STATUS_COLUMN + " = ? WHERE id = ?";
        executeUpdate(sql, id, status.getValue(), id);
    }

    /**
     * Writes the vector and flips the row to {@code completed} in one statement.
     *
     * @throws RowUpdateException when the row is gone or the update fails
     */
    public void writeEmbedding(String table, String embeddingColumn, Long id, float[] embedding) {
        requireIdentifier(table);
        requireIdentifier(embeddingColumn);
        String sql = "UPDATE " + table + " SET " + embeddingColumn + " = ?::vector, "
                + STATUS_COLUMN + " = ? WHERE id = ?";
        executeUpdate(sql, id, PgVectors.toLiteral(embedding), EmbeddingStatus.COMPLETED.getValue(), id);
    }

    private void executeUpdate(String sql, Long id, Object... args) {
        int updated;
        try {
            updated = jdbcTemplate.update(sql, args);
        } catch (DataAccessException e) {
            throw new RowUpdateException("Update of row " + id + " failed: "
                    + e.getMostSpecificCause().getMessage(), e);
        }
        if (updated == 0) {
            throw new RowUpdateException("Row " + id + " no longer exists");
        }
    }

    static void requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
    }
}
