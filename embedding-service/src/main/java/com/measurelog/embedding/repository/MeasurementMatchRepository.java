package com.measurelog.embedding.repository;

import com.measurelog.common.vector.PgVectors;
import com.measurelog.embedding.dto.MeasurementMatch;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Inner-product lookup over {@code measurements.embedding}, served by the
 * {@code vector_ip_ops} HNSW index. pgvector's {@code <#>} is the <i>negative</i> inner
 * product, so {@code similarity > threshold} is {@code embedding <#> q < -threshold}.
 */
@Repository
public class MeasurementMatchRepository {

    private static final String MATCH_SQL = """
            SELECT id, log_id, name, sensor_name, meas_description, units,
                   min_value, max_value, avg_value, source, tst_id, uut_type,
                   meas_status, serial_number, category, sub_category,
                   (embedding <#> ?::vector) * -1 AS similarity
            FROM measurements
            WHERE embedding <#> ?::vector < ?
            ORDER BY embedding <#> ?::vector
            """;

    private static final RowMapper<MeasurementMatch> MATCH_MAPPER = (rs, rowNum) -> new MeasurementMatch(
            rs.getLong("id"),
            rs.getLong("log_id"),
            rs.getString("name"),
            rs.getString("sensor_name"),
            rs.getString("meas_description"),
            rs.getString("units"),
            rs.getDouble("min_value"),
            rs.getDouble("max_value"),
            rs.getDouble("avg_value"),
            rs.getString("source"),
            rs.getString("tst_id"),
            rs.getString("uut_type"),
            rs.getString("meas_status"),
            rs.getString("serial_number"),
            rs.getString("category"),
            rs.getString("sub_category"),
            rs.getDouble("similarity"));

    @Autowired
    private JdbcTemplate jdbcTemplate;

    public List<MeasurementMatch> findMatches(float[] queryEmbedding, double threshold) {
        String query = PgVectors.toLiteral(queryEmbedding);
        return jdbcTemplate.query(MATCH_SQL, MATCH_MAPPER, query, query, -threshold, query);
    }
}
