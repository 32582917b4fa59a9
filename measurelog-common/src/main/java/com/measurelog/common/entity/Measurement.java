package com.measurelog.common.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.ColumnTransformer;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;

/**
 * One sensor section of an ingested log, as persisted.
 *
 * Rows are only ever inserted by the ingestion service (status {@code pending},
 * embedding null). The embedding service touches nothing but {@code embedding}
 * and {@code embedding_status}, through JDBC, because JPA has no pgvector type:
 * the vector columns are mapped here as their text form ({@code [0.1,0.2,...]}).
 */
@Entity
@Table(name = "measurements", indexes = {
        @Index(name = "idx_measurements_log_id", columnList = "log_id"),
        @Index(name = "idx_measurements_embedding_status", columnList = "embedding_status")
})
public class Measurement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "log_id", nullable = false)
    private Long logId; // FK → logs.id

    @Column(name = "name", nullable = false, length = 255)
    private String name; // display name: "<sensor> @ <tst_id>"

    @Column(name = "sensor_name", nullable = false, length = 255)
    private String sensorName;

    @Column(name = "meas_description", nullable = false, columnDefinition = "TEXT")
    private String description;

    @Column(name = "units", nullable = false, length = 50)
    private String units;

    @Column(name = "min_value", nullable = false)
    private double minValue;

    @Column(name = "max_value", nullable = false)
    private double maxValue;

    @Column(name = "avg_value", nullable = false)
    private double avgValue;

    @Column(name = "total_measurements", nullable = false)
    private int totalMeasurements;

    @JdbcTypeCode(SqlTypes.ARRAY)
    @Column(name = "sensor_readings", nullable = false, columnDefinition = "double precision[]")
    private double[] sensorReadings;

    // Compact 16-dim summary of the readings (padded/truncated), not a semantic embedding
    @ColumnTransformer(read = "readings_vector::text", write = "?::vector")
    @Column(name = "readings_vector", columnDefinition = "vector(16)")
    private String readingsVector;

    @Column(name = "source", nullable = false, length = 255)
    private String source;

    @Column(name = "tst_id", nullable = false, length = 100)
    private String tstId;

    @Column(name = "uut_type", nullable = false, length = 100)
    private String uutType;

    @Column(name = "meas_status", nullable = false, length = 50)
    private String status;

    @Column(name = "serial_number", nullable = false, length = 100)
    private String serialNumber;

    @Column(name = "category", nullable = false, length = 100)
    private String category;

    @Column(name = "sub_category", nullable = false, length = 100)
    private String subCategory;

    @Column(name = "embedding_text", nullable = false, columnDefinition = "TEXT")
    private String embeddingText;

    @Column(name = "embedding_status", nullable = false, length = 20)
    private EmbeddingStatus embeddingStatus = EmbeddingStatus.PENDING;

    @ColumnTransformer(read = "embedding::text")
    @Column(name = "embedding", columnDefinition = "vector(384)", insertable = false, updatable = false)
    private String embedding;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public Measurement() {
        this.createdAt = LocalDateTime.now();
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getLogId() {
        return logId;
    }

    public void setLogId(Long logId) {
        this.logId = logId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSensorName() {
        return sensorName;
    }

    public void setSensorName(String sensorName) {
        this.sensorName = sensorName;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getUnits() {
        return units;
    }

    public void setUnits(String units) {
        this.units = units;
    }

    public double getMinValue() {
        return minValue;
    }

    public void setMinValue(double minValue) {
        this.minValue = minValue;
    }

    public double getMaxValue() {
        return maxValue;
    }

    public void setMaxValue(double maxValue) {
        this.maxValue = maxValue;
    }

    public double getAvgValue() {
        return avgValue;
    }

    public void setAvgValue(double avgValue) {
        this.avgValue = avgValue;
    }

    public int getTotalMeasurements() {
        return totalMeasurements;
    }

    public void setTotalMeasurements(int totalMeasurements) {
        this.totalMeasurements = totalMeasurements;
    }

    public double[] getSensorReadings() {
        return sensorReadings;
    }

    public void setSensorReadings(double[] sensorReadings) {
        this.sensorReadings = sensorReadings;
    }

    public String getReadingsVector() {
        return readingsVector;
    }

    public void setReadingsVector(String readingsVector) {
        this.readingsVector = readingsVector;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getTstId() {
        return tstId;
    }

    public void setTstId(String tstId) {
        this.tstId = tstId;
    }

    public String getUutType() {
        return uutType;
    }

    public void setUutType(String uutType) {
        this.uutType = uutType;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    public void setSerialNumber(String serialNumber) {
        this.serialNumber = serialNumber;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getSubCategory() {
        return subCategory;
    }

    public void setSubCategory(String subCategory) {
        this.subCategory = subCategory;
    }

    public String getEmbeddingText() {
        return embeddingText;
    }

    public void setEmbeddingText(String embeddingText) {
        this.embeddingText = embeddingText;
    }

    public EmbeddingStatus getEmbeddingStatus() {
        return embeddingStatus;
    }

    public void setEmbeddingStatus(EmbeddingStatus embeddingStatus) {
        this.embeddingStatus = embeddingStatus;
    }

    public String getEmbedding() {
        return embedding;
    }

    public void setEmbedding(String embedding) {
        this.embedding = embedding;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public String toString() {
        return String.format("Measurement{id=%s, log=%s, sensor='%s', readings=%d, embedding=%s}",
                id, logId, sensorName, totalMeasurements, embeddingStatus);
    }
}
