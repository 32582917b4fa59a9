package com.measurelog.ingestion.config;

import com.measurelog.common.vector.VectorNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class IngestionConfig {

    @Value("${measurelog.ingestion.readings-vector-dimensions:16}")
    private int readingsVectorDimensions;

    /**
     * Shapes raw sensor readings into the fixed-width {@code readings_vector} column.
     */
    @Bean
    public VectorNormalizer readingsVectorNormalizer() {
        return new VectorNormalizer(readingsVectorDimensions);
    }
}
