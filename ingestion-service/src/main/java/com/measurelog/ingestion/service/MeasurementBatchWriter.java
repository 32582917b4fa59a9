package com.measurelog.ingestion.service;

import com.measurelog.common.entity.Measurement;
import com.measurelog.common.exception.DatabaseWriteException;
import com.measurelog.common.repository.MeasurementRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Inserts one batch of measurement rows in its own transaction. A failed batch rolls back
 * alone; batches committed before it are untouched.
 */
@Service
public class MeasurementBatchWriter {

    @Autowired
    private MeasurementRepository measurementRepository;

    /**
     * @return the generated row ids, in insertion order
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<Long> writeBatch(List<Measurement> batch) {
        try {
            return measurementRepository.saveAllAndFlush(batch).stream()
                    .map(Measurement::getId)
                    .toList();
        } catch (DataAccessException e) {
            throw new DatabaseWriteException("Insert of " + batch.size() + " measurements failed: "
                    + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
