package com.measurelog.common.repository;

import com.measurelog.common.entity.LogFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LogFileRepository extends JpaRepository<LogFile, Long> {

    // Upload events are delivered at-least-once; the storage object id is the dedup key
    Optional<LogFile> findByStorageObjectId(String storageObjectId);

    List<LogFile> findByCreatedByOrderByCreatedAtDesc(String createdBy);
}
