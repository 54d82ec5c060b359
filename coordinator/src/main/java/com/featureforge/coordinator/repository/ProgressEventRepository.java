package com.featureforge.coordinator.repository;

import com.featureforge.coordinator.model.ProgressEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProgressEventRepository extends JpaRepository<ProgressEvent, Long> {

    /** Newest first. */
    List<ProgressEvent> findByTaskIdOrderByIdDesc(String taskId, Pageable page);

    List<ProgressEvent> findAllByOrderByIdDesc(Pageable page);
}
