package com.example.transformationhub.repository;

import com.example.transformationhub.domain.StoredNesting;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface StoredNestingRepository extends JpaRepository<StoredNesting, Long> {

    List<StoredNesting> findByWorkflowId(UUID workflowId);

    List<StoredNesting> findByDescendantId(UUID descendantId);

    void deleteByWorkflowId(UUID workflowId);
}
