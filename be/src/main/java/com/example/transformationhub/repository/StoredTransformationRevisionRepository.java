package com.example.transformationhub.repository;

import com.example.transformationhub.domain.StoredTransformationRevision;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface StoredTransformationRevisionRepository extends JpaRepository<StoredTransformationRevision, UUID> {

    Optional<StoredTransformationRevision> findByRevisionGroupIdAndVersionTag(UUID revisionGroupId, String versionTag);
}
