package com.example.transformationhub.api.v1.dto;

import com.example.transformationhub.model.NestingRow;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Response for GET /api/v1/transformations/{id}/nesting: what the revision uses and what uses it.
 */
public record NestingResponse(UUID id, List<NestingRow> descendants, Set<UUID> usedBy) {}
