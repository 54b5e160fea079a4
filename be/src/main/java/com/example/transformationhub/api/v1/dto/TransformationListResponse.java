package com.example.transformationhub.api.v1.dto;

import java.util.List;

/**
 * Response for GET /api/v1/transformations.
 */
public record TransformationListResponse(List<TransformationListItem> transformations) {}
