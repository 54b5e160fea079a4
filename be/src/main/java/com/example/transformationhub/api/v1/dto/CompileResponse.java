package com.example.transformationhub.api.v1.dto;

import com.example.transformationhub.codegen.ExecutableUnit;
import com.example.transformationhub.model.DataType;
import com.example.transformationhub.model.Wiring;

import java.util.Map;

/**
 * Response for POST /api/v1/transformations/{id}/compile: everything an external executor needs
 * to run the revision once.
 */
public record CompileResponse(
        ExecutableUnit unit,
        Wiring wiring,
        Map<String, DataType> outputTypesByOutputName
) {}
