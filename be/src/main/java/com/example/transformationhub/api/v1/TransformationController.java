package com.example.transformationhub.api.v1;

import com.example.transformationhub.api.v1.dto.CompileResponse;
import com.example.transformationhub.api.v1.dto.NestingResponse;
import com.example.transformationhub.api.v1.dto.TransformationListItem;
import com.example.transformationhub.api.v1.dto.TransformationListResponse;
import com.example.transformationhub.codegen.ExecutableUnit;
import com.example.transformationhub.model.Connector;
import com.example.transformationhub.model.DataType;
import com.example.transformationhub.model.RevisionState;
import com.example.transformationhub.model.TransformationRevision;
import com.example.transformationhub.model.TransformationType;
import com.example.transformationhub.model.Wiring;
import com.example.transformationhub.service.TransformationRevisionService;
import com.example.transformationhub.validation.WorkflowGraphValidator;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * REST controller for transformation revisions.
 * <p>
 * Exposes {@code /api/v1/transformations} for create (POST), list (GET), get by id (GET /{id}),
 * create-or-update (PUT /{id}), delete (DELETE /{id}), nesting (GET /{id}/nesting) and
 * compilation for an external executor (POST /{id}/compile).
 * </p>
 */
@RestController
@RequestMapping("/api/v1/transformations")
@RequiredArgsConstructor
@Slf4j
public class TransformationController {

    private final TransformationRevisionService service;

    @PostMapping
    public ResponseEntity<TransformationRevision> create(@Valid @RequestBody TransformationRevision revision) {
        log.info("Creating transformation revision id={} name={} type={}", revision.id(), revision.name(), revision.type());
        TransformationRevision stored = service.create(revision);
        return ResponseEntity.status(HttpStatus.CREATED).body(stored);
    }

    @GetMapping
    public ResponseEntity<TransformationListResponse> list(
            @RequestParam(required = false) TransformationType type,
            @RequestParam(required = false) RevisionState state) {
        log.debug("Listing transformation revisions type={} state={}", type, state);
        return ResponseEntity.ok(new TransformationListResponse(
                service.findAll(type, state).stream().map(TransformationListItem::of).toList()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransformationRevision> getById(@PathVariable UUID id) {
        log.info("Getting transformation revision id={}", id);
        return ResponseEntity.ok(service.findById(id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<TransformationRevision> update(
            @PathVariable UUID id,
            @RequestParam(defaultValue = "false") boolean allowOverwriteReleased,
            @Valid @RequestBody TransformationRevision revision) {
        if (!id.equals(revision.id())) {
            throw new IllegalArgumentException("Path id " + id + " does not match revision id " + revision.id());
        }
        log.info("Updating transformation revision id={} state={} allowOverwriteReleased={}",
                id, revision.state(), allowOverwriteReleased);
        return ResponseEntity.status(HttpStatus.CREATED).body(service.validateAndStore(revision, allowOverwriteReleased));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        log.info("Deleting transformation revision id={}", id);
        service.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/nesting")
    public ResponseEntity<NestingResponse> nesting(@PathVariable UUID id) {
        log.debug("Getting nesting of transformation revision id={}", id);
        return ResponseEntity.ok(new NestingResponse(id, service.nesting(id), service.usedBy(id)));
    }

    /**
     * Compiles the revision. Without a body the revision's test wiring is used.
     */
    @PostMapping("/{id}/compile")
    public ResponseEntity<CompileResponse> compile(@PathVariable UUID id, @Valid @RequestBody(required = false) Wiring wiring) {
        log.info("Compiling transformation revision id={} customWiring={}", id, wiring != null);
        ExecutableUnit unit = service.compileForExecution(id);
        Wiring effective = wiring != null ? wiring : service.findById(id).testWiring();
        WorkflowGraphValidator.validateWiring(unit.ioInterface(), effective);
        Map<String, DataType> outputTypes = new LinkedHashMap<>();
        for (Connector output : unit.ioInterface().outputs()) {
            outputTypes.put(output.name(), output.dataType());
        }
        return ResponseEntity.ok(new CompileResponse(unit, effective, outputTypes));
    }
}
