package com.example.transformationhub.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Derived record: {@code workflowId} uses {@code descendantId} through the operators in
 * {@code viaOperatorPath}, {@code depth} levels down. One row per distinct path.
 */
public record NestingRow(UUID workflowId, UUID descendantId, List<UUID> viaOperatorPath, int depth) {

    /** Orders rows by descendant, then by operator path. */
    public static final Comparator<NestingRow> ORDER = Comparator
            .comparing((NestingRow row) -> row.descendantId().toString())
            .thenComparing(NestingRow::pathKey);

    public NestingRow {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(descendantId, "descendantId");
        viaOperatorPath = List.copyOf(viaOperatorPath);
        if (depth < 1 || depth != viaOperatorPath.size()) {
            throw new IllegalArgumentException("depth " + depth + " does not match path length " + viaOperatorPath.size());
        }
    }

    public String pathKey() {
        return viaOperatorPath.stream().map(UUID::toString).collect(Collectors.joining("/"));
    }
}
