package com.example.transformationhub.model;

import jakarta.validation.Valid;

import java.util.List;
import java.util.Optional;

/**
 * Ordered inputs and outputs a revision exposes to its callers.
 */
public record IoInterface(@Valid List<Connector> inputs, @Valid List<Connector> outputs) {

    public IoInterface {
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }

    public static IoInterface empty() {
        return new IoInterface(List.of(), List.of());
    }

    public Optional<Connector> input(String name) {
        return inputs.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public Optional<Connector> output(String name) {
        return outputs.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    /** Same interface with presentation metadata dropped. */
    public IoInterface withoutPositions() {
        return new IoInterface(
                inputs.stream().map(Connector::withoutPosition).toList(),
                outputs.stream().map(Connector::withoutPosition).toList());
    }
}
