package com.example.transformationhub.model;

import jakarta.validation.Valid;

import java.util.List;

/**
 * Input and output bindings used for ad-hoc execution and testing.
 */
public record Wiring(@Valid List<InputWiring> inputWirings, @Valid List<OutputWiring> outputWirings) {

    public Wiring {
        inputWirings = inputWirings != null ? List.copyOf(inputWirings) : List.of();
        outputWirings = outputWirings != null ? List.copyOf(outputWirings) : List.of();
    }

    public static Wiring empty() {
        return new Wiring(List.of(), List.of());
    }
}
