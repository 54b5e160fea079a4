package com.example.transformationhub.model;

/**
 * Canvas position of a graph element. Presentation only.
 */
public record Position(int x, int y) {
}
