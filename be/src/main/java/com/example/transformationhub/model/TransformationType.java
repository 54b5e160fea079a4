package com.example.transformationhub.model;

/**
 * Kind of a transformation revision: a leaf unit of code or a graph of other revisions.
 */
public enum TransformationType {
    COMPONENT,
    WORKFLOW
}
