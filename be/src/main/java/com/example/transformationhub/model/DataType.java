package com.example.transformationhub.model;

/**
 * Data type of a connector. A destination typed {@link #ANY} accepts every source type.
 */
public enum DataType {
    INT,
    FLOAT,
    STRING,
    BOOLEAN,
    SERIES,
    MULTITSFRAME,
    DATAFRAME,
    PLOTLYJSON,
    ANY;

    /**
     * Whether a link from a source of type {@code source} may end in a connector of this type.
     */
    public boolean accepts(DataType source) {
        return this == ANY || this == source;
    }
}
