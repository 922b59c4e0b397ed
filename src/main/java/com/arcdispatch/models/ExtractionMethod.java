package com.arcdispatch.models;

/**
 * How predicted grids were located in the model's answer.
 */
public enum ExtractionMethod {
    /** Read from a named field of a JSON object in the text. */
    DIRECT_FIELD,
    /** Recovered by scanning free text for grid-shaped arrays. */
    TEXT_RECOVERY
}
