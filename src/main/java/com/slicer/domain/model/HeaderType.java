package com.slicer.domain.model;

/**
 * Header row written by the CSV output.
 */
public enum HeaderType {
    /** Raw result labels. */
    NAMES,
    /** Human readable attribute labels. */
    LABELS,
    /** No header row. */
    NONE
}
