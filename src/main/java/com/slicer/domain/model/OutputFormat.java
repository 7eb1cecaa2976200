package com.slicer.domain.model;

public enum OutputFormat {
    JSON,
    CSV
}
