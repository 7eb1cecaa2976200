package com.slicer.infrastructure.config;

public enum OptionType {
    BOOL,
    INT,
    STRING
}
