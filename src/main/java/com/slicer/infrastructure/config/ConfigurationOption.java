package com.slicer.infrastructure.config;

import lombok.Value;

import java.util.List;

/**
 * Resolved server option.
 */
@Value
public class ConfigurationOption {

    String name;
    Object value;
    OptionType type;

    /** Allowed values, null when any value of the type is accepted. */
    List<?> allowed;
}
