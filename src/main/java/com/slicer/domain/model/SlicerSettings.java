package com.slicer.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Validated server options. Built once at startup, read-only afterwards.
 */
@Value
@Builder
public class SlicerSettings {

    public static final String HTTP_BASIC = "http_basic";

    boolean prettyPrint;
    int jsonRecordLimit;
    String authorizationMethod;
}
