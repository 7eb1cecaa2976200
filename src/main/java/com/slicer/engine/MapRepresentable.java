package com.slicer.engine;

import java.util.Map;

/**
 * Value that renders itself as a JSON object. Map values may be lazy
 * iterables; the JSON writer bounds them.
 */
public interface MapRepresentable {

    Map<String, Object> toMap();
}
