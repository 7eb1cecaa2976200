package com.slicer.engine;

import java.util.List;
import java.util.Map;

public interface Cube {

    String getName();

    /**
     * Attributes for the given names. A single name may expand to more than
     * one attribute (a dimension name expands to its levels' attributes).
     *
     * @param aggregated when true, measure aggregates are looked up as well
     */
    List<Attribute> getAttributes(List<String> names, boolean aggregated);

    /**
     * Public description of the cube model.
     */
    Map<String, Object> toMap(boolean expandDimensions, boolean withMappings,
                              boolean fullAttributeNames, boolean createLabel);
}
