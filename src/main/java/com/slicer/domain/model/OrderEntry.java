package com.slicer.domain.model;

import lombok.Value;

/**
 * One ordering requested with {@code order=field[:direction]}. Direction is
 * null when the client left it to the browser.
 */
@Value
public class OrderEntry {

    String field;
    String direction;

    public static OrderEntry of(String field, String direction) {
        return new OrderEntry(field, direction);
    }
}
