package com.slicer.domain.model;

import com.slicer.engine.AggregationBrowser;
import com.slicer.engine.Cell;
import com.slicer.engine.Cube;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything resolved about a request before its handler runs.
 *
 * Created once per request by the context chain and owned by that request
 * only. Cube-independent routes carry no cube and no browser.
 */
@Value
@Builder(builderClassName = "Builder")
public class RequestContext {

    /** Request attribute holding the context. */
    public static final String ATTRIBUTE = RequestContext.class.getName();

    Cube cube;
    AggregationBrowser browser;

    /** Primary cell, null when no cut was requested. */
    Cell cell;

    Integer page;
    Integer pageSize;

    /** Requested ordering, never null. */
    List<OrderEntry> order;

    /** Caller identity, null for anonymous callers. */
    String authorizationToken;

    int jsonRecordLimit;
    boolean prettyPrint;
}
