package com.slicer.engine;

import com.slicer.domain.model.OrderEntry;

import java.util.List;

/**
 * Executes aggregation queries against the data of one cube.
 */
public interface AggregationBrowser {

    /**
     * Name of the synthetic result column that tells whether a row matches
     * the split cell.
     */
    String SPLIT_DIMENSION_NAME = "__within_split__";

    /**
     * Aggregate the cell.
     *
     * @param cell       cell to aggregate, null for the whole cube
     * @param aggregates aggregate names, empty for all
     * @param drilldown  drilldown specifications
     * @param split      split cell, may be null
     * @param page       page number, may be null
     * @param pageSize   page size, may be null
     * @param order      requested ordering
     */
    AggregationResult aggregate(Cell cell, List<String> aggregates, List<String> drilldown,
                                Cell split, Integer page, Integer pageSize, List<OrderEntry> order);
}
