package com.slicer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Slicer Server
 *
 * HTTP front end of an OLAP aggregation engine.
 *
 * Architecture:
 * - Request context chain (cube, cell, paging, ordering, authorization) before every handler
 * - Compact multi-value query grammar for cuts, aggregates and drilldowns
 * - Typed server options validated at startup
 * - Bounded streaming JSON and streamed CSV output
 *
 * The aggregation engine is plugged in by registering a
 * {@link com.slicer.engine.Workspace} bean.
 */
@SpringBootApplication
public class SlicerServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SlicerServerApplication.class, args);
    }
}
