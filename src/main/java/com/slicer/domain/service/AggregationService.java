package com.slicer.domain.service;

import com.slicer.domain.model.AggregateQuery;
import com.slicer.domain.model.RequestContext;
import com.slicer.engine.AggregationResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs assembled aggregate queries on the browser of the request's cube.
 *
 * Engine failures are rethrown as they are; their classification belongs to
 * the engine. There is no retry at this level.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationService {

    private final MeterRegistry meterRegistry;

    public AggregationResult aggregate(RequestContext context, AggregateQuery query) {
        String cubeName = context.getCube().getName();
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            AggregationResult result = context.getBrowser().aggregate(
                    query.getCell(),
                    query.getAggregates(),
                    query.getDrilldown(),
                    query.getSplit(),
                    query.getPage(),
                    query.getPageSize(),
                    query.getOrder()
            );

            sample.stop(Timer.builder("slicer.aggregate.latency")
                    .tag("cube", cubeName)
                    .register(meterRegistry));

            Counter.builder("slicer.aggregate.executed")
                    .tag("cube", cubeName)
                    .tag("result", "success")
                    .register(meterRegistry)
                    .increment();

            log.info("Aggregated cube '{}': aggregates={}, drilldown={}, split={}",
                    cubeName, query.getAggregates(), query.getDrilldown(), query.getSplit() != null);

            return result;

        } catch (RuntimeException e) {
            log.error("Error aggregating cube '{}': {}", cubeName, e.getMessage(), e);

            Counter.builder("slicer.aggregate.executed")
                    .tag("cube", cubeName)
                    .tag("result", "error")
                    .register(meterRegistry)
                    .increment();

            throw e;
        }
    }
}
