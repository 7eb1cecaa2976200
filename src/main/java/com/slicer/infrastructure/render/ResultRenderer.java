package com.slicer.infrastructure.render;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slicer.domain.model.AggregateQuery;
import com.slicer.domain.model.HeaderType;
import com.slicer.domain.model.RequestContext;
import com.slicer.engine.AggregationResult;
import com.slicer.engine.Cube;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.List;

/**
 * Streams responses as bounded JSON or as CSV.
 *
 * JSON sequences are cut at the request's record limit. CSV rows are not
 * limited.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultRenderer {

    public static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final ObjectMapper objectMapper;

    public ResponseEntity<StreamingResponseBody> render(AggregationResult result, AggregateQuery query,
                                                        RequestContext context) {
        switch (query.getFormat()) {
            case CSV:
                if (query.getFields() != null) {
                    log.debug("Field selection {} is not applied to CSV output", query.getFields());
                }
                return csv(result, context.getCube(), query.getHeader());
            case JSON:
            default:
                return json(result, context);
        }
    }

    public ResponseEntity<StreamingResponseBody> json(Object value, RequestContext context) {
        int recordLimit = context.getJsonRecordLimit();
        boolean prettyPrint = context.isPrettyPrint();

        StreamingResponseBody body = outputStream -> {
            try (JsonGenerator generator = objectMapper.createGenerator(outputStream, JsonEncoding.UTF8)) {
                generator.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
                BoundedJsonWriter writer = new BoundedJsonWriter(generator, recordLimit, prettyPrint);
                writer.write(value);
                writer.flush();
            }
        };

        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }

    /**
     * The header is resolved before streaming starts so that attribute
     * lookup failures are still reported as errors.
     */
    public ResponseEntity<StreamingResponseBody> csv(AggregationResult result, Cube cube, HeaderType headerType) {
        List<String> header = CsvResultWriter.header(result, cube, headerType);
        List<String> fields = result.getLabels();

        StreamingResponseBody body = outputStream ->
                CsvResultWriter.write(outputStream, header, fields, result);

        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .body(body);
    }
}
