package com.slicer.infrastructure.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slicer.domain.model.RequestContext;
import com.slicer.engine.AggregationResultStub;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class BoundedJsonWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResultRenderer renderer = new ResultRenderer(objectMapper);

    private String render(Object value, int limit, boolean prettyPrint) throws IOException {
        RequestContext context = RequestContext.builder()
                .order(List.of())
                .jsonRecordLimit(limit)
                .prettyPrint(prettyPrint)
                .build();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        renderer.json(value, context).getBody().writeTo(out);
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testWrite_SequenceCutAtLimit() throws IOException {
        JsonNode node = objectMapper.readTree(render(List.of(1, 2, 3, 4, 5), 3, false));

        assertTrue(node.isArray());
        assertEquals(3, node.size());
        assertEquals(3, node.get(2).asInt());
    }

    @Test
    void testWrite_SequenceWithinLimit() throws IOException {
        assertEquals("[1,2]", render(List.of(1, 2), 3, false));
    }

    @Test
    void testWrite_NeverPullsBeyondLimit() throws IOException {
        AtomicInteger pulled = new AtomicInteger();
        Stream<Integer> endless = Stream.iterate(0, i -> i + 1).peek(i -> pulled.incrementAndGet());

        JsonNode node = objectMapper.readTree(render(endless, 10, false));

        assertEquals(10, node.size());
        assertEquals(10, pulled.get());
    }

    @Test
    void testWrite_NestedSequencesAreBounded() throws IOException {
        AggregationResultStub result = new AggregationResultStub("date", "amount_sum")
                .withRow("2010", 10)
                .withRow("2011", 20)
                .withRow("2012", 30);

        JsonNode node = objectMapper.readTree(render(result, 2, false));

        assertEquals(2, node.get("cells").size());
        assertEquals("2011", node.get("cells").get(1).get("date").asText());
        assertEquals(3, node.get("total_cell_count").asInt());
    }

    @Test
    void testWrite_PrettyPrintChangesOnlyWhitespace() throws IOException {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("name", "sales");
        value.put("levels", new String[]{"year", "month"});
        value.put("count", 2);
        value.put("missing", null);

        String compact = render(value, 1000, false);
        String pretty = render(value, 1000, true);

        assertFalse(compact.contains("\n"));
        assertTrue(pretty.contains("\n    \"name\""));
        assertEquals(objectMapper.readTree(compact), objectMapper.readTree(pretty));
    }

    @Test
    void testWrite_PrimitiveArray() throws IOException {
        assertEquals("[1,2]", render(new int[]{1, 2, 3}, 2, false));
    }
}
