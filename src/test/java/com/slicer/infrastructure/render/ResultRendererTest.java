package com.slicer.infrastructure.render;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slicer.domain.model.AggregateQuery;
import com.slicer.domain.model.HeaderType;
import com.slicer.domain.model.OutputFormat;
import com.slicer.domain.model.RequestContext;
import com.slicer.engine.AggregationBrowser;
import com.slicer.engine.AggregationResultStub;
import com.slicer.engine.Attribute;
import com.slicer.engine.Cube;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResultRendererTest {

    @Mock
    private Cube cube;

    private ResultRenderer renderer;
    private AggregationResultStub result;
    private RequestContext context;

    @BeforeEach
    void setUp() {
        renderer = new ResultRenderer(new ObjectMapper());
        result = new AggregationResultStub("date.year", "amount_sum", AggregationBrowser.SPLIT_DIMENSION_NAME)
                .withRow(2010, 10, true)
                .withRow(2011, null, false);
        context = RequestContext.builder()
                .cube(cube)
                .order(List.of())
                .jsonRecordLimit(1000)
                .build();
    }

    private static String body(ResponseEntity<StreamingResponseBody> response) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        response.getBody().writeTo(out);
        return out.toString(StandardCharsets.UTF_8);
    }

    private static Attribute attribute(String name, String label) {
        Attribute attribute = mock(Attribute.class);
        when(attribute.getLabel()).thenReturn(label);
        if (label == null) {
            when(attribute.getName()).thenReturn(name);
        }
        return attribute;
    }

    private AggregateQuery query(OutputFormat format, HeaderType header) {
        return AggregateQuery.builder()
                .format(format)
                .header(header)
                .build();
    }

    @Test
    void testRender_CsvNamesHeader() throws IOException {
        ResponseEntity<StreamingResponseBody> response =
                renderer.render(result, query(OutputFormat.CSV, HeaderType.NAMES), context);

        assertEquals(ResultRenderer.TEXT_CSV, response.getHeaders().getContentType());
        assertEquals("date.year,amount_sum,__within_split__\r\n"
                + "2010,10,true\r\n"
                + "2011,,false\r\n", body(response));
    }

    @Test
    void testRender_CsvNoHeader() throws IOException {
        String csv = body(renderer.render(result, query(OutputFormat.CSV, HeaderType.NONE), context));

        assertEquals("2010,10,true\r\n2011,,false\r\n", csv);
        verifyNoInteractions(cube);
    }

    @Test
    void testRender_CsvLabelsHeader() throws IOException {
        // Given
        Attribute year = attribute("date.year", "Year");
        Attribute amount = attribute("amount_sum", null);
        when(cube.getAttributes(List.of("date.year"), true)).thenReturn(List.of(year));
        when(cube.getAttributes(List.of("amount_sum"), true)).thenReturn(List.of(amount));

        // When
        String csv = body(renderer.render(result, query(OutputFormat.CSV, HeaderType.LABELS), context));

        // Then
        assertTrue(csv.startsWith("Year,amount_sum,Matches Filters\r\n"));
        verify(cube, never()).getAttributes(List.of(AggregationBrowser.SPLIT_DIMENSION_NAME), true);
    }

    @Test
    void testRender_CsvIgnoresFieldSelection() throws IOException {
        AggregateQuery query = AggregateQuery.builder()
                .format(OutputFormat.CSV)
                .header(HeaderType.NONE)
                .fields(List.of("amount_sum"))
                .build();

        String csv = body(renderer.render(result, query, context));

        assertTrue(csv.startsWith("2010,10,true\r\n"));
    }

    @Test
    void testRender_CsvEmptyLabelsWritesNoHeader() throws IOException {
        AggregationResultStub empty = new AggregationResultStub();

        assertEquals("", body(renderer.render(empty, query(OutputFormat.CSV, HeaderType.NAMES), context)));
    }

    @Test
    void testRender_Json() throws IOException {
        ResponseEntity<StreamingResponseBody> response =
                renderer.render(result, query(OutputFormat.JSON, HeaderType.LABELS), context);

        assertEquals(MediaType.APPLICATION_JSON, response.getHeaders().getContentType());
        assertTrue(body(response).contains("\"cells\":[{\"date.year\":2010"));
        verifyNoInteractions(cube);
    }
}
