package com.slicer.domain.service;

import com.slicer.domain.exception.RequestException;
import com.slicer.domain.model.AggregateQuery;
import com.slicer.domain.model.HeaderType;
import com.slicer.domain.model.OrderEntry;
import com.slicer.domain.model.OutputFormat;
import com.slicer.domain.model.RequestContext;
import com.slicer.engine.Cell;
import com.slicer.engine.Cube;
import com.slicer.engine.cut.StringCutParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
class AggregateQueryAssemblerTest {

    @Mock
    private Cube cube;

    private AggregateQueryAssembler assembler;
    private MockHttpServletRequest request;
    private RequestContext context;
    private Cell cell;

    @BeforeEach
    void setUp() {
        assembler = new AggregateQueryAssembler(new CutGrammar(new StringCutParser()));
        request = new MockHttpServletRequest("GET", "/cube/sales/aggregate");
        cell = new Cell(cube, new StringCutParser().parse("date:2010"));
        context = RequestContext.builder()
                .cube(cube)
                .cell(cell)
                .page(2)
                .pageSize(20)
                .order(List.of(OrderEntry.of("amount", "desc")))
                .jsonRecordLimit(1000)
                .build();
    }

    @Test
    void testAssemble_Defaults() {
        AggregateQuery query = assembler.assemble(context, request);

        assertEquals(OutputFormat.JSON, query.getFormat());
        assertEquals(HeaderType.LABELS, query.getHeader());
        assertTrue(query.getAggregates().isEmpty());
        assertTrue(query.getDrilldown().isEmpty());
        assertNull(query.getSplit());
        assertNull(query.getFields());
        assertSame(cell, query.getCell());
        assertEquals(2, query.getPage());
        assertEquals(20, query.getPageSize());
        assertEquals(List.of(OrderEntry.of("amount", "desc")), query.getOrder());
    }

    @Test
    void testAssemble_AggregatesAndDrilldownConcatenate() {
        request.addParameter("aggregates", "a|b");
        request.addParameter("aggregates", "c");
        request.addParameter("drilldown", "date|geo");
        request.addParameter("drilldown", "product");

        AggregateQuery query = assembler.assemble(context, request);

        assertEquals(List.of("a", "b", "c"), query.getAggregates());
        assertEquals(List.of("date", "geo", "product"), query.getDrilldown());
    }

    @Test
    void testAssemble_SplitCell() {
        request.addParameter("split", "geo:us");

        AggregateQuery query = assembler.assemble(context, request);

        assertNotNull(query.getSplit());
        assertSame(cube, query.getSplit().getCube());
        assertEquals("geo", query.getSplit().getCuts().get(0).getDimension());
    }

    @Test
    void testAssemble_FormatAndHeaderCaseInsensitive() {
        request.addParameter("format", "CSV");
        request.addParameter("header", "Names");

        AggregateQuery query = assembler.assemble(context, request);

        assertEquals(OutputFormat.CSV, query.getFormat());
        assertEquals(HeaderType.NAMES, query.getHeader());
    }

    @Test
    void testAssemble_UnknownFormat() {
        request.addParameter("format", "xml");

        RequestException e = assertThrows(RequestException.class, () -> assembler.assemble(context, request));

        assertEquals("Parameter 'format' should be one of: json, csv", e.getMessage());
    }

    @Test
    void testAssemble_UnknownHeader() {
        request.addParameter("header", "fancy");

        assertThrows(RequestException.class, () -> assembler.assemble(context, request));
    }

    @Test
    void testAssemble_FieldsLowerCased() {
        request.addParameter("fields", "Date,AMOUNT");

        AggregateQuery query = assembler.assemble(context, request);

        assertEquals(List.of("date", "amount"), query.getFields());
    }
}
