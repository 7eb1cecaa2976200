package com.slicer.domain.service;

import com.slicer.domain.exception.RequestException;
import com.slicer.engine.Cell;
import com.slicer.engine.Cube;
import com.slicer.engine.cut.Cut;
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
class CutGrammarTest {

    @Mock
    private Cube cube;

    private CutGrammar cutGrammar;
    private MockHttpServletRequest request;

    @BeforeEach
    void setUp() {
        cutGrammar = new CutGrammar(new StringCutParser());
        request = new MockHttpServletRequest("GET", "/cube/sales/aggregate");
    }

    @Test
    void testResolveCell_ConcatenatesOccurrencesInOrder() {
        // Given
        request.addParameter("cut", "date:2010|geo:us");
        request.addParameter("cut", "product:books");

        // When
        Cell cell = cutGrammar.resolveCell(request, "cut", cube);

        // Then
        assertNotNull(cell);
        assertSame(cube, cell.getCube());
        List<String> dimensions = cell.getCuts().stream().map(Cut::getDimension).toList();
        assertEquals(List.of("date", "geo", "product"), dimensions);
    }

    @Test
    void testResolveCell_NoCutsYieldsNoCell() {
        assertNull(cutGrammar.resolveCell(request, "cut", cube));
    }

    @Test
    void testResolveCell_EmptyParameterYieldsNoCell() {
        request.addParameter("cut", "");

        assertNull(cutGrammar.resolveCell(request, "cut", cube));
    }

    @Test
    void testResolveCell_OnlyNamedParameter() {
        request.addParameter("cut", "date:2010");
        request.addParameter("split", "geo:us");

        Cell split = cutGrammar.resolveCell(request, "split", cube);

        assertEquals(1, split.getCuts().size());
        assertEquals("geo", split.getCuts().get(0).getDimension());
    }

    @Test
    void testParseCuts_InvalidCutIsRequestError() {
        request.addParameter("cut", "nonsense");

        RequestException e = assertThrows(RequestException.class, () -> cutGrammar.parseCuts(request, "cut"));

        assertTrue(e.getMessage().contains("'cut'"));
        assertNotNull(e.getCause());
    }
}
