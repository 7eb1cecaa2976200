package com.slicer.domain.service;

import com.slicer.domain.exception.RequestException;
import com.slicer.engine.Cell;
import com.slicer.engine.Cube;
import com.slicer.engine.cut.Cut;
import com.slicer.engine.cut.CutParseException;
import com.slicer.engine.cut.CutParser;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns cut-bearing query parameters ({@code cut}, {@code split}) into cells.
 *
 * Each occurrence of the parameter is parsed on its own and the cuts are
 * concatenated in occurrence order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CutGrammar {

    private final CutParser cutParser;

    public List<Cut> parseCuts(HttpServletRequest request, String argName) {
        List<Cut> cuts = new ArrayList<>();
        for (String cutString : RequestParameters.values(request, argName)) {
            try {
                cuts.addAll(cutParser.parse(cutString));
            } catch (CutParseException e) {
                throw new RequestException("Invalid '" + argName + "' parameter: " + e.getMessage(), e);
            }
        }
        return cuts;
    }

    /**
     * Cell with all cuts of the parameter, or null when the parameter carries
     * no cut. An empty cell is never returned.
     */
    public Cell resolveCell(HttpServletRequest request, String argName, Cube cube) {
        List<Cut> cuts = parseCuts(request, argName);
        if (cuts.isEmpty()) {
            return null;
        }
        log.debug("Resolved '{}' cell with {} cuts", argName, cuts.size());
        return new Cell(cube, cuts);
    }
}
