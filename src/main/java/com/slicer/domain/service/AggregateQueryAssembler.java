package com.slicer.domain.service;

import com.slicer.domain.model.AggregateQuery;
import com.slicer.domain.model.HeaderType;
import com.slicer.domain.model.OutputFormat;
import com.slicer.domain.model.RequestContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Builds the {@link AggregateQuery} of an aggregate request.
 *
 * {@code aggregates} and {@code drilldown} may be repeated; every occurrence
 * is a {@code |} separated list and the lists are concatenated, so
 * {@code aggregates=a|b&aggregates=c} asks for a, b and c.
 */
@Component
@RequiredArgsConstructor
public class AggregateQueryAssembler {

    private final CutGrammar cutGrammar;

    public AggregateQuery assemble(RequestContext context, HttpServletRequest request) {
        OutputFormat format = RequestParameters.validatedParameter(request, "format",
                OutputFormat.class, OutputFormat.JSON);
        HeaderType header = RequestParameters.validatedParameter(request, "header",
                HeaderType.class, HeaderType.LABELS);

        return AggregateQuery.builder()
                .cell(context.getCell())
                .aggregates(RequestParameters.splitAll(request, "aggregates", "|"))
                .drilldown(RequestParameters.splitAll(request, "drilldown", "|"))
                .split(cutGrammar.resolveCell(request, "split", context.getCube()))
                .page(context.getPage())
                .pageSize(context.getPageSize())
                .order(context.getOrder())
                .format(format)
                .header(header)
                .fields(parseFields(request.getParameter("fields")))
                .build();
    }

    private static List<String> parseFields(String fields) {
        if (fields == null || fields.isEmpty()) {
            return null;
        }
        return Arrays.asList(fields.toLowerCase(Locale.ROOT).split(","));
    }
}
