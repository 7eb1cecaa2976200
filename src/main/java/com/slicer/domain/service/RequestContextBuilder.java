package com.slicer.domain.service;

import com.slicer.domain.exception.RequestException;
import com.slicer.domain.model.OrderEntry;
import com.slicer.domain.model.RequestContext;
import com.slicer.domain.model.SlicerSettings;
import com.slicer.engine.Cube;
import com.slicer.engine.Workspace;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Prepares the {@link RequestContext} before a route handler runs.
 *
 * Steps run in a fixed order:
 * 1. cube resolution
 * 2. browser resolution
 * 3. primary cell ({@code cut})
 * 4. paging ({@code page}, {@code pagesize})
 * 5. ordering ({@code order})
 * 6. authorization
 * 7. output options ({@code json_record_limit}, {@code prettyprint})
 *
 * The first failing step aborts the chain with its exception; engine errors
 * such as an unknown cube pass through unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestContextBuilder {

    private final Workspace workspace;
    private final CutGrammar cutGrammar;
    private final AuthorizationGate authorizationGate;
    private final SlicerSettings settings;

    /**
     * @param cubeName cube named by the route, null for cube-independent routes
     */
    public RequestContext build(HttpServletRequest request, String cubeName) {
        RequestContext.Builder context = RequestContext.builder();

        Cube cube = null;
        if (cubeName != null) {
            cube = workspace.cube(cubeName);
            context.cube(cube)
                    .browser(workspace.browser(cube));
        }

        context.cell(cutGrammar.resolveCell(request, "cut", cube))
                .page(parseInteger(request, "page", 0))
                .pageSize(parseInteger(request, "pagesize", 1))
                .order(parseOrder(request));

        String token = authorizationGate.prepareToken(request);
        if (cube != null) {
            authorizationGate.authorize(token, cube);
        }
        context.authorizationToken(token);

        context.jsonRecordLimit(settings.getJsonRecordLimit());
        String prettyPrint = request.getParameter("prettyprint");
        context.prettyPrint(prettyPrint != null
                ? RequestParameters.toBoolean(prettyPrint)
                : settings.isPrettyPrint());

        RequestContext result = context.build();
        log.debug("Prepared request context: cube={}, page={}, pageSize={}, order={}",
                cubeName, result.getPage(), result.getPageSize(), result.getOrder());
        return result;
    }

    private static Integer parseInteger(HttpServletRequest request, String name, int minimum) {
        String value = request.getParameter(name);
        if (value == null) {
            return null;
        }

        int number;
        try {
            number = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new RequestException("'" + name + "' should be a number", e);
        }
        if (number < minimum) {
            throw new RequestException("'" + name + "' should be at least " + minimum);
        }
        return number;
    }

    /**
     * {@code order=field[:direction],...}, accumulated over all occurrences.
     * Components after the second colon are ignored.
     */
    static List<OrderEntry> parseOrder(HttpServletRequest request) {
        List<OrderEntry> order = new ArrayList<>();
        for (String token : RequestParameters.splitAll(request, "order", ",")) {
            String[] parts = token.split(":", -1);
            if (parts.length == 1) {
                order.add(OrderEntry.of(token, null));
            } else {
                order.add(OrderEntry.of(parts[0], parts[1]));
            }
        }
        return order;
    }
}
