package com.slicer.api;

import com.slicer.domain.model.AggregateQuery;
import com.slicer.domain.model.RequestContext;
import com.slicer.domain.model.SlicerSettings;
import com.slicer.domain.service.AggregateQueryAssembler;
import com.slicer.domain.service.AggregationService;
import com.slicer.engine.AggregationResult;
import com.slicer.engine.Cube;
import com.slicer.engine.Workspace;
import com.slicer.infrastructure.cache.CubeListCache;
import com.slicer.infrastructure.render.ResultRenderer;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Slicer HTTP API.
 *
 * Endpoints:
 * - GET / - liveness marker
 * - GET /version - server and API version
 * - GET /info - authorization method and version
 * - GET /cubes - list of cubes
 * - GET /cube/{cubeName}/model - cube model
 * - GET /cube/{cubeName}/aggregate - aggregation as JSON or CSV
 *
 * Every handler receives the {@link RequestContext} prepared by
 * {@link RequestContextInterceptor}; a cube named in the path is already
 * resolved and authorized when the handler runs.
 */
@Slf4j
@RestController
public class SlicerController {

    public static final int API_VERSION = 2;

    private final Workspace workspace;
    private final CubeListCache cubeListCache;
    private final AggregateQueryAssembler queryAssembler;
    private final AggregationService aggregationService;
    private final ResultRenderer resultRenderer;
    private final SlicerSettings settings;
    private final String serverVersion;

    public SlicerController(Workspace workspace,
                            CubeListCache cubeListCache,
                            AggregateQueryAssembler queryAssembler,
                            AggregationService aggregationService,
                            ResultRenderer resultRenderer,
                            SlicerSettings settings,
                            @Value("${slicer.server-version:1.0}") String serverVersion) {
        this.workspace = workspace;
        this.cubeListCache = cubeListCache;
        this.queryAssembler = queryAssembler;
        this.aggregationService = aggregationService;
        this.resultRenderer = resultRenderer;
        this.settings = settings;
        this.serverVersion = serverVersion;
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public String index() {
        return "Cubes";
    }

    @GetMapping("/version")
    public ResponseEntity<StreamingResponseBody> version(RequestContext context) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("version", serverVersion);
        // Kept for older clients
        info.put("server_version", serverVersion);
        info.put("api_version", API_VERSION);
        return resultRenderer.json(info, context);
    }

    @GetMapping("/info")
    public ResponseEntity<StreamingResponseBody> info(RequestContext context) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("authorization_method", settings.getAuthorizationMethod());
        info.put("version", serverVersion);
        return resultRenderer.json(info, context);
    }

    @GetMapping("/cubes")
    public ResponseEntity<StreamingResponseBody> listCubes(RequestContext context) {
        return resultRenderer.json(cubeListCache.cubes(), context);
    }

    @GetMapping("/cube/{cubeName}/model")
    public ResponseEntity<StreamingResponseBody> cubeModel(RequestContext context) {
        Cube cube = context.getCube();
        Map<String, Object> model = new LinkedHashMap<>(cube.toMap(true, false, true, true));
        model.put("features", workspace.cubeFeatures(cube));
        return resultRenderer.json(model, context);
    }

    /**
     * Aggregate the cube.
     *
     * GET /cube/{cubeName}/aggregate?cut=...&drilldown=...&aggregates=...
     *
     * Query Parameters:
     * - cut, split (repeatable): cut strings
     * - aggregates, drilldown (repeatable): '|' separated lists
     * - order (repeatable): comma separated field[:direction]
     * - page, pagesize: paging
     * - format: json (default) or csv
     * - header: names, labels (default) or none, CSV only
     * - fields: comma separated output fields
     * - prettyprint: indent JSON output
     */
    @GetMapping("/cube/{cubeName}/aggregate")
    public ResponseEntity<StreamingResponseBody> aggregate(RequestContext context, HttpServletRequest request) {
        AggregateQuery query = queryAssembler.assemble(context, request);

        log.info("Aggregate cube '{}': format={}, drilldown={}",
                context.getCube().getName(), query.getFormat(), query.getDrilldown());

        AggregationResult result = aggregationService.aggregate(context, query);
        return resultRenderer.render(result, query, context);
    }
}
