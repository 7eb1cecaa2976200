package com.slicer.engine;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point of the aggregation engine.
 *
 * The slicer server only consumes this interface; the engine behind it owns
 * cube metadata, stores and aggregation. Implementations must be safe for
 * concurrent use by request threads.
 */
public interface Workspace {

    /**
     * Resolve a cube by name.
     *
     * @throws NoSuchCubeException if the workspace has no such cube
     */
    Cube cube(String name);

    /**
     * Browser able to run aggregations on the given cube.
     */
    AggregationBrowser browser(Cube cube);

    /**
     * Short descriptions of all cubes visible through this workspace.
     * Potentially expensive.
     */
    List<Map<String, Object>> listCubes();

    /**
     * Features the browser of the cube supports, such as available actions
     * and aggregate functions.
     */
    Map<String, Object> cubeFeatures(Cube cube);

    /**
     * Authorizer guarding cube access, empty when access is open.
     */
    Optional<Authorizer> getAuthorizer();
}
