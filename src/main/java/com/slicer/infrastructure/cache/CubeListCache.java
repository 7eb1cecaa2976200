package com.slicer.infrastructure.cache;

import com.slicer.engine.Workspace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Memoized cube list.
 *
 * Listing cubes may hit the engine's model providers, so the list is computed
 * on first use and kept for the life of the process. This is the only shared
 * mutable state of the server: concurrent first callers wait for a single
 * computation instead of each listing the cubes. A failed listing is not
 * cached.
 */
@Slf4j
@Service
public class CubeListCache {

    private final Workspace workspace;
    private final Object lock = new Object();

    private volatile List<Map<String, Object>> cubes;

    public CubeListCache(Workspace workspace) {
        this.workspace = workspace;
    }

    public List<Map<String, Object>> cubes() {
        List<Map<String, Object>> cached = cubes;
        if (cached != null) {
            log.debug("Cache hit for cube list");
            return cached;
        }

        synchronized (lock) {
            if (cubes == null) {
                log.debug("Cache miss for cube list, listing cubes");
                cubes = List.copyOf(workspace.listCubes());
                log.info("Cached cube list: {} cubes", cubes.size());
            }
            return cubes;
        }
    }

    /**
     * Drop the cached list; the next call lists the cubes again.
     */
    public void invalidate() {
        synchronized (lock) {
            cubes = null;
        }
        log.debug("Invalidated cube list cache");
    }
}
