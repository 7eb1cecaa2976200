package com.slicer.engine;

public interface Authorizer {

    /**
     * Check that the identity may access the cube.
     *
     * @param token caller identity, null for anonymous callers
     * @throws AuthorizationDeniedException when access is denied
     */
    void authorize(String token, Cube cube);
}
