package com.slicer.domain.service;

import com.slicer.domain.exception.NotAuthorizedException;
import com.slicer.domain.exception.ServerMisconfigurationException;
import com.slicer.domain.model.SlicerSettings;
import com.slicer.engine.AuthorizationDeniedException;
import com.slicer.engine.Authorizer;
import com.slicer.engine.Cube;
import com.slicer.engine.Workspace;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Caller identity and cube access checks.
 *
 * With {@code http_basic} the identity is the user name of the Basic
 * credentials; the password is not checked here, that is the business of the
 * authenticating proxy in front of the server.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthorizationGate {

    private static final String BASIC_PREFIX = "basic ";

    private final SlicerSettings settings;
    private final Workspace workspace;

    /**
     * @return caller identity, null for anonymous requests
     * @throws ServerMisconfigurationException if the configured
     *                                         authorization method is not supported
     */
    public String prepareToken(HttpServletRequest request) {
        String method = settings.getAuthorizationMethod();
        if (!SlicerSettings.HTTP_BASIC.equals(method)) {
            throw new ServerMisconfigurationException("Unsupported authorization method: " + method);
        }
        return basicUsername(request.getHeader(HttpHeaders.AUTHORIZATION));
    }

    /**
     * Check cube access. Without an authorizer every request is allowed.
     *
     * @throws NotAuthorizedException if the authorizer denies access
     */
    public void authorize(String token, Cube cube) {
        Optional<Authorizer> authorizer = workspace.getAuthorizer();
        if (authorizer.isEmpty()) {
            return;
        }

        try {
            authorizer.get().authorize(token, cube);
        } catch (AuthorizationDeniedException e) {
            log.warn("Access to cube '{}' denied for '{}'", cube.getName(), token);
            throw new NotAuthorizedException("Not authorized to access cube '" + cube.getName() + "'", e);
        }
    }

    static String basicUsername(String header) {
        if (header == null || header.length() <= BASIC_PREFIX.length()
                || !header.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            return null;
        }

        String credentials;
        try {
            byte[] decoded = Base64.getDecoder().decode(header.substring(BASIC_PREFIX.length()).trim());
            credentials = new String(decoded, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed Basic credentials: {}", e.getMessage());
            return null;
        }

        int separator = credentials.indexOf(':');
        if (separator <= 0) {
            return null;
        }
        return credentials.substring(0, separator);
    }
}
