package com.slicer.api;

import com.slicer.domain.model.RequestContext;
import com.slicer.domain.service.RequestContextBuilder;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

/**
 * Builds the request context before the handler runs. A failing step
 * propagates its exception, so the handler is never invoked and the error
 * goes to {@link SlicerExceptionHandler}.
 */
@Component
@RequiredArgsConstructor
public class RequestContextInterceptor implements HandlerInterceptor {

    static final String CUBE_NAME_VARIABLE = "cubeName";

    private final RequestContextBuilder contextBuilder;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // Streaming responses are re-dispatched; the context of the first dispatch is still attached.
        if (request.getDispatcherType() == DispatcherType.ASYNC || !(handler instanceof HandlerMethod)) {
            return true;
        }

        @SuppressWarnings("unchecked")
        Map<String, String> pathVariables =
                (Map<String, String>) request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        String cubeName = pathVariables != null ? pathVariables.get(CUBE_NAME_VARIABLE) : null;

        RequestContext context = contextBuilder.build(request, cubeName);
        request.setAttribute(RequestContext.ATTRIBUTE, context);
        return true;
    }
}
