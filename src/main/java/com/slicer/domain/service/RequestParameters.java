package com.slicer.domain.service;

import com.slicer.domain.exception.RequestException;
import jakarta.servlet.http.HttpServletRequest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Helpers for the multi-valued query parameter grammar.
 */
public final class RequestParameters {

    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "1", "on");

    private RequestParameters() {
    }

    /**
     * All occurrences of a parameter in request order, empty when absent.
     */
    public static List<String> values(HttpServletRequest request, String name) {
        String[] values = request.getParameterValues(name);
        return values == null ? Collections.emptyList() : Arrays.asList(values);
    }

    /**
     * Split every occurrence of a parameter on the separator and concatenate
     * the tokens in occurrence order. Empty tokens are dropped.
     */
    public static List<String> splitAll(HttpServletRequest request, String name, String separator) {
        Pattern pattern = Pattern.compile(Pattern.quote(separator));
        List<String> tokens = new ArrayList<>();
        for (String value : values(request, name)) {
            for (String token : pattern.split(value)) {
                if (!token.isEmpty()) {
                    tokens.add(token);
                }
            }
        }
        return tokens;
    }

    /**
     * Case-insensitive enumerated parameter. An absent or empty parameter
     * yields the default.
     *
     * @throws RequestException if the value is not one of the enum constants
     */
    public static <E extends Enum<E>> E validatedParameter(HttpServletRequest request, String name,
                                                           Class<E> type, E defaultValue) {
        String value = request.getParameter(name);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }

        String normalized = value.toLowerCase(Locale.ROOT);
        for (E constant : type.getEnumConstants()) {
            if (parameterValue(constant).equals(normalized)) {
                return constant;
            }
        }

        String allowed = Arrays.stream(type.getEnumConstants())
                .map(RequestParameters::parameterValue)
                .collect(Collectors.joining(", "));
        throw new RequestException("Parameter '" + name + "' should be one of: " + allowed);
    }

    public static String parameterValue(Enum<?> constant) {
        return constant.name().toLowerCase(Locale.ROOT);
    }

    /**
     * Boolean-ish literal: {@code true}, {@code yes}, {@code 1} and {@code on}
     * are true, anything else is false.
     */
    public static boolean toBoolean(String value) {
        return value != null && TRUE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
    }
}
