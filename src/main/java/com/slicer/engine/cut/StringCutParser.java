package com.slicer.engine.cut;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default cut string grammar.
 *
 * <pre>
 * cuts     := cut ( '|' cut )*
 * cut      := [ '!' ] dimension [ '@' hierarchy ] ':' spec
 * spec     := path ( ';' path )+      set cut
 *           | [ path ] '-' [ path ]   range cut
 *           | path                    point cut
 * path     := key ( ',' key )*
 * </pre>
 *
 * A backslash escapes the following character, so keys may contain any of
 * the separators.
 */
public class StringCutParser implements CutParser {

    private static final char ESCAPE = '\\';
    private static final char CUT_SEPARATOR = '|';
    private static final char SET_SEPARATOR = ';';
    private static final char RANGE_SEPARATOR = '-';
    private static final char PATH_SEPARATOR = ',';
    private static final char DIMENSION_SEPARATOR = ':';

    private static final Pattern CUT_PATTERN =
            Pattern.compile("^(?<invert>!)?(?<dim>\\w+)(@(?<hier>\\w+))?:(?<spec>.*)$", Pattern.DOTALL);

    @Override
    public List<Cut> parse(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }

        List<Cut> cuts = new ArrayList<>();
        for (String cutString : splitUnescaped(text, CUT_SEPARATOR)) {
            cuts.add(parseCut(cutString));
        }
        return cuts;
    }

    private Cut parseCut(String cutString) {
        Matcher matcher = CUT_PATTERN.matcher(cutString);
        if (!matcher.matches()) {
            throw new CutParseException("Unknown cut format '" + cutString + "'");
        }

        boolean invert = matcher.group("invert") != null;
        String dimension = matcher.group("dim");
        String hierarchy = matcher.group("hier");
        String spec = matcher.group("spec");

        if (indexOfUnescaped(spec, DIMENSION_SEPARATOR) >= 0) {
            throw new CutParseException("Unknown cut format '" + cutString + "'");
        }

        if (indexOfUnescaped(spec, SET_SEPARATOR) >= 0) {
            List<List<String>> paths = new ArrayList<>();
            for (String pathString : splitUnescaped(spec, SET_SEPARATOR)) {
                paths.add(parsePath(pathString, cutString));
            }
            return new SetCut(dimension, hierarchy, paths, invert);
        }

        int rangeAt = indexOfUnescaped(spec, RANGE_SEPARATOR);
        if (rangeAt >= 0) {
            String fromString = spec.substring(0, rangeAt);
            String toString = spec.substring(rangeAt + 1);
            if (indexOfUnescaped(toString, RANGE_SEPARATOR) >= 0) {
                throw new CutParseException("Invalid range in cut '" + cutString + "'");
            }
            List<String> from = fromString.isEmpty() ? null : parsePath(fromString, cutString);
            List<String> to = toString.isEmpty() ? null : parsePath(toString, cutString);
            return new RangeCut(dimension, hierarchy, from, to, invert);
        }

        return new PointCut(dimension, hierarchy, parsePath(spec, cutString), invert);
    }

    private List<String> parsePath(String pathString, String cutString) {
        if (pathString.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> path = new ArrayList<>();
        for (String key : splitUnescaped(pathString, PATH_SEPARATOR)) {
            path.add(unescape(key, cutString));
        }
        return path;
    }

    /**
     * Split on separators that are not escaped. Escape sequences are kept so
     * that nested separators can be split later.
     */
    static List<String> splitUnescaped(String text, char separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ESCAPE && i + 1 < text.length()) {
                current.append(c).append(text.charAt(++i));
            } else if (c == separator) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    static int indexOfUnescaped(String text, char separator) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ESCAPE) {
                i++;
            } else if (c == separator) {
                return i;
            }
        }
        return -1;
    }

    private static String unescape(String key, String cutString) {
        StringBuilder result = new StringBuilder(key.length());
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == ESCAPE) {
                if (i + 1 == key.length()) {
                    throw new CutParseException("Dangling escape character in cut '" + cutString + "'");
                }
                result.append(key.charAt(++i));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }
}
