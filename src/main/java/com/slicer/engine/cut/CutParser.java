package com.slicer.engine.cut;

import java.util.List;

/**
 * Parses the compact textual encoding of cuts used in query strings.
 */
@FunctionalInterface
public interface CutParser {

    /**
     * @param text cut string, possibly encoding several cuts
     * @return cuts in the order they appear, empty for a null or empty string
     * @throws CutParseException if the text is not a valid cut string
     */
    List<Cut> parse(String text);
}
