package org.dxworks.probconv.parser;

import org.dxworks.probconv.model.Problem;

/**
 * Parses one source format into a canonical problem tree.
 */
public interface ProblemParser {

    /**
     * @throws org.dxworks.probconv.exception.ParseException if the source is malformed or uses
     *                                                       a construct the format does not support
     */
    Problem parse(String source);
}
