package org.dxworks.probconv.parser.markdown;

import org.commonmark.node.CustomBlock;

/**
 * Consecutive {@code [[...]]} lines; each line contributes its own blocks.
 */
public class SolutionBlock extends CustomBlock {
}
