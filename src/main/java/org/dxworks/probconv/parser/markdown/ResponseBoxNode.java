package org.dxworks.probconv.parser.markdown;

import org.commonmark.node.CustomNode;

/**
 * A {@code [____](answer)} box; children are the answer's inline nodes.
 */
public class ResponseBoxNode extends CustomNode {
}
