package org.dxworks.probconv.model;

import java.util.Arrays;
import java.util.List;

/**
 * Transient run of inline content whose paragraph grouping is still undecided.
 * <p>
 * Parsers emit blobs (possibly interspersed with {@link ParBreak} markers) wherever their
 * source syntax does not say where paragraphs start and end; the paragraph reconstructor
 * removes them. A canonical tree never contains a blob.
 */
public final class Blob extends InternalNode {

    public Blob(Node... children) {
        this(Arrays.asList(children));
    }

    public Blob(List<? extends Node> children) {
        super(children);
    }

    @Override
    public NodeType getType() {
        return NodeType.BLOB;
    }

    @Override
    public Blob withChildren(List<? extends Node> children) {
        return new Blob(children);
    }
}
