package org.dxworks.probconv.parser.markdown;

import org.commonmark.node.CustomBlock;

/**
 * Consecutive choice lines. Children are {@link ChoiceItem}s.
 */
public class ChoiceListBlock extends CustomBlock {

    private final boolean select;

    public ChoiceListBlock(boolean select) {
        this.select = select;
    }

    /** True for {@code [ ]} lines, which allow several correct answers. */
    public boolean isSelect() {
        return select;
    }
}
