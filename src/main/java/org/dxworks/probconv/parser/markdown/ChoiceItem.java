package org.dxworks.probconv.parser.markdown;

import org.commonmark.node.CustomBlock;

public class ChoiceItem extends CustomBlock {

    private final boolean correct;

    public ChoiceItem(boolean correct) {
        this.correct = correct;
    }

    public boolean isCorrect() {
        return correct;
    }
}
