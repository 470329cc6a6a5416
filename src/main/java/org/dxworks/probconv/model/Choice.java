package org.dxworks.probconv.model;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One option of a {@link MultipleChoice} or {@link MultipleSelect}.
 */
public final class Choice extends InternalNode {

    private final boolean correct;

    public Choice(boolean correct, Node... children) {
        this(correct, Arrays.asList(children));
    }

    public Choice(boolean correct, List<? extends Node> children) {
        super(children);
        this.correct = correct;
    }

    public boolean isCorrect() {
        return correct;
    }

    @Override
    public NodeType getType() {
        return NodeType.CHOICE;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("correct", correct);
        return attributes;
    }

    @Override
    public Choice withChildren(List<? extends Node> children) {
        return new Choice(correct, children);
    }
}
