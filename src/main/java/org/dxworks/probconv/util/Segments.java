package org.dxworks.probconv.util;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

public final class Segments {

    private Segments() {
        // utility class
    }

    /**
     * Splits {@code items} into consecutive segments, starting a new segment at every item
     * matching {@code isStart}. Items before the first match form a leading segment of their
     * own. Two adjacent matches give two segments; no segment is ever empty.
     * <p>
     * {@code segment([x, 1, 2, a, 3], isString)} gives {@code [[x, 1, 2], [a, 3]]}.
     */
    public static <T> List<List<T>> segment(List<? extends T> items, Predicate<? super T> isStart) {
        List<List<T>> segments = new ArrayList<>();
        List<T> current = null;
        for (T item : items) {
            if (current == null || isStart.test(item)) {
                current = new ArrayList<>();
                segments.add(current);
            }
            current.add(item);
        }
        return segments;
    }
}
