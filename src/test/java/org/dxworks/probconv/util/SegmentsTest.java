package org.dxworks.probconv.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SegmentsTest {

    @Test
    void startsNewSegmentAtEveryMatch() {
        List<Object> items = List.of("x", 1, 2, "a", 3);

        List<List<Object>> segments = Segments.segment(items, item -> item instanceof String);

        assertEquals(List.of(List.of("x", 1, 2), List.of("a", 3)), segments);
    }

    @Test
    void leadingNonMatchesFormTheirOwnSegment() {
        List<List<Integer>> segments = Segments.segment(List.of(1, 2, 10, 3), i -> i >= 10);

        assertEquals(List.of(List.of(1, 2), List.of(10, 3)), segments);
    }

    @Test
    void adjacentMatchesGiveSeparateSegments() {
        List<List<String>> segments = Segments.segment(List.of("a", "b"), s -> true);

        assertEquals(List.of(List.of("a"), List.of("b")), segments);
    }

    @Test
    void emptyInputGivesNoSegments() {
        assertTrue(Segments.segment(List.<String>of(), s -> true).isEmpty());
    }
}
