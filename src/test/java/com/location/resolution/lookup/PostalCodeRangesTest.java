package com.location.resolution.lookup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PostalCodeRangesTest {

    private static List<String> codes(int count) {
        return IntStream.range(0, count).mapToObj(i -> String.valueOf(10000 + i)).toList();
    }

    @Test
    @DisplayName("Up to three codes are listed in full")
    void small() {
        assertEquals(List.of("10000", "10001", "10002"), PostalCodeRanges.summarize(codes(3)));
    }

    @Test
    @DisplayName("Four to ten codes are listed in full")
    void medium() {
        assertEquals(codes(4), PostalCodeRanges.summarize(codes(4)));
        assertEquals(codes(10), PostalCodeRanges.summarize(codes(10)));
    }

    @Test
    @DisplayName("More than ten codes become the first five plus a remainder count")
    void large() {
        List<String> summary = PostalCodeRanges.summarize(codes(11));
        assertEquals(6, summary.size());
        assertEquals("10004", summary.get(4));
        assertEquals("+6 more", summary.get(5));
    }

    @Test
    @DisplayName("Duplicates and nulls are dropped before counting")
    void duplicates() {
        assertEquals(List.of("1", "2"), PostalCodeRanges.summarize(Arrays.asList("1", null, "1", "2")));
    }
}
