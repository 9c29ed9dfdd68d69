package com.location.resolution.lookup;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compresses the postal codes of a region into a short display list.
 */
final class PostalCodeRanges {

    static final int TRUNCATE_ABOVE = 10;
    static final int TRUNCATED_PREFIX = 5;

    private PostalCodeRanges() {
    }

    /**
     * Summarizes codes: more than ten become the first five plus {@code "+N more"},
     * anything else is listed in full. Input order is kept; callers pass sorted codes.
     */
    static List<String> summarize(List<String> sortedCodes) {
        List<String> codes = sortedCodes.stream()
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        if (codes.size() <= TRUNCATE_ABOVE) {
            return codes;
        }
        List<String> summary = new ArrayList<>(codes.subList(0, TRUNCATED_PREFIX));
        summary.add("+" + (codes.size() - TRUNCATED_PREFIX) + " more");
        return summary;
    }
}
