package com.msst.core.discovery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Immutable table of test groups and their inclusive ID ranges, in declaration order.
 * Ranges never overlap.
 */
public final class TestGroups {

    /**
     * @param name  group name, also the namespace its units live in
     * @param start first ID (inclusive)
     * @param end   last ID (inclusive)
     */
    public record Range(String name, int start, int end) {
        public Range {
            if (start > end) {
                throw new IllegalArgumentException(
                        "Group " + name + ": range start " + start + " is after end " + end);
            }
        }

        public boolean contains(int id) {
            return start <= id && id <= end;
        }

        boolean overlaps(Range other) {
            return start <= other.end && other.start <= end;
        }
    }

    private final List<Range> ranges;

    private TestGroups(List<Range> ranges) {
        for (int i = 0; i < ranges.size(); i++) {
            for (int j = i + 1; j < ranges.size(); j++) {
                Range a = ranges.get(i);
                Range b = ranges.get(j);
                if (a.name().equals(b.name())) {
                    throw new IllegalArgumentException("Duplicate group " + a.name());
                }
                if (a.overlaps(b)) {
                    throw new IllegalArgumentException(String.format(Locale.ROOT,
                            "Group ranges overlap: %s [%d,%d] and %s [%d,%d]",
                            a.name(), a.start(), a.end(), b.name(), b.start(), b.end()));
                }
            }
        }
        this.ranges = Collections.unmodifiableList(new ArrayList<>(ranges));
    }

    public static TestGroups of(List<Range> ranges) {
        return new TestGroups(ranges);
    }

    /** The table shipped with the harness. */
    public static TestGroups defaults() {
        return of(List.of(
                new Range("basic", 1, 99),
                new Range("multipart", 100, 199),
                new Range("versioning", 200, 299),
                new Range("acl", 300, 399),
                new Range("encryption", 400, 499),
                new Range("lifecycle", 500, 599),
                new Range("performance", 600, 699),
                new Range("stress", 700, 799),
                new Range("compatibility", 800, 899)
        ));
    }

    public List<Range> ranges() {
        return ranges;
    }

    public List<String> names() {
        return ranges.stream().map(Range::name).toList();
    }

    public Optional<Range> groupOf(int id) {
        return ranges.stream().filter(r -> r.contains(id)).findFirst();
    }
}
