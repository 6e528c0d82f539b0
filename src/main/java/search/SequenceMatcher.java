package search;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.RandomAccess;

/**
 * {@link PatternMatcher} over a list of elements compared with {@link Objects#equals}.
 * Scans candidate starts left to right and compares one pattern-sized window per start.
 * A {@link RandomAccess} list is searched in place and must not change while a search runs;
 * any other list (e.g. a LinkedList) is copied once here so each element read stays O(1).
 */
public final class SequenceMatcher<T> implements PatternMatcher<List<T>, List<? extends T>> {

    private final List<T> source;

    public SequenceMatcher(List<T> source) {
        Objects.requireNonNull(source, "source");
        this.source = source instanceof RandomAccess ? source : new ArrayList<>(source);
    }

    public static <T> SequenceMatcher<T> of(List<T> source) {
        return new SequenceMatcher<>(source);
    }

    // Converts an array into the pattern shape this matcher searches for.
    @SafeVarargs
    public static <T> List<T> pattern(T... elements) {
        return Arrays.asList(elements);
    }

    @Override
    public Optional<PatternMatch<List<T>>> findFirstFrom(List<? extends T> pattern, int offset) {
        Objects.requireNonNull(pattern, "pattern");
        final int m = pattern.size();
        if (m == 0) {
            throw new IllegalArgumentException("pattern must not be empty");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative");
        }
        if (!(pattern instanceof RandomAccess)) {
            pattern = new ArrayList<>(pattern);
        }
        final int n = source.size();
        for (int start = offset; start < n; start++) {
            // remaining source shorter than the pattern, no match possible
            if (start + m > n) {
                return Optional.empty();
            }
            if (matchesAt(pattern, start)) {
                return Optional.of(new PatternMatch<>(start, m, Collections.unmodifiableList(new ArrayList<>(source.subList(start, start + m)))));
            }
        }
        return Optional.empty();
    }

    private boolean matchesAt(List<? extends T> pattern, int start) {
        for (int i = 0; i < pattern.size(); i++) {
            if (!Objects.equals(source.get(start + i), pattern.get(i))) {
                return false;
            }
        }
        return true;
    }
}
