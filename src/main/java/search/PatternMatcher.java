package search;

import org.apache.commons.math3.util.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Search capability over one source sequence.
 *
 * <p>Implementations provide {@link #findFirstFrom}; every other operation is derived from it.
 * Offsets are in the source's native unit (UTF-16 code units for text, elements otherwise).
 * Matches returned by the multi-match operations never overlap: after a hit the cursor moves
 * to {@link PatternMatch#end()}.</p>
 *
 * @param <V> view type carried by each match
 * @param <P> pattern type
 */
public interface PatternMatcher<V, P> {

    /**
     * Earliest occurrence of {@code pattern} starting at or after {@code offset}.
     * Empty when {@code offset} is past the end of the source or nothing matches.
     *
     * @throws IllegalArgumentException if {@code offset} is negative or the pattern is empty
     */
    Optional<PatternMatch<V>> findFirstFrom(P pattern, int offset);

    default Optional<PatternMatch<V>> findFirst(P pattern) {
        return findFirstFrom(pattern, 0);
    }

    /**
     * All non-overlapping occurrences from {@code offset}, in ascending position.
     * Returns an empty list when there are none.
     */
    default List<PatternMatch<V>> findEveryFrom(P pattern, int offset) {
        List<PatternMatch<V>> matches = new ArrayList<>();
        int cursor = offset;
        Optional<PatternMatch<V>> found = findFirstFrom(pattern, cursor);
        while (found.isPresent()) {
            PatternMatch<V> match = found.get();
            matches.add(match);
            cursor = match.end();
            found = findFirstFrom(pattern, cursor);
        }
        return Collections.unmodifiableList(matches);
    }

    default List<PatternMatch<V>> findEvery(P pattern) {
        return findEveryFrom(pattern, 0);
    }

    default int count(P pattern) {
        return findEvery(pattern).size();
    }

    /**
     * Earliest match among {@code patterns}, paired with the position of the pattern in the
     * iteration order that produced it. On equal start index the earlier pattern wins.
     */
    default Optional<Pair<Integer, PatternMatch<V>>> findAnyIndexedFrom(Iterable<? extends P> patterns, int offset) {
        Objects.requireNonNull(patterns, "patterns");
        Pair<Integer, PatternMatch<V>> earliest = null;
        int patternIdx = 0;
        for (P pattern : patterns) {
            Optional<PatternMatch<V>> found = findFirstFrom(Objects.requireNonNull(pattern, "pattern"), offset);
            // strict comparison keeps the first-seen pattern on ties
            if (found.isPresent() && (earliest == null || found.get().index() < earliest.getValue().index())) {
                earliest = new Pair<>(patternIdx, found.get());
            }
            patternIdx++;
        }
        return Optional.ofNullable(earliest);
    }

    default Optional<Pair<Integer, PatternMatch<V>>> findAnyIndexed(Iterable<? extends P> patterns) {
        return findAnyIndexedFrom(patterns, 0);
    }

    default Optional<PatternMatch<V>> findAnyFrom(Iterable<? extends P> patterns, int offset) {
        return findAnyIndexedFrom(patterns, offset).map(Pair::getValue);
    }

    default Optional<PatternMatch<V>> findAny(Iterable<? extends P> patterns) {
        return findAnyFrom(patterns, 0);
    }

    /**
     * {@link #findEveryFrom} for each pattern, concatenated in pattern order. The result is
     * grouped by pattern and is not sorted by position across groups.
     */
    default List<Pair<Integer, PatternMatch<V>>> findAllIndexedFrom(Iterable<? extends P> patterns, int offset) {
        Objects.requireNonNull(patterns, "patterns");
        List<Pair<Integer, PatternMatch<V>>> matches = new ArrayList<>();
        int patternIdx = 0;
        for (P pattern : patterns) {
            for (PatternMatch<V> match : findEveryFrom(Objects.requireNonNull(pattern, "pattern"), offset)) {
                matches.add(new Pair<>(patternIdx, match));
            }
            patternIdx++;
        }
        return Collections.unmodifiableList(matches);
    }

    default List<Pair<Integer, PatternMatch<V>>> findAllIndexed(Iterable<? extends P> patterns) {
        return findAllIndexedFrom(patterns, 0);
    }

    default List<PatternMatch<V>> findAllFrom(Iterable<? extends P> patterns, int offset) {
        List<PatternMatch<V>> matches = new ArrayList<>();
        for (Pair<Integer, PatternMatch<V>> indexed : findAllIndexedFrom(patterns, offset)) {
            matches.add(indexed.getValue());
        }
        return Collections.unmodifiableList(matches);
    }

    default List<PatternMatch<V>> findAll(Iterable<? extends P> patterns) {
        return findAllFrom(patterns, 0);
    }
}
