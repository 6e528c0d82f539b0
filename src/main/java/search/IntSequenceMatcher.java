package search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Objects;
import java.util.Optional;

/**
 * Window-scan {@link PatternMatcher} over a primitive int stream, e.g. token ids produced by
 * a tokenizer. Same semantics as {@link SequenceMatcher} without boxing.
 */
public final class IntSequenceMatcher implements PatternMatcher<IntList, IntList> {

    private final IntList source;

    public IntSequenceMatcher(IntList source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public IntSequenceMatcher(int[] source) {
        this(IntArrayList.wrap(Objects.requireNonNull(source, "source")));
    }

    public static IntList pattern(int... tokens) {
        return IntArrayList.wrap(tokens);
    }

    @Override
    public Optional<PatternMatch<IntList>> findFirstFrom(IntList pattern, int offset) {
        Objects.requireNonNull(pattern, "pattern");
        final int m = pattern.size();
        if (m == 0) {
            throw new IllegalArgumentException("pattern must not be empty");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative");
        }
        final int n = source.size();
        final int lastStart = n - m;
        for (int start = offset; start <= lastStart; start++) {
            int i = 0;
            while (i < m && source.getInt(start + i) == pattern.getInt(i)) {
                i++;
            }
            if (i == m) {
                IntList window = IntLists.unmodifiable(new IntArrayList(source.subList(start, start + m)));
                return Optional.of(new PatternMatch<>(start, m, window));
            }
        }
        return Optional.empty();
    }
}
