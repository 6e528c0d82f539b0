package search;

/**
 * One occurrence of a pattern inside a source.
 *
 * <p>{@code view} holds its own immutable copy of the matched elements, so a match stays
 * readable after the source it came from is mutated or dropped.</p>
 *
 * @param index  position of the first matched unit in the source
 * @param length number of matched units
 * @param view   the matched data
 * @param <V>    view type, same shape as the source (String, List, IntList)
 */
public record PatternMatch<V>(int index, int length, V view) {

    public PatternMatch {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative");
        }
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative");
        }
    }

    public int start() { return index; }

    public int end() { return index + length; }

    public MatchRange range() { return new MatchRange(index, index + length); }
}
