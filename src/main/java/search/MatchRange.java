package search;

// Half-open interval [startPos, endPos) over a source's native indexing unit.
public record MatchRange(int startPos, int endPos) {

    public MatchRange {
        if (startPos < 0 || endPos < startPos) {
            throw new IllegalArgumentException("invalid range [" + startPos + ", " + endPos + ")");
        }
    }

    public int length() { return endPos - startPos; }

    public boolean contains(int pos) { return pos >= startPos && pos < endPos; }
}
