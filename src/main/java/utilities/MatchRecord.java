package utilities;

import java.util.List;

// One reported hit: which pattern matched, where, and the matched text.
public record MatchRecord(int patternIdx, String pattern, int start, int end, String text) {

    public static final List<String> CSV_HEADER = List.of("pattern", "start", "end", "text");

    public List<Object> toCsvRow() {
        return List.of(pattern, start, end, text);
    }
}
