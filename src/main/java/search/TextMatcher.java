package search;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link PatternMatcher} over text. Offsets and lengths are UTF-16 code units; an offset that
 * splits a surrogate pair is not validated and gives whatever {@link String#indexOf} gives.
 */
public final class TextMatcher implements PatternMatcher<String, CharSequence> {

    private final String source;

    public TextMatcher(CharSequence source) {
        this.source = Objects.requireNonNull(source, "source").toString();
    }

    @Override
    public Optional<PatternMatch<String>> findFirstFrom(CharSequence pattern, int offset) {
        String needle = Objects.requireNonNull(pattern, "pattern").toString();
        if (needle.isEmpty()) {
            throw new IllegalArgumentException("pattern must not be empty");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative");
        }
        if (offset > source.length()) {
            return Optional.empty();
        }
        int idx = source.indexOf(needle, offset);
        if (idx < 0) {
            return Optional.empty();
        }
        return Optional.of(new PatternMatch<>(idx, needle.length(), source.substring(idx, idx + needle.length())));
    }
}
