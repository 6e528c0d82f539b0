package utilities;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

// Immutable configuration for one command-line search run.
public final class SearchConfiguration {

    private final Path dataFile;
    private final List<String> patterns;
    private final Path patternsFile;
    private final SearchMode mode;
    private final int offset;
    private final Path csvFile;

    private SearchConfiguration(Builder builder) {
        this.dataFile = builder.dataFile;
        this.patterns = List.copyOf(builder.patterns);
        this.patternsFile = builder.patternsFile;
        this.mode = builder.mode;
        this.offset = builder.offset;
        this.csvFile = builder.csvFile;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    private void validate() {
        if (dataFile == null) {
            throw new IllegalArgumentException("a data file is required");
        }
        if (mode == null) {
            throw new IllegalArgumentException("a search mode is required");
        }
        if (patterns.isEmpty() && patternsFile == null) {
            throw new IllegalArgumentException("at least one pattern or a patterns file is required");
        }
        for (String p : patterns) {
            if (p.isEmpty()) {
                throw new IllegalArgumentException("patterns must not be empty");
            }
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative");
        }
        if (!mode.multiPattern() && patternsFile == null && patterns.size() != 1) {
            throw new IllegalArgumentException("mode " + mode.cliToken() + " takes exactly one pattern");
        }
    }

    public Path dataFile() { return dataFile; }
    // Patterns given inline; those from patternsFile are loaded at run time and appended.
    public List<String> patterns() { return patterns; }
    public Path patternsFile() { return patternsFile; }
    public SearchMode mode() { return mode; }
    public int offset() { return offset; }
    public Path csvFile() { return csvFile; }

    public static final class Builder {
        private Path dataFile;
        private final List<String> patterns = new ArrayList<>();
        private Path patternsFile;
        private SearchMode mode = SearchMode.EVERY;
        private int offset = 0;
        private Path csvFile;

        private Builder() {}

        public Builder dataFile(Path dataFile) {
            this.dataFile = dataFile;
            return this;
        }

        public Builder pattern(String pattern) {
            this.patterns.add(Objects.requireNonNull(pattern, "pattern"));
            return this;
        }

        public Builder patterns(List<String> patterns) {
            for (String p : patterns) {
                pattern(p);
            }
            return this;
        }

        public Builder patternsFile(Path patternsFile) {
            this.patternsFile = patternsFile;
            return this;
        }

        public Builder mode(SearchMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder csvFile(Path csvFile) {
            this.csvFile = csvFile;
            return this;
        }

        public SearchConfiguration build() {
            return new SearchConfiguration(this);
        }
    }
}
