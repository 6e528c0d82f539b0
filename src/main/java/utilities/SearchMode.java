package utilities;

import java.util.EnumSet;

public enum SearchMode {
    FIRST("first"),
    EVERY("every"),
    ANY("any"),
    ALL("all");

    private final String cliToken;

    SearchMode(String token) { this.cliToken = token; }

    public String cliToken() { return cliToken; }

    // FIRST and EVERY take exactly one pattern.
    public boolean multiPattern() { return this == ANY || this == ALL; }

    public static SearchMode fromString(String value) {
        return EnumSet.allOf(SearchMode.class).stream()
                .filter(mode -> mode.cliToken.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown search mode: " + value));
    }
}
