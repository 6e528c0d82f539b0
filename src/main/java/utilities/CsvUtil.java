package utilities;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

public class CsvUtil {
    private CsvUtil() {}

    // Formatting for match reports: CSV files, or tab separated lines with withDelimiter('\t').
    public static final class Config {
        private final char delimiter;
        private final char quote;
        private final String lineSeparator;
        private final Charset charset;

        private Config(char delimiter, char quote, String lineSeparator, Charset charset) {
            this.delimiter = delimiter;
            this.quote = quote;
            this.lineSeparator = Objects.requireNonNull(lineSeparator, "lineSeparator");
            this.charset = Objects.requireNonNull(charset, "charset");
        }

        // comma, double quote, platform line separator, UTF-8.
        public static Config defaults() {
            return new Config(',', '"', System.lineSeparator(), StandardCharsets.UTF_8);
        }

        public Config withDelimiter(char delimiter) { return new Config(delimiter, quote, lineSeparator, charset); }
        public Config withLineSeparator(String ls)  { return new Config(delimiter, quote, ls, charset); }
    }

    // Write a header row followed by data rows to a file, replacing it if present.
    public static void writeTable(Path file, List<?> header, List<? extends List<?>> rows, Config config) throws IOException {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(rows, "rows");
        try (BufferedWriter bw = Files.newBufferedWriter(file, config.charset)) {
            writeLine(bw, header, config);
            for (List<?> row : rows) {
                writeLine(bw, row, config);
            }
        }
    }

    public static String toCsvLine(List<?> row) {
        return toCsvLine(row, Config.defaults());
    }

    public static String toCsvLine(List<?> row, Config config) {
        Objects.requireNonNull(row, "row");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < row.size(); i++) {
            if (i > 0) sb.append(config.delimiter);
            sb.append(quoteIfNeeded(row.get(i) == null ? "" : String.valueOf(row.get(i)), config));
        }
        return sb.toString();
    }

    private static void writeLine(Writer writer, List<?> row, Config config) throws IOException {
        writer.write(toCsvLine(row, config));
        writer.write(config.lineSeparator);
    }

    // Quote fields holding the delimiter, the quote char or a line break; inner quotes are doubled.
    private static String quoteIfNeeded(String field, Config config) {
        boolean needsQuotes = field.indexOf(config.delimiter) >= 0
                || field.indexOf(config.quote) >= 0
                || field.indexOf('\n') >= 0 || field.indexOf('\r') >= 0;
        if (!needsQuotes) {
            return field;
        }
        String q = String.valueOf(config.quote);
        return q + field.replace(q, q + q) + q;
    }
}
