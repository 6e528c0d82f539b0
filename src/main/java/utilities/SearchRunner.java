package utilities;

import errors.ErrorChain;
import errors.ErrorPropagation;
import org.apache.commons.math3.util.Pair;
import search.PatternMatch;
import search.TextMatcher;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Executes a {@link SearchConfiguration}: loads the data file, runs the configured mode through a
 * {@link TextMatcher} and reports every hit as a {@link MatchRecord}.
 */
public class SearchRunner {

    private static final CsvUtil.Config TSV = CsvUtil.Config.defaults().withDelimiter('\t');

    private final DatasetReader reader;

    public SearchRunner() {
        this(new DatasetReader());
    }

    public SearchRunner(DatasetReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    public List<MatchRecord> run(SearchConfiguration config) throws ErrorChain {
        String text = reader.readText(config.dataFile());
        SearchLogger.trace("Searching " + config.dataFile() + " in mode " + config.mode().cliToken());
        List<String> patterns = resolvePatterns(config);
        SearchMode mode = config.mode();

        TextMatcher matcher = new TextMatcher(text);
        long startNs = System.nanoTime();
        List<MatchRecord> records = new ArrayList<>();
        switch (mode) {
            case FIRST -> matcher.findFirstFrom(patterns.get(0), config.offset())
                    .ifPresent(m -> records.add(toRecord(0, patterns, m)));
            case EVERY -> {
                for (PatternMatch<String> m : matcher.findEveryFrom(patterns.get(0), config.offset())) {
                    records.add(toRecord(0, patterns, m));
                }
            }
            case ANY -> {
                Optional<Pair<Integer, PatternMatch<String>>> hit = matcher.findAnyIndexedFrom(patterns, config.offset());
                hit.ifPresent(p -> records.add(toRecord(p.getKey(), patterns, p.getValue())));
            }
            case ALL -> {
                for (Pair<Integer, PatternMatch<String>> p : matcher.findAllIndexedFrom(patterns, config.offset())) {
                    records.add(toRecord(p.getKey(), patterns, p.getValue()));
                }
            }
        }
        double elapsedMs = (System.nanoTime() - startNs) / 1_000_000.0;
        SearchLogger.info(String.format(Locale.ROOT, "%s search, %d pattern(s) over %d chars from offset %d: %d match(es) in %.3f ms",
                mode.cliToken(), patterns.size(), text.length(), config.offset(), records.size(), elapsedMs));
        return records;
    }

    private List<String> resolvePatterns(SearchConfiguration config) throws ErrorChain {
        List<String> patterns = new ArrayList<>(config.patterns());
        if (config.patternsFile() != null) {
            patterns.addAll(reader.readPatterns(config.patternsFile()));
        }
        if (patterns.isEmpty()) {
            throw new ErrorChain("No patterns to search for");
        }
        if (!config.mode().multiPattern() && patterns.size() != 1) {
            throw new ErrorChain("Mode " + config.mode().cliToken() + " takes exactly one pattern, got " + patterns.size());
        }
        return patterns;
    }

    private static MatchRecord toRecord(int patternIdx, List<String> patterns, PatternMatch<String> m) {
        return new MatchRecord(patternIdx, patterns.get(patternIdx), m.start(), m.end(), m.view());
    }

    public static String toTsvLine(MatchRecord record) {
        return CsvUtil.toCsvLine(record.toCsvRow(), TSV);
    }

    public static void writeCsv(List<MatchRecord> records, Path csvFile) throws ErrorChain {
        List<List<?>> rows = new ArrayList<>(records.size());
        for (MatchRecord r : records) {
            rows.add(r.toCsvRow());
        }
        ErrorPropagation.doOnError(() -> {
            CsvUtil.writeTable(csvFile, MatchRecord.CSV_HEADER, rows, CsvUtil.Config.defaults());
            return csvFile;
        }, () -> "Failed to write CSV report " + csvFile);
        SearchLogger.info("Wrote " + records.size() + " match(es) to " + csvFile);
    }
}
