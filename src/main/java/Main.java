import errors.ErrorChain;
import utilities.MatchRecord;
import utilities.SearchConfiguration;
import utilities.SearchLogger;
import utilities.SearchMode;
import utilities.SearchRunner;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line driver: searches a text file for one or more literal patterns and prints each
 * hit as {@code pattern<TAB>start<TAB>end<TAB>text}, or writes them to a CSV file.
 *
 * <pre>
 *   --data FILE       text to search (required)
 *   --pattern TEXT    pattern, repeatable
 *   --patterns FILE   one pattern per line
 *   --mode MODE       first | every | any | all (default every)
 *   --offset N        start searching at this UTF-16 offset (default 0)
 *   --csv FILE        write matches to FILE instead of stdout
 * </pre>
 */
public final class Main {

    public static void main(String[] args) {
        int status;
        try {
            status = run(CliOptions.parse(args).toConfiguration());
        } catch (IllegalArgumentException e) {
            SearchLogger.error("Invalid arguments: " + e.getMessage());
            status = 2;
        }
        System.exit(status);
    }

    static int run(SearchConfiguration config) {
        try {
            List<MatchRecord> records = new SearchRunner().run(config);
            if (config.csvFile() != null) {
                SearchRunner.writeCsv(records, config.csvFile());
            } else {
                for (MatchRecord r : records) {
                    System.out.println(SearchRunner.toTsvLine(r));
                }
            }
            if (records.isEmpty()) {
                SearchLogger.warning("No matches in " + config.dataFile());
                return 1;
            }
            return 0;
        } catch (ErrorChain e) {
            SearchLogger.error(e.render());
            return 3;
        }
    }

    static final class CliOptions {
        final SearchConfiguration.Builder builder = SearchConfiguration.builder();

        private CliOptions() {}

        static CliOptions parse(String[] args) {
            CliOptions options = new CliOptions();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unexpected argument " + arg);
                }
                String key;
                String value;
                int eq = arg.indexOf('=');
                if (eq >= 0) {
                    key = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else {
                    key = arg.substring(2);
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Missing value for option --" + key);
                    }
                    value = args[++i];
                }
                switch (key) {
                    case "data" -> options.builder.dataFile(Path.of(value));
                    case "pattern" -> options.builder.pattern(value);
                    case "patterns" -> options.builder.patternsFile(Path.of(value));
                    case "mode" -> options.builder.mode(SearchMode.fromString(value));
                    case "offset" -> options.builder.offset(Integer.parseInt(value));
                    case "csv" -> options.builder.csvFile(Path.of(value));
                    default -> throw new IllegalArgumentException("Unknown option --" + key);
                }
            }
            return options;
        }

        SearchConfiguration toConfiguration() {
            return builder.build();
        }
    }
}
