package utilities;

import errors.ErrorChain;
import errors.ErrorPropagation;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

// Loads the text to search and the pattern files (one pattern per line) the CLI works with.
public class DatasetReader {

    private final Charset charset;

    public DatasetReader() {
        this(StandardCharsets.UTF_8);
    }

    public DatasetReader(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    public String readText(Path dataFile) throws ErrorChain {
        Objects.requireNonNull(dataFile, "dataFile");
        String text = ErrorPropagation.doOnError(() -> Files.readString(dataFile, charset),
                () -> "Failed to read data file " + dataFile);
        SearchLogger.debug("Loaded " + text.length() + " chars from " + dataFile);
        return text;
    }

    //Blank lines are skipped, every other line is taken verbatim as a pattern.
    public List<String> readPatterns(Path patternsFile) throws ErrorChain {
        Objects.requireNonNull(patternsFile, "patternsFile");
        List<String> lines = ErrorPropagation.doOnError(() -> Files.readAllLines(patternsFile, charset),
                () -> "Failed to read patterns file " + patternsFile);
        List<String> patterns = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (!line.isEmpty()) {
                patterns.add(line);
            }
        }
        SearchLogger.debug("Loaded " + patterns.size() + " patterns from " + patternsFile);
        return patterns;
    }
}
