import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import utilities.SearchConfiguration;
import utilities.SearchMode;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MainTest {

    @Test
    void parses_both_option_forms() {
        SearchConfiguration config = Main.CliOptions.parse(new String[]{
                "--data", "corpus.txt", "--pattern=ab", "--mode", "any", "--pattern", "cd", "--offset=4", "--csv", "out.csv"
        }).toConfiguration();

        assertThat(config.dataFile()).isEqualTo(Path.of("corpus.txt"));
        assertThat(config.patterns()).containsExactly("ab", "cd");
        assertThat(config.mode()).isEqualTo(SearchMode.ANY);
        assertThat(config.offset()).isEqualTo(4);
        assertThat(config.csvFile()).isEqualTo(Path.of("out.csv"));
    }

    @Test
    void bad_arguments_are_rejected() {
        assertThatThrownBy(() -> Main.CliOptions.parse(new String[]{"--bogus", "1"}))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--bogus");
        assertThatThrownBy(() -> Main.CliOptions.parse(new String[]{"--data"}))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Missing value");
        assertThatThrownBy(() -> Main.CliOptions.parse(new String[]{"stray"}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Main.CliOptions.parse(new String[]{"--offset", "x"}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Main.CliOptions.parse(new String[]{"--pattern", "a"}).toConfiguration())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("data file");
    }

    @Test
    void run_exit_status_reflects_outcome(@TempDir Path dir) throws Exception {
        Path data = dir.resolve("data.txt");
        Files.writeString(data, "hello world");
        Path csv = dir.resolve("out.csv");

        assertThat(Main.run(SearchConfiguration.builder().dataFile(data).pattern("l").csvFile(csv).build())).isZero();
        assertThat(Files.readAllLines(csv)).hasSize(4);
        assertThat(Main.run(SearchConfiguration.builder().dataFile(data).pattern("zzz").build())).isEqualTo(1);
        assertThat(Main.run(SearchConfiguration.builder().dataFile(dir.resolve("nope.txt")).pattern("l").build())).isEqualTo(3);
    }
}
