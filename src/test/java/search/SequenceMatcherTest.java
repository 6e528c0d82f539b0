package search;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class SequenceMatcherTest {

    @Test
    void findEvery_reports_non_overlapping_windows() {
        SequenceMatcher<Integer> matcher = SequenceMatcher.of(List.of(1, 2, 3, 1, 2, 3));

        List<PatternMatch<List<Integer>>> pms = matcher.findEvery(SequenceMatcher.pattern(1, 2));

        assertThat(pms).extracting(PatternMatch::range).containsExactly(new MatchRange(0, 2), new MatchRange(3, 5));
        assertThat(pms).extracting(PatternMatch::view).containsOnly(List.of(1, 2));
    }

    @Test
    void self_overlapping_pattern_advances_past_each_match() {
        SequenceMatcher<String> matcher = SequenceMatcher.of(List.of("a", "a", "a", "a", "a"));

        assertThat(matcher.findEvery(List.of("a", "a"))).extracting(PatternMatch::start).containsExactly(0, 2);
    }

    @Test
    void pattern_longer_than_remaining_source_finds_nothing() {
        SequenceMatcher<Integer> matcher = SequenceMatcher.of(List.of(1, 2, 3));

        assertThat(matcher.findFirst(List.of(1, 2, 3, 4))).isEmpty();
        assertThat(matcher.findFirstFrom(List.of(2, 3), 2)).isEmpty();
        assertThat(matcher.findFirstFrom(List.of(3), 2).orElseThrow().start()).isEqualTo(2);
        assertThat(matcher.findFirstFrom(List.of(3), 3)).isEmpty();
        assertThat(matcher.findFirstFrom(List.of(3), 10)).isEmpty();
    }

    @Test
    void empty_source_finds_nothing() {
        assertThat(SequenceMatcher.<Integer>of(List.of()).findEvery(List.of(1))).isEmpty();
    }

    @Test
    void null_elements_compare_by_equality() {
        SequenceMatcher<String> matcher = SequenceMatcher.of(Arrays.asList("x", null, "y", null));

        PatternMatch<List<String>> pm = matcher.findFirst(Arrays.asList(null, "y")).orElseThrow();

        assertThat(pm.start()).isEqualTo(1);
        assertThat(pm.view()).containsExactly(null, "y");
    }

    @Test
    void view_is_an_immutable_copy_of_the_window() {
        List<Character> source = new ArrayList<>(List.of('a', 'b', 'c'));
        SequenceMatcher<Character> matcher = SequenceMatcher.of(source);

        PatternMatch<List<Character>> pm = matcher.findFirst(List.of('b', 'c')).orElseThrow();
        source.set(1, 'z');

        assertThat(pm.view()).containsExactly('b', 'c');
        assertThatThrownBy(() -> pm.view().add('d')).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void findAny_and_findAll_work_on_element_sequences() {
        SequenceMatcher<Integer> matcher = SequenceMatcher.of(List.of(5, 1, 2, 5, 3, 1, 2));
        List<List<Integer>> patterns = List.of(List.of(1, 2), List.of(5));

        assertThat(matcher.findAny(patterns).orElseThrow().view()).isEqualTo(List.of(5));
        assertThat(matcher.findAll(patterns)).extracting(PatternMatch::start).containsExactly(1, 5, 0, 3);
    }

    @Test
    void empty_pattern_and_negative_offset_are_rejected() {
        SequenceMatcher<Integer> matcher = SequenceMatcher.of(List.of(1, 2));

        assertThatThrownBy(() -> matcher.findFirst(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> matcher.findFirstFrom(List.of(1), -3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> matcher.findFirst(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void linked_list_source_is_scanned_in_linear_time() {
        LinkedList<Integer> source = new LinkedList<>();
        for (int i = 0; i < 200_000; i++) {
            source.add(i % 100);
        }
        source.add(-1);
        source.add(-2);
        SequenceMatcher<Integer> matcher = SequenceMatcher.of(source);

        // a get(i) per element on a 200k LinkedList takes tens of seconds
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            assertThat(matcher.findFirst(List.of(-2, -1))).isEmpty();
            assertThat(matcher.findFirst(List.of(-1, -2)).orElseThrow().start()).isEqualTo(200_000);
            assertThat(matcher.count(List.of(98, 99))).isEqualTo(2_000);
        });
    }

    @Test
    void linked_list_pattern_matches_like_any_other_list() {
        SequenceMatcher<Integer> matcher = SequenceMatcher.of(new LinkedList<>(List.of(1, 2, 3, 1, 2, 3)));

        assertThat(matcher.findEvery(new LinkedList<>(List.of(2, 3)))).extracting(PatternMatch::start).containsExactly(1, 4);
    }
}
