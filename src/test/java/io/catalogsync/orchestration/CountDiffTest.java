package io.catalogsync.orchestration;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CountDiffTest {

    @Test
    void shouldReturnFirstMappingWhenSecondIsMissing() {
        Map<String, Integer> live = Map.of("Slides", 3, "Exercises", 1);

        assertSame(live, CountDiff.diff(live, null));
    }

    @Test
    void shouldReturnSecondMappingWhenFirstIsMissing() {
        Map<String, Integer> cached = Map.of("Slides", 3);

        assertSame(cached, CountDiff.diff(null, cached));
        assertNull(CountDiff.diff(null, null));
    }

    @Test
    void shouldReportEverythingAgainstAnEmptyMapping() {
        Map<String, Integer> live = Map.of("Slides", 3, "Exercises", 1);

        assertEquals(live, CountDiff.diff(live, Map.of()));
        assertTrue(CountDiff.diff(Map.of(), live).isEmpty());
    }

    @Test
    void shouldNotDiffAMappingWithItself() {
        Map<String, Integer> live = Map.of("Slides", 3, "Exercises", 1, "Exams", 7);

        assertTrue(CountDiff.diff(live, live).isEmpty());
        assertTrue(CountDiff.diff(live, new HashMap<>(live)).isEmpty());
    }

    @Test
    void shouldReportNewAndGrownCategoriesOnly() {
        Map<String, Integer> live = Map.of("Slides", 3, "Exercises", 1, "Exams", 2);
        Map<String, Integer> cached = Map.of("Slides", 3, "Exams", 1);

        assertEquals(Map.of("Exercises", 1, "Exams", 2), CountDiff.diff(live, cached));
    }

    @Test
    void shouldIgnoreDecreasedCounts() {
        Map<String, Integer> live = Map.of("Slides", 2);
        Map<String, Integer> cached = Map.of("Slides", 5);

        assertTrue(CountDiff.diff(live, cached).isEmpty());
    }

    @Test
    void shouldKeepOrderOfFirstMappingAndLeaveInputsUntouched() {
        Map<String, Integer> live = new LinkedHashMap<>();
        live.put("Slides", 3);
        live.put("Exercises", 1);
        live.put("Exams", 2);
        Map<String, Integer> cached = new LinkedHashMap<>(Map.of("Exercises", 1));
        Map<String, Integer> liveCopy = new LinkedHashMap<>(live);
        Map<String, Integer> cachedCopy = new LinkedHashMap<>(cached);

        Map<String, Integer> diff = CountDiff.diff(live, cached);

        assertEquals(List.of("Slides", "Exams"), List.copyOf(diff.keySet()));
        assertEquals(liveCopy, live);
        assertEquals(cachedCopy, cached);
    }

    @Test
    void shouldBeSoundAndCompleteOnRandomMappings() {
        Random random = new Random(42);
        List<String> keys = List.of("a", "b", "c", "d", "e", "f");

        for (int round = 0; round < 500; round++) {
            Map<String, Integer> a = randomCounts(random, keys);
            Map<String, Integer> b = randomCounts(random, keys);

            Map<String, Integer> diff = CountDiff.diff(a, b);

            for (String key : keys) {
                boolean ahead = a.containsKey(key) && (!b.containsKey(key) || a.get(key) > b.get(key));
                assertEquals(ahead, diff.containsKey(key), "key " + key + " of " + a + " vs " + b);
                if (ahead) {
                    assertEquals(a.get(key), diff.get(key));
                }
            }
            assertEquals(diff, CountDiff.diff(a, b), "diff must be deterministic");
        }
    }

    private static Map<String, Integer> randomCounts(Random random, List<String> keys) {
        Map<String, Integer> counts = new HashMap<>();
        for (String key : keys) {
            if (random.nextBoolean()) {
                counts.put(key, random.nextInt(5));
            }
        }
        return counts;
    }
}
