package io.catalogsync.orchestration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compares two count mappings and reports the keys that are ahead in the first.
 */
public final class CountDiff {

    private CountDiff() {
        // Utility class
    }

    /**
     * Every key of {@code a} that is missing from {@code b} or has a strictly
     * greater count in {@code a}, valued with its count in {@code a}.
     * <p>
     * A missing {@code b} yields {@code a} unchanged; a missing {@code a}
     * yields {@code b} unchanged. Decreases are never reported.
     *
     * @param a the mapping that may be ahead, may be null
     * @param b the mapping compared against, may be null
     * @return the keys ahead in {@code a}, in the iteration order of {@code a}
     */
    public static <K> Map<K, Integer> diff(Map<K, Integer> a, Map<K, Integer> b) {
        if (b == null) {
            return a;
        }
        if (a == null) {
            return b;
        }

        Map<K, Integer> ahead = new LinkedHashMap<>();
        for (Map.Entry<K, Integer> entry : a.entrySet()) {
            Integer other = b.get(entry.getKey());
            if (other == null || entry.getValue() > other) {
                ahead.put(entry.getKey(), entry.getValue());
            }
        }
        return ahead;
    }
}
