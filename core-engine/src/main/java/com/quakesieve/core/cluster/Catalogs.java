package com.quakesieve.core.cluster;

import com.quakesieve.core.model.Event;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordering and sanity helpers shared by the engines.
 *
 * <p>
 * Orders are returned as arrays of input positions so that engines can keep
 * their per-event state in arrays parallel to the input list.
 * </p>
 */
final class Catalogs {

    private Catalogs() {
        // utility class — not instantiable
    }

    /**
     * @throws IllegalArgumentException if two events share an id
     */
    static void requireUniqueIds(List<Event> events) {
        Set<String> seen = new HashSet<>();
        for (Event event : events) {
            if (!seen.add(event.getId())) {
                throw new IllegalArgumentException("Duplicate event id in catalog: " + event.getId());
            }
        }
    }

    /**
     * Magnitude descending, then time ascending, then input position.
     */
    static int[] magnitudeDescending(List<Event> events) {
        Comparator<Integer> order = Comparator
                .comparingDouble((Integer i) -> events.get(i).getMagnitude()).reversed()
                .thenComparing(i -> events.get(i).getTime())
                .thenComparingInt(i -> i);
        return sorted(events.size(), order);
    }

    /**
     * Time ascending, then input position.
     */
    static int[] chronological(List<Event> events) {
        Comparator<Integer> order = Comparator
                .comparing((Integer i) -> events.get(i).getTime())
                .thenComparingInt(i -> i);
        return sorted(events.size(), order);
    }

    private static int[] sorted(int n, Comparator<Integer> order) {
        Integer[] positions = new Integer[n];
        for (int i = 0; i < n; i++) {
            positions[i] = i;
        }
        Arrays.sort(positions, order);
        return Arrays.stream(positions).mapToInt(Integer::intValue).toArray();
    }
}
