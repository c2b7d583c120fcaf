package ai.tabprof.engine;

import ai.tabprof.schema.ValueCount;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Exact value counts of a column. Unbounded: memory grows with the number of distinct values.
 * Remembers the order in which values were first seen, used to break ties between equal counts.
 */
public class FrequencyTable {

    private static final Comparator<Entry> RANK = Comparator
        .comparingLong((Entry e) -> e.count).reversed()
        .thenComparingLong(e -> e.firstSeen);

    private final Map<String, Entry> entries = new HashMap<>();

    public void increment(String value) {
        Entry entry = entries.get(value);
        if (entry == null) {
            entry = new Entry(value, entries.size());
            entries.put(value, entry);
        }
        entry.count++;
    }

    public long count(String value) {
        Entry entry = entries.get(value);
        return entry == null ? 0 : entry.count;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Highest counts first, equal counts in first-seen order.
     *
     * @param n max number of values
     * @return at most n values
     */
    public List<ValueCount> top(int n) {
        if (n <= 0 || entries.isEmpty()) {
            return Collections.emptyList();
        }
        // min-heap on rank keeps the n best entries seen so far
        PriorityQueue<Entry> heap = new PriorityQueue<>(Math.min(n, entries.size()) + 1, RANK.reversed());
        for (Entry entry : entries.values()) {
            heap.offer(entry);
            if (heap.size() > n) {
                heap.poll();
            }
        }
        List<Entry> best = new ArrayList<>(heap);
        best.sort(RANK);
        List<ValueCount> result = new ArrayList<>(best.size());
        for (Entry entry : best) {
            result.add(new ValueCount(entry.value, entry.count));
        }
        return result;
    }

    private static final class Entry {
        private final String value;
        private final long firstSeen;
        private long count;

        private Entry(String value, long firstSeen) {
            this.value = value;
            this.firstSeen = firstSeen;
        }
    }
}
