package ai.tabprof.engine;

import ai.tabprof.id.RowHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Counts rows whose full value tuple was already seen, using a set of 128-bit row hashes.
 * <p>
 * The set is checked against {@code seenHashesLimit} before every lookup. Once it holds more hashes than the limit,
 * tracking stops: later rows are neither looked up nor inserted, so their duplicates are never counted. Past that
 * point the duplicate count is a lower bound.
 */
public class DuplicateDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DuplicateDetector.class);

    private final int seenHashesLimit;
    private final Set<UUID> seen = new HashSet<>();
    private final RowHasher hasher = new RowHasher();

    private long duplicates;
    private long untracked;

    public DuplicateDetector(int seenHashesLimit) {
        this.seenHashesLimit = seenHashesLimit;
    }

    /**
     * @param row values in column order, null for nulls
     * @return true when the row was counted as a duplicate
     */
    public boolean observe(String[] row) {
        if (!isTracking()) {
            if (untracked++ == 0) {
                LOG.warn("Duplicate detection stopped after {} distinct rows, duplicate count is approximate from now on",
                    seen.size());
            }
            return false;
        }
        UUID hash = hasher.hash(row);
        if (seen.contains(hash)) {
            duplicates++;
            return true;
        }
        seen.add(hash);
        return false;
    }

    public boolean isTracking() {
        return seen.size() <= seenHashesLimit;
    }

    public long duplicates() {
        return duplicates;
    }

    /**
     * @return rows skipped after the cutover
     */
    public long untracked() {
        return untracked;
    }

    public boolean isApproximate() {
        return untracked > 0;
    }

    public int trackedHashes() {
        return seen.size();
    }
}
