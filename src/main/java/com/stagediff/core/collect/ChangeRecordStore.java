package com.stagediff.core.collect;

import com.stagediff.core.model.ChangeRecord;
import com.stagediff.core.model.Delta;
import com.stagediff.core.model.Phase;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Path-keyed store of {@link ChangeRecord}s, one per distinct path seen in either phase.
 *
 * <p>Within a phase the latest report for a path replaces the earlier one; counts
 * are not summed. A report in one phase never touches the other phase's delta.
 *
 * <p>Not thread-safe. A store belongs to a single status run.
 */
public class ChangeRecordStore {

    private final Map<String, ChangeRecord> records = new HashMap<>();

    /**
     * Records the delta for {@code path} in {@code phase}, creating the record on first sight.
     *
     * @param path    path relative to the working copy root
     * @param phase   the pass that produced the counts
     * @param added   lines added
     * @param deleted lines deleted
     */
    public void upsert(String path, Phase phase, long added, long deleted) {
        var delta = new Delta(added, deleted);
        records.compute(path, (key, existing) ->
                (existing != null ? existing : ChangeRecord.unchanged(key)).withDelta(phase, delta));
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Returns a copy of all records in no particular order.
     */
    public List<ChangeRecord> snapshot() {
        return List.copyOf(records.values());
    }
}
