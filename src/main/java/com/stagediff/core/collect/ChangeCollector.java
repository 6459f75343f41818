package com.stagediff.core.collect;

import com.stagediff.core.git.DiffEngine;
import com.stagediff.core.git.ReferenceResolver;
import com.stagediff.core.git.SnapshotLoadException;
import com.stagediff.core.git.StagedSnapshotLoader;
import com.stagediff.core.logging.MdcContext;
import com.stagediff.core.model.Baseline;
import com.stagediff.core.model.FileStat;
import com.stagediff.core.model.Phase;
import com.stagediff.core.model.StatusRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the two comparison passes and feeds every reported path into a {@link ChangeRecordStore}.
 *
 * <p>Passes always run in this order:
 * <ol>
 *   <li>{@link Phase#WORKING_COPY}: working copy vs staged snapshot</li>
 *   <li>{@link Phase#STAGED}: staged snapshot vs the resolved baseline</li>
 * </ol>
 *
 * <p>If the staged snapshot cannot be loaded, collection is abandoned before
 * either pass runs and the store is left untouched.
 */
public class ChangeCollector {

    private static final Logger log = LoggerFactory.getLogger(ChangeCollector.class);

    private final StagedSnapshotLoader snapshotLoader;
    private final ReferenceResolver referenceResolver;
    private final DiffEngine diffEngine;

    public ChangeCollector(StagedSnapshotLoader snapshotLoader,
                           ReferenceResolver referenceResolver,
                           DiffEngine diffEngine) {
        this.snapshotLoader = snapshotLoader;
        this.referenceResolver = referenceResolver;
        this.diffEngine = diffEngine;
    }

    /**
     * Collects both phases into {@code store}.
     *
     * @return true if both passes ran, false if collection was abandoned
     *         because the staged snapshot could not be loaded
     */
    public boolean run(ChangeRecordStore store, StatusRequest request) {
        MdcContext.setWorkDir(request.workDir());
        try {
            try {
                snapshotLoader.load(request.workDir());
            } catch (SnapshotLoadException e) {
                log.debug("Abandoning change collection: {}", e.getMessage());
                return false;
            }

            Baseline baseline = referenceResolver.resolve(request.workDir(), request.reference());

            MdcContext.setPhase(Phase.WORKING_COPY);
            record(store, Phase.WORKING_COPY,
                    diffEngine.diffWorkingCopy(request.workDir(), request.pathspec()));

            MdcContext.setPhase(Phase.STAGED);
            record(store, Phase.STAGED,
                    diffEngine.diffStaged(request.workDir(), baseline, request.pathspec()));

            log.debug("Collected {} paths (baseline {}{})", store.size(), baseline.label(),
                    baseline.isEmptyTree() ? ", empty tree" : "");
            return true;
        } finally {
            MdcContext.clear();
        }
    }

    private static void record(ChangeRecordStore store, Phase phase, List<FileStat> stats) {
        for (FileStat stat : stats) {
            store.upsert(stat.path(), phase, stat.added(), stat.deleted());
        }
        log.debug("{} pass reported {} paths", phase, stats.size());
    }
}
