package com.stagediff.core.engine;

import com.stagediff.core.collect.ChangeCollector;
import com.stagediff.core.collect.ChangeRecordStore;
import com.stagediff.core.model.StatusRequest;
import com.stagediff.core.report.ColorConfigLoader;
import com.stagediff.core.report.ColorSettings;
import com.stagediff.core.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Collect-then-render flow behind {@code stagediff --status}.
 *
 * <p>Each call builds a fresh {@link ChangeRecordStore}; nothing outlives the call.
 */
@Service
public class StatusReportService {

    private static final Logger log = LoggerFactory.getLogger(StatusReportService.class);

    private final ChangeCollector collector;
    private final ColorConfigLoader colorConfigLoader;

    public StatusReportService(ChangeCollector collector, ColorConfigLoader colorConfigLoader) {
        this.collector = collector;
        this.colorConfigLoader = colorConfigLoader;
    }

    /**
     * @throws com.stagediff.core.report.ColorConfigException if a color setting is malformed
     */
    public ColorSettings loadColors(Path workDir) {
        return colorConfigLoader.load(workDir);
    }

    /**
     * Runs both comparison passes and renders the report.
     *
     * @return the report text, or empty if the staged snapshot could not be loaded
     * @throws com.stagediff.core.git.GitCommandException if a diff command fails
     */
    public Optional<String> report(StatusRequest request, ColorSettings colors) {
        var store = new ChangeRecordStore();
        if (!collector.run(store, request)) {
            return Optional.empty();
        }
        log.debug("Rendering {} changed paths", store.size());
        return Optional.of(new Reporter(colors).render(store));
    }
}
