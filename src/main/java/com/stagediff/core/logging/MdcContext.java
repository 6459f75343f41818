package com.stagediff.core.logging;

import com.stagediff.core.model.Phase;
import org.slf4j.MDC;

import java.nio.file.Path;

/**
 * Utility for managing stagediff-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorkDir(Path workDir) {
        MDC.put("workDir", workDir.toString());
    }

    public static void setPhase(Phase phase) {
        MDC.put("phase", phase.name());
    }

    public static void clear() {
        MDC.remove("workDir");
        MDC.remove("phase");
    }
}
