package com.stagediff.core.git;

/**
 * Outcome of a single git invocation.
 *
 * @param exitCode process exit code
 * @param stdout   captured standard output, decoded as UTF-8 (NUL separators preserved)
 * @param stderr   captured standard error, decoded as UTF-8
 */
public record GitResult(int exitCode, String stdout, String stderr) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
