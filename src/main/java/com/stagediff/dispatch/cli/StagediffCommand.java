package com.stagediff.dispatch.cli;

import com.stagediff.config.StagediffProperties;
import com.stagediff.core.engine.StatusReportService;
import com.stagediff.core.git.GitCommandException;
import com.stagediff.core.model.StatusRequest;
import com.stagediff.core.report.ColorConfigException;
import com.stagediff.core.report.ColorSettings;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: stagediff --status [--reference=&lt;ref&gt;] [--] [&lt;pathspec&gt;...]
 * <p>
 * Prints, per changed path, the staged line counts (against the reference,
 * or the empty tree when it does not resolve) and the unstaged line counts
 * (working copy against the index). Without {@code --status} it prints usage
 * and fails.
 */
@Command(
        name = "stagediff",
        mixinStandardHelpOptions = true,
        version = "stagediff 0.1.0",
        description = "Per-path staged and unstaged line counts for a git working copy"
)
@Component
public class StagediffCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 128;
    static final int EXIT_USAGE = 129;

    @Option(names = "--status", description = "Print status information with diffstat")
    private boolean status;

    @Option(names = "--reference", paramLabel = "<ref>",
            description = "Commit to compare the staged snapshot against (default: stagediff.reference, HEAD)")
    private String reference;

    @Parameters(arity = "0..*", paramLabel = "<pathspec>", description = "Limit the report to these paths")
    private List<String> pathspec = new ArrayList<>();

    @Spec
    private CommandSpec spec;

    private final StatusReportService statusReportService;
    private final StagediffProperties properties;

    public StagediffCommand(StatusReportService statusReportService, StagediffProperties properties) {
        this.statusReportService = statusReportService;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        Path workDir = Path.of(properties.getWorkDir()).toAbsolutePath().normalize();

        // Color configuration is validated before the mode is looked at.
        ColorSettings colors;
        try {
            colors = statusReportService.loadColors(workDir);
        } catch (ColorConfigException | GitCommandException e) {
            ConsoleOutput.fatal(ColorSettings.plain(), e.getMessage());
            return EXIT_FATAL;
        }

        if (!status) {
            spec.commandLine().usage(System.err, colors.mode().ansi());
            return EXIT_USAGE;
        }

        var request = new StatusRequest(workDir,
                reference != null ? reference : properties.getReference(), pathspec);
        try {
            statusReportService.report(request, colors).ifPresent(System.out::print);
        } catch (GitCommandException e) {
            ConsoleOutput.fatal(colors, e.getMessage());
            ConsoleOutput.hint(colors, "Is " + workDir + " inside a git working copy?");
            return EXIT_FATAL;
        }
        System.out.flush();
        return EXIT_OK;
    }
}
