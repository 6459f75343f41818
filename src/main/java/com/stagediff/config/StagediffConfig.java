package com.stagediff.config;

import com.stagediff.core.collect.ChangeCollector;
import com.stagediff.core.git.BinarySizeResolver;
import com.stagediff.core.git.DiffEngine;
import com.stagediff.core.git.GitCommandRunner;
import com.stagediff.core.git.GitDiffEngine;
import com.stagediff.core.git.NumstatParser;
import com.stagediff.core.git.ReferenceResolver;
import com.stagediff.core.git.StagedSnapshotLoader;
import com.stagediff.core.report.ColorConfigLoader;
import com.stagediff.core.report.GitColorParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StagediffConfig {

    @Bean
    public GitCommandRunner gitCommandRunner(StagediffProperties properties) {
        return new GitCommandRunner(properties.getGitExecutable());
    }

    @Bean
    public DiffEngine diffEngine(GitCommandRunner runner) {
        return new GitDiffEngine(runner, new NumstatParser(), new BinarySizeResolver(runner));
    }

    @Bean
    public ChangeCollector changeCollector(GitCommandRunner runner, DiffEngine diffEngine) {
        return new ChangeCollector(new StagedSnapshotLoader(runner), new ReferenceResolver(runner), diffEngine);
    }

    @Bean
    public ColorConfigLoader colorConfigLoader(GitCommandRunner runner) {
        return new ColorConfigLoader(runner, new GitColorParser());
    }
}
