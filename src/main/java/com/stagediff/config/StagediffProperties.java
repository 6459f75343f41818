package com.stagediff.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "stagediff")
public class StagediffProperties {

    private String gitExecutable = "git";
    private String workDir = ".";
    private String reference = "HEAD";

    public String getGitExecutable() { return gitExecutable; }
    public void setGitExecutable(String gitExecutable) { this.gitExecutable = gitExecutable; }
    public String getWorkDir() { return workDir; }
    public void setWorkDir(String workDir) { this.workDir = workDir; }
    public String getReference() { return reference; }
    public void setReference(String reference) { this.reference = reference; }
}
