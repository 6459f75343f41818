package com.stagediff.core.git;

import com.stagediff.core.model.FileStat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GitCommandRunnerTest {

    @Test
    void buildCommandPrefixesExecutable() {
        var runner = new GitCommandRunner("/usr/local/bin/git");

        assertEquals(List.of("/usr/local/bin/git", "diff-files", "--numstat"),
                runner.buildCommand(List.of("diff-files", "--numstat")));
    }

    @Test
    void missingExecutableThrowsGitCommandException() {
        var runner = new GitCommandRunner("stagediff-no-such-git-binary");

        assertThrows(GitCommandException.class, () -> runner.run(Path.of("."), "status"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void largeStderrDoesNotBlockStdout(@TempDir Path dir) throws IOException {
        // far more stderr than a pipe buffer holds, written before any stdout
        Path fakeGit = dir.resolve("fake-git");
        Files.writeString(fakeGit, """
                #!/bin/sh
                head -c 200000 /dev/zero | tr '\\000' 'w' >&2
                printf '1\\t2\\ta.txt\\000'
                exit 3
                """);
        Files.setPosixFilePermissions(fakeGit, PosixFilePermissions.fromString("rwxr-xr-x"));
        var runner = new GitCommandRunner(fakeGit.toString());

        GitResult result = assertTimeoutPreemptively(Duration.ofSeconds(20),
                () -> runner.run(dir, "diff-files", "--numstat", "-z"));

        assertEquals(3, result.exitCode());
        assertEquals("1\t2\ta.txt\0", result.stdout());
        assertEquals(200_000, result.stderr().length());
        assertEquals(List.of(FileStat.text("a.txt", 1, 2)),
                new NumstatParser().parse(result.stdout()));
    }

    @Test
    void resultReportsSuccessOnlyForZeroExit() {
        assertTrue(new GitResult(0, "", "").isSuccess());
        assertFalse(new GitResult(1, "", "").isSuccess());
    }
}
