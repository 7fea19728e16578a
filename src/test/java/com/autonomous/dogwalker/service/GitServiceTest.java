package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.exception.TransientFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GitServiceTest {

    private static final Path REPO = Path.of("workdir", "task");

    @Mock
    private CommandRunner commands;

    private GitService gitService;

    @BeforeEach
    void setUp() {
        gitService = new GitService(commands);
    }

    @Test
    void shouldGenerateBranchName() {
        String branch = gitService.generateBranchName("Bryans-Coregi", "Add rate limiting to /api/login!");
        assertEquals("bryans-coregi/add-rate-limiting-to-api-login", branch);
    }

    @Test
    void shouldTruncateLongSlugs() {
        String slug = GitService.slugify("Refactor the entire authentication module to support OAuth and SAML providers");

        assertTrue(slug.length() <= 40);
        assertFalse(slug.endsWith("-"));
        assertEquals("task", GitService.slugify("!!!"));
    }

    @Test
    void shouldSkipCommitWhenNothingChanged() {
        when(commands.run(eq(REPO), any(), eq(List.of("git", "status", "--porcelain"))))
            .thenReturn(new CommandRunner.Result(0, ""));

        assertFalse(gitService.commitAll(REPO, "Add rate limiting"));
        verify(commands, never()).run(eq(REPO), any(), eq(List.of("git", "add", "-A")));
    }

    @Test
    void shouldListChangedFilesWithoutPlaceholders() {
        when(commands.run(eq(REPO), any(), eq(List.of("git", "diff", "--name-only", "origin/main...HEAD"))))
            .thenReturn(new CommandRunner.Result(0, "src/Login.java\n"));
        when(commands.run(eq(REPO), any(), eq(List.of("git", "status", "--porcelain"))))
            .thenReturn(new CommandRunner.Result(0, " M src/Limiter.java\n?? logs/.gitkeep\n M src/Login.java\n"));

        assertEquals(List.of("src/Login.java", "src/Limiter.java"), gitService.getModifiedFiles(REPO));
    }

    @Test
    void shouldClassifyFailedPushAsTransient() {
        when(commands.run(eq(REPO), any(), eq(List.of("git", "push", "-u", "origin", "coregi/rate-limit"))))
            .thenReturn(new CommandRunner.Result(128, "fatal: unable to access: Could not resolve host: github.com"));

        assertThrows(TransientFailureException.class, () -> gitService.push(REPO, "coregi/rate-limit"));
    }
}
