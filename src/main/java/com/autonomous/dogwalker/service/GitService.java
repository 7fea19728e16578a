package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.exception.TaskValidationException;
import com.autonomous.dogwalker.model.Dog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checkout management for a task: clone, branch, commit, push.
 */
@Service
public class GitService {

    private static final Logger log = LoggerFactory.getLogger(GitService.class);

    private static final Duration GIT_TIMEOUT = Duration.ofMinutes(5);
    private static final int MAX_SLUG_LENGTH = 40;

    private final CommandRunner commands;

    @Value("${dogwalker.repo.slug:}")
    private String repoSlug;

    @Value("${dogwalker.repo.base-branch:main}")
    private String baseBranch = "main";

    @Value("${dogwalker.repo.workdir:workdir}")
    private String workdir = "workdir";

    public GitService(CommandRunner commands) {
        this.commands = commands;
    }

    public String generateBranchName(String dogName, String description) {
        return dogName.toLowerCase(Locale.ROOT) + "/" + slugify(description);
    }

    public static String slugify(String text) {
        String slug = text.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("^-+|-+$", "");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? "task" : slug;
    }

    /**
     * Fresh clone of the repository on a new branch, committing as the dog.
     */
    public Path prepareCheckout(String taskId, String branchName, Dog dog) {
        if (repoSlug == null || repoSlug.isBlank()) {
            throw new TaskValidationException("No repository configured (dogwalker.repo.slug)");
        }
        Path repoDir = Paths.get(workdir, taskId.replaceAll("[^A-Za-z0-9_.-]", "_"));
        cleanup(repoDir);

        log.info("Cloning {} into {}", repoSlug, repoDir);
        try {
            Files.createDirectories(repoDir.getParent());
        } catch (IOException e) {
            throw new TaskValidationException("Cannot create work directory " + repoDir.getParent(), e);
        }
        git(null, "clone", List.of("git", "clone", cloneUrl(dog), repoDir.toString()));
        git(repoDir, "git config", List.of("git", "config", "user.name", dog.getName()));
        git(repoDir, "git config", List.of("git", "config", "user.email", dog.getEmail()));
        git(repoDir, "checkout " + baseBranch, List.of("git", "checkout", baseBranch));
        git(repoDir, "checkout -b " + branchName, List.of("git", "checkout", "-b", branchName));
        return repoDir;
    }

    /** Commits anything pending. Returns false when there was nothing to commit. */
    public boolean commitAll(Path repoDir, String message) {
        CommandRunner.Result status = git(repoDir, "git status", List.of("git", "status", "--porcelain"));
        if (status.getOutput().isBlank()) {
            log.info("No changes to commit in {}", repoDir);
            return false;
        }
        git(repoDir, "git add", List.of("git", "add", "-A"));
        git(repoDir, "git commit", List.of("git", "commit", "-m", message));
        return true;
    }

    /** Pushes an empty commit so a draft PR can be opened before any code exists. */
    public void pushEmptyBranch(Path repoDir, String branchName, String message) {
        git(repoDir, "git commit", List.of("git", "commit", "--allow-empty", "-m", message));
        push(repoDir, branchName);
    }

    public void push(Path repoDir, String branchName) {
        log.info("Pushing branch {}", branchName);
        git(repoDir, "push " + branchName, List.of("git", "push", "-u", "origin", branchName));
    }

    /**
     * Files that differ from the base branch, committed or not.
     */
    public List<String> getModifiedFiles(Path repoDir) {
        Set<String> files = new LinkedHashSet<>();
        CommandRunner.Result diff = git(repoDir, "git diff",
            List.of("git", "diff", "--name-only", "origin/" + baseBranch + "...HEAD"));
        diff.getOutput().lines().map(String::strip).forEach(files::add);

        CommandRunner.Result status = git(repoDir, "git status", List.of("git", "status", "--porcelain"));
        status.getOutput().lines()
            .filter(line -> line.length() > 3)
            .map(line -> line.substring(3).strip())
            .forEach(files::add);

        List<String> result = new ArrayList<>(files);
        result.removeIf(file -> file.isEmpty() || file.endsWith(".gitkeep"));
        return result;
    }

    public void cleanup(Path repoDir) {
        try {
            if (FileSystemUtils.deleteRecursively(repoDir)) {
                log.info("Cleaned up work directory {}", repoDir);
            }
        } catch (IOException e) {
            log.warn("Failed to clean up work directory {}: {}", repoDir, e.getMessage());
        }
    }

    private String cloneUrl(Dog dog) {
        String token = dog.getCredentialRef() == null ? null : System.getenv(dog.getCredentialRef());
        if (token == null || token.isBlank()) {
            token = System.getenv("GITHUB_TOKEN");
        }
        if (token == null || token.isBlank()) {
            return "https://github.com/" + repoSlug + ".git";
        }
        return "https://x-access-token:" + token + "@github.com/" + repoSlug + ".git";
    }

    private CommandRunner.Result git(Path repoDir, String operation, List<String> command) {
        CommandRunner.Result result = commands.run(repoDir, GIT_TIMEOUT, command);
        if (!result.isSuccess()) {
            throw ErrorClassifier.forCommandFailure(operation, result.getOutput());
        }
        return result;
    }
}
