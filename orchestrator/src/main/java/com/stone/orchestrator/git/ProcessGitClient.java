package com.stone.orchestrator.git;

import com.stone.orchestrator.config.StoneProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link GitClient} backed by the {@code git} executable.
 *
 * Every command runs as a child process with stderr merged into stdout and a
 * wall-clock limit; the caller's thread blocks until it exits.
 */
@Component
public class ProcessGitClient implements GitClient {

    private static final Logger log = LoggerFactory.getLogger(ProcessGitClient.class);

    private static final List<String> IDENTITY = List.of(
            "-c", "user.name=Stone Workflow",
            "-c", "user.email=stone-workflow@users.noreply.github.com",
            "-c", "core.editor=true");

    private final Path     repository;
    private final String   cloneUrl;
    private final String   token;
    private final Duration timeout;

    public ProcessGitClient(StoneProperties properties) {
        this.repository = Path.of(properties.repository().path()).toAbsolutePath();
        this.cloneUrl   = properties.repository().effectiveCloneUrl();
        this.token      = properties.forge().token();
        this.timeout    = properties.conflicts().gitTimeout();
    }

    // ------------------------------------------------------------------
    // Read-only, against the local repository
    // ------------------------------------------------------------------

    @Override
    public String mergeBase(String base, String head) {
        return run(repository, List.of("merge-base", base, head)).strip();
    }

    @Override
    public String simulateMerge(String mergeBase, String base, String head) {
        return run(repository, List.of("merge-tree", mergeBase, base, head));
    }

    @Override
    public List<String> changedPaths(String base, String head) {
        return lines(run(repository, List.of("diff", "--name-only", base + "..." + head)));
    }

    @Override
    public boolean branchExists(String branch) {
        return execute(repository, List.of("rev-parse", "--verify", "--quiet", branch)).exitCode() == 0;
    }

    @Override
    public int behindCount(String branch, String base) {
        String out = run(repository, List.of("rev-list", "--count", branch + ".." + base)).strip();
        try {
            return Integer.parseInt(out);
        } catch (NumberFormatException e) {
            throw new GitCommandException(List.of("rev-list", "--count"), "unexpected output: " + out, e);
        }
    }

    // ------------------------------------------------------------------
    // Working copies
    // ------------------------------------------------------------------

    @Override
    public WorkingCopy cloneAndCheckout(String branch) {
        Path dir;
        try {
            dir = Files.createTempDirectory("stone-wc-");
        } catch (IOException e) {
            throw new GitCommandException(List.of("clone"), "cannot create temporary directory", e);
        }
        WorkingCopy wc = new WorkingCopy(dir, branch);
        try {
            log.info("Cloning {} @ {} into {}", cloneUrl, branch, dir);
            run(dir, withAuth(List.of("clone", "--no-tags", "--branch", branch, cloneUrl, ".")));
            return wc;
        } catch (RuntimeException e) {
            wc.close();
            throw e;
        }
    }

    @Override
    public RebaseOutcome rebase(WorkingCopy wc, String onto) {
        run(wc.directory(), withAuth(List.of("fetch", "origin", onto)));
        List<String> args = new ArrayList<>(IDENTITY);
        args.addAll(List.of("rebase", "origin/" + onto));
        return rebaseStep(wc, args);
    }

    @Override
    public List<String> conflictedPaths(WorkingCopy wc) {
        return lines(run(wc.directory(), List.of("diff", "--name-only", "--diff-filter=U")));
    }

    @Override
    public void checkoutSide(WorkingCopy wc, String path, Side side) {
        String flag = side == Side.OURS ? "--ours" : "--theirs";
        run(wc.directory(), List.of("checkout", flag, "--", path));
    }

    @Override
    public void stage(WorkingCopy wc, String path) {
        run(wc.directory(), List.of("add", "--", path));
    }

    @Override
    public RebaseOutcome continueRebase(WorkingCopy wc) {
        List<String> args = new ArrayList<>(IDENTITY);
        args.addAll(List.of("rebase", "--continue"));
        return rebaseStep(wc, args);
    }

    @Override
    public void abortRebase(WorkingCopy wc) {
        run(wc.directory(), List.of("rebase", "--abort"));
    }

    @Override
    public void push(WorkingCopy wc, String branch) {
        log.info("Pushing rebased {} to origin", branch);
        run(wc.directory(), withAuth(List.of("push", "--force-with-lease", "origin", "HEAD:" + branch)));
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /**
     * A rebase that stops on conflicts exits non-zero but is not an error:
     * report the unmerged paths instead. Any other failure is.
     */
    private RebaseOutcome rebaseStep(WorkingCopy wc, List<String> args) {
        CommandResult result = execute(wc.directory(), args);
        if (result.exitCode() == 0) {
            return RebaseOutcome.completed();
        }
        List<String> conflicted = conflictedPaths(wc);
        if (conflicted.isEmpty()) {
            throw new GitCommandException(args, result.exitCode(), result.output());
        }
        return RebaseOutcome.stopped(conflicted);
    }

    private List<String> withAuth(List<String> args) {
        if (token.isBlank() || !cloneUrl.startsWith("https://")) {
            return args;
        }
        String basic = Base64.getEncoder().encodeToString(
                ("x-access-token:" + token).getBytes(StandardCharsets.UTF_8));
        List<String> full = new ArrayList<>(List.of("-c", "http.extraHeader=AUTHORIZATION: basic " + basic));
        full.addAll(args);
        return full;
    }

    /** Runs git and returns its output; throws on a non-zero exit. */
    private String run(Path dir, List<String> args) {
        CommandResult result = execute(dir, args);
        if (result.exitCode() != 0) {
            throw new GitCommandException(redacted(args), result.exitCode(), result.output());
        }
        return result.output();
    }

    private CommandResult execute(Path dir, List<String> args) {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(args);
        log.debug("Executing git {} in {}", String.join(" ", redacted(args)), dir);

        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory(dir.toFile());
            builder.redirectErrorStream(true);
            builder.environment().put("GIT_TERMINAL_PROMPT", "0");
            Process process = builder.start();

            StringBuilder output = new StringBuilder();
            Thread reader = new Thread(() -> {
                try (BufferedReader in = new BufferedReader(
                        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = in.readLine()) != null) {
                        output.append(line).append('\n');
                    }
                } catch (IOException e) {
                    log.warn("Error reading git output: {}", e.getMessage());
                }
            });
            reader.start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new GitCommandException(redacted(args),
                        "timed out after " + timeout.toSeconds() + "s", null);
            }
            reader.join(1000);
            return new CommandResult(process.exitValue(), output.toString());
        } catch (IOException e) {
            throw new GitCommandException(redacted(args), e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException(redacted(args), "interrupted", e);
        }
    }

    /** Drops the auth header so tokens never reach logs or exception messages. */
    private static List<String> redacted(List<String> args) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            if ("-c".equals(args.get(i)) && i + 1 < args.size()
                    && args.get(i + 1).startsWith("http.extraHeader")) {
                i++;
                continue;
            }
            out.add(args.get(i));
        }
        return out;
    }

    private static List<String> lines(String output) {
        return output.lines().map(String::strip).filter(l -> !l.isEmpty()).toList();
    }

    private record CommandResult(int exitCode, String output) {}
}
