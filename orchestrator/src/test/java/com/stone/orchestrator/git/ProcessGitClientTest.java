package com.stone.orchestrator.git;

import com.stone.orchestrator.TestProperties;
import com.stone.orchestrator.config.StoneProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the real git executable against a throwaway repository with a
 * {@code main} branch and a conflicting {@code stone/7} feature branch.
 */
@EnabledIf("gitAvailable")
class ProcessGitClientTest {

    @TempDir Path tmp;

    Path             repo;
    ProcessGitClient git;

    @BeforeEach
    void setUp() throws Exception {
        repo = Files.createDirectories(tmp.resolve("origin"));
        sh(repo, "init", "-q");
        sh(repo, "checkout", "-q", "-b", "main");
        Files.writeString(repo.resolve("App.txt"), "line\n");
        commit("initial");

        sh(repo, "checkout", "-q", "-b", "stone/7");
        Files.writeString(repo.resolve("App.txt"), "feature\n");
        Files.writeString(repo.resolve("Feature.txt"), "new\n");
        commit("feature change");

        sh(repo, "checkout", "-q", "main");
        Files.writeString(repo.resolve("App.txt"), "main\n");
        commit("main change");

        StoneProperties defaults = TestProperties.defaults();
        git = new ProcessGitClient(new StoneProperties(
                new StoneProperties.Repository("acme", "widgets", repo.toString(), repo.toString()),
                defaults.forge(),
                defaults.labels(),
                defaults.audit(),
                defaults.branches(),
                new StoneProperties.Conflicts("prefer-feature", Duration.ofSeconds(60)),
                defaults.teams()));
    }

    @Test
    void readOnlyQueries() {
        assertThat(git.branchExists("stone/7")).isTrue();
        assertThat(git.branchExists("stone/8")).isFalse();
        assertThat(git.behindCount("stone/7", "main")).isEqualTo(1);
        assertThat(git.changedPaths("main", "stone/7")).containsExactlyInAnyOrder("App.txt", "Feature.txt");

        String base = git.mergeBase("main", "stone/7");
        assertThat(base).matches("[0-9a-f]{40}");
        assertThat(git.simulateMerge(base, "main", "stone/7")).contains("<<<<<<<").contains("App.txt");
    }

    @Test
    void rebaseStopsOnConflict_thenFeatureSideIsKeptAndPushed() {
        try (WorkingCopy wc = git.cloneAndCheckout("stone/7")) {
            RebaseOutcome stop = git.rebase(wc, "main");
            assertThat(stop.clean()).isFalse();
            assertThat(stop.conflictedPaths()).containsExactly("App.txt");

            git.checkoutSide(wc, "App.txt", GitClient.Side.THEIRS);
            git.stage(wc, "App.txt");
            assertThat(git.continueRebase(wc).clean()).isTrue();

            git.push(wc, "stone/7");
        }
        assertThat(git.behindCount("stone/7", "main")).isZero();
    }

    @Test
    void failingCommand_raisesGitCommandException() {
        assertThatThrownBy(() -> git.mergeBase("main", "no-such-branch"))
                .isInstanceOf(GitCommandException.class)
                .satisfies(e -> assertThat(((GitCommandException) e).exitCode()).isNotZero());
    }

    @Test
    void workingCopy_isRemovedOnClose() {
        Path dir;
        try (WorkingCopy wc = git.cloneAndCheckout("stone/7")) {
            dir = wc.directory();
            assertThat(dir.resolve("Feature.txt")).exists();
        }
        assertThat(dir).doesNotExist();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static boolean gitAvailable() {
        try {
            Process p = new ProcessBuilder("git", "--version").redirectErrorStream(true).start();
            p.getInputStream().readAllBytes();
            return p.waitFor(10, TimeUnit.SECONDS) && p.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void commit(String message) throws Exception {
        sh(repo, "add", "-A");
        sh(repo, "-c", "user.name=Test", "-c", "user.email=test@example.com", "commit", "-q", "-m", message);
    }

    private static void sh(Path dir, String... args) throws Exception {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));
        Process p = new ProcessBuilder(command).directory(dir.toFile()).redirectErrorStream(true).start();
        String out = new String(p.getInputStream().readAllBytes());
        if (!p.waitFor(30, TimeUnit.SECONDS) || p.exitValue() != 0) {
            throw new IllegalStateException("git " + String.join(" ", args) + " failed: " + out);
        }
    }
}
