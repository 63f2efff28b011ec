package orchestrator.prepare;

import orchestrator.env.ExecResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ProcessBuildToolchain")
class ProcessBuildToolchainTest {

    @TempDir
    Path tmp;

    /** Records commands instead of starting processes. */
    static final class RecordingToolchain extends ProcessBuildToolchain {
        final List<List<String>> commands = new ArrayList<>();
        final List<Map<String, String>> envs = new ArrayList<>();
        int exitCode;
        String output = "";

        RecordingToolchain(List<String> indexCommand) {
            super(indexCommand);
        }

        @Override
        protected ExecResult run(List<String> command, Path workDir, Map<String, String> env) {
            commands.add(command);
            envs.add(env);
            return new ExecResult(exitCode, output, "");
        }
    }

    @Nested
    @DisplayName("mergeRepositories")
    class MergeRepositories {

        @Test
        @DisplayName("should copy packages from existing inputs and index the result")
        void shouldCopyPackagesFromExistingInputsAndIndexTheResult() throws Exception {
            Path vdsm = Files.createDirectories(tmp.resolve("build/vdsm/el7/x86_64"));
            Files.writeString(vdsm.resolve("vdsm-4.17.0-1.el7.x86_64.rpm"), "rpm");
            Files.writeString(vdsm.resolve("build.log"), "log");
            Path output = tmp.resolve("internal_repo/el7");
            RecordingToolchain toolchain = new RecordingToolchain(List.of("createrepo", "--update"));

            toolchain.mergeRepositories(output, List.of(tmp.resolve("build/vdsm/el7"), tmp.resolve("missing")));

            assertThat(output.resolve("vdsm-4.17.0-1.el7.x86_64.rpm")).exists();
            assertThat(output.resolve("build.log")).doesNotExist();
            assertThat(toolchain.commands).containsExactly(List.of("createrepo", "--update", output.toString()));
        }

        @Test
        @DisplayName("should skip indexing when no index command is configured")
        void shouldSkipIndexingWhenNoIndexCommandIsConfigured() throws Exception {
            RecordingToolchain toolchain = new RecordingToolchain(List.of());

            toolchain.mergeRepositories(tmp.resolve("out"), List.of());

            assertThat(tmp.resolve("out")).isDirectory();
            assertThat(toolchain.commands).isEmpty();
        }
    }

    @Nested
    @DisplayName("commands")
    class Commands {

        @Test
        @DisplayName("should pass sources, output and distributions to the build script")
        void shouldPassSourcesOutputAndDistributionsToTheBuildScript() throws Exception {
            RecordingToolchain toolchain = new RecordingToolchain(List.of());

            toolchain.buildRpms("build_engine_rpms.sh", Path.of("/src/engine"), Path.of("/prefix/build/ovirt-engine"),
                    List.of("el7"), Map.of("BUILD_GWT", "0"));

            assertThat(toolchain.commands).containsExactly(List.of(
                    "build_engine_rpms.sh", "/src/engine", "/prefix/build/ovirt-engine", "el7"));
            assertThat(toolchain.envs).containsExactly(Map.of("BUILD_GWT", "0"));
        }

        @Test
        @DisplayName("should sync only the selected repositories under a lock")
        void shouldSyncOnlyTheSelectedRepositoriesUnderALock() throws Exception {
            RecordingToolchain toolchain = new RecordingToolchain(List.of());
            Path repo = tmp.resolve("repo");

            toolchain.syncRepository(repo, Path.of("/etc/reposync.conf"), List.of("ovirt-el7", "epel-el7"));

            assertThat(toolchain.commands.get(0)).containsExactly(
                    "reposync", "--config=/etc/reposync.conf", "--download_path=" + repo,
                    "--newest-only", "--delete", "--repoid=ovirt-el7", "--repoid=epel-el7");
            assertThat(repo.resolve(".lock")).exists();
        }

        @Test
        @DisplayName("should make a second sync of the same repository wait for the first")
        void shouldMakeASecondSyncOfTheSameRepositoryWaitForTheFirst() throws Exception {
            Path repo = tmp.resolve("repo");
            CountDownLatch firstEntered = new CountDownLatch(1);
            CountDownLatch releaseFirst = new CountDownLatch(1);
            AtomicInteger running = new AtomicInteger();
            AtomicInteger maxRunning = new AtomicInteger();
            AtomicInteger runs = new AtomicInteger();
            List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());

            class BlockingToolchain extends ProcessBuildToolchain {
                BlockingToolchain() {
                    super(List.of());
                }

                @Override
                protected ExecResult run(List<String> command, Path workDir, Map<String, String> env) {
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                    try {
                        if (runs.incrementAndGet() == 1) {
                            firstEntered.countDown();
                            releaseFirst.await(10, TimeUnit.SECONDS);
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        running.decrementAndGet();
                    }
                    return new ExecResult(0, "", "");
                }
            }

            Thread first = syncThread(new BlockingToolchain(), repo, errors);
            first.start();
            assertThat(firstEntered.await(10, TimeUnit.SECONDS)).isTrue();

            Thread second = syncThread(new BlockingToolchain(), repo, errors);
            second.start();
            second.join(200);

            assertThat(second.isAlive()).isTrue();
            assertThat(runs).hasValue(1);

            releaseFirst.countDown();
            first.join(10_000);
            second.join(10_000);

            assertThat(errors).isEmpty();
            assertThat(runs).hasValue(2);
            assertThat(maxRunning).hasValue(1);
        }

        private Thread syncThread(ProcessBuildToolchain toolchain, Path repo, List<Throwable> errors) {
            return new Thread(() -> {
                try {
                    toolchain.syncRepository(repo, Path.of("/etc/reposync.conf"), List.of("ovirt-el7"));
                } catch (Throwable t) {
                    errors.add(t);
                }
            });
        }

        @Test
        @DisplayName("should fail with the exit status when a command fails")
        void shouldFailWithTheExitStatusWhenACommandFails() {
            RecordingToolchain toolchain = new RecordingToolchain(List.of());
            toolchain.exitCode = 2;
            toolchain.output = "error: rpmbuild exited";

            assertThatThrownBy(() -> toolchain.buildRpms("build_vdsm_rpms.sh", tmp, tmp, List.of("el7"), Map.of()))
                    .isInstanceOf(IOException.class)
                    .hasMessage("build_vdsm_rpms.sh failed with status 2, see logs");
        }

        @Test
        @DisplayName("should return the stripped revision")
        void shouldReturnTheStrippedRevision() throws Exception {
            RecordingToolchain toolchain = new RecordingToolchain(List.of());
            toolchain.output = "3f2a9c1e\n";

            assertThat(toolchain.gitRevision(tmp)).isEqualTo("3f2a9c1e");
            assertThat(toolchain.commands).containsExactly(List.of("git", "rev-parse", "HEAD"));
        }
    }
}
