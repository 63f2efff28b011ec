package orchestrator.prepare;

import orchestrator.env.ExecResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link BuildToolchain} that shells out to the local tools:
 * {@code reposync}, the {@code build_*_rpms.sh} scripts, {@code git} and a
 * repository indexer ({@code createrepo} by default).
 */
public class ProcessBuildToolchain implements BuildToolchain {

    private static final Logger log = LoggerFactory.getLogger(ProcessBuildToolchain.class);

    public static final List<String> DEFAULT_INDEX_COMMAND = List.of("createrepo");

    private static final ConcurrentMap<Path, ReentrantLock> SYNC_LOCKS = new ConcurrentHashMap<>();

    private final List<String> indexCommand;

    public ProcessBuildToolchain() {
        this(DEFAULT_INDEX_COMMAND);
    }

    /**
     * @param indexCommand command run with the merged repository appended; empty to skip indexing
     */
    public ProcessBuildToolchain(List<String> indexCommand) {
        this.indexCommand = List.copyOf(indexCommand);
    }

    @Override
    public void syncRepository(Path repoPath, Path yumConfig, List<String> repoIds) throws IOException {
        Files.createDirectories(repoPath);

        List<String> command = new ArrayList<>(List.of(
                "reposync",
                "--config=" + yumConfig,
                "--download_path=" + repoPath,
                "--newest-only",
                "--delete"));
        repoIds.forEach(id -> command.add("--repoid=" + id));

        // serializes syncs of the same repository across prefixes: the file lock
        // between processes, the in-process lock between threads of this JVM
        ReentrantLock lock = SYNC_LOCKS.computeIfAbsent(repoPath.toRealPath(), p -> new ReentrantLock());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting to sync " + repoPath);
        }
        try (FileChannel channel = FileChannel.open(repoPath.resolve(".lock"),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            check(run(command, null, Map.of()), "reposync");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void buildRpms(String script, Path sourceDir, Path outputDir, List<String> dists,
                          Map<String, String> env) throws IOException {
        log.info("Building {} from {}, for {}, storing results in {}",
                script, sourceDir, String.join(", ", dists), outputDir);

        List<String> command = new ArrayList<>(List.of(script, sourceDir.toString(), outputDir.toString()));
        command.addAll(dists);
        check(run(command, null, env), script);
    }

    @Override
    public void mergeRepositories(Path output, List<Path> inputs) throws IOException {
        Files.createDirectories(output);
        int copied = 0;
        for (Path input : inputs) {
            if (!Files.isDirectory(input)) {
                log.debug("Skipping missing repository {}", input);
                continue;
            }
            List<Path> rpms;
            try (Stream<Path> files = Files.walk(input)) {
                rpms = files.filter(p -> p.getFileName().toString().endsWith(".rpm")).toList();
            }
            for (Path rpm : rpms) {
                Files.copy(rpm, output.resolve(rpm.getFileName()), StandardCopyOption.REPLACE_EXISTING);
                copied++;
            }
        }
        log.info("Merged {} package(s) into {}", copied, output);

        if (!indexCommand.isEmpty()) {
            List<String> command = new ArrayList<>(indexCommand);
            command.add(output.toString());
            check(run(command, null, Map.of()), indexCommand.get(0));
        }
    }

    @Override
    public String gitRevision(Path workTree) throws IOException {
        ExecResult result = run(List.of("git", "rev-parse", "HEAD"), workTree, Map.of());
        check(result, "git rev-parse");
        return result.stdout().strip();
    }

    /**
     * Runs a command to completion. Standard error is merged into standard output.
     */
    protected ExecResult run(List<String> command, Path workDir, Map<String, String> env) throws IOException {
        log.debug("Running: {}", String.join(" ", command));
        ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(true);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        pb.environment().putAll(env);

        Process process = pb.start();
        String output;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            output = reader.lines().collect(Collectors.joining("\n"));
        }
        try {
            return new ExecResult(process.waitFor(), output, "");
        } catch (InterruptedException e) {
            process.destroy();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for " + command.get(0));
        }
    }

    private static void check(ExecResult result, String what) throws IOException {
        if (!result.isSuccess()) {
            log.error("{} returned with error {}", what, result.exitCode());
            log.error("Output was:\n{}", result.stdout());
            throw new IOException(what + " failed with status " + result.exitCode() + ", see logs");
        }
    }
}
