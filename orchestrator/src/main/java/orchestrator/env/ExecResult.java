package orchestrator.env;

/**
 * Result of a command or script executed on a machine.
 *
 * @param exitCode process exit status
 * @param stdout captured standard output
 * @param stderr captured standard error
 */
public record ExecResult(int exitCode, String stdout, String stderr) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
