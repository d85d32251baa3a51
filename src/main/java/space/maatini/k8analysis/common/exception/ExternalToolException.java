package space.maatini.k8analysis.common.exception;

/**
 * Exception thrown when an external command pipeline exits with a non-zero status.
 */
public class ExternalToolException extends K8AnalysisException {

    private final int status;
    private final String command;
    private final String errors;

    public ExternalToolException(String command, int status, String errors) {
        super("Command pipeline failed: status=" + status + ", command=" + command + ", errors=" + errors);
        this.status = status;
        this.command = command;
        this.errors = errors;
    }

    public ExternalToolException(String command, Throwable cause) {
        super("Command pipeline could not be run: command=" + command + ", error=" + cause.getMessage(), cause);
        this.status = -1;
        this.command = command;
        this.errors = cause.getMessage();
    }

    public int getStatus() {
        return status;
    }

    public String getCommand() {
        return command;
    }

    public String getErrors() {
        return errors;
    }
}
