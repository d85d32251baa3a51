package space.maatini.k8analysis.common.exception;

/**
 * Exception thrown when a value does not satisfy its required format.
 */
public class ValidationException extends K8AnalysisException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
