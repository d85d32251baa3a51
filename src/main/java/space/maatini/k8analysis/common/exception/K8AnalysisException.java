package space.maatini.k8analysis.common.exception;

/**
 * Base class of every failure raised while parsing or running jobs.
 */
public class K8AnalysisException extends RuntimeException {

    public K8AnalysisException(String message) {
        super(message);
    }

    public K8AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
