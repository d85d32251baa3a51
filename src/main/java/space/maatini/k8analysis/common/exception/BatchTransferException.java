package space.maatini.k8analysis.common.exception;

import java.util.List;

/**
 * Exception thrown when at least one transfer of a concurrent batch failed.
 * Transfers that succeeded are not rolled back.
 */
public class BatchTransferException extends K8AnalysisException {

    private final List<Throwable> failures;

    public BatchTransferException(String operation, int batchSize, List<Throwable> failures) {
        super(failures.size() + " of " + batchSize + " " + operation + " transfers failed, first failure: "
                + failures.get(0).getMessage(), failures.get(0));
        this.failures = List.copyOf(failures);
        this.failures.stream().skip(1).forEach(this::addSuppressed);
    }

    public List<Throwable> getFailures() {
        return failures;
    }
}
