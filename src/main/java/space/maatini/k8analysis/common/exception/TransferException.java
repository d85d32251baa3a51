package space.maatini.k8analysis.common.exception;

import space.maatini.k8analysis.storage.model.BucketPath;

import java.nio.file.Path;

/**
 * Exception thrown when a transfer call returned but its effect cannot be observed.
 */
public class TransferException extends K8AnalysisException {

    private final BucketPath bucketPath;
    private final Path localPath;

    public TransferException(String message, BucketPath bucketPath, Path localPath) {
        super(message);
        this.bucketPath = bucketPath;
        this.localPath = localPath;
    }

    public TransferException(String message, BucketPath bucketPath, Path localPath, Throwable cause) {
        super(message, cause);
        this.bucketPath = bucketPath;
        this.localPath = localPath;
    }

    public BucketPath getBucketPath() {
        return bucketPath;
    }

    public Path getLocalPath() {
        return localPath;
    }
}
