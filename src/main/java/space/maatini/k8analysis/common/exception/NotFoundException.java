package space.maatini.k8analysis.common.exception;

import space.maatini.k8analysis.storage.model.BucketPath;

/**
 * Exception thrown when a remote object that must exist does not.
 */
public class NotFoundException extends K8AnalysisException {

    private final BucketPath path;

    public NotFoundException(BucketPath path) {
        super("Cannot download file that doesn't exist: " + path);
        this.path = path;
    }

    public BucketPath getPath() {
        return path;
    }
}
