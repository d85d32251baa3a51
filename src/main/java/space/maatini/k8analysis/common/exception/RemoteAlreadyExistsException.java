package space.maatini.k8analysis.common.exception;

import space.maatini.k8analysis.storage.model.BucketPath;

/**
 * Exception thrown when an upload would overwrite an existing remote object.
 */
public class RemoteAlreadyExistsException extends K8AnalysisException {

    private final BucketPath path;

    public RemoteAlreadyExistsException(BucketPath path) {
        super("Cannot upload file from local file cache since this file already exists in the bucket: " + path);
        this.path = path;
    }

    public BucketPath getPath() {
        return path;
    }
}
