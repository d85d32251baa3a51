package space.maatini.k8analysis.common.exception;

import java.nio.file.Path;

/**
 * Exception thrown when a local file to upload does not exist.
 */
public class LocalFileMissingException extends K8AnalysisException {

    private final Path localPath;

    public LocalFileMissingException(Path localPath) {
        super("Cannot upload file that doesn't exist: '" + localPath + "'");
        this.localPath = localPath;
    }

    public Path getLocalPath() {
        return localPath;
    }
}
