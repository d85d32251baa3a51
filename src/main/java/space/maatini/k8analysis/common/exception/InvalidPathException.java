package space.maatini.k8analysis.common.exception;

import space.maatini.k8analysis.storage.model.BucketPath;

/**
 * Exception thrown when a string cannot be parsed as a bucket path, or a bucket path cannot be
 * mirrored on the local filesystem.
 */
public class InvalidPathException extends ValidationException {

    private final String path;

    public InvalidPathException(String path, String expectedPrefix) {
        super("Path is not a bucket path starting with '" + expectedPrefix + "': '" + path + "'");
        this.path = path;
    }

    public InvalidPathException(BucketPath path, String segment) {
        super("Bucket path has " + (segment.isEmpty() ? "an empty" : "a '" + segment + "'")
                + " segment and cannot be mapped to a local file: " + path);
        this.path = path.toString();
    }

    public String getPath() {
        return path;
    }
}
