package space.maatini.k8analysis.common.exception;

import space.maatini.k8analysis.storage.model.BucketPath;

/**
 * Exception thrown when a FASTQ file name is not marked as exactly one of read 1 or read 2.
 */
public class AmbiguousReadMarkerException extends ValidationException {

    private final BucketPath path;

    public AmbiguousReadMarkerException(BucketPath path, String read1Marker, String read2Marker) {
        super("The FASTQ file is not marked clearly as read 1 or read 2 (expected exactly one of '"
                + read1Marker + "' or '" + read2Marker + "'): " + path);
        this.path = path;
    }

    public BucketPath getPath() {
        return path;
    }
}
