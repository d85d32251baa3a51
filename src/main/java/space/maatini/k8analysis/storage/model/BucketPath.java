package space.maatini.k8analysis.storage.model;

import space.maatini.k8analysis.common.exception.InvalidPathException;

import java.util.Comparator;
import java.util.Objects;

/**
 * Location of an object in a bucket, written as {@code gs://bucket/relative/path}.
 * <p>
 * Ordering is lexicographic on bucket, then relative path.
 */
public final class BucketPath implements Comparable<BucketPath> {

    public static final String SCHEME = "gs://";

    private static final Comparator<BucketPath> ORDER = Comparator
            .comparing(BucketPath::getBucket)
            .thenComparing(BucketPath::getRelativePath);

    private final String bucket;
    private final String relativePath;

    public BucketPath(String bucket, String relativePath) {
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.relativePath = Objects.requireNonNull(relativePath, "relativePath");
        if (relativePath.startsWith("/")) {
            throw new IllegalArgumentException("Relative path must not start with '/': " + relativePath);
        }
    }

    /**
     * Parse a bucket path string.
     *
     * @param path The path, e.g. {@code gs://bucket/some/file.bam}.
     * @return The parsed path.
     * @throws InvalidPathException if the path does not start with {@link #SCHEME}.
     */
    public static BucketPath parse(String path) {
        if (path == null || !path.startsWith(SCHEME)) {
            throw new InvalidPathException(path, SCHEME);
        }
        String withoutScheme = path.substring(SCHEME.length());
        int slash = withoutScheme.indexOf('/');
        if (slash < 0) {
            return new BucketPath(withoutScheme, "");
        }
        return new BucketPath(withoutScheme.substring(0, slash), withoutScheme.substring(slash + 1));
    }

    public String getBucket() {
        return bucket;
    }

    public String getRelativePath() {
        return relativePath;
    }

    /**
     * The directory containing this path. A trailing slash is ignored, and a path without any
     * slash has the bucket root (empty relative path) as parent.
     */
    public BucketPath parent() {
        String path = relativePath.endsWith("/")
                ? relativePath.substring(0, relativePath.length() - 1)
                : relativePath;
        int lastSlash = path.lastIndexOf('/');
        return new BucketPath(bucket, lastSlash < 0 ? "" : path.substring(0, lastSlash));
    }

    /**
     * Check that the relative path can be mirrored one-to-one on a local filesystem: no empty,
     * {@code .} or {@code ..} segments. A single trailing slash is allowed.
     *
     * @throws InvalidPathException naming the first offending segment.
     */
    public void requireMappableSegments() {
        if (relativePath.isEmpty()) {
            return;
        }
        String path = relativePath.endsWith("/")
                ? relativePath.substring(0, relativePath.length() - 1)
                : relativePath;
        for (String segment : path.split("/", -1)) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new InvalidPathException(this, segment);
            }
        }
    }

    public BucketPath withSuffix(String suffix) {
        return new BucketPath(bucket, relativePath + suffix);
    }

    /**
     * The last segment of the relative path.
     */
    public String getFileName() {
        return relativePath.substring(relativePath.lastIndexOf('/') + 1);
    }

    @Override
    public int compareTo(BucketPath other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BucketPath)) {
            return false;
        }
        BucketPath other = (BucketPath) o;
        return bucket.equals(other.bucket) && relativePath.equals(other.relativePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucket, relativePath);
    }

    @Override
    public String toString() {
        return relativePath.isEmpty() ? SCHEME + bucket : SCHEME + bucket + "/" + relativePath;
    }
}
