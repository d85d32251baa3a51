package space.maatini.k8analysis.storage.client;

import space.maatini.k8analysis.storage.model.BucketPath;

import java.nio.file.Path;
import java.util.List;

/**
 * Interface for the object storage backend holding job inputs and outputs.
 */
public interface ObjectStoreClient {

    /**
     * Check whether an object exists.
     *
     * @param path The object path.
     * @return true if the object exists.
     */
    boolean exists(BucketPath path);

    /**
     * Download an object to a local file, creating parent directories as needed.
     *
     * @param path      The object path.
     * @param localPath The local destination.
     * @throws space.maatini.k8analysis.common.exception.NotFoundException if the object does not exist.
     * @throws space.maatini.k8analysis.common.exception.TransferException if the local file is absent afterwards.
     */
    void download(BucketPath path, Path localPath);

    /**
     * Upload a local file to an object.
     *
     * @param localPath The local source.
     * @param path      The object path.
     * @throws space.maatini.k8analysis.common.exception.LocalFileMissingException if the local file does not exist.
     * @throws space.maatini.k8analysis.common.exception.TransferException if the object is absent afterwards.
     */
    void upload(Path localPath, BucketPath path);

    /**
     * List the objects directly inside a directory, not recursing into subdirectories.
     *
     * @param directory The directory path; a trailing slash is optional.
     * @return The child object paths.
     */
    List<BucketPath> listChildren(BucketPath directory);

    /**
     * Find all objects matching a path with {@code *} wildcards.
     *
     * @param pattern The path pattern.
     * @return The matching object paths, empty if nothing matches.
     */
    List<BucketPath> matchGlob(BucketPath pattern);
}
