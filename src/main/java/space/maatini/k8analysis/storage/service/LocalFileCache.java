package space.maatini.k8analysis.storage.service;

import io.smallrye.mutiny.CompositeException;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import space.maatini.k8analysis.common.exception.BatchTransferException;
import space.maatini.k8analysis.common.exception.RemoteAlreadyExistsException;
import space.maatini.k8analysis.storage.client.ObjectStoreClient;
import space.maatini.k8analysis.storage.model.BucketPath;
import space.maatini.k8analysis.storage.model.TransferStatus;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Local cache of bucket files that mirrors the file structure in the buckets.
 * <p>
 * The same bucket file always maps to the same local path, {@code root/bucket/relative_path}, so
 * a file that is already present locally is never downloaded again. Entries are never evicted.
 * Uploads are write-once: an existing remote object is never overwritten.
 */
@ApplicationScoped
public class LocalFileCache {

    private static final Logger LOG = Logger.getLogger(LocalFileCache.class);

    private final Path rootDirectory;
    private final ObjectStoreClient storeClient;

    @Inject
    public LocalFileCache(@ConfigProperty(name = "k8analysis.cache-directory") String rootDirectory,
            ObjectStoreClient storeClient) {
        this(Paths.get(rootDirectory), storeClient);
    }

    public LocalFileCache(Path rootDirectory, ObjectStoreClient storeClient) {
        this.rootDirectory = rootDirectory;
        this.storeClient = storeClient;
    }

    /**
     * The local path of a bucket file. Does not touch the filesystem.
     *
     * @throws space.maatini.k8analysis.common.exception.InvalidPathException if the relative path has an
     *         empty, {@code .} or {@code ..} segment, which would alias another object's local file.
     */
    public Path localPathFor(BucketPath bucketPath) {
        bucketPath.requireMappableSegments();
        Path bucketDirectory = rootDirectory.resolve(bucketPath.getBucket());
        return bucketPath.getRelativePath().isEmpty()
                ? bucketDirectory
                : bucketDirectory.resolve(bucketPath.getRelativePath());
    }

    // ==================== Single transfers ====================

    public TransferStatus downloadOne(BucketPath bucketPath) {
        Path localPath = localPathFor(bucketPath);
        if (Files.exists(localPath)) {
            LOG.infof("Skipping download of '%s' since it is already in the local file cache.", bucketPath);
            return TransferStatus.SKIP;
        }
        storeClient.download(bucketPath, localPath);
        return TransferStatus.SUCCESS;
    }

    public TransferStatus uploadOne(BucketPath bucketPath) {
        Path localPath = localPathFor(bucketPath);
        if (storeClient.exists(bucketPath)) {
            throw new RemoteAlreadyExistsException(bucketPath);
        }
        storeClient.upload(localPath, bucketPath);
        return TransferStatus.SUCCESS;
    }

    // ==================== Batch transfers ====================

    /**
     * Download all files concurrently. Every download runs to completion even if others fail;
     * the batch then fails as a whole without removing the files that did arrive.
     *
     * @throws BatchTransferException if any download failed.
     */
    public void downloadMany(Collection<BucketPath> bucketPaths) {
        runConcurrently("download", bucketPaths, this::downloadOne);
    }

    /**
     * Upload all files concurrently, with the same failure policy as {@link #downloadMany}.
     *
     * @throws BatchTransferException if any upload failed.
     */
    public void uploadMany(Collection<BucketPath> bucketPaths) {
        runConcurrently("upload", bucketPaths, this::uploadOne);
    }

    private void runConcurrently(String operation, Collection<BucketPath> bucketPaths,
            Function<BucketPath, TransferStatus> transfer) {
        if (bucketPaths.isEmpty()) {
            LOG.debugf("Nothing to %s", operation);
            return;
        }
        List<BucketPath> sortedPaths = bucketPaths.stream().sorted().distinct().collect(Collectors.toList());

        ExecutorService executor = Executors.newCachedThreadPool();
        try {
            List<Uni<TransferStatus>> transfers = new ArrayList<>();
            for (BucketPath bucketPath : sortedPaths) {
                LOG.infof("Submitting %s of '%s'", operation, bucketPath);
                transfers.add(Uni.createFrom().item(() -> transfer.apply(bucketPath))
                        .runSubscriptionOn(executor)
                        .invoke(status -> LOG.infof("Finished %s of '%s' with result '%s'",
                                operation, bucketPath, status))
                        .onFailure().invoke(t -> LOG.errorf("Failed %s of '%s': %s",
                                operation, bucketPath, t.getMessage())));
            }

            Uni.combine().all().unis(transfers)
                    .collectFailures()
                    .discardItems()
                    .await().indefinitely();
        } catch (CompositeException e) {
            throw new BatchTransferException(operation, sortedPaths.size(), e.getCauses());
        } catch (RuntimeException e) {
            throw new BatchTransferException(operation, sortedPaths.size(), List.of(e));
        } finally {
            executor.shutdown();
        }
    }
}
