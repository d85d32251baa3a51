package space.maatini.k8analysis.storage.client;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import space.maatini.k8analysis.common.exception.LocalFileMissingException;
import space.maatini.k8analysis.common.exception.NotFoundException;
import space.maatini.k8analysis.common.exception.TransferException;
import space.maatini.k8analysis.common.util.FileUtils;
import space.maatini.k8analysis.common.util.GlobPattern;
import space.maatini.k8analysis.storage.model.BucketPath;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Object store backed by the S3 API.
 */
@ApplicationScoped
public class S3ObjectStoreClient implements ObjectStoreClient {

    private static final Logger LOG = Logger.getLogger(S3ObjectStoreClient.class);

    private static final int NOT_FOUND = 404;

    private final S3Client s3;

    @Inject
    public S3ObjectStoreClient(S3Client s3) {
        this.s3 = s3;
    }

    @Override
    public boolean exists(BucketPath path) {
        HeadObjectRequest headRequest = HeadObjectRequest.builder()
                .bucket(path.getBucket())
                .key(path.getRelativePath())
                .build();
        try {
            s3.headObject(headRequest);
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == NOT_FOUND) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public void download(BucketPath path, Path localPath) {
        LOG.infof("Starting download of '%s' to '%s'.", path, localPath);
        if (!exists(path)) {
            throw new NotFoundException(path);
        }
        FileUtils.createParentDirectories(localPath);

        GetObjectRequest getRequest = GetObjectRequest.builder()
                .bucket(path.getBucket())
                .key(path.getRelativePath())
                .build();
        s3.getObject(getRequest, localPath);

        if (!Files.exists(localPath)) {
            throw new TransferException("Download of '" + path + "' to '" + localPath + "' has failed.",
                    path, localPath);
        }
        LOG.infof("Finished download of '%s' to '%s'.", path, localPath);
    }

    @Override
    public void upload(Path localPath, BucketPath path) {
        LOG.infof("Starting upload of '%s' to '%s'.", localPath, path);
        if (!Files.exists(localPath)) {
            throw new LocalFileMissingException(localPath);
        }

        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(path.getBucket())
                .key(path.getRelativePath())
                .build();
        s3.putObject(putRequest, localPath);

        if (!exists(path)) {
            throw new TransferException("Upload of '" + localPath + "' to '" + path + "' has failed.",
                    path, localPath);
        }
        LOG.infof("Finished upload of '%s' to '%s'.", localPath, path);
    }

    @Override
    public List<BucketPath> listChildren(BucketPath directory) {
        String prefix = directory.getRelativePath().endsWith("/") || directory.getRelativePath().isEmpty()
                ? directory.getRelativePath()
                : directory.getRelativePath() + "/";
        return list(directory.getBucket(), prefix, "/", key -> true);
    }

    @Override
    public List<BucketPath> matchGlob(BucketPath pattern) {
        GlobPattern glob = GlobPattern.compile(pattern.getRelativePath());
        String prefix = GlobPattern.literalPrefix(pattern.getRelativePath());
        LOG.debugf("Matching objects under prefix '%s' against '%s'", prefix, pattern);
        return list(pattern.getBucket(), prefix, null, glob::matches);
    }

    private List<BucketPath> list(String bucket, String prefix, String delimiter, Predicate<String> keyFilter) {
        List<BucketPath> paths = new ArrayList<>();
        String continuationToken = null;
        do {
            ListObjectsV2Request listRequest = ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(prefix)
                    .delimiter(delimiter)
                    .continuationToken(continuationToken)
                    .build();
            ListObjectsV2Response response = s3.listObjectsV2(listRequest);
            for (S3Object object : response.contents()) {
                if (keyFilter.test(object.key())) {
                    paths.add(new BucketPath(bucket, object.key()));
                }
            }
            continuationToken = Boolean.TRUE.equals(response.isTruncated())
                    ? response.nextContinuationToken()
                    : null;
        } while (continuationToken != null);
        return paths;
    }
}
