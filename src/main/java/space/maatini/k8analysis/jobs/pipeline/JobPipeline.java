package space.maatini.k8analysis.jobs.pipeline;

import org.jboss.logging.Logger;
import space.maatini.k8analysis.common.exception.NoInputsFoundException;
import space.maatini.k8analysis.jobs.model.Job;
import space.maatini.k8analysis.storage.client.ObjectStoreClient;
import space.maatini.k8analysis.storage.model.BucketPath;
import space.maatini.k8analysis.storage.service.LocalFileCache;
import space.maatini.k8analysis.tools.GenomicsToolbox;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs one kind of job: skip if the output exists, otherwise discover and download the inputs,
 * run the tools locally and upload the outputs. Any failure ends the job.
 *
 * @param <J> The job kind.
 */
public abstract class JobPipeline<J extends Job> {

    protected static final String BAM_INDEX_SUFFIX = ".bai";

    protected final ObjectStoreClient storeClient;
    protected final LocalFileCache fileCache;
    protected final GenomicsToolbox toolbox;

    protected JobPipeline(ObjectStoreClient storeClient, LocalFileCache fileCache, GenomicsToolbox toolbox) {
        this.storeClient = storeClient;
        this.fileCache = fileCache;
        this.toolbox = toolbox;
    }

    public JobOutcome execute(J job) {
        Logger log = logger();
        String jobName = job.getJobType().getJobName();
        log.infof("Starting %s job", jobName);
        log.info("Settings:");
        for (Map.Entry<String, BucketPath> setting : job.getSettings().entrySet()) {
            log.infof("    %-11s = %s", setting.getKey(), setting.getValue());
        }

        if (storeClient.exists(job.getOutputPath())) {
            log.info("Skipping job. Output file already exists in bucket");
            return JobOutcome.SKIPPED;
        }

        run(job);

        log.infof("Finished %s job", jobName);
        return JobOutcome.COMPLETED;
    }

    /**
     * Everything after the idempotency check.
     */
    protected abstract void run(J job);

    protected abstract Logger logger();

    // ==================== Shared stages ====================

    protected List<BucketPath> discoverMatching(BucketPath pattern, String description) {
        List<BucketPath> matches = storeClient.matchGlob(pattern);
        if (matches.isEmpty()) {
            throw new NoInputsFoundException(description, pattern);
        }
        logger().infof("Found %s matching input path %s:%n%s", description, pattern, joinLines(matches));
        return matches;
    }

    protected List<BucketPath> discoverChildren(BucketPath directory, String description) {
        logger().infof("Searching for %s to download: %s", description, directory);
        List<BucketPath> children = storeClient.listChildren(directory);
        if (children.isEmpty()) {
            throw new NoInputsFoundException(description, directory);
        }
        logger().infof("Identified %s to download:%n%s", description, joinLines(children));
        return children;
    }

    protected void stageIn(Collection<BucketPath> inputs) {
        logger().info("Starting download of input files");
        fileCache.downloadMany(inputs);
        logger().info("Finished download of input files");
    }

    protected void stageOut(Collection<BucketPath> outputs) {
        logger().info("Starting upload of output files");
        fileCache.uploadMany(outputs);
        logger().info("Finished upload of output files");
    }

    protected Path localPath(BucketPath bucketPath) {
        return fileCache.localPathFor(bucketPath);
    }

    private static String joinLines(Collection<?> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining("\n"));
    }
}
