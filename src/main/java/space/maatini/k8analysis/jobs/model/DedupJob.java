package space.maatini.k8analysis.jobs.model;

import space.maatini.k8analysis.storage.model.BucketPath;

/**
 * Mark duplicate reads without UMIs, producing an indexed BAM.
 */
public final class DedupJob extends SingleBamJob {

    public DedupJob(BucketPath inputPath, BucketPath outputPath) {
        super(inputPath, outputPath);
    }

    @Override
    public JobType getJobType() {
        return JobType.DEDUP;
    }
}
