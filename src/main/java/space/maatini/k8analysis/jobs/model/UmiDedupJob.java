package space.maatini.k8analysis.jobs.model;

import space.maatini.k8analysis.storage.model.BucketPath;

/**
 * Collapse duplicate reads using the UMIs in the read names, producing an indexed BAM.
 */
public final class UmiDedupJob extends SingleBamJob {

    public UmiDedupJob(BucketPath inputPath, BucketPath outputPath) {
        super(inputPath, outputPath);
    }

    @Override
    public JobType getJobType() {
        return JobType.UMI_DEDUP;
    }
}
