package space.maatini.k8analysis.jobs.model;

import space.maatini.k8analysis.storage.model.BucketPath;

/**
 * Write flag statistics of a BAM to a text file.
 */
public final class FlagstatJob extends SingleBamJob {

    public FlagstatJob(BucketPath inputPath, BucketPath outputPath) {
        super(inputPath, outputPath);
    }

    @Override
    public JobType getJobType() {
        return JobType.FLAGSTAT;
    }
}
