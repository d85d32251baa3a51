package space.maatini.k8analysis.jobs.model;

import space.maatini.k8analysis.storage.model.BucketPath;

/**
 * Count the distinct mapping coordinates (contig and position) of a BAM.
 */
public final class MappingCoordsCountJob extends SingleBamJob {

    public MappingCoordsCountJob(BucketPath inputPath, BucketPath outputPath) {
        super(inputPath, outputPath);
    }

    @Override
    public JobType getJobType() {
        return JobType.COUNT_MAPPING_COORDS;
    }
}
