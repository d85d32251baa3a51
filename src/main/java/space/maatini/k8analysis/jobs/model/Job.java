package space.maatini.k8analysis.jobs.model;

import space.maatini.k8analysis.storage.model.BucketPath;

import java.util.Map;

/**
 * A parsed, immutable job. Implementations hold only bucket path values.
 */
public interface Job {

    JobType getJobType();

    /**
     * The main output object; if it already exists the job is skipped.
     */
    BucketPath getOutputPath();

    /**
     * Named parameters of the job, in declaration order, for logging.
     */
    Map<String, BucketPath> getSettings();
}
