package space.maatini.k8analysis.jobs.pipeline;

/**
 * How a job that did not fail ended.
 */
public enum JobOutcome {
    /** The output already existed; nothing was done. */
    SKIPPED,
    COMPLETED
}
