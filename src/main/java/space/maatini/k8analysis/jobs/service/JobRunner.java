package space.maatini.k8analysis.jobs.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import space.maatini.k8analysis.jobs.model.DedupJob;
import space.maatini.k8analysis.jobs.model.DnaAlignJob;
import space.maatini.k8analysis.jobs.model.FlagstatJob;
import space.maatini.k8analysis.jobs.model.Job;
import space.maatini.k8analysis.jobs.model.MappingCoordsCountJob;
import space.maatini.k8analysis.jobs.model.RnaAlignJob;
import space.maatini.k8analysis.jobs.model.UmiDedupJob;
import space.maatini.k8analysis.jobs.pipeline.DedupPipeline;
import space.maatini.k8analysis.jobs.pipeline.DnaAlignPipeline;
import space.maatini.k8analysis.jobs.pipeline.FlagstatPipeline;
import space.maatini.k8analysis.jobs.pipeline.JobOutcome;
import space.maatini.k8analysis.jobs.pipeline.MappingCoordsCountPipeline;
import space.maatini.k8analysis.jobs.pipeline.RnaAlignPipeline;
import space.maatini.k8analysis.jobs.pipeline.UmiDedupPipeline;

import java.util.List;
import java.util.function.Supplier;

/**
 * Runs jobs one at a time, in order. A failed job is logged and the next job still runs.
 */
@ApplicationScoped
public class JobRunner {

    private static final Logger LOG = Logger.getLogger(JobRunner.class);

    private final DnaAlignPipeline dnaAlignPipeline;
    private final RnaAlignPipeline rnaAlignPipeline;
    private final DedupPipeline dedupPipeline;
    private final UmiDedupPipeline umiDedupPipeline;
    private final FlagstatPipeline flagstatPipeline;
    private final MappingCoordsCountPipeline mappingCoordsCountPipeline;

    @Inject
    public JobRunner(DnaAlignPipeline dnaAlignPipeline, RnaAlignPipeline rnaAlignPipeline,
            DedupPipeline dedupPipeline, UmiDedupPipeline umiDedupPipeline, FlagstatPipeline flagstatPipeline,
            MappingCoordsCountPipeline mappingCoordsCountPipeline) {
        this.dnaAlignPipeline = dnaAlignPipeline;
        this.rnaAlignPipeline = rnaAlignPipeline;
        this.dedupPipeline = dedupPipeline;
        this.umiDedupPipeline = umiDedupPipeline;
        this.flagstatPipeline = flagstatPipeline;
        this.mappingCoordsCountPipeline = mappingCoordsCountPipeline;
    }

    /**
     * Run all jobs.
     *
     * @return The number of jobs that failed.
     */
    public int runAll(List<Job> jobs) {
        int failures = 0;
        for (int i = 0; i < jobs.size(); i++) {
            Job job = jobs.get(i);
            LOG.infof("Running job %d of %d: %s", i + 1, jobs.size(), job.getJobType().getJobName());
            try {
                JobOutcome outcome = run(job);
                LOG.infof("Job %d of %d (%s) ended: %s", i + 1, jobs.size(), job.getJobType().getJobName(), outcome);
            } catch (RuntimeException e) {
                failures++;
                LOG.errorf(e, "Job %d of %d (%s) failed: %s", i + 1, jobs.size(), job.getJobType().getJobName(),
                        e.getMessage());
            }
        }
        return failures;
    }

    /**
     * Run one job with the pipeline for its type.
     */
    public JobOutcome run(Job job) {
        Supplier<JobOutcome> execution = switch (job.getJobType()) {
            case DNA_ALIGN -> () -> dnaAlignPipeline.execute((DnaAlignJob) job);
            case RNA_ALIGN -> () -> rnaAlignPipeline.execute((RnaAlignJob) job);
            case DEDUP -> () -> dedupPipeline.execute((DedupJob) job);
            case UMI_DEDUP -> () -> umiDedupPipeline.execute((UmiDedupJob) job);
            case FLAGSTAT -> () -> flagstatPipeline.execute((FlagstatJob) job);
            case COUNT_MAPPING_COORDS -> () -> mappingCoordsCountPipeline.execute((MappingCoordsCountJob) job);
        };
        return execution.get();
    }
}
