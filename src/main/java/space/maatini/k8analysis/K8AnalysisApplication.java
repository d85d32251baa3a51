package space.maatini.k8analysis;

import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import space.maatini.k8analysis.common.exception.ValidationException;
import space.maatini.k8analysis.jobs.model.Job;
import space.maatini.k8analysis.jobs.service.JobArgumentParser;
import space.maatini.k8analysis.jobs.service.JobRunner;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command line entry point: {@code [--dry-run] <job> <options> [<job> <options> ...]}.
 * <p>
 * Exit code 0 when every job completed or was skipped, 1 when a job failed and 2 when the
 * arguments are invalid. A dry run only parses and logs the jobs.
 */
@QuarkusMain
public class K8AnalysisApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(K8AnalysisApplication.class);

    public static final String DRY_RUN_FLAG = "--dry-run";

    public static final int EXIT_OK = 0;
    public static final int EXIT_JOB_FAILED = 1;
    public static final int EXIT_INVALID_ARGUMENTS = 2;

    @Inject
    JobArgumentParser argumentParser;

    @Inject
    JobRunner jobRunner;

    @Override
    public int run(String... args) {
        List<String> arguments = new ArrayList<>(JobArgumentParser.tokenize(Arrays.asList(args)));
        boolean dryRun = arguments.remove(DRY_RUN_FLAG);

        LOG.infof("Starting %sk8analysis.", dryRun ? "dry run for " : "");

        LOG.info("Extracting jobs from arguments.");
        List<Job> jobs;
        try {
            jobs = argumentParser.extractJobs(arguments);
        } catch (ValidationException e) {
            LOG.errorf("Invalid arguments: %s", e.getMessage());
            return EXIT_INVALID_ARGUMENTS;
        }

        if (jobs.isEmpty()) {
            LOG.warn("No jobs detected.");
        } else if (dryRun) {
            jobs.forEach(job -> LOG.infof("Would run %s", job));
        } else {
            int failures = jobRunner.runAll(jobs);
            if (failures > 0) {
                LOG.errorf("%d of %d jobs failed.", failures, jobs.size());
                LOG.info("Finished k8analysis.");
                return EXIT_JOB_FAILED;
            }
        }

        LOG.infof("Finished %sk8analysis.", dryRun ? "dry run for " : "");
        return EXIT_OK;
    }
}
