package space.maatini.k8analysis.jobs.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * The kinds of job, each identified on the command line by its job name.
 */
public enum JobType {
    DNA_ALIGN,
    RNA_ALIGN,
    DEDUP,
    UMI_DEDUP,
    FLAGSTAT,
    COUNT_MAPPING_COORDS;

    public String getJobName() {
        return name().toLowerCase();
    }

    public static Optional<JobType> fromJobName(String jobName) {
        return Arrays.stream(values())
                .filter(type -> type.getJobName().equals(jobName))
                .findFirst();
    }

    public static Set<String> getJobNames() {
        return Arrays.stream(values())
                .map(JobType::getJobName)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
