package space.maatini.k8analysis.jobs.service;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.text.StringTokenizer;
import org.apache.commons.text.matcher.StringMatcherFactory;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import space.maatini.k8analysis.common.exception.ValidationException;
import space.maatini.k8analysis.jobs.model.DedupJob;
import space.maatini.k8analysis.jobs.model.DnaAlignJob;
import space.maatini.k8analysis.jobs.model.FlagstatJob;
import space.maatini.k8analysis.jobs.model.Job;
import space.maatini.k8analysis.jobs.model.JobType;
import space.maatini.k8analysis.jobs.model.MappingCoordsCountJob;
import space.maatini.k8analysis.jobs.model.RnaAlignJob;
import space.maatini.k8analysis.jobs.model.UmiDedupJob;
import space.maatini.k8analysis.storage.model.BucketPath;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns command line arguments into jobs.
 * <p>
 * Grammar: {@code <job name> <options> [<job name> <options> ...]}, e.g.
 * {@code dna_align -i gs://b/reads/sample_*.fastq.gz -r 37 -o gs://b/out/sample.bam}.
 */
@ApplicationScoped
public class JobArgumentParser {

    private static final Logger LOG = Logger.getLogger(JobArgumentParser.class);

    public static final String REF_GENOME_37 = "37";
    public static final String REF_GENOME_38 = "38";

    private final Map<String, String> referenceGenomeAliases;

    @Inject
    public JobArgumentParser(
            @ConfigProperty(name = "k8analysis.reference-genome.37") String referenceGenome37,
            @ConfigProperty(name = "k8analysis.reference-genome.38") String referenceGenome38) {
        this.referenceGenomeAliases = Map.of(REF_GENOME_37, referenceGenome37, REF_GENOME_38, referenceGenome38);
    }

    /**
     * Parse all jobs, in order.
     *
     * @throws ValidationException if any job name, option or value is invalid.
     */
    public List<Job> extractJobs(List<String> arguments) {
        List<String> tokens = tokenize(arguments);
        Set<String> jobNames = JobType.getJobNames();

        List<Job> jobs = new ArrayList<>();
        int index = 0;
        while (index < tokens.size()) {
            JobType jobType = toJobType(tokens.get(index++));
            LOG.infof("Detected job of type: %s.", jobType.getJobName());

            List<String> jobArguments = new ArrayList<>();
            while (index < tokens.size() && !jobNames.contains(tokens.get(index))) {
                jobArguments.add(tokens.get(index++));
            }
            jobs.add(parseJob(jobType, jobArguments));
        }
        return jobs;
    }

    Job parseJob(JobType jobType, List<String> jobArguments) {
        return switch (jobType) {
            case DNA_ALIGN -> toDnaAlignJob(parseOptions(jobType, jobArguments, new DnaAlignOptions()));
            case RNA_ALIGN -> toRnaAlignJob(parseOptions(jobType, jobArguments, new RnaAlignOptions()));
            case DEDUP -> {
                SingleBamOptions options = parseOptions(jobType, jobArguments, new SingleBamOptions.BamOutput());
                yield new DedupJob(BucketPath.parse(options.input), BucketPath.parse(options.output()));
            }
            case UMI_DEDUP -> {
                SingleBamOptions options = parseOptions(jobType, jobArguments, new SingleBamOptions.BamOutput());
                yield new UmiDedupJob(BucketPath.parse(options.input), BucketPath.parse(options.output()));
            }
            case FLAGSTAT -> {
                SingleBamOptions options = parseOptions(jobType, jobArguments, new SingleBamOptions.FileOutput());
                yield new FlagstatJob(BucketPath.parse(options.input), BucketPath.parse(options.output()));
            }
            case COUNT_MAPPING_COORDS -> {
                SingleBamOptions options = parseOptions(jobType, jobArguments, new SingleBamOptions.FileOutput());
                yield new MappingCoordsCountJob(BucketPath.parse(options.input), BucketPath.parse(options.output()));
            }
        };
    }

    private DnaAlignJob toDnaAlignJob(DnaAlignOptions options) {
        return new DnaAlignJob(
                BucketPath.parse(options.input),
                resolveReferenceGenome(options.referenceGenome),
                BucketPath.parse(options.output));
    }

    private static RnaAlignJob toRnaAlignJob(RnaAlignOptions options) {
        return new RnaAlignJob(
                BucketPath.parse(options.input),
                BucketPath.parse(options.referenceResourceDirectory),
                BucketPath.parse(options.output));
    }

    private static <T> T parseOptions(JobType jobType, List<String> jobArguments, T options) {
        JCommander commander = new JCommander();
        commander.setProgramName(jobType.getJobName());
        commander.setAcceptUnknownOptions(false);
        commander.setAllowAbbreviatedOptions(false);
        commander.addObject(options);
        try {
            commander.parse(jobArguments.toArray(new String[0]));
        } catch (ParameterException e) {
            throw new ValidationException("Invalid arguments for job " + jobType.getJobName() + ": "
                    + e.getMessage(), e);
        }
        return options;
    }

    // ==================== Values ====================

    private BucketPath resolveReferenceGenome(String value) {
        String alias = referenceGenomeAliases.get(value);
        return BucketPath.parse(alias != null ? alias : value);
    }

    private static JobType toJobType(String jobName) {
        return JobType.fromJobName(jobName)
                .orElseThrow(() -> new ValidationException("Unrecognized job name '" + jobName
                        + "'. Recognized job names: " + JobType.getJobNames()));
    }

    /**
     * Arguments may arrive as a single string, e.g. from a container definition; split on whitespace,
     * honouring single and double quotes.
     */
    public static List<String> tokenize(List<String> arguments) {
        List<String> tokens = new ArrayList<>();
        for (String argument : arguments) {
            StringTokenizer tokenizer = new StringTokenizer(argument,
                    StringMatcherFactory.INSTANCE.splitMatcher(),
                    StringMatcherFactory.INSTANCE.quoteMatcher());
            tokens.addAll(tokenizer.getTokenList());
        }
        return tokens;
    }
}
