package space.maatini.k8analysis.jobs.service;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.ParameterException;
import space.maatini.k8analysis.common.exception.InvalidPathException;
import space.maatini.k8analysis.storage.model.BucketPath;

import java.util.regex.Pattern;

/**
 * Value checks for job options. Every accepted value can be parsed as a {@link BucketPath} that maps
 * one-to-one onto the local file cache.
 */
public final class OptionValidators {

    static final Pattern BUCKET_PATH_PATTERN = Pattern.compile("^gs://[a-zA-Z0-9/._-]+$");
    static final Pattern BAM_BUCKET_PATH_PATTERN = Pattern.compile("^gs://[a-zA-Z0-9/._-]+\\.bam$");
    static final Pattern WILDCARD_FASTQ_BUCKET_PATH_PATTERN = Pattern.compile("^gs://[a-zA-Z0-9*/._-]+\\.fastq\\.gz$");

    private OptionValidators() {
    }

    abstract static class PatternValidator implements IParameterValidator {

        private final Pattern pattern;

        PatternValidator(Pattern pattern) {
            this.pattern = pattern;
        }

        @Override
        public void validate(String name, String value) throws ParameterException {
            if (!pattern.matcher(value).matches()) {
                throw new ParameterException("Value '" + value + "' of option " + name
                        + " does not match the regex pattern '" + pattern.pattern() + "'.");
            }
            requireMappable(value);
        }
    }

    public static class AnyBucketPath extends PatternValidator {
        public AnyBucketPath() {
            super(BUCKET_PATH_PATTERN);
        }
    }

    public static class BamPath extends PatternValidator {
        public BamPath() {
            super(BAM_BUCKET_PATH_PATTERN);
        }
    }

    public static class WildcardFastqPath extends PatternValidator {
        public WildcardFastqPath() {
            super(WILDCARD_FASTQ_BUCKET_PATH_PATTERN);
        }
    }

    /**
     * {@value JobArgumentParser#REF_GENOME_37}, {@value JobArgumentParser#REF_GENOME_38} or a bucket path.
     */
    public static class ReferenceGenome implements IParameterValidator {

        @Override
        public void validate(String name, String value) throws ParameterException {
            if (JobArgumentParser.REF_GENOME_37.equals(value) || JobArgumentParser.REF_GENOME_38.equals(value)) {
                return;
            }
            if (!BUCKET_PATH_PATTERN.matcher(value).matches()) {
                throw new ParameterException("Value '" + value + "' of option " + name + " does not match '"
                        + JobArgumentParser.REF_GENOME_37 + "', '" + JobArgumentParser.REF_GENOME_38
                        + "' or regex '" + BUCKET_PATH_PATTERN.pattern() + "'.");
            }
            requireMappable(value);
        }
    }

    private static void requireMappable(String value) {
        try {
            BucketPath.parse(value).requireMappableSegments();
        } catch (InvalidPathException e) {
            throw new ParameterException(e.getMessage(), e);
        }
    }
}
