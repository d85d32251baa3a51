package space.maatini.k8analysis.jobs.service;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

/**
 * Options of the jobs that read one BAM. The output is another BAM for the deduplication jobs and a
 * plain file for the statistics jobs.
 */
abstract class SingleBamOptions {

    @Parameter(names = {"--input", "-i"}, required = true, validateWith = OptionValidators.BamPath.class,
            description = "Path of the input BAM, with its .bai index alongside")
    String input;

    abstract String output();

    @Parameters(separators = "=")
    static class BamOutput extends SingleBamOptions {

        @Parameter(names = {"--output", "-o"}, required = true, validateWith = OptionValidators.BamPath.class,
                description = "Path of the BAM to create")
        String output;

        @Override
        String output() {
            return output;
        }
    }

    @Parameters(separators = "=")
    static class FileOutput extends SingleBamOptions {

        @Parameter(names = {"--output", "-o"}, required = true, validateWith = OptionValidators.AnyBucketPath.class,
                description = "Path of the file to create")
        String output;

        @Override
        String output() {
            return output;
        }
    }
}
