package space.maatini.k8analysis.jobs.service;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(separators = "=")
class RnaAlignOptions {

    @Parameter(names = {"--input", "-i"}, required = true, validateWith = OptionValidators.WildcardFastqPath.class,
            description = "Wildcard path of the FASTQ files")
    String input;

    @Parameter(names = {"--ref-genome-dir", "-r"}, required = true, validateWith = OptionValidators.AnyBucketPath.class,
            description = "Directory with the STAR genome resource files")
    String referenceResourceDirectory;

    @Parameter(names = {"--output", "-o"}, required = true, validateWith = OptionValidators.BamPath.class,
            description = "Path of the BAM to create")
    String output;
}
