package space.maatini.k8analysis.jobs.service;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(separators = "=")
class DnaAlignOptions {

    @Parameter(names = {"--input", "-i"}, required = true, validateWith = OptionValidators.WildcardFastqPath.class,
            description = "Wildcard path of the FASTQ files, e.g. gs://bucket/runs/SAMPLE_*.fastq.gz")
    String input;

    @Parameter(names = {"--ref-genome", "-r"}, required = true, validateWith = OptionValidators.ReferenceGenome.class,
            description = "Reference genome: 37, 38 or the path of a FASTA file with its index files alongside")
    String referenceGenome;

    @Parameter(names = {"--output", "-o"}, required = true, validateWith = OptionValidators.BamPath.class,
            description = "Path of the BAM to create")
    String output;
}
