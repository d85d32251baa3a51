package space.maatini.k8analysis.tools;

import space.maatini.k8analysis.jobs.model.LocalReadPair;

import java.nio.file.Path;
import java.util.List;

/**
 * Interface for the external command line tools run by jobs.
 * <p>
 * Every call is synchronous: it either produces its output file(s) or throws
 * {@link space.maatini.k8analysis.common.exception.ExternalToolException}.
 */
public interface GenomicsToolbox {

    /**
     * Align one lane with bwa mem and write a coordinate-sorted BAM.
     *
     * @param readPair        The lane's local FASTQ files.
     * @param referenceGenome The local reference FASTA, with its bwa index files alongside.
     * @param outputBam       The BAM to write.
     * @param readGroup       The read group line, e.g. {@code @RG\tID:...}.
     */
    void alignDnaBam(LocalReadPair readPair, Path referenceGenome, Path outputBam, String readGroup);

    /**
     * Align all lanes with STAR into the working directory.
     *
     * @param readPairs        The local FASTQ pairs.
     * @param genomeDirectory  The local STAR genome resource directory.
     * @param workingDirectory Directory for STAR's output files.
     * @return The unsorted BAM written by STAR.
     */
    Path alignRnaBam(List<LocalReadPair> readPairs, Path genomeDirectory, Path workingDirectory);

    void sortBam(Path inputBam, Path outputBam);

    void mergeBams(List<Path> inputBams, Path outputBam);

    /**
     * Index a BAM, writing {@code <bam>.bai} next to it.
     */
    void createBamIndex(Path bam);

    void deduplicateWithoutUmi(Path inputBam, Path outputBam);

    void deduplicateWithUmi(Path inputBam, Path outputBam);

    void flagstat(Path inputBam, Path outputFile);

    /**
     * Write the number of distinct (contig, position) mapping coordinates of a BAM.
     */
    void countMappingCoordinates(Path inputBam, Path outputFile);
}
