package space.maatini.k8analysis.jobs.model;

import space.maatini.k8analysis.storage.model.BucketPath;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Align paired DNA reads to a reference genome FASTA, producing one indexed BAM.
 */
public final class DnaAlignJob implements Job {

    private final BucketPath inputPattern;
    private final BucketPath referenceGenome;
    private final BucketPath outputPath;

    public DnaAlignJob(BucketPath inputPattern, BucketPath referenceGenome, BucketPath outputPath) {
        this.inputPattern = Objects.requireNonNull(inputPattern);
        this.referenceGenome = Objects.requireNonNull(referenceGenome);
        this.outputPath = Objects.requireNonNull(outputPath);
    }

    @Override
    public JobType getJobType() {
        return JobType.DNA_ALIGN;
    }

    /**
     * Wildcard path matching the FASTQ files to align.
     */
    public BucketPath getInputPattern() {
        return inputPattern;
    }

    /**
     * Path of the reference FASTA; its index files are expected next to it.
     */
    public BucketPath getReferenceGenome() {
        return referenceGenome;
    }

    @Override
    public BucketPath getOutputPath() {
        return outputPath;
    }

    @Override
    public Map<String, BucketPath> getSettings() {
        Map<String, BucketPath> settings = new LinkedHashMap<>();
        settings.put("input_path", inputPattern);
        settings.put("ref_genome", referenceGenome);
        settings.put("output_path", outputPath);
        return settings;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DnaAlignJob)) {
            return false;
        }
        DnaAlignJob other = (DnaAlignJob) o;
        return inputPattern.equals(other.inputPattern)
                && referenceGenome.equals(other.referenceGenome)
                && outputPath.equals(other.outputPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputPattern, referenceGenome, outputPath);
    }

    @Override
    public String toString() {
        return "DnaAlignJob" + getSettings();
    }
}
