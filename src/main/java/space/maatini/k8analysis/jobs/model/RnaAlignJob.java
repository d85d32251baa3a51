package space.maatini.k8analysis.jobs.model;

import space.maatini.k8analysis.storage.model.BucketPath;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Align paired RNA reads against a prepared genome resource directory, producing one indexed BAM.
 */
public final class RnaAlignJob implements Job {

    private final BucketPath inputPattern;
    private final BucketPath referenceResourceDirectory;
    private final BucketPath outputPath;

    public RnaAlignJob(BucketPath inputPattern, BucketPath referenceResourceDirectory, BucketPath outputPath) {
        this.inputPattern = Objects.requireNonNull(inputPattern);
        this.referenceResourceDirectory = Objects.requireNonNull(referenceResourceDirectory);
        this.outputPath = Objects.requireNonNull(outputPath);
    }

    @Override
    public JobType getJobType() {
        return JobType.RNA_ALIGN;
    }

    public BucketPath getInputPattern() {
        return inputPattern;
    }

    public BucketPath getReferenceResourceDirectory() {
        return referenceResourceDirectory;
    }

    @Override
    public BucketPath getOutputPath() {
        return outputPath;
    }

    @Override
    public Map<String, BucketPath> getSettings() {
        Map<String, BucketPath> settings = new LinkedHashMap<>();
        settings.put("input_path", inputPattern);
        settings.put("ref_genome", referenceResourceDirectory);
        settings.put("output_path", outputPath);
        return settings;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RnaAlignJob)) {
            return false;
        }
        RnaAlignJob other = (RnaAlignJob) o;
        return inputPattern.equals(other.inputPattern)
                && referenceResourceDirectory.equals(other.referenceResourceDirectory)
                && outputPath.equals(other.outputPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputPattern, referenceResourceDirectory, outputPath);
    }

    @Override
    public String toString() {
        return "RnaAlignJob" + getSettings();
    }
}
