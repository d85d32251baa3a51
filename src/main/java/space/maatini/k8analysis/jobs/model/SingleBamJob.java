package space.maatini.k8analysis.jobs.model;

import space.maatini.k8analysis.storage.model.BucketPath;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A job that reads one indexed BAM and writes one output object.
 */
public abstract class SingleBamJob implements Job {

    private final BucketPath inputPath;
    private final BucketPath outputPath;

    protected SingleBamJob(BucketPath inputPath, BucketPath outputPath) {
        this.inputPath = Objects.requireNonNull(inputPath);
        this.outputPath = Objects.requireNonNull(outputPath);
    }

    public BucketPath getInputPath() {
        return inputPath;
    }

    @Override
    public BucketPath getOutputPath() {
        return outputPath;
    }

    @Override
    public Map<String, BucketPath> getSettings() {
        Map<String, BucketPath> settings = new LinkedHashMap<>();
        settings.put("input_path", inputPath);
        settings.put("output_path", outputPath);
        return settings;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SingleBamJob other = (SingleBamJob) o;
        return inputPath.equals(other.inputPath) && outputPath.equals(other.outputPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), inputPath, outputPath);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + getSettings();
    }
}
