package space.maatini.k8analysis.jobs.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Local counterpart of a {@link ReadPair}, pointing into the file cache.
 */
public final class LocalReadPair {

    private final String pairName;
    private final Path read1;
    private final Path read2;

    public LocalReadPair(String pairName, Path read1, Path read2) {
        this.pairName = Objects.requireNonNull(pairName);
        this.read1 = Objects.requireNonNull(read1);
        this.read2 = Objects.requireNonNull(read2);
    }

    public String getPairName() {
        return pairName;
    }

    public Path getRead1() {
        return read1;
    }

    public Path getRead2() {
        return read2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LocalReadPair)) {
            return false;
        }
        LocalReadPair other = (LocalReadPair) o;
        return pairName.equals(other.pairName) && read1.equals(other.read1) && read2.equals(other.read2);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pairName, read1, read2);
    }
}
