package space.maatini.k8analysis.jobs.model;

import space.maatini.k8analysis.storage.model.BucketPath;
import space.maatini.k8analysis.storage.service.LocalFileCache;

import java.util.Objects;

/**
 * Read 1 and read 2 FASTQ files of one sequencing lane, joined on their shared pair name.
 */
public final class ReadPair {

    private final String pairName;
    private final BucketPath read1;
    private final BucketPath read2;

    public ReadPair(String pairName, BucketPath read1, BucketPath read2) {
        this.pairName = Objects.requireNonNull(pairName);
        this.read1 = Objects.requireNonNull(read1);
        this.read2 = Objects.requireNonNull(read2);
    }

    public String getPairName() {
        return pairName;
    }

    public BucketPath getRead1() {
        return read1;
    }

    public BucketPath getRead2() {
        return read2;
    }

    public LocalReadPair toLocal(LocalFileCache fileCache) {
        return new LocalReadPair(pairName, fileCache.localPathFor(read1), fileCache.localPathFor(read2));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReadPair)) {
            return false;
        }
        ReadPair other = (ReadPair) o;
        return pairName.equals(other.pairName) && read1.equals(other.read1) && read2.equals(other.read2);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pairName, read1, read2);
    }

    @Override
    public String toString() {
        return "Read1: " + read1 + "\nRead2: " + read2;
    }
}
