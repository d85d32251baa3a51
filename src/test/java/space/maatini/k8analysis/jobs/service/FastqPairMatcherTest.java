package space.maatini.k8analysis.jobs.service;

import org.junit.jupiter.api.Test;
import space.maatini.k8analysis.common.exception.AmbiguousReadMarkerException;
import space.maatini.k8analysis.common.exception.UnbalancedPairException;
import space.maatini.k8analysis.jobs.model.ReadPair;
import space.maatini.k8analysis.storage.model.BucketPath;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FastqPairMatcher.
 */
class FastqPairMatcherTest {

    private final FastqPairMatcher matcher = new FastqPairMatcher();

    private static BucketPath fastq(String fileName) {
        return BucketPath.parse("gs://bucket/runs/" + fileName);
    }

    @Test
    void testPairUp_SinglePair() {
        BucketPath read1 = fastq("A_R1_.fastq.gz");
        BucketPath read2 = fastq("A_R2_.fastq.gz");

        List<ReadPair> pairs = matcher.pairUp(List.of(read2, read1));

        assertEquals(1, pairs.size());
        assertEquals("A_R?_", pairs.get(0).getPairName());
        assertEquals(read1, pairs.get(0).getRead1());
        assertEquals(read2, pairs.get(0).getRead2());
    }

    @Test
    void testPairUp_SortedByPairName() {
        List<ReadPair> pairs = matcher.pairUp(List.of(
                fastq("S_FC_S1_L002_R2_001.fastq.gz"),
                fastq("S_FC_S1_L001_R1_001.fastq.gz"),
                fastq("S_FC_S1_L002_R1_001.fastq.gz"),
                fastq("S_FC_S1_L001_R2_001.fastq.gz")));

        assertEquals(2, pairs.size());
        assertEquals("S_FC_S1_L001_R?_001", pairs.get(0).getPairName());
        assertEquals("S_FC_S1_L002_R?_001", pairs.get(1).getPairName());
    }

    @Test
    void testPairUp_Empty() {
        assertTrue(matcher.pairUp(List.of()).isEmpty());
    }

    @Test
    void testPairUp_MissingMate() {
        UnbalancedPairException exception = assertThrows(UnbalancedPairException.class,
                () -> matcher.pairUp(List.of(fastq("A_R1_.fastq.gz"), fastq("A_R2_.fastq.gz"),
                        fastq("B_R1_.fastq.gz"))));

        assertEquals(Set.of("B_R?_"), exception.getMissingRead2());
        assertTrue(exception.getMissingRead1().isEmpty());
    }

    @Test
    void testPairUp_BothMarkers() {
        assertThrows(AmbiguousReadMarkerException.class,
                () -> matcher.pairUp(List.of(fastq("A_R1__R2_.fastq.gz"))));
    }

    @Test
    void testPairUp_NoMarker() {
        AmbiguousReadMarkerException exception = assertThrows(AmbiguousReadMarkerException.class,
                () -> matcher.pairUp(List.of(fastq("A.fastq.gz"))));

        assertEquals(fastq("A.fastq.gz"), exception.getPath());
    }

    @Test
    void testPairUp_RepeatedMarker() {
        assertThrows(AmbiguousReadMarkerException.class,
                () -> matcher.pairUp(List.of(fastq("A_R1__R1_.fastq.gz"))));
    }

    @Test
    void testPairUp_MarkerInDirectoryIsIgnored() {
        List<ReadPair> pairs = matcher.pairUp(List.of(
                BucketPath.parse("gs://bucket/x_R1_/A_R1_.fastq.gz"),
                BucketPath.parse("gs://bucket/x_R1_/A_R2_.fastq.gz")));

        assertEquals(1, pairs.size());
    }

    @Test
    void testToPairName() {
        assertEquals("A_R?_001", FastqPairMatcher.toPairName("A_R1_001.fastq.gz", "_R1_"));
        assertEquals("A_R?_", FastqPairMatcher.toPairName("A_R2_", "_R2_"));
    }

    @Test
    void testCountOccurrences() {
        assertEquals(0, FastqPairMatcher.countOccurrences("A.fastq", "_R1_"));
        assertEquals(2, FastqPairMatcher.countOccurrences("A_R1__R1_", "_R1_"));
    }
}
