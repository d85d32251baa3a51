package space.maatini.k8analysis.jobs.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import space.maatini.k8analysis.common.exception.NoInputsFoundException;
import space.maatini.k8analysis.jobs.model.LocalReadPair;
import space.maatini.k8analysis.jobs.model.RnaAlignJob;
import space.maatini.k8analysis.jobs.service.FastqPairMatcher;
import space.maatini.k8analysis.storage.model.BucketPath;
import space.maatini.k8analysis.storage.service.LocalFileCache;
import space.maatini.k8analysis.testutil.FsObjectStoreClient;
import space.maatini.k8analysis.testutil.TestFiles;
import space.maatini.k8analysis.tools.GenomicsToolbox;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RnaAlignPipeline.
 */
class RnaAlignPipelineTest {

    private static final BucketPath GENOME_DIR = BucketPath.parse("gs://refs/star/38");
    private static final BucketPath INPUT = BucketPath.parse("gs://bucket/rna/S_*.fastq.gz");
    private static final BucketPath OUTPUT = BucketPath.parse("gs://bucket/out/S.bam");
    private static final RnaAlignJob JOB = new RnaAlignJob(INPUT, GENOME_DIR, OUTPUT);

    @TempDir
    Path tempDir;

    private FsObjectStoreClient store;
    private LocalFileCache cache;
    private GenomicsToolbox toolbox;
    private Path workingDirectory;
    private RnaAlignPipeline pipeline;

    @BeforeEach
    void setUp() {
        store = new FsObjectStoreClient(tempDir.resolve("remote"));
        cache = new LocalFileCache(tempDir.resolve("cache"), store);
        toolbox = mock(GenomicsToolbox.class);
        workingDirectory = tempDir.resolve("work");
        pipeline = new RnaAlignPipeline(store, cache, toolbox, new FastqPairMatcher(), workingDirectory);

        store.put(GENOME_DIR.withSuffix("/SA"), "sa");
        store.put(GENOME_DIR.withSuffix("/Genome"), "genome");

        doAnswer(invocation -> {
            Path workDir = invocation.getArgument(2);
            return TestFiles.write(workDir.resolve("Aligned.out.bam"), "unsorted");
        }).when(toolbox).alignRnaBam(anyList(), any(), any());
        doAnswer(invocation -> {
            TestFiles.write(invocation.getArgument(1), "sorted " + TestFiles.read(invocation.getArgument(0)));
            return null;
        }).when(toolbox).sortBam(any(), any());
        doAnswer(invocation -> {
            Path bam = invocation.getArgument(0);
            TestFiles.write(bam.resolveSibling(bam.getFileName() + ".bai"), "index");
            return null;
        }).when(toolbox).createBamIndex(any());
    }

    @Test
    void testAllLanesAlignedTogether() {
        for (String lane : List.of("L001", "L002")) {
            store.put(BucketPath.parse("gs://bucket/rna/S_FC_S1_" + lane + "_R1_001.fastq.gz"), "r1");
            store.put(BucketPath.parse("gs://bucket/rna/S_FC_S1_" + lane + "_R2_001.fastq.gz"), "r2");
        }

        assertEquals(JobOutcome.COMPLETED, pipeline.execute(JOB));

        List<LocalReadPair> expectedPairs = List.of(
                new LocalReadPair("S_FC_S1_L001_R?_001",
                        cache.localPathFor(BucketPath.parse("gs://bucket/rna/S_FC_S1_L001_R1_001.fastq.gz")),
                        cache.localPathFor(BucketPath.parse("gs://bucket/rna/S_FC_S1_L001_R2_001.fastq.gz"))),
                new LocalReadPair("S_FC_S1_L002_R?_001",
                        cache.localPathFor(BucketPath.parse("gs://bucket/rna/S_FC_S1_L002_R1_001.fastq.gz")),
                        cache.localPathFor(BucketPath.parse("gs://bucket/rna/S_FC_S1_L002_R2_001.fastq.gz"))));
        verify(toolbox).alignRnaBam(eq(expectedPairs), eq(cache.localPathFor(GENOME_DIR)), eq(workingDirectory));
        verify(toolbox).sortBam(workingDirectory.resolve("Aligned.out.bam"), cache.localPathFor(OUTPUT));
        assertEquals("sorted unsorted", store.read(OUTPUT));
        assertEquals("index", store.read(OUTPUT.withSuffix(".bai")));
    }

    @Test
    void testOutputExists_Skipped() {
        store.put(OUTPUT, "bam");

        assertEquals(JobOutcome.SKIPPED, pipeline.execute(JOB));
        verifyNoInteractions(toolbox);
        assertTrue(store.getGlobs().isEmpty());
        assertTrue(store.getListings().isEmpty());
        assertTrue(store.getDownloads().isEmpty());
    }

    @Test
    void testEmptyGenomeDirectory() {
        store.put(BucketPath.parse("gs://bucket/rna/S_FC_S1_L001_R1_001.fastq.gz"), "r1");
        store.put(BucketPath.parse("gs://bucket/rna/S_FC_S1_L001_R2_001.fastq.gz"), "r2");
        RnaAlignJob job = new RnaAlignJob(INPUT, BucketPath.parse("gs://refs/star/37"), OUTPUT);

        assertThrows(NoInputsFoundException.class, () -> pipeline.execute(job));
        verifyNoInteractions(toolbox);
    }
}
