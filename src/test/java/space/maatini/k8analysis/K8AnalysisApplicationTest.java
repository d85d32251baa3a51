package space.maatini.k8analysis;

import io.quarkus.test.junit.main.Launch;
import io.quarkus.test.junit.main.LaunchResult;
import io.quarkus.test.junit.main.QuarkusMainTest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the command line entry point. None of these touch object storage.
 */
@QuarkusMainTest
class K8AnalysisApplicationTest {

    @Test
    @Launch(value = {})
    void testNoArguments(LaunchResult result) {
        assertEquals(K8AnalysisApplication.EXIT_OK, result.exitCode());
    }

    @Test
    @Launch(value = {"--dry-run", "flagstat", "-i", "gs://bucket/in.bam", "-o", "gs://bucket/in.flagstat",
            "dna_align", "-i", "gs://bucket/reads/S_*.fastq.gz", "-r", "38", "-o", "gs://bucket/S.bam"})
    void testDryRun(LaunchResult result) {
        assertEquals(K8AnalysisApplication.EXIT_OK, result.exitCode());
    }

    @Test
    @Launch(value = {"--dry-run dedup --input gs://bucket/in.bam --output gs://bucket/out.bam"})
    void testDryRun_SingleStringArgument(LaunchResult result) {
        assertEquals(K8AnalysisApplication.EXIT_OK, result.exitCode());
    }

    @Test
    @Launch(value = {"variant_call", "-i", "gs://bucket/in.bam"}, exitCode = K8AnalysisApplication.EXIT_INVALID_ARGUMENTS)
    void testUnknownJob(LaunchResult result) {
        assertEquals(2, result.exitCode());
    }

    @Test
    @Launch(value = {"dedup", "-i", "gs://bucket/in.sam", "-o", "gs://bucket/out.bam"},
            exitCode = K8AnalysisApplication.EXIT_INVALID_ARGUMENTS)
    void testInvalidValue(LaunchResult result) {
        assertEquals(2, result.exitCode());
    }

    @Test
    @Launch(value = {"--dry-run dna_align -i \"gs://bucket/reads/S_*.fastq.gz\" -r '37' -o gs://bucket/S.bam"})
    void testDryRun_QuotedValues(LaunchResult result) {
        assertEquals(K8AnalysisApplication.EXIT_OK, result.exitCode());
    }

    @Test
    @Launch(value = {"flagstat", "-i", "gs://bucket/in.bam", "-o", "gs://bucket/../other/in.flagstat"},
            exitCode = K8AnalysisApplication.EXIT_INVALID_ARGUMENTS)
    void testUnmappablePath(LaunchResult result) {
        assertEquals(2, result.exitCode());
    }
}
