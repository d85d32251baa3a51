package space.maatini.k8analysis.jobs.service;

import space.maatini.k8analysis.common.exception.InvalidRecordGroupException;
import space.maatini.k8analysis.jobs.model.LocalReadPair;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Derives the read group header line for a lane from its FASTQ file name.
 */
public final class ReadGroups {

    /** Illumina naming: {@code <sample>_<flowcell>_S<n>_L<lane>_R<read>...}. */
    public static final Pattern RECORD_GROUP_ID_PATTERN = Pattern.compile("(.*_){2}S[0-9]+_L[0-9]{3}_R[1-2].*");

    private static final String PLATFORM = "ILLUMINA";

    private ReadGroups() {
    }

    /**
     * Build the read group string passed to the aligner, with literal {@code \t} separators.
     *
     * @param localReadPair The lane's FASTQ files; the read 1 name is the record group ID.
     * @param finalBamPath  The final BAM; its name is the sample name.
     * @throws InvalidRecordGroupException if the read 1 name does not follow the naming scheme.
     */
    public static String readGroupString(LocalReadPair localReadPair, Path finalBamPath) {
        String recordGroupId = stripExtensions(localReadPair.getRead1().getFileName().toString());
        if (!RECORD_GROUP_ID_PATTERN.matcher(recordGroupId).matches()) {
            throw new InvalidRecordGroupException(recordGroupId, RECORD_GROUP_ID_PATTERN.pattern());
        }
        String sampleName = stripExtensions(finalBamPath.getFileName().toString());
        String flowcellId = recordGroupId.split("_", -1)[1];

        return "@RG\\tID:" + recordGroupId
                + "\\tLB:" + sampleName
                + "\\tPL:" + PLATFORM
                + "\\tPU:" + flowcellId
                + "\\tSM:" + sampleName;
    }

    private static String stripExtensions(String fileName) {
        int dot = fileName.indexOf('.');
        return dot < 0 ? fileName : fileName.substring(0, dot);
    }
}
