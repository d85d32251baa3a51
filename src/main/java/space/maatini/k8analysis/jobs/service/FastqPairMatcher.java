package space.maatini.k8analysis.jobs.service;

import jakarta.enterprise.context.ApplicationScoped;
import space.maatini.k8analysis.common.exception.AmbiguousReadMarkerException;
import space.maatini.k8analysis.common.exception.UnbalancedPairException;
import space.maatini.k8analysis.jobs.model.ReadPair;
import space.maatini.k8analysis.storage.model.BucketPath;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Pairs up read 1 and read 2 FASTQ files by their file names.
 * <p>
 * A read 1 file name contains {@value #READ1_MARKER} exactly once and no {@value #READ2_MARKER},
 * and vice versa. The pair name is the file name with the marker replaced by
 * {@value #READ_PAIR_MARKER} and everything from the first dot removed.
 */
@ApplicationScoped
public class FastqPairMatcher {

    public static final String READ1_MARKER = "_R1_";
    public static final String READ2_MARKER = "_R2_";
    public static final String READ_PAIR_MARKER = "_R?_";

    /**
     * Pair up FASTQ files.
     *
     * @param fastqPaths The FASTQ files, in any order.
     * @return The pairs, sorted by pair name.
     * @throws AmbiguousReadMarkerException if a file is not clearly read 1 or read 2.
     * @throws UnbalancedPairException      if some file has no mate.
     */
    public List<ReadPair> pairUp(Collection<BucketPath> fastqPaths) {
        Map<String, BucketPath> pairNameToRead1 = new HashMap<>();
        Map<String, BucketPath> pairNameToRead2 = new HashMap<>();

        for (BucketPath fastqPath : fastqPaths) {
            String fileName = fastqPath.getFileName();
            int read1Count = countOccurrences(fileName, READ1_MARKER);
            int read2Count = countOccurrences(fileName, READ2_MARKER);

            if (read1Count == 1 && read2Count == 0) {
                pairNameToRead1.put(toPairName(fileName, READ1_MARKER), fastqPath);
            } else if (read1Count == 0 && read2Count == 1) {
                pairNameToRead2.put(toPairName(fileName, READ2_MARKER), fastqPath);
            } else {
                throw new AmbiguousReadMarkerException(fastqPath, READ1_MARKER, READ2_MARKER);
            }
        }

        if (!pairNameToRead1.keySet().equals(pairNameToRead2.keySet())) {
            Set<String> missingRead2 = new TreeSet<>(pairNameToRead1.keySet());
            missingRead2.removeAll(pairNameToRead2.keySet());
            Set<String> missingRead1 = new TreeSet<>(pairNameToRead2.keySet());
            missingRead1.removeAll(pairNameToRead1.keySet());
            throw new UnbalancedPairException(missingRead2, missingRead1);
        }

        return new TreeSet<>(pairNameToRead1.keySet()).stream()
                .map(pairName -> new ReadPair(pairName, pairNameToRead1.get(pairName), pairNameToRead2.get(pairName)))
                .collect(Collectors.toList());
    }

    static String toPairName(String fileName, String marker) {
        String pairName = fileName.replace(marker, READ_PAIR_MARKER);
        int dot = pairName.indexOf('.');
        return dot < 0 ? pairName : pairName.substring(0, dot);
    }

    static int countOccurrences(String value, String marker) {
        int count = 0;
        int index = value.indexOf(marker);
        while (index >= 0) {
            count++;
            index = value.indexOf(marker, index + marker.length());
        }
        return count;
    }
}
