package space.maatini.k8analysis.common.exception;

import java.util.Set;

/**
 * Exception thrown when read 1 and read 2 files cannot all be matched into pairs.
 */
public class UnbalancedPairException extends ValidationException {

    private final Set<String> missingRead2;
    private final Set<String> missingRead1;

    public UnbalancedPairException(Set<String> missingRead2, Set<String> missingRead1) {
        super("Not all FASTQ files can be matched up in proper pairs of read 1 and read 2: "
                + "pairs without read 2 " + missingRead2 + ", pairs without read 1 " + missingRead1);
        this.missingRead2 = Set.copyOf(missingRead2);
        this.missingRead1 = Set.copyOf(missingRead1);
    }

    public Set<String> getMissingRead2() {
        return missingRead2;
    }

    public Set<String> getMissingRead1() {
        return missingRead1;
    }
}
