package space.maatini.k8analysis.common.exception;

/**
 * Exception thrown when a FASTQ file name cannot be turned into a read group.
 */
public class InvalidRecordGroupException extends ValidationException {

    private final String recordGroupId;
    private final String requiredPattern;

    public InvalidRecordGroupException(String recordGroupId, String requiredPattern) {
        super("Record group ID '" + recordGroupId + "' does not match the required regex '" + requiredPattern + "'");
        this.recordGroupId = recordGroupId;
        this.requiredPattern = requiredPattern;
    }

    public String getRecordGroupId() {
        return recordGroupId;
    }

    public String getRequiredPattern() {
        return requiredPattern;
    }
}
