package space.maatini.k8analysis.storage.model;

/**
 * Result of a single cache transfer.
 */
public enum TransferStatus {
    /** The local copy already existed, nothing was transferred. */
    SKIP,
    SUCCESS
}
