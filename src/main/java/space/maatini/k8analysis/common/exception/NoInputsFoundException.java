package space.maatini.k8analysis.common.exception;

import space.maatini.k8analysis.storage.model.BucketPath;

/**
 * Exception thrown when input discovery for a job yields nothing.
 */
public class NoInputsFoundException extends K8AnalysisException {

    private final BucketPath searchPath;

    public NoInputsFoundException(String description, BucketPath searchPath) {
        super("Could not find " + description + " matching the path " + searchPath);
        this.searchPath = searchPath;
    }

    public BucketPath getSearchPath() {
        return searchPath;
    }
}
