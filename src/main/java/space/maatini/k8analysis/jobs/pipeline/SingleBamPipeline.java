package space.maatini.k8analysis.jobs.pipeline;

import space.maatini.k8analysis.common.exception.NoInputsFoundException;
import space.maatini.k8analysis.jobs.model.SingleBamJob;
import space.maatini.k8analysis.storage.client.ObjectStoreClient;
import space.maatini.k8analysis.storage.model.BucketPath;
import space.maatini.k8analysis.storage.service.LocalFileCache;
import space.maatini.k8analysis.tools.GenomicsToolbox;

import java.nio.file.Path;
import java.util.List;

/**
 * Base for jobs that download one BAM with its index, run a tool on it and upload the result.
 */
public abstract class SingleBamPipeline<J extends SingleBamJob> extends JobPipeline<J> {

    protected SingleBamPipeline(ObjectStoreClient storeClient, LocalFileCache fileCache, GenomicsToolbox toolbox) {
        super(storeClient, fileCache, toolbox);
    }

    @Override
    protected void run(J job) {
        BucketPath input = job.getInputPath();
        if (!storeClient.exists(input)) {
            throw new NoInputsFoundException("input BAM", input);
        }

        stageIn(List.of(input, input.withSuffix(BAM_INDEX_SUFFIX)));

        process(localPath(input), localPath(job.getOutputPath()));

        stageOut(outputsOf(job));
    }

    /**
     * Produce the local output files from the local input BAM.
     */
    protected abstract void process(Path localInput, Path localOutput);

    /**
     * The objects to upload; by default only the output itself.
     */
    protected List<BucketPath> outputsOf(J job) {
        return List.of(job.getOutputPath());
    }
}
