package space.maatini.k8analysis.jobs.pipeline;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import space.maatini.k8analysis.jobs.model.UmiDedupJob;
import space.maatini.k8analysis.storage.client.ObjectStoreClient;
import space.maatini.k8analysis.storage.model.BucketPath;
import space.maatini.k8analysis.storage.service.LocalFileCache;
import space.maatini.k8analysis.tools.GenomicsToolbox;

import java.nio.file.Path;
import java.util.List;

@ApplicationScoped
public class UmiDedupPipeline extends SingleBamPipeline<UmiDedupJob> {

    private static final Logger LOG = Logger.getLogger(UmiDedupPipeline.class);

    @Inject
    public UmiDedupPipeline(ObjectStoreClient storeClient, LocalFileCache fileCache, GenomicsToolbox toolbox) {
        super(storeClient, fileCache, toolbox);
    }

    @Override
    protected void process(Path localInput, Path localOutput) {
        LOG.info("Starting UMI deduplication");
        toolbox.deduplicateWithUmi(localInput, localOutput);
        LOG.info("Finished UMI deduplication");

        LOG.info("Starting creation of bam index");
        toolbox.createBamIndex(localOutput);
        LOG.info("Finished creation of bam index");
    }

    @Override
    protected List<BucketPath> outputsOf(UmiDedupJob job) {
        return List.of(job.getOutputPath(), job.getOutputPath().withSuffix(BAM_INDEX_SUFFIX));
    }

    @Override
    protected Logger logger() {
        return LOG;
    }
}
