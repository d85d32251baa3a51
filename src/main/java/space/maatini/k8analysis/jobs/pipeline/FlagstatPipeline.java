package space.maatini.k8analysis.jobs.pipeline;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import space.maatini.k8analysis.jobs.model.FlagstatJob;
import space.maatini.k8analysis.storage.client.ObjectStoreClient;
import space.maatini.k8analysis.storage.service.LocalFileCache;
import space.maatini.k8analysis.tools.GenomicsToolbox;

import java.nio.file.Path;

@ApplicationScoped
public class FlagstatPipeline extends SingleBamPipeline<FlagstatJob> {

    private static final Logger LOG = Logger.getLogger(FlagstatPipeline.class);

    @Inject
    public FlagstatPipeline(ObjectStoreClient storeClient, LocalFileCache fileCache, GenomicsToolbox toolbox) {
        super(storeClient, fileCache, toolbox);
    }

    @Override
    protected void process(Path localInput, Path localOutput) {
        LOG.infof("Starting flagstat of %s", localInput);
        toolbox.flagstat(localInput, localOutput);
        LOG.infof("Finished flagstat, written to %s", localOutput);
    }

    @Override
    protected Logger logger() {
        return LOG;
    }
}
