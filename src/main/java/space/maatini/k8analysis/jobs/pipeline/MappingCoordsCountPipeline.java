package space.maatini.k8analysis.jobs.pipeline;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import space.maatini.k8analysis.jobs.model.MappingCoordsCountJob;
import space.maatini.k8analysis.storage.client.ObjectStoreClient;
import space.maatini.k8analysis.storage.service.LocalFileCache;
import space.maatini.k8analysis.tools.GenomicsToolbox;

import java.nio.file.Path;

@ApplicationScoped
public class MappingCoordsCountPipeline extends SingleBamPipeline<MappingCoordsCountJob> {

    private static final Logger LOG = Logger.getLogger(MappingCoordsCountPipeline.class);

    @Inject
    public MappingCoordsCountPipeline(ObjectStoreClient storeClient, LocalFileCache fileCache, GenomicsToolbox toolbox) {
        super(storeClient, fileCache, toolbox);
    }

    @Override
    protected void process(Path localInput, Path localOutput) {
        LOG.infof("Starting count of mapping coordinates of %s", localInput);
        toolbox.countMappingCoordinates(localInput, localOutput);
        LOG.infof("Finished count of mapping coordinates, written to %s", localOutput);
    }

    @Override
    protected Logger logger() {
        return LOG;
    }
}
