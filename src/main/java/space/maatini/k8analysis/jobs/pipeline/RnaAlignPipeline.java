package space.maatini.k8analysis.jobs.pipeline;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import space.maatini.k8analysis.common.util.FileUtils;
import space.maatini.k8analysis.jobs.model.LocalReadPair;
import space.maatini.k8analysis.jobs.model.ReadPair;
import space.maatini.k8analysis.jobs.model.RnaAlignJob;
import space.maatini.k8analysis.jobs.service.FastqPairMatcher;
import space.maatini.k8analysis.storage.client.ObjectStoreClient;
import space.maatini.k8analysis.storage.model.BucketPath;
import space.maatini.k8analysis.storage.service.LocalFileCache;
import space.maatini.k8analysis.tools.GenomicsToolbox;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * RNA alignment: a single STAR run over all lanes, then sort and index.
 */
@ApplicationScoped
public class RnaAlignPipeline extends JobPipeline<RnaAlignJob> {

    private static final Logger LOG = Logger.getLogger(RnaAlignPipeline.class);

    private final FastqPairMatcher pairMatcher;
    private final Path workingDirectory;

    @Inject
    public RnaAlignPipeline(ObjectStoreClient storeClient, LocalFileCache fileCache, GenomicsToolbox toolbox,
            FastqPairMatcher pairMatcher,
            @ConfigProperty(name = "k8analysis.working-directory") String workingDirectory) {
        this(storeClient, fileCache, toolbox, pairMatcher, Paths.get(workingDirectory));
    }

    public RnaAlignPipeline(ObjectStoreClient storeClient, LocalFileCache fileCache, GenomicsToolbox toolbox,
            FastqPairMatcher pairMatcher, Path workingDirectory) {
        super(storeClient, fileCache, toolbox);
        this.pairMatcher = pairMatcher;
        this.workingDirectory = workingDirectory;
    }

    @Override
    protected void run(RnaAlignJob job) {
        List<BucketPath> fastqPaths = discoverMatching(job.getInputPattern(), "FASTQ paths");

        List<ReadPair> readPairs = pairMatcher.pairUp(fastqPaths);
        LOG.infof("The FASTQ paths have been paired up:%n%s",
                readPairs.stream().map(ReadPair::toString).collect(Collectors.joining("\n\n")));

        List<BucketPath> resourceFiles = discoverChildren(job.getReferenceResourceDirectory(),
                "reference genome files");

        List<BucketPath> inputs = new ArrayList<>(fastqPaths);
        inputs.addAll(resourceFiles);
        stageIn(inputs);

        alignLocally(job, readPairs);

        BucketPath output = job.getOutputPath();
        stageOut(List.of(output, output.withSuffix(BAM_INDEX_SUFFIX)));
    }

    private void alignLocally(RnaAlignJob job, List<ReadPair> readPairs) {
        FileUtils.createOrCleanupDirectory(workingDirectory);

        List<LocalReadPair> localReadPairs = readPairs.stream()
                .map(readPair -> readPair.toLocal(fileCache))
                .collect(Collectors.toList());
        Path genomeDirectory = localPath(job.getReferenceResourceDirectory());
        Path finalBam = localPath(job.getOutputPath());

        LOG.info("Start creating unsorted bam");
        Path unsortedBam = toolbox.alignRnaBam(localReadPairs, genomeDirectory, workingDirectory);
        LOG.infof("Finished creating unsorted bam %s", unsortedBam);

        LOG.infof("Start sorting bam %s to create %s", unsortedBam, finalBam);
        toolbox.sortBam(unsortedBam, finalBam);
        LOG.infof("Finished sorting bam %s to create %s", unsortedBam, finalBam);

        LOG.infof("Start indexing bam %s", finalBam);
        toolbox.createBamIndex(finalBam);
        LOG.infof("Finished indexing bam %s", finalBam);

        FileUtils.createOrCleanupDirectory(workingDirectory);
    }

    @Override
    protected Logger logger() {
        return LOG;
    }
}
