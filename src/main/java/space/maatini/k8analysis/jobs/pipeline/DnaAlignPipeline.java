package space.maatini.k8analysis.jobs.pipeline;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import space.maatini.k8analysis.common.util.FileUtils;
import space.maatini.k8analysis.jobs.model.DnaAlignJob;
import space.maatini.k8analysis.jobs.model.LocalReadPair;
import space.maatini.k8analysis.jobs.model.ReadPair;
import space.maatini.k8analysis.jobs.service.FastqPairMatcher;
import space.maatini.k8analysis.jobs.service.ReadGroups;
import space.maatini.k8analysis.storage.client.ObjectStoreClient;
import space.maatini.k8analysis.storage.model.BucketPath;
import space.maatini.k8analysis.storage.service.LocalFileCache;
import space.maatini.k8analysis.tools.GenomicsToolbox;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * DNA alignment: one bwa alignment per lane, merged into a single indexed BAM.
 */
@ApplicationScoped
public class DnaAlignPipeline extends JobPipeline<DnaAlignJob> {

    private static final Logger LOG = Logger.getLogger(DnaAlignPipeline.class);

    private final FastqPairMatcher pairMatcher;
    private final Path workingDirectory;

    @Inject
    public DnaAlignPipeline(ObjectStoreClient storeClient, LocalFileCache fileCache, GenomicsToolbox toolbox,
            FastqPairMatcher pairMatcher,
            @ConfigProperty(name = "k8analysis.working-directory") String workingDirectory) {
        this(storeClient, fileCache, toolbox, pairMatcher, Paths.get(workingDirectory));
    }

    public DnaAlignPipeline(ObjectStoreClient storeClient, LocalFileCache fileCache, GenomicsToolbox toolbox,
            FastqPairMatcher pairMatcher, Path workingDirectory) {
        super(storeClient, fileCache, toolbox);
        this.pairMatcher = pairMatcher;
        this.workingDirectory = workingDirectory;
    }

    @Override
    protected void run(DnaAlignJob job) {
        List<BucketPath> fastqPaths = discoverMatching(job.getInputPattern(), "FASTQ paths");

        List<ReadPair> readPairs = pairMatcher.pairUp(fastqPaths);
        LOG.infof("The FASTQ paths have been paired up:%n%s",
                readPairs.stream().map(ReadPair::toString).collect(Collectors.joining("\n\n")));

        List<BucketPath> referenceFiles = discoverChildren(job.getReferenceGenome().parent(),
                "reference genome files");

        List<BucketPath> inputs = new ArrayList<>(fastqPaths);
        inputs.addAll(referenceFiles);
        stageIn(inputs);

        alignLocally(job, readPairs);

        BucketPath output = job.getOutputPath();
        stageOut(List.of(output, output.withSuffix(BAM_INDEX_SUFFIX)));
    }

    private void alignLocally(DnaAlignJob job, List<ReadPair> readPairs) {
        FileUtils.createOrCleanupDirectory(workingDirectory);

        Path finalBam = localPath(job.getOutputPath());
        Path referenceGenome = localPath(job.getReferenceGenome());

        List<Path> laneBams = new ArrayList<>();
        for (ReadPair readPair : readPairs) {
            Path laneBam = workingDirectory.resolve(readPair.getPairName() + ".bam");
            LocalReadPair localReadPair = readPair.toLocal(fileCache);
            String readGroup = ReadGroups.readGroupString(localReadPair, finalBam);

            LOG.infof("Start creating lane bam %s", laneBam);
            toolbox.alignDnaBam(localReadPair, referenceGenome, laneBam, readGroup);
            LOG.infof("Finished creating lane bam %s", laneBam);
            laneBams.add(laneBam);
        }

        createMergedBamWithIndex(laneBams, finalBam);

        FileUtils.createOrCleanupDirectory(workingDirectory);
    }

    private void createMergedBamWithIndex(List<Path> laneBams, Path finalBam) {
        if (laneBams.size() == 1) {
            LOG.info("Only one lane bam, so lane bam is merged bam.");
            moveFile(laneBams.get(0), finalBam);
        } else {
            LOG.infof("Start merging %d lane bams", laneBams.size());
            toolbox.mergeBams(laneBams, finalBam);
            LOG.info("Finished merging lane bams");
        }

        LOG.info("Start creating index for merged bam");
        toolbox.createBamIndex(finalBam);
        LOG.info("Finished creating index for merged bam");
    }

    private static void moveFile(Path source, Path target) {
        FileUtils.createParentDirectories(target);
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to move " + source + " to " + target, e);
        }
    }

    @Override
    protected Logger logger() {
        return LOG;
    }
}
