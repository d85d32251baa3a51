package space.maatini.k8analysis.tools;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import space.maatini.k8analysis.common.exception.ExternalToolException;
import space.maatini.k8analysis.common.util.FileUtils;
import space.maatini.k8analysis.jobs.model.LocalReadPair;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs bwa, sambamba, STAR and UMI-Collapse as local subprocess pipelines.
 */
@ApplicationScoped
public class ProcessGenomicsToolbox implements GenomicsToolbox {

    private static final Logger LOG = Logger.getLogger(ProcessGenomicsToolbox.class);

    private static final int MAX_ERROR_CHARS = 4000;
    private static final String STAR_UNSORTED_BAM = "Aligned.out.bam";

    private final ToolPaths tools;

    @Inject
    public ProcessGenomicsToolbox(
            @ConfigProperty(name = "k8analysis.tools.bwa") String bwa,
            @ConfigProperty(name = "k8analysis.tools.sambamba") String sambamba,
            @ConfigProperty(name = "k8analysis.tools.star") String star,
            @ConfigProperty(name = "k8analysis.tools.java", defaultValue = "java") String java,
            @ConfigProperty(name = "k8analysis.tools.umi-collapse-jar") String umiCollapseJar,
            @ConfigProperty(name = "k8analysis.tools.umi-collapse-jvm-options", defaultValue = "") String umiCollapseJvmOptions,
            @ConfigProperty(name = "k8analysis.tools.sambamba-overflow-list-size", defaultValue = "4500000") int overflowListSize) {
        this(new ToolPaths(bwa, sambamba, star, java, umiCollapseJar, umiCollapseJvmOptions, overflowListSize));
    }

    public ProcessGenomicsToolbox(ToolPaths tools) {
        this.tools = tools;
    }

    /**
     * Locations and fixed options of the external tools.
     */
    public static final class ToolPaths {
        final String bwa;
        final String sambamba;
        final String star;
        final String java;
        final String umiCollapseJar;
        final List<String> umiCollapseJvmOptions;
        final int overflowListSize;

        public ToolPaths(String bwa, String sambamba, String star, String java, String umiCollapseJar,
                String umiCollapseJvmOptions, int overflowListSize) {
            this.bwa = bwa;
            this.sambamba = sambamba;
            this.star = star;
            this.java = java;
            this.umiCollapseJar = umiCollapseJar;
            this.umiCollapseJvmOptions = Arrays.stream(umiCollapseJvmOptions.trim().split("\\s+"))
                    .filter(option -> !option.isEmpty())
                    .collect(Collectors.toList());
            this.overflowListSize = overflowListSize;
        }
    }

    // ==================== Alignment ====================

    @Override
    public void alignDnaBam(LocalReadPair readPair, Path referenceGenome, Path outputBam, String readGroup) {
        String threads = threadCount();
        List<String> align = List.of(tools.bwa, "mem", "-Y", "-t", threads, "-R", readGroup,
                referenceGenome.toString(), readPair.getRead1().toString(), readPair.getRead2().toString());
        List<String> samToBam = List.of(tools.sambamba, "view", "-f", "bam", "-S", "-l", "0", "/dev/stdin");
        List<String> sort = List.of(tools.sambamba, "sort", "-o", outputBam.toString(), "/dev/stdin");

        FileUtils.createParentDirectories(outputBam);
        runPipeline(List.of(align, samToBam, sort), null);
    }

    @Override
    public Path alignRnaBam(List<LocalReadPair> readPairs, Path genomeDirectory, Path workingDirectory) {
        String read1Files = readPairs.stream().map(pair -> pair.getRead1().toString()).collect(Collectors.joining(","));
        String read2Files = readPairs.stream().map(pair -> pair.getRead2().toString()).collect(Collectors.joining(","));
        List<String> align = List.of(tools.star,
                "--runThreadN", threadCount(),
                "--genomeDir", genomeDirectory.toString(),
                "--readFilesIn", read1Files, read2Files,
                "--readFilesCommand", "zcat",
                "--outSAMtype", "BAM", "Unsorted",
                "--outSAMattributes", "All",
                "--outSAMunmapped", "Within",
                "--outFileNamePrefix", workingDirectory.toString() + File.separator);

        runPipeline(List.of(align), null);
        return workingDirectory.resolve(STAR_UNSORTED_BAM);
    }

    @Override
    public void sortBam(Path inputBam, Path outputBam) {
        FileUtils.createParentDirectories(outputBam);
        runPipeline(List.of(List.of(tools.sambamba, "sort", "-t", threadCount(), "-o", outputBam.toString(),
                inputBam.toString())), null);
    }

    @Override
    public void mergeBams(List<Path> inputBams, Path outputBam) {
        List<String> merge = new ArrayList<>(List.of(tools.sambamba, "merge", "-t", threadCount(), outputBam.toString()));
        inputBams.forEach(bam -> merge.add(bam.toString()));

        FileUtils.createParentDirectories(outputBam);
        runPipeline(List.of(merge), null);
    }

    @Override
    public void createBamIndex(Path bam) {
        runPipeline(List.of(List.of(tools.sambamba, "index", "-t", threadCount(), bam.toString())), null);
    }

    // ==================== Deduplication ====================

    @Override
    public void deduplicateWithoutUmi(Path inputBam, Path outputBam) {
        List<String> markdup = List.of(tools.sambamba, "markdup", "-t", threadCount(),
                "--overflow-list-size=" + tools.overflowListSize, inputBam.toString(), outputBam.toString());

        FileUtils.createParentDirectories(outputBam);
        runPipeline(List.of(markdup), null);
    }

    @Override
    public void deduplicateWithUmi(Path inputBam, Path outputBam) {
        List<String> collapse = new ArrayList<>();
        collapse.add(tools.java);
        collapse.addAll(tools.umiCollapseJvmOptions);
        collapse.addAll(List.of("-jar", tools.umiCollapseJar, "bam", "-i", inputBam.toString(),
                "-o", outputBam.toString(), "--umi-sep", ":", "--paired", "--two-pass"));

        FileUtils.createParentDirectories(outputBam);
        runPipeline(List.of(collapse), null);
    }

    // ==================== Statistics ====================

    @Override
    public void flagstat(Path inputBam, Path outputFile) {
        FileUtils.createParentDirectories(outputFile);
        runPipeline(List.of(List.of(tools.sambamba, "flagstat", "-t", threadCount(), inputBam.toString())), outputFile);
    }

    @Override
    public void countMappingCoordinates(Path inputBam, Path outputFile) {
        List<String> view = List.of(tools.sambamba, "view", "-t", threadCount(), inputBam.toString());
        List<String> select = List.of("awk", "{print $3 \"\\t\" $4}");
        List<String> unique = List.of("sort", "-u");
        List<String> count = List.of("wc", "-l");

        FileUtils.createParentDirectories(outputFile);
        runPipeline(List.of(view, select, unique, count), outputFile);
    }

    // ==================== Process handling ====================

    /**
     * Run commands connected stdout to stdin, like a shell pipeline.
     *
     * @param commands   The commands, first to last.
     * @param outputFile Where the last command's stdout goes; discarded when null.
     * @throws ExternalToolException if any command cannot be started or the last exits non-zero.
     */
    void runPipeline(List<List<String>> commands, Path outputFile) {
        String commandLine = commands.stream()
                .map(command -> String.join(" ", command))
                .collect(Collectors.joining(" | "));
        if (outputFile != null) {
            commandLine += " > " + outputFile;
        }
        LOG.infof("Running command pipeline:%n%s", commandLine);

        Path errorLog = null;
        try {
            errorLog = Files.createTempFile("k8analysis-", ".stderr");
            List<ProcessBuilder> builders = new ArrayList<>();
            for (List<String> command : commands) {
                builders.add(new ProcessBuilder(command)
                        .redirectError(ProcessBuilder.Redirect.appendTo(errorLog.toFile())));
            }
            builders.get(builders.size() - 1).redirectOutput(outputFile != null
                    ? ProcessBuilder.Redirect.to(outputFile.toFile())
                    : ProcessBuilder.Redirect.DISCARD);

            List<Process> processes = ProcessBuilder.startPipeline(builders);
            int status = 0;
            for (Process process : processes) {
                status = process.waitFor();
            }
            if (status != 0) {
                throw new ExternalToolException(commandLine, status, readTail(errorLog));
            }
            LOG.debugf("Command pipeline finished: %s", commandLine);
        } catch (IOException e) {
            throw new ExternalToolException(commandLine, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalToolException(commandLine, e);
        } finally {
            if (errorLog != null) {
                deleteQuietly(errorLog);
            }
        }
    }

    private static String readTail(Path errorLog) {
        try {
            String errors = Files.readString(errorLog, StandardCharsets.UTF_8);
            return errors.length() > MAX_ERROR_CHARS ? errors.substring(errors.length() - MAX_ERROR_CHARS) : errors;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read error output from " + errorLog, e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warnf("Could not delete temporary file %s: %s", file, e.getMessage());
        }
    }

    private static String threadCount() {
        return String.valueOf(Runtime.getRuntime().availableProcessors());
    }
}
