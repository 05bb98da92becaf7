package com.phillippitts.simrecon.service.orchestration;

import com.phillippitts.simrecon.domain.BatchResult;
import com.phillippitts.simrecon.domain.ChannelOverride;
import com.phillippitts.simrecon.domain.JobOutcome;
import com.phillippitts.simrecon.domain.JobResult;
import com.phillippitts.simrecon.domain.OutputFileType;
import com.phillippitts.simrecon.exception.NotFoundException;
import com.phillippitts.simrecon.exception.ValidationException;
import com.phillippitts.simrecon.service.capture.OutputCapture;
import com.phillippitts.simrecon.service.config.ConfigResolver;
import com.phillippitts.simrecon.service.config.YamlConfigReader;
import com.phillippitts.simrecon.service.files.FilenameRules;
import com.phillippitts.simrecon.service.files.PathAllocator;
import com.phillippitts.simrecon.service.files.Platform;
import com.phillippitts.simrecon.testutil.EventCapturingPublisher;
import com.phillippitts.simrecon.testutil.FakeDatasetHandler;
import com.phillippitts.simrecon.testutil.FakeSimEngine;
import com.phillippitts.simrecon.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconstructionServiceTest {

    @TempDir
    Path tempDir;

    private final FakeSimEngine engine = new FakeSimEngine();
    private final FakeDatasetHandler datasets = new FakeDatasetHandler(488, 561);
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private ReconstructionService service;
    private Path source;
    private Path outDir;
    private Map<Integer, ChannelOverride> otfs;

    @BeforeEach
    void setUp() throws IOException {
        JobCollaborators collaborators = new JobCollaborators(engine, datasets, new OutputCapture(),
                new PathAllocator(FilenameRules.forPlatform(Platform.LINUX)));
        JobOrchestrator orchestrator = new JobOrchestrator(new SyncExecutor(), new SyncExecutor(), publisher);
        service = new ReconstructionService(new ConfigResolver(new YamlConfigReader()), orchestrator, collaborators);
        source = Files.writeString(tempDir.resolve("cell.dv"), "raw");
        outDir = tempDir.resolve("out");
        otfs = Map.of(
                488, ChannelOverride.otf(Files.writeString(tempDir.resolve("otf_488.tiff"), "otf")),
                561, ChannelOverride.otf(Files.writeString(tempDir.resolve("otf_561.tiff"), "otf")));
    }

    private ProcessingOptions.Builder options() {
        return ProcessingOptions.builder().outputDirectory(outDir);
    }

    private static List<String> names(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.map(p -> p.getFileName().toString()).sorted().toList();
        }
    }

    @Test
    void stitchesChannelsIntoOneOutputWithCombinedLog() throws IOException {
        BatchResult batch = service.reconstruct(List.of(source), null, otfs, Map.of(), options().build());

        JobResult result = batch.results().get(0);
        assertThat(result.outcome()).isEqualTo(JobOutcome.SUCCEEDED);
        assertThat(result.outputs()).containsExactly(outDir.resolve("cell_recon.dv"));
        assertThat(datasets.stitched).containsExactly(outDir.resolve("cell_recon.dv"));
        assertThat(names(outDir)).containsExactly("cell_recon.dv", "cell_recon.log");
        assertThat(Files.readString(outDir.resolve("cell_recon.log")))
                .startsWith("Job " + result.jobId())
                .contains("fake recon engine processing cell_488")
                .contains("fake recon engine processing cell_561");
    }

    @Test
    void writesOneFilePerChannelWhenNotStitching() throws IOException {
        BatchResult batch = service.reconstruct(List.of(source), null, otfs, Map.of(),
                options().stitchChannels(false).outputFileType(OutputFileType.TIFF).build());

        assertThat(batch.results().get(0).outputs())
                .containsExactly(outDir.resolve("cell_recon_488.tiff"), outDir.resolve("cell_recon_561.tiff"));
        assertThat(names(outDir)).containsExactly("cell_recon.log", "cell_recon_488.tiff", "cell_recon_561.tiff");
    }

    @Test
    void passesChannelOtfAndCommandLineSettingsToEngine() {
        Map<String, Object> settings = Map.of("wiener", "0.002", "ndirs", 3);

        service.reconstruct(List.of(source), null, otfs, settings, options().build());

        assertThat(engine.calls).hasSize(2);
        FakeSimEngine.Call first = engine.calls.get(0);
        assertThat(first.otf()).isEqualTo(tempDir.resolve("otf_488.tiff"));
        assertThat(first.params()).containsEntry("wiener", 0.002).containsEntry("ndirs", 3);
        assertThat(first.target().isCaptured()).isTrue();
    }

    @Test
    void unknownCommandLineSettingIsRejectedUpFront() {
        assertThatThrownBy(() -> service.reconstruct(List.of(source), null, otfs, Map.of("beaddiam", 0.1),
                options().build()))
                .isInstanceOf(ValidationException.class);
        assertThat(outDir).doesNotExist();
    }

    @Test
    void missingOtfFailsJobUnlessPartialAllowed() {
        Map<Integer, ChannelOverride> only488 = Map.of(488, otfs.get(488));

        BatchResult strict = service.reconstruct(List.of(source), null, only488, Map.of(), options().build());

        assertThat(strict.results().get(0).outcome()).isEqualTo(JobOutcome.FAILED);
        assertThat(strict.results().get(0).failure()).isInstanceOf(NotFoundException.class).hasMessageContaining("561");
        assertThat(engine.calls).isEmpty();
        assertThat(outDir).doesNotExist();

        BatchResult partial = service.reconstruct(List.of(source), null, only488, Map.of(),
                options().allowPartial(true).build());

        JobResult result = partial.results().get(0);
        assertThat(result.outcome()).isEqualTo(JobOutcome.PARTIALLY_SUCCEEDED);
        assertThat(result.skippedWavelengths()).containsExactly(561);
        assertThat(engine.calls).hasSize(1);
    }

    @Test
    void otfPathThatDoesNotExistCountsAsMissing() {
        Map<Integer, ChannelOverride> broken = Map.of(
                488, otfs.get(488),
                561, ChannelOverride.otf(tempDir.resolve("gone.tiff")));

        BatchResult batch = service.reconstruct(List.of(source), null, broken, Map.of(),
                options().allowPartial(true).build());

        assertThat(batch.results().get(0).skippedWavelengths()).containsExactly(561);
    }

    @Test
    void existingOutputGetsUniqueNameUnlessOverwriting() throws IOException {
        Files.createDirectories(outDir);
        Files.writeString(outDir.resolve("cell_recon.dv"), "previous");

        BatchResult unique = service.reconstruct(List.of(source), null, otfs, Map.of(), options().build());
        assertThat(unique.results().get(0).outputs()).containsExactly(outDir.resolve("cell_recon_1.dv"));
        assertThat(outDir.resolve("cell_recon.dv")).hasContent("previous");

        BatchResult replaced = service.reconstruct(List.of(source), null, otfs, Map.of(),
                options().overwrite(true).build());
        assertThat(replaced.results().get(0).outputs()).containsExactly(outDir.resolve("cell_recon.dv"));
        assertThat(outDir.resolve("cell_recon.dv")).content().isNotEqualTo("previous");
    }

    @Test
    void stitchedRunKeepsEarlierLogUnlessOverwriting() throws IOException {
        service.reconstruct(List.of(source), null, otfs, Map.of(),
                options().stitchChannels(false).build());
        String firstLog = Files.readString(outDir.resolve("cell_recon.log"));

        BatchResult stitched = service.reconstruct(List.of(source), null, otfs, Map.of(), options().build());

        assertThat(stitched.results().get(0).outputs()).containsExactly(outDir.resolve("cell_recon.dv"));
        assertThat(outDir.resolve("cell_recon.log")).hasContent(firstLog);
        assertThat(Files.readString(outDir.resolve("cell_recon_1.log")))
                .startsWith("Job " + stitched.results().get(0).jobId());
    }

    @Test
    void keepsWorkspaceWhenCleanupDisabled() throws IOException {
        Path processing = tempDir.resolve("processing");

        BatchResult batch = service.reconstruct(List.of(source), null, otfs, Map.of(),
                options().processingDirectory(processing).cleanup(false).build());

        String jobId = batch.results().get(0).jobId();
        Path workspace = processing.resolve("cell_" + jobId);
        assertThat(workspace).isDirectory();
        assertThat(names(workspace)).anyMatch(n -> n.endsWith(".log"));
    }

    @Test
    void removesWorkspaceAndEmptyProcessingDirectory() {
        Path processing = tempDir.resolve("processing");

        service.reconstruct(List.of(source), null, otfs, Map.of(),
                options().processingDirectory(processing).build());

        assertThat(processing).doesNotExist();
        assertThat(outDir.resolve("cell_recon.dv")).exists();
    }

    @Test
    void engineFailureIsolatedToItsJob() throws IOException {
        Path other = Files.writeString(tempDir.resolve("other.dv"), "raw");
        engine.failOn.add("other");

        BatchResult batch = service.reconstruct(List.of(source, other), null, otfs, Map.of(), options().build());

        assertThat(batch.results()).extracting(JobResult::outcome)
                .containsExactly(JobOutcome.SUCCEEDED, JobOutcome.FAILED);
        assertThat(names(outDir)).containsExactly("cell_recon.dv", "cell_recon.log");
        assertThat(publisher.jobEvents()).hasSize(2);
    }

    @Test
    void readsChannelSettingsFromRootConfig() throws IOException {
        Files.writeString(tempDir.resolve("defaults.yaml"), "wiener: 0.001\n");
        Files.writeString(tempDir.resolve("488.yaml"), "wiener: 0.004\n");
        Path root = Files.writeString(tempDir.resolve("root.yaml"), String.join("\n",
                "configs:",
                "  defaults: defaults.yaml",
                "  488: 488.yaml",
                "otfs:",
                "  488: otf_488.tiff",
                "  561: otf_561.tiff",
                ""));

        service.reconstruct(List.of(source), root, Map.of(), Map.of(), options().build());

        assertThat(engine.calls).extracting(c -> c.params().get("wiener")).containsExactly(0.004, 0.001);
    }
}
