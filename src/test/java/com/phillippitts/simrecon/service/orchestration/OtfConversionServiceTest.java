package com.phillippitts.simrecon.service.orchestration;

import com.phillippitts.simrecon.domain.BatchResult;
import com.phillippitts.simrecon.domain.CropRegion;
import com.phillippitts.simrecon.domain.JobOutcome;
import com.phillippitts.simrecon.exception.ValidationException;
import com.phillippitts.simrecon.service.capture.OutputCapture;
import com.phillippitts.simrecon.service.config.ConfigResolver;
import com.phillippitts.simrecon.service.config.YamlConfigReader;
import com.phillippitts.simrecon.service.files.FilenameRules;
import com.phillippitts.simrecon.service.files.PathAllocator;
import com.phillippitts.simrecon.service.files.Platform;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OtfConversionServiceTest {

    @TempDir
    Path tempDir;

    private final FakeSimEngine engine = new FakeSimEngine();
    private final FakeDatasetHandler datasets = new FakeDatasetHandler(525);
    private OtfConversionService service;
    private Path psf;

    @BeforeEach
    void setUp() throws IOException {
        JobCollaborators collaborators = new JobCollaborators(engine, datasets, new OutputCapture(),
                new PathAllocator(FilenameRules.forPlatform(Platform.LINUX)));
        service = new OtfConversionService(new ConfigResolver(new YamlConfigReader()),
                new JobOrchestrator(new SyncExecutor(), new SyncExecutor(), null), collaborators);
        psf = Files.writeString(tempDir.resolve("psf.dv"), "psf");
    }

    @Test
    void writesOtfPerChannelBesideThePsf() throws IOException {
        BatchResult batch = service.convert(List.of(psf), null, Map.of(), null);

        assertThat(batch.results().get(0).outcome()).isEqualTo(JobOutcome.SUCCEEDED);
        assertThat(batch.results().get(0).outputs()).containsExactly(tempDir.resolve("psf_OTF_525.tiff"));
        assertThat(tempDir.resolve("psf_OTF.log")).exists();
        assertThat(Files.readString(tempDir.resolve("psf_OTF.log"))).contains("fake otf engine processing psf_525");
    }

    @Test
    void commandLineSettingsReachTheEngine() {
        service.convert(List.of(psf), null, Map.of("angle", "-0.8", "nocompen", true), null);

        assertThat(engine.calls).singleElement().satisfies(call -> {
            assertThat(call.kind()).isEqualTo("otf");
            assertThat(call.params()).containsEntry("angle", -0.8).containsEntry("nocompen", true);
        });
    }

    @Test
    void reconstructionOnlySettingIsRejected() {
        assertThatThrownBy(() -> service.convert(List.of(psf), null, Map.of("wiener", 0.1), null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("wiener");
    }

    @Test
    void cropIsPassedToChannelExtraction() {
        CropRegion crop = new CropRegion(256, 256, 128.0, 128.0);

        service.convert(List.of(psf), null, Map.of(), new OtfOptions(tempDir.resolve("otfs"), false, true, crop));

        assertThat(datasets.crops).containsExactly(crop);
        assertThat(tempDir.resolve("otfs/psf_OTF_525.tiff")).exists();
    }

    @Test
    void severalPsfsRunOneAfterAnother() throws IOException {
        Path second = Files.writeString(tempDir.resolve("psf2.dv"), "psf");

        BatchResult batch = service.convert(List.of(psf, second), null, Map.of(), OtfOptions.defaults());

        assertThat(batch.results()).hasSize(2).allMatch(r -> r.outcome() == JobOutcome.SUCCEEDED);
        assertThat(engine.calls.get(0).endNanos()).isLessThanOrEqualTo(engine.calls.get(1).startNanos());
    }

    @Test
    void missingPsfFailsJob() {
        BatchResult batch = service.convert(List.of(tempDir.resolve("missing.dv")), null, Map.of(), null);

        assertThat(batch.hasFailures()).isTrue();
        assertThat(engine.calls).isEmpty();
    }
}
