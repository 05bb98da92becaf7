package com.phillippitts.simrecon.service.engine;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EngineCommandBuilderTest {

    private static final Path IN = Path.of("/data/in.dv");
    private static final Path OUT = Path.of("/data/out.dv");
    private static final Path OTF = Path.of("/data/otf.tiff");

    @Test
    void booleanTrueBecomesBareFlag() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("fastSI", true);
        params.put("nokz0", false);

        List<String> cmd = EngineCommandBuilder.reconstruct("recon", IN, OUT, OTF, params);

        assertThat(cmd).containsExactly("recon", "/data/in.dv", "/data/out.dv", "/data/otf.tiff", "--fastSI");
    }

    @Test
    void nullValuesAreOmitted() {
        Map<String, Object> params = new HashMap<>();
        params.put("wiener", null);

        assertThat(EngineCommandBuilder.reconstruct("recon", IN, OUT, OTF, params)).hasSize(4);
    }

    @Test
    void whitespaceSeparatedStringsBecomeSeparateArguments() {
        List<String> cmd = EngineCommandBuilder.makeOtf("otf", IN, OTF, Map.of("fixorigin", " 3  20 "));

        assertThat(cmd).containsExactly("otf", "/data/in.dv", "/data/otf.tiff", "-fixorigin", "3", "20");
    }

    @Test
    void numbersUseTheirStringForm() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("ndirs", 3);
        params.put("wiener", 0.005);

        assertThat(EngineCommandBuilder.reconstruct("recon", IN, OUT, OTF, params))
                .endsWith("--ndirs", "3", "--wiener", "0.005");
    }
}
