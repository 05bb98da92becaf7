package com.phillippitts.simrecon.service.engine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds deterministic engine command lines from parameter maps.
 *
 * <p>Parameters are emitted in map order. {@code true} booleans become bare flags and
 * {@code false} or null values are omitted. String values containing whitespace (for example
 * {@code fixorigin: "3 20"}) are split into separate arguments.
 */
final class EngineCommandBuilder {

    private EngineCommandBuilder() {
    }

    /**
     * {@code makeotf psf otf -key value ...}
     */
    static List<String> makeOtf(String binary, Path psf, Path otf, Map<String, Object> params) {
        List<String> cmd = new ArrayList<>();
        cmd.add(binary);
        cmd.add(psf.toAbsolutePath().toString());
        cmd.add(otf.toAbsolutePath().toString());
        appendParameters(cmd, "-", params);
        return cmd;
    }

    /**
     * {@code cudasirecon input output otf --key value ...}
     */
    static List<String> reconstruct(String binary, Path input, Path output, Path otf,
                                    Map<String, Object> params) {
        List<String> cmd = new ArrayList<>();
        cmd.add(binary);
        cmd.add(input.toAbsolutePath().toString());
        cmd.add(output.toAbsolutePath().toString());
        cmd.add(otf.toAbsolutePath().toString());
        appendParameters(cmd, "--", params);
        return cmd;
    }

    private static void appendParameters(List<String> cmd, String prefix, Map<String, Object> params) {
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            if (value instanceof Boolean flag) {
                if (flag) {
                    cmd.add(prefix + entry.getKey());
                }
                continue;
            }
            cmd.add(prefix + entry.getKey());
            for (String part : value.toString().trim().split("\\s+")) {
                if (!part.isEmpty()) {
                    cmd.add(part);
                }
            }
        }
    }
}
