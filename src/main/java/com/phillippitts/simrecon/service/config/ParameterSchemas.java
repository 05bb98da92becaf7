package com.phillippitts.simrecon.service.config;

import com.phillippitts.simrecon.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static com.phillippitts.simrecon.service.config.ParameterType.BOOLEAN;
import static com.phillippitts.simrecon.service.config.ParameterType.DOUBLE;
import static com.phillippitts.simrecon.service.config.ParameterType.INTEGER;
import static com.phillippitts.simrecon.service.config.ParameterType.STRING;

/**
 * Valid-key schemas for the OTF conversion and reconstruction engines.
 *
 * <p>A config layer is a flat map that may mix keys from both schemas. {@link #split} routes
 * each key to the schema(s) that define it; keys such as {@code nphases} belong to both.
 */
public final class ParameterSchemas {

    public static final ParameterSchema OTF = ParameterSchema.builder("OTF")
            .add("nphases", INTEGER, "Number of pattern phases per SIM direction")
            .add("ls", DOUBLE, "Line spacing of the SIM pattern in microns")
            .add("na", DOUBLE, "Detection numerical aperture")
            .add("nimm", DOUBLE, "Refractive index of the immersion medium")
            .add("background", DOUBLE, "Camera readout background")
            .add("beaddiam", DOUBLE, "Diameter of the bead in microns")
            .add("angle", DOUBLE, "Angle of the SIM pattern direction in radians")
            .add("nocompen", BOOLEAN, "Do not perform bead size compensation")
            .add("fixorigin", STRING, "Range of kz pixels used to fix the 2D OTF origin, e.g. '3 20'")
            .add("leavekz", STRING, "Pixels to keep for kz ranges, e.g. '7 11 3'")
            .add("krmax", INTEGER, "Pixels outside this limit are zeroed")
            .add("I2M", STRING, "I2M OTF file")
            .build();

    public static final ParameterSchema RECONSTRUCTION = ParameterSchema.builder("reconstruction")
            .add("ndirs", INTEGER, "Number of SIM directions")
            .add("nphases", INTEGER, "Number of pattern phases per SIM direction")
            .add("nordersout", INTEGER, "Number of output SIM orders")
            .add("angle0", DOUBLE, "Angle of the first SIM direction in radians")
            .add("ls", DOUBLE, "Line spacing of the SIM pattern in microns")
            .add("na", DOUBLE, "Detection numerical aperture")
            .add("nimm", DOUBLE, "Refractive index of the immersion medium")
            .add("zoomfact", DOUBLE, "Lateral zoom factor")
            .add("explodefact", DOUBLE, "Artificial exploding factor for display")
            .add("zzoom", INTEGER, "Axial zoom factor")
            .add("background", DOUBLE, "Camera readout background")
            .add("wiener", DOUBLE, "Wiener constant")
            .add("forcemodamp", STRING, "Modulation amplitudes to force, one per order")
            .add("k0angles", STRING, "User-given pattern directions")
            .add("otfRA", BOOLEAN, "Use rotationally averaged OTF")
            .add("otfPerAngle", BOOLEAN, "Use one OTF per SIM angle")
            .add("fastSI", BOOLEAN, "Data is ordered angle-z-phase")
            .add("k0searchAll", BOOLEAN, "Search for k0 at all time points")
            .add("norescale", BOOLEAN, "Do not rescale images")
            .add("equalizez", BOOLEAN, "Bleach correction for z")
            .add("equalizet", BOOLEAN, "Bleach correction for time")
            .add("dampenOrder0", BOOLEAN, "Dampen the order 0 OTF")
            .add("nosuppress", BOOLEAN, "Do not suppress the DC singularity")
            .add("nokz0", BOOLEAN, "Do not use kz=0 plane of the order 0 OTF")
            .add("gammaApo", DOUBLE, "Output apodization gamma")
            .add("suppressR", INTEGER, "Radius of the suppression range")
            .add("dampenFactor", DOUBLE, "Factor for order 0 dampening")
            .add("nofilteroverlaps", BOOLEAN, "Do not filter overlapping regions")
            .add("usecorr", STRING, "Flat-field correction file")
            .build();

    private ParameterSchemas() {
    }

    /**
     * One config layer split by schema.
     *
     * @param otf keys belonging to the OTF schema
     * @param reconstruction keys belonging to the reconstruction schema
     */
    public record SplitSettings(Map<String, Object> otf, Map<String, Object> reconstruction) {
    }

    /**
     * Splits a flat settings layer into OTF and reconstruction parameters.
     *
     * @param source where the layer came from, for error messages
     * @throws ValidationException if a key matches neither schema
     */
    public static SplitSettings split(Map<String, Object> settings, String source) {
        Set<String> unknown = new TreeSet<>();
        for (String key : settings.keySet()) {
            if (!OTF.contains(key) && !RECONSTRUCTION.contains(key)) {
                unknown.add(key);
            }
        }
        if (!unknown.isEmpty()) {
            throw new ValidationException("Unknown setting(s) in " + source + ": " + unknown);
        }
        return new SplitSettings(
                new LinkedHashMap<>(OTF.select(settings)),
                new LinkedHashMap<>(RECONSTRUCTION.select(settings)));
    }
}
