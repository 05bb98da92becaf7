package com.phillippitts.simrecon.service.dataset;

import com.phillippitts.simrecon.domain.CropRegion;
import com.phillippitts.simrecon.exception.AlreadyExistsException;
import com.phillippitts.simrecon.exception.NotFoundException;
import com.phillippitts.simrecon.exception.StorageException;
import com.phillippitts.simrecon.exception.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.CopyOption;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;

/**
 * Format-agnostic {@link DatasetHandler} for single-channel files.
 *
 * <p>Every source is treated as one channel at a fixed wavelength and files are copied
 * byte for byte. Cropping needs a real codec and is skipped with a warning.
 */
public class SingleChannelDatasetHandler implements DatasetHandler {

    private static final Logger LOG = LogManager.getLogger(SingleChannelDatasetHandler.class);

    private final int wavelength;

    public SingleChannelDatasetHandler(int wavelength) {
        if (wavelength <= 0) {
            throw new ValidationException("Wavelength must be positive, got " + wavelength);
        }
        this.wavelength = wavelength;
    }

    public int wavelength() {
        return wavelength;
    }

    @Override
    public List<Integer> wavelengths(Path source) {
        requireFile(source);
        return List.of(wavelength);
    }

    @Override
    public void extractChannel(Path source, int requested, Path target, CropRegion crop) {
        requireFile(source);
        if (requested != wavelength) {
            throw new NotFoundException("No channel with wavelength " + requested + " in", source.toString());
        }
        if (crop != null) {
            LOG.warn("Cropping to {}x{} is not supported for {}; using the full frame",
                    crop.width(), crop.height(), source.getFileName());
        }
        copy(source, target, true);
    }

    @Override
    public void writeStitched(Map<Integer, Path> channelOutputs, Path target, boolean overwrite) {
        if (channelOutputs.size() != 1) {
            throw new ValidationException("Cannot stitch " + channelOutputs.size()
                    + " channels without a multi-channel codec");
        }
        copy(channelOutputs.values().iterator().next(), target, overwrite);
    }

    @Override
    public void writeChannel(Path channelOutput, Path target, boolean overwrite) {
        copy(channelOutput, target, overwrite);
    }

    private static void requireFile(Path source) {
        if (!Files.isRegularFile(source)) {
            throw new NotFoundException("Source file not found", source.toString());
        }
    }

    private static void copy(Path from, Path to, boolean overwrite) {
        CopyOption[] options = overwrite
                ? new CopyOption[] {StandardCopyOption.REPLACE_EXISTING}
                : new CopyOption[0];
        try {
            Files.copy(from, to, options);
            LOG.debug("Wrote {} -> {}", from, to);
        } catch (FileAlreadyExistsException e) {
            throw new AlreadyExistsException("Output already exists", to);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + to, e);
        }
    }
}
