package com.phillippitts.simrecon.service.files;

import com.phillippitts.simrecon.exception.StorageException;

import java.io.IOException;
import java.io.Writer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.List;

/**
 * Concatenates text files (engine logs) into one file with separator lines between them.
 */
public final class TextFileCombiner {

    public static final char DEFAULT_SEPARATOR_CHAR = '-';
    public static final int DEFAULT_SEPARATOR_LINES = 2;
    public static final int DEFAULT_SEPARATOR_LENGTH = 80;

    private TextFileCombiner() {
    }

    /**
     * Combines files with the default separator (two lines of 80 dashes).
     */
    public static void combine(Path output, String header, List<Path> inputs) {
        combine(output, header, inputs, DEFAULT_SEPARATOR_CHAR, DEFAULT_SEPARATOR_LINES,
                DEFAULT_SEPARATOR_LENGTH);
    }

    /**
     * Writes {@code header} (if non-null) followed by every input, separated by
     * {@code separatorLines} lines of {@code separatorChar} repeated {@code separatorLength} times.
     * With {@code separatorLines < 1} the separator is a single newline. The output is forced to
     * stable storage before returning.
     *
     * @throws StorageException if an input cannot be read or the output cannot be written
     */
    public static void combine(Path output, String header, List<Path> inputs,
                               char separatorChar, int separatorLines, int separatorLength) {
        String separator = separator(separatorChar, separatorLines, separatorLength);
        try (FileChannel channel = FileChannel.open(output, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            Writer writer = Channels.newWriter(channel, StandardCharsets.UTF_8);
            if (header != null) {
                writer.write(header);
                writer.write(separator);
            }
            for (int i = 0; i < inputs.size(); i++) {
                if (i > 0) {
                    writer.write(separator);
                }
                // Lenient decode: engine logs may contain bytes that are not valid UTF-8
                writer.write(new String(Files.readAllBytes(inputs.get(i)), StandardCharsets.UTF_8));
            }
            writer.flush();
            channel.force(true);
        } catch (IOException e) {
            throw new StorageException("Failed to combine text files into " + output, e);
        }
    }

    static String separator(char separatorChar, int separatorLines, int separatorLength) {
        if (separatorLines < 1) {
            return "\n";
        }
        String line = separatorLength < 1 ? "" : String.valueOf(separatorChar).repeat(separatorLength);
        return "\n" + String.join("\n", Collections.nCopies(separatorLines, line)) + "\n";
    }
}
