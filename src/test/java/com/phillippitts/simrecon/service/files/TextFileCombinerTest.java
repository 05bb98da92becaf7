package com.phillippitts.simrecon.service.files;

import com.phillippitts.simrecon.exception.StorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextFileCombinerTest {

    @TempDir
    Path tempDir;

    @Test
    void joinsFilesWithHeaderAndSeparators() throws IOException {
        Path a = Files.writeString(tempDir.resolve("a.log"), "first");
        Path b = Files.writeString(tempDir.resolve("b.log"), "second");
        Path out = tempDir.resolve("combined.log");

        TextFileCombiner.combine(out, "Job 1234", List.of(a, b), '=', 1, 4);

        assertThat(Files.readString(out)).isEqualTo("Job 1234\n====\nfirst\n====\nsecond");
    }

    @Test
    void omitsHeaderWhenNull() throws IOException {
        Path a = Files.writeString(tempDir.resolve("a.log"), "only");
        Path out = tempDir.resolve("combined.log");

        TextFileCombiner.combine(out, null, List.of(a));

        assertThat(Files.readString(out)).isEqualTo("only");
    }

    @Test
    void overwritesExistingOutput() throws IOException {
        Path a = Files.writeString(tempDir.resolve("a.log"), "new");
        Path out = Files.writeString(tempDir.resolve("combined.log"), "much longer old content");

        TextFileCombiner.combine(out, null, List.of(a));

        assertThat(Files.readString(out)).isEqualTo("new");
    }

    @Test
    void toleratesInvalidUtf8() throws IOException {
        Path a = Files.write(tempDir.resolve("a.log"), new byte[] {'o', 'k', (byte) 0xFF});
        Path out = tempDir.resolve("combined.log");

        TextFileCombiner.combine(out, null, List.of(a));

        assertThat(Files.readString(out, StandardCharsets.UTF_8)).startsWith("ok");
    }

    @Test
    void defaultSeparatorIsTwoDashedLines() {
        String line = "-".repeat(80);

        assertThat(TextFileCombiner.separator('-', 2, 80)).isEqualTo("\n" + line + "\n" + line + "\n");
        assertThat(TextFileCombiner.separator('-', 0, 80)).isEqualTo("\n");
    }

    @Test
    void missingInputFails() {
        Path out = tempDir.resolve("combined.log");

        assertThatThrownBy(() -> TextFileCombiner.combine(out, null, List.of(tempDir.resolve("missing.log"))))
                .isInstanceOf(StorageException.class);
    }
}
