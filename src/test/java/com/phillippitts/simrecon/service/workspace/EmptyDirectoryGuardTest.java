package com.phillippitts.simrecon.service.workspace;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class EmptyDirectoryGuardTest {

    @TempDir
    Path tempDir;

    @Test
    void removesNewDirectoryLeftEmpty() throws IOException {
        Path dir = tempDir.resolve("out");

        try (EmptyDirectoryGuard guard = EmptyDirectoryGuard.watch(dir)) {
            assertThat(guard.existedBefore()).isFalse();
            Files.createDirectory(dir);
        }

        assertThat(dir).doesNotExist();
    }

    @Test
    void keepsNewDirectoryWithContent() throws IOException {
        Path dir = tempDir.resolve("out");

        try (EmptyDirectoryGuard ignored = EmptyDirectoryGuard.watch(dir)) {
            Files.createDirectory(dir);
            Files.writeString(dir.resolve("result.dv"), "x");
        }

        assertThat(dir).isDirectory();
    }

    @Test
    void neverRemovesPreExistingDirectory() throws IOException {
        Path dir = Files.createDirectory(tempDir.resolve("existing"));

        try (EmptyDirectoryGuard guard = EmptyDirectoryGuard.watch(dir)) {
            assertThat(guard.existedBefore()).isTrue();
        }

        assertThat(dir).isDirectory();
    }

    @Test
    void nullPathIsNoOp() {
        EmptyDirectoryGuard guard = EmptyDirectoryGuard.watch(null);

        guard.close();

        assertThat(guard.existedBefore()).isFalse();
    }

    @Test
    void directoryNeverCreatedIsIgnored() {
        Path dir = tempDir.resolve("never");

        EmptyDirectoryGuard.watch(dir).close();

        assertThat(dir).doesNotExist();
    }
}
