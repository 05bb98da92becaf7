package com.phillippitts.simrecon.service.workspace;

import com.phillippitts.simrecon.exception.AlreadyExistsException;
import com.phillippitts.simrecon.exception.NotFoundException;
import com.phillippitts.simrecon.exception.StorageException;
import com.phillippitts.simrecon.service.files.FilenameRules;
import com.phillippitts.simrecon.service.files.PathAllocator;
import com.phillippitts.simrecon.service.files.Platform;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.filter.AbstractFilter;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class TemporaryWorkspaceTest {

    @TempDir
    Path tempDir;

    private TemporaryWorkspace.Builder builder(Path parent) {
        return TemporaryWorkspace.builder(parent)
                .pathAllocator(new PathAllocator(FilenameRules.forPlatform(Platform.LINUX)));
    }

    @Test
    void createsNamedDirectoryAndRemovesItOnClose() throws IOException {
        Path path;
        try (TemporaryWorkspace workspace = builder(tempDir).name("cell_ab12cd34").create()) {
            path = workspace.path();
            assertThat(path).isEqualTo(tempDir.resolve("cell_ab12cd34")).isDirectory();
            Files.writeString(workspace.allocateFile("cell", ".dv"), "data");
        }

        assertThat(path).doesNotExist();
    }

    @Test
    void keepsDirectoryWhenDeleteDisabled() {
        TemporaryWorkspace workspace = builder(tempDir).name("kept").delete(false).create();

        workspace.close();

        assertThat(workspace.path()).isDirectory();
        assertThat(workspace.isReleased()).isTrue();
    }

    @Test
    void fallsBackToAnonymousDirectoryWhenNameTaken() throws IOException {
        Files.createDirectory(tempDir.resolve("taken"));

        try (TemporaryWorkspace workspace = builder(tempDir).name("taken").create()) {
            assertThat(workspace.path()).isNotEqualTo(tempDir.resolve("taken"));
            assertThat(workspace.path().getParent()).isEqualTo(tempDir);
            assertThat(workspace.path().getFileName().toString()).startsWith("taken");
        }

        assertThat(tempDir.resolve("taken")).isDirectory();
    }

    @Test
    void rejectsTakenNameWithoutFallback() throws IOException {
        Files.createDirectory(tempDir.resolve("taken"));

        assertThatThrownBy(() -> builder(tempDir).name("taken").allowFallback(false).create())
                .isInstanceOf(AlreadyExistsException.class);
    }

    @Test
    void createsMissingParents() {
        Path parent = tempDir.resolve("a/b");

        try (TemporaryWorkspace workspace = builder(parent).create()) {
            assertThat(workspace.path().getParent()).isEqualTo(parent);
        }
    }

    @Test
    void missingParentFailsWhenCreationDisabled() {
        assertThatThrownBy(() -> builder(tempDir.resolve("absent")).createParents(false).create())
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void tracksAllocatedFiles() {
        try (TemporaryWorkspace workspace = builder(tempDir).create()) {
            Path a = workspace.allocateFile("in", ".dv");
            Path b = workspace.allocateFile("out", ".dv");

            assertThat(workspace.files()).containsExactly(a, b);
            assertThat(a.getParent()).isEqualTo(workspace.path());
        }
    }

    @Test
    void closeIsIdempotentAndBlocksFurtherAllocation() {
        TemporaryWorkspace workspace = builder(tempDir).create();
        workspace.close();
        workspace.close();

        assertThatThrownBy(() -> workspace.allocateFile("late", ".dv"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cleanupFailureThrowsUnlessIgnored() {
        TemporaryWorkspace strict = builder(tempDir).name("strict")
                .remover(path -> {
                    throw new AccessDeniedException(path.toString());
                })
                .create();

        assertThatThrownBy(strict::close)
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("strict")
                .hasCauseInstanceOf(AccessDeniedException.class);
        assertThat(strict.isReleased()).isTrue();

        TemporaryWorkspace lenient = builder(tempDir).name("lenient").ignoreCleanupErrors(true)
                .remover(path -> {
                    throw new AccessDeniedException(path.toString());
                })
                .create();

        lenient.close();

        assertThat(lenient.path()).isDirectory();
    }

    @Test
    void unreachableWorkspaceIsCleanedUpImplicitly() {
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        Logger logger = ctx.getLogger(TemporaryWorkspace.class.getName());
        InMemoryAppender appender = new InMemoryAppender("workspace-appender");
        appender.start();
        logger.addAppender(appender);
        try {
            Path leaked = createWithoutClosing("leaked");
            assertThat(leaked).isDirectory();

            await().atMost(10, SECONDS).pollInterval(100, MILLISECONDS).until(() -> {
                System.gc();
                return Files.notExists(leaked);
            });
            await().atMost(2, SECONDS).until(() -> appender.events.stream().anyMatch(e ->
                    e.getLevel() == Level.WARN
                            && e.getMessage().getFormattedMessage().contains("Implicitly cleaning up")
                            && e.getMessage().getFormattedMessage().contains("leaked")));
        } finally {
            logger.removeAppender(appender);
            appender.stop();
        }
    }

    private Path createWithoutClosing(String name) {
        TemporaryWorkspace workspace = builder(tempDir).name(name).create();
        return workspace.path();
    }

    private static class InMemoryAppender extends AbstractAppender {
        private final List<LogEvent> events = new CopyOnWriteArrayList<>();

        InMemoryAppender(String name) {
            super(name, new AbstractFilter() {}, PatternLayout.createDefaultLayout(), true, null);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }
    }
}
