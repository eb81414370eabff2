package com.jobrunner.analysis;

import com.jobrunner.fixtures.ProcessVideoExport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ClassFileSymbols and the source locators built on it.
 */
class ClassFileSymbolsTest {

    @Test
    @DisplayName("Should read names and literals from a compiled class")
    void shouldReadSymbols() throws IOException {
        try (InputStream in = ProcessVideoExport.class.getResourceAsStream("ProcessVideoExport.class")) {
            assertNotNull(in);
            List<String> symbols = ClassFileSymbols.read(in);

            assertTrue(symbols.contains("java/lang/ProcessBuilder"));
            assertTrue(symbols.contains("ffmpeg"));
            assertTrue(symbols.contains("execute"));
        }
    }

    @Test
    @DisplayName("Should reject data without the class-file magic")
    void shouldRejectNonClassFile() {
        InputStream in = new ByteArrayInputStream(new byte[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10});

        assertThrows(IOException.class, () -> ClassFileSymbols.read(in));
    }

    @Test
    @DisplayName("Class-file locator should return the joined symbols")
    void classFileLocator() {
        Optional<String> text = new ClassFileSourceLocator().locate(ProcessVideoExport.class);

        assertTrue(text.isPresent());
        assertTrue(text.get().contains("ffmpeg"));
    }

    @Test
    @DisplayName("Source roots should take precedence over the class file")
    void sourceRootsFirst(@TempDir Path root) throws IOException {
        Path source = root.resolve("com/jobrunner/fixtures/ProcessVideoExport.java");
        Files.createDirectories(source.getParent());
        Files.writeString(source, "class ProcessVideoExport { /* marker-from-source */ }");

        String text = SourceLocator.standard(List.of(root.toString()))
                .locate(ProcessVideoExport.class)
                .orElseThrow();

        assertTrue(text.contains("marker-from-source"));
    }

    @Test
    @DisplayName("Missing source files should fall back to the class file")
    void fallsBackToClassFile(@TempDir Path root) {
        String text = SourceLocator.standard(List.of(root.toString()))
                .locate(ProcessVideoExport.class)
                .orElseThrow();

        assertTrue(text.contains("java/lang/ProcessBuilder"));
    }
}
