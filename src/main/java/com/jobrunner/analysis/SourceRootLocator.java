package com.jobrunner.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Looks up {@code <root>/<package dirs>/<TopLevelClass>.java}.
 */
public class SourceRootLocator implements SourceLocator {

    private static final Logger log = LoggerFactory.getLogger(SourceRootLocator.class);

    private final List<Path> roots;

    public SourceRootLocator(List<Path> roots) {
        this.roots = List.copyOf(roots);
    }

    @Override
    public Optional<String> locate(Class<?> jobClass) {
        Class<?> topLevel = jobClass;
        while (topLevel.getEnclosingClass() != null) {
            topLevel = topLevel.getEnclosingClass();
        }
        String relative = topLevel.getName().replace('.', '/') + ".java";

        for (Path root : roots) {
            Path candidate = root.resolve(relative);
            if (Files.isRegularFile(candidate)) {
                try {
                    return Optional.of(Files.readString(candidate));
                } catch (IOException e) {
                    log.warn("Cannot read source file {}: {}", candidate, e.getMessage());
                }
            }
        }
        return Optional.empty();
    }
}
