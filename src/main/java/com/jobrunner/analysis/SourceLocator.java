package com.jobrunner.analysis;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the code text of a job class for static analysis.
 */
@FunctionalInterface
public interface SourceLocator {

    /**
     * Text to scan for the class, empty when its code cannot be located.
     */
    Optional<String> locate(Class<?> jobClass);

    /**
     * Locator that never finds anything.
     */
    static SourceLocator none() {
        return jobClass -> Optional.empty();
    }

    /**
     * Source files under the given roots first, then the compiled class.
     */
    static SourceLocator standard(List<String> sourceRoots) {
        List<SourceLocator> chain = new ArrayList<>();
        if (!sourceRoots.isEmpty()) {
            chain.add(new SourceRootLocator(sourceRoots.stream().map(Path::of).toList()));
        }
        chain.add(new ClassFileSourceLocator());
        return firstOf(chain);
    }

    static SourceLocator firstOf(List<SourceLocator> locators) {
        List<SourceLocator> copy = List.copyOf(locators);
        return jobClass -> {
            for (SourceLocator locator : copy) {
                Optional<String> text = locator.locate(jobClass);
                if (text.isPresent()) {
                    return text;
                }
            }
            return Optional.empty();
        };
    }
}
