package com.jobrunner.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Reads the symbols of the job's compiled class from its class loader.
 */
public class ClassFileSourceLocator implements SourceLocator {

    private static final Logger log = LoggerFactory.getLogger(ClassFileSourceLocator.class);

    @Override
    public Optional<String> locate(Class<?> jobClass) {
        String resource = "/" + jobClass.getName().replace('.', '/') + ".class";
        try (InputStream in = jobClass.getResourceAsStream(resource)) {
            if (in == null) {
                return Optional.empty();
            }
            return Optional.of(String.join("\n", ClassFileSymbols.read(in)));
        } catch (IOException e) {
            log.debug("Cannot read class file of {}: {}", jobClass.getName(), e.getMessage());
            return Optional.empty();
        }
    }
}
