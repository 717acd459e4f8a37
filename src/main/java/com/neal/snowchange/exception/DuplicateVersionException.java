package com.neal.snowchange.exception;

import java.nio.file.Path;

/**
 * @author Neal
 */
public class DuplicateVersionException extends MigrationException {
    private final String version;
    private final Path firstPath;
    private final Path secondPath;

    public DuplicateVersionException(String version, Path firstPath, Path secondPath) {
        super(String.format("The script version %s exists more than once (first instance %s, second instance %s)", version, firstPath, secondPath));
        this.version = version;
        this.firstPath = firstPath;
        this.secondPath = secondPath;
    }

    public String getVersion() {
        return version;
    }

    public Path getFirstPath() {
        return firstPath;
    }

    public Path getSecondPath() {
        return secondPath;
    }
}
