package com.stratum.database.migration;

import java.nio.file.Path;

/** Thrown when the configured migrations directory does not exist. */
public class MigrationDirectoryNotFoundException extends MigrationException {

    private final Path directory;

    public MigrationDirectoryNotFoundException(Path directory) {
        super("Unable to find migration folder '%s'".formatted(directory));
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }
}
