package com.stratum.database.migration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers migration files in a directory and orders them by version.
 *
 * <p>A file is a candidate when its name starts with {@value #PREFIX} and one of the registered
 * {@link MigrationLoader}s supports it. The version is the run of digits following the prefix, so
 * {@code version_12_add_orders.sql} is version 12. Candidates whose version cannot be parsed are
 * skipped with a warning; discovery continues with the rest.
 *
 * <p>The result is sorted ascending by version. The directory listing is sorted by file name
 * first and the version sort is stable, so duplicate versions keep file-name order.
 */
public final class MigrationRegistry {

    private static final Logger log = LoggerFactory.getLogger(MigrationRegistry.class);

    /** File name prefix every migration must carry. */
    public static final String PREFIX = "version_";

    private static final Pattern VERSION = Pattern.compile(PREFIX + "(\\d+)");

    private final List<MigrationLoader> loaders;

    /**
     * @param loaders loaders consulted in order for each candidate file; at least one
     */
    public MigrationRegistry(List<MigrationLoader> loaders) {
        if (loaders == null || loaders.isEmpty()) {
            throw new IllegalArgumentException("at least one MigrationLoader is required");
        }
        this.loaders = List.copyOf(loaders);
    }

    /**
     * Lists, parses and loads every migration in {@code directory}.
     *
     * @param directory the migrations directory
     * @return descriptors sorted ascending by version; empty if the directory holds none
     * @throws MigrationDirectoryNotFoundException if the directory does not exist
     * @throws MigrationException if the directory cannot be listed
     */
    public List<MigrationDescriptor> discover(Path directory) {
        if (!Files.isDirectory(directory)) {
            log.error("Unable to find migration folder '{}'", directory.toAbsolutePath());
            throw new MigrationDirectoryNotFoundException(directory);
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new MigrationException("Unable to list migration folder '%s'".formatted(directory), e);
        }

        List<MigrationDescriptor> migrations = new ArrayList<>();
        for (Path file : files) {
            String fileName = file.getFileName().toString();
            if (!fileName.startsWith(PREFIX)) {
                continue;
            }
            Optional<MigrationLoader> loader = loaderFor(fileName);
            if (loader.isEmpty()) {
                log.debug("No loader for '{}', ignoring", fileName);
                continue;
            }

            String identifier = stripExtension(fileName);
            Optional<Long> version = parseVersion(identifier);
            if (version.isEmpty()) {
                log.warn("Cannot parse version number from '{}', skipping", identifier);
                continue;
            }

            log.debug("Found {} at version {}", identifier, version.get());
            migrations.add(new MigrationDescriptor(
                    identifier, version.get(), file, loader.get().load(file)));
        }

        migrations.sort(Comparator.comparingLong(MigrationDescriptor::version));
        return List.copyOf(migrations);
    }

    /**
     * Returns the highest version in {@code directory}, or 0 when it holds no migrations.
     *
     * @throws MigrationDirectoryNotFoundException if the directory does not exist
     */
    public long latestVersion(Path directory) {
        return latestVersion(discover(directory));
    }

    static long latestVersion(List<MigrationDescriptor> migrations) {
        return migrations.isEmpty() ? 0 : migrations.get(migrations.size() - 1).version();
    }

    /**
     * Extracts the version from a migration identifier.
     *
     * @param identifier file name without extension
     * @return the version, or empty if there are no digits after the prefix or they overflow
     */
    static Optional<Long> parseVersion(String identifier) {
        Matcher matcher = VERSION.matcher(identifier);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(matcher.group(1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private Optional<MigrationLoader> loaderFor(String fileName) {
        return loaders.stream().filter(loader -> loader.supports(fileName)).findFirst();
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
