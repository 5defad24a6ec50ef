package com.stratum.database.migration;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Named operations a host can ask {@link MigrationService} to run. */
public enum MigrationCommand {
    INIT("init", "create the version table"),
    INSPECT("inspect", "print the database version"),
    LATEST("latest", "print the latest migration version"),
    UPGRADE("upgrade", "run migrations up to [target] (default: latest)"),
    STATUS("status", "list migrations not yet applied");

    private final String commandName;
    private final String help;

    MigrationCommand(String commandName, String help) {
        this.commandName = commandName;
        this.help = help;
    }

    public String commandName() {
        return commandName;
    }

    public String help() {
        return help;
    }

    public static Optional<MigrationCommand> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(c -> c.commandName.equals(normalized)).findFirst();
    }
}
