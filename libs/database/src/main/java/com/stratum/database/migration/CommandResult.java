package com.stratum.database.migration;

import java.util.OptionalLong;

/**
 * What a host should report after running a {@link MigrationCommand}.
 *
 * @param command the command that ran; null if the name was not recognised
 * @param successful false for any reported error condition
 * @param version the version the command reports, when it has one
 * @param message one-line human-readable summary
 */
public record CommandResult(
        MigrationCommand command, boolean successful, OptionalLong version, String message) {

    public static CommandResult success(MigrationCommand command, String message) {
        return new CommandResult(command, true, OptionalLong.empty(), message);
    }

    public static CommandResult success(MigrationCommand command, long version, String message) {
        return new CommandResult(command, true, OptionalLong.of(version), message);
    }

    public static CommandResult failure(MigrationCommand command, String message) {
        return new CommandResult(command, false, OptionalLong.empty(), message);
    }

    /** Process exit status: 0 on success, 1 for any reported error. */
    public int exitCode() {
        return successful ? 0 : 1;
    }
}
