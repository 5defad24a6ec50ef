package com.stratum.database.migration;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public surface of the migration engine: {@code init}, {@code inspect}, {@code latest}, {@code
 * upgrade} and {@code status}.
 *
 * <p>Each operation returns a {@link CommandResult} instead of throwing: every {@link
 * MigrationException} is logged and turned into an unsuccessful result, so a host can map the
 * outcome straight to an exit status. Arguments are validated before the database is contacted.
 *
 * <p>This is a POJO (no Spring annotations) and can be built directly in tests. Spring wiring
 * lives in {@link com.stratum.database.migration.config.MigrationEngineConfig}.
 */
public class MigrationService {

    private static final Logger log = LoggerFactory.getLogger(MigrationService.class);

    private final MigrationExecutor executor;

    public MigrationService(MigrationExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Dispatches a command by name, the way a command line names it.
     *
     * @param commandName one of the {@link MigrationCommand} names
     * @param arguments remaining arguments; only {@code upgrade} accepts one (the target)
     * @return the command's result; unsuccessful for unknown commands or bad arguments
     */
    public CommandResult run(String commandName, List<String> arguments) {
        List<String> args = arguments == null ? List.of() : arguments;
        MigrationCommand command = MigrationCommand.fromName(commandName).orElse(null);
        if (command == null) {
            log.error("Unknown command '{}'", commandName);
            return CommandResult.failure(null, "Unknown command '%s'".formatted(commandName));
        }
        int allowed = command == MigrationCommand.UPGRADE ? 1 : 0;
        if (args.size() > allowed) {
            String extra = String.join(" ", args.subList(allowed, args.size()));
            return CommandResult.failure(command,
                    "Unexpected arguments for '%s': %s".formatted(command.commandName(), extra));
        }
        return switch (command) {
            case INIT -> init();
            case INSPECT -> inspect();
            case LATEST -> latest();
            case UPGRADE -> upgrade(args.isEmpty() ? null : args.get(0));
            case STATUS -> status();
        };
    }

    public CommandResult init() {
        return guarded(MigrationCommand.INIT, () -> {
            InitOutcome outcome = executor.init();
            return outcome == InitOutcome.CREATED
                    ? CommandResult.success(MigrationCommand.INIT, 0, "Database initialized")
                    : CommandResult.success(MigrationCommand.INIT, "Database was already initialized");
        });
    }

    /** Unsuccessful, without raising, when the database is not initialized or unparsable. */
    public CommandResult inspect() {
        return guarded(MigrationCommand.INSPECT, () -> {
            VersionState state = executor.inspect();
            return switch (state.status()) {
                case INITIALIZED -> CommandResult.success(
                        MigrationCommand.INSPECT, state.version(), Long.toString(state.version()));
                case NOT_INITIALIZED -> CommandResult.failure(
                        MigrationCommand.INSPECT, new NotInitializedException().getMessage());
                case UNPARSABLE -> CommandResult.failure(
                        MigrationCommand.INSPECT, new VersionParseException(state.rawValue()).getMessage());
            };
        });
    }

    public CommandResult latest() {
        return guarded(MigrationCommand.LATEST, () -> {
            long latest = executor.latest();
            return CommandResult.success(MigrationCommand.LATEST, latest, Long.toString(latest));
        });
    }

    /**
     * @param target null or {@value UpgradeTarget#LATEST} for the latest migration, otherwise a
     *     non-negative integer
     */
    public CommandResult upgrade(String target) {
        return guarded(MigrationCommand.UPGRADE, () -> {
            UpgradeTarget parsed = UpgradeTarget.parse(target);
            UpgradeResult result = executor.upgrade(parsed);
            String message = result.upToDate()
                    ? "Already up to date at version %d".formatted(result.currentVersion())
                    : "Upgraded from version %d to %d".formatted(result.previousVersion(), result.currentVersion());
            return CommandResult.success(MigrationCommand.UPGRADE, result.currentVersion(), message);
        });
    }

    public CommandResult status() {
        return guarded(MigrationCommand.STATUS, () -> {
            MigrationStatus status = executor.status();
            if (status.currentVersion() > status.latestVersion()) {
                return CommandResult.failure(MigrationCommand.STATUS,
                        new VersionAheadOfMigrationsException(status.currentVersion(), status.latestVersion())
                                .getMessage());
            }
            String message = status.upToDate()
                    ? "Up to date at version %d".formatted(status.currentVersion())
                    : "At version %d, %d pending: %s".formatted(
                            status.currentVersion(),
                            status.pending().size(),
                            status.pending().stream()
                                    .map(MigrationDescriptor::identifier)
                                    .collect(Collectors.joining(", ")));
            return CommandResult.success(MigrationCommand.STATUS, status.currentVersion(), message);
        });
    }

    private CommandResult guarded(MigrationCommand command, Supplier<CommandResult> action) {
        try {
            return action.get();
        } catch (MigrationException e) {
            log.warn("{} failed: {}", command.commandName(), e.getMessage());
            return CommandResult.failure(command, e.getMessage());
        }
    }
}
