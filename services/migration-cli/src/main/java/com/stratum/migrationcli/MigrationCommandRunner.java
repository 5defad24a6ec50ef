package com.stratum.migrationcli;

import com.stratum.database.migration.CommandResult;
import com.stratum.database.migration.MigrationCommand;
import com.stratum.database.migration.MigrationService;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs the command named by the first non-option argument and keeps its exit code.
 *
 * <p>Arguments starting with {@code --} are Spring property overrides and are not passed to the
 * command. Results go to standard output, failures and usage to standard error.
 */
@Component
public class MigrationCommandRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(MigrationCommandRunner.class);

    static final String MDC_COMMAND = "command";

    static final int USAGE_EXIT_CODE = 1;

    private final MigrationService migrationService;
    private final PrintStream out;
    private final PrintStream err;
    private int exitCode;

    @Autowired
    public MigrationCommandRunner(MigrationService migrationService) {
        this(migrationService, System.out, System.err);
    }

    MigrationCommandRunner(MigrationService migrationService, PrintStream out, PrintStream err) {
        this.migrationService = migrationService;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(String... args) {
        List<String> positional = Arrays.stream(args).filter(arg -> !arg.startsWith("--")).toList();
        if (positional.isEmpty()) {
            printUsage();
            exitCode = USAGE_EXIT_CODE;
            return;
        }

        String command = positional.get(0);
        List<String> arguments = positional.subList(1, positional.size());
        CommandResult result;
        MDC.put(MDC_COMMAND, command);
        try {
            log.debug("Running '{}' with arguments {}", command, arguments);
            result = migrationService.run(command, arguments);
        } finally {
            MDC.remove(MDC_COMMAND);
        }
        if (result.successful()) {
            out.println(result.message());
        } else {
            err.println(result.message());
            if (result.command() == null) {
                printUsage();
            }
        }
        exitCode = result.exitCode();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void printUsage() {
        err.println("usage: migration-cli <command> [target]");
        err.println();
        err.println("commands:");
        for (MigrationCommand command : MigrationCommand.values()) {
            err.printf("  %-8s %s%n", command.commandName(), command.help());
        }
    }
}
