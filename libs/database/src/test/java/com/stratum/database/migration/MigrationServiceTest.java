package com.stratum.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link MigrationService}: command dispatch, argument normalization and the
 * translation of engine exceptions into {@link CommandResult}s.
 */
@DisplayName("MigrationService")
class MigrationServiceTest {

    private MigrationExecutor executor;
    private MigrationService service;

    @BeforeEach
    void setUp() {
        executor = mock(MigrationExecutor.class);
        service = new MigrationService(executor);
    }

    @Nested
    @DisplayName("upgrade target normalization")
    class UpgradeTargets {

        @Test
        @DisplayName("an absent target means latest")
        void absentMeansLatest() {
            when(executor.upgrade(UpgradeTarget.latest())).thenReturn(UpgradeResult.upToDate(4));

            CommandResult result = service.run("upgrade", List.of());

            assertThat(result.successful()).isTrue();
            verify(executor).upgrade(UpgradeTarget.latest());
        }

        @Test
        @DisplayName("a numeric target is passed as a version")
        void numericTarget() {
            when(executor.upgrade(UpgradeTarget.of(7)))
                    .thenReturn(new UpgradeResult(3, 7, List.of(descriptor(7))));

            CommandResult result = service.upgrade("7");

            assertThat(result.successful()).isTrue();
            assertThat(result.version()).hasValue(7);
            assertThat(result.message()).isEqualTo("Upgraded from version 3 to 7");
        }

        @Test
        @DisplayName("an invalid target fails before the database is contacted")
        void invalidTarget() {
            CommandResult result = service.upgrade("tip");

            assertThat(result.successful()).isFalse();
            assertThat(result.exitCode()).isEqualTo(1);
            assertThat(result.message()).contains("tip");
            verifyNoInteractions(executor);
        }
    }

    @Nested
    @DisplayName("reported conditions")
    class ReportedConditions {

        @Test
        @DisplayName("not initialized is an unsuccessful result, not an exception")
        void notInitialized() {
            when(executor.upgrade(UpgradeTarget.latest())).thenThrow(new NotInitializedException());

            CommandResult result = service.upgrade(null);

            assertThat(result.successful()).isFalse();
            assertThat(result.command()).isEqualTo(MigrationCommand.UPGRADE);
            assertThat(result.message()).contains("init");
        }

        @Test
        @DisplayName("version ahead of migrations is reported")
        void versionAhead() {
            when(executor.upgrade(UpgradeTarget.latest()))
                    .thenThrow(new VersionAheadOfMigrationsException(5, 3));

            assertThat(service.upgrade("latest").exitCode()).isEqualTo(1);
        }

        @Test
        @DisplayName("a missing migrations directory fails latest")
        void missingDirectory() {
            when(executor.latest()).thenThrow(new MigrationDirectoryNotFoundException(Path.of("gone")));

            CommandResult result = service.latest();

            assertThat(result.successful()).isFalse();
            assertThat(result.message()).contains("gone");
        }

        @Test
        @DisplayName("a failed migration is reported with its identifier")
        void applicationFailure() {
            when(executor.upgrade(UpgradeTarget.latest())).thenThrow(new MigrationApplicationException(
                    descriptor(2), new IllegalStateException("boom")));

            CommandResult result = service.upgrade(null);

            assertThat(result.successful()).isFalse();
            assertThat(result.message()).contains("version_2").contains("boom");
        }
    }

    @Nested
    @DisplayName("inspect")
    class Inspect {

        @Test
        @DisplayName("reports the stored version")
        void initialized() {
            when(executor.inspect()).thenReturn(VersionState.initialized(9));

            CommandResult result = service.inspect();

            assertThat(result.successful()).isTrue();
            assertThat(result.message()).isEqualTo("9");
        }

        @Test
        @DisplayName("not initialized yields a non-zero exit code")
        void notInitialized() {
            when(executor.inspect()).thenReturn(VersionState.notInitialized());

            assertThat(service.inspect().exitCode()).isEqualTo(1);
        }

        @Test
        @DisplayName("an unparsable stored value yields a non-zero exit code")
        void unparsable() {
            when(executor.inspect()).thenReturn(VersionState.unparsable("x"));

            CommandResult result = service.inspect();

            assertThat(result.exitCode()).isEqualTo(1);
            assertThat(result.message()).contains("'x'");
        }
    }

    @Nested
    @DisplayName("dispatch by name")
    class Dispatch {

        @Test
        @DisplayName("init reports whether state was created")
        void init() {
            when(executor.init()).thenReturn(InitOutcome.CREATED, InitOutcome.ALREADY_INITIALIZED);

            assertThat(service.run("init", List.of()).message()).isEqualTo("Database initialized");
            CommandResult second = service.run("init", null);
            assertThat(second.successful()).isTrue();
            assertThat(second.message()).isEqualTo("Database was already initialized");
        }

        @Test
        @DisplayName("latest prints the highest version")
        void latest() {
            when(executor.latest()).thenReturn(12L);

            CommandResult result = service.run("LATEST", List.of());

            assertThat(result.message()).isEqualTo("12");
            assertThat(result.exitCode()).isZero();
        }

        @Test
        @DisplayName("status lists pending migrations")
        void status() {
            when(executor.status()).thenReturn(new MigrationStatus(1, 3, List.of(descriptor(2), descriptor(3))));

            CommandResult result = service.run("status", List.of());

            assertThat(result.message()).isEqualTo("At version 1, 2 pending: version_2, version_3");
        }

        @Test
        @DisplayName("unknown commands fail")
        void unknownCommand() {
            CommandResult result = service.run("downgrade", List.of("1"));

            assertThat(result.successful()).isFalse();
            assertThat(result.command()).isNull();
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("unexpected arguments fail without running the command")
        void extraArguments() {
            assertThat(service.run("inspect", List.of("now")).successful()).isFalse();
            assertThat(service.run("upgrade", List.of("1", "2")).successful()).isFalse();
            verifyNoInteractions(executor);
        }
    }

    private static MigrationDescriptor descriptor(long version) {
        return new MigrationDescriptor(
                "version_" + version, version, Path.of("version_" + version + ".sql"), migrator -> List.of());
    }
}
