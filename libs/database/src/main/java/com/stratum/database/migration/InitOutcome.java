package com.stratum.database.migration;

/** What {@code init} found when it ran. */
public enum InitOutcome {
    /** The version row was created at version 0. */
    CREATED,
    /** A version row already existed and was left untouched. */
    ALREADY_INITIALIZED
}
