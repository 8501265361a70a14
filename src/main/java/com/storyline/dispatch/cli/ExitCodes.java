package com.storyline.dispatch.cli;

/**
 * Process exit codes returned by the subcommands.
 */
final class ExitCodes {

    static final int OK = 0;
    /** Syntax, definition or evaluation error in the resolved text. */
    static final int RESOLUTION_ERROR = 1;
    /** Unreadable input, unreadable or unwritable state file. */
    static final int IO_ERROR = 2;

    private ExitCodes() {}
}
