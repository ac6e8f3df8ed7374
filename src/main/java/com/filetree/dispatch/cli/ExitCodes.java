package com.filetree.dispatch.cli;

/**
 * Process exit codes returned by the commands.
 */
final class ExitCodes {

    static final int OK = 0;
    static final int FAILURE = 1;
    static final int CONFIGURATION = 2;

    private ExitCodes() {}
}
