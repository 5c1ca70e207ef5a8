package com.syntaxis.generator;

import com.syntaxis.generator.cli.GenerateCommand;

/**
 * Main entry point for the Syntaxis template generator.
 * Turns grammatical templates into word sequences drawn from a lexicon.
 */
public class SyntaxisApplication {

    public static void main(String[] args) {
        int exitCode = GenerateCommand.newCommandLine().execute(args);
        System.exit(exitCode);
    }
}
