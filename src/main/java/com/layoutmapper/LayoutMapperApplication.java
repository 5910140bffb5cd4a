package com.layoutmapper;

import com.layoutmapper.cli.LayoutMapperCommand;
import picocli.CommandLine;

/**
 * Main entry point for the layout mapper CLI.
 * Reads design-tool layout exports and component catalogs from disk and reports
 * style digests, component mappings and generated scaffold code.
 */
public class LayoutMapperApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LayoutMapperCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
