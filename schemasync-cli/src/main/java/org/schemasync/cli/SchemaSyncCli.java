package org.schemasync.cli;

import picocli.CommandLine;

/**
 * Entry point of the schemasync command line tool.
 */
@CommandLine.Command(
        name = "schemasync",
        mixinStandardHelpOptions = true,
        version = "schemasync 0.1.0",
        description = "Compares two MySQL schemas and migrates the target to match the source",
        subcommands = {
                PlanCommand.class,
                SyncCommand.class
        }
)
public class SchemaSyncCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SchemaSyncCli()).execute(args);
        System.exit(exitCode);
    }
}
