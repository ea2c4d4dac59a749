package dss;

import dss.cli.DssCommand;
import picocli.CommandLine;

/**
 * Entry point of the {@code dss} command line.
 */
public class App {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DssCommand()).execute(args);
        System.exit(exitCode);
    }
}
