package dss.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level {@code dss} command. Does nothing by itself but print usage.
 */
@Command(name = "dss",
        mixinStandardHelpOptions = true,
        version = "dss 0.3.0",
        header = "Distributed simulation scheduling coordinator",
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0: success",
                "1: store or validation error",
                "2: invalid command line"
        },
        subcommands = {
                GenerateCommand.class,
                ServeCommand.class,
                StatusCommand.class,
                DeleteCommand.class,
                RerunCommand.class,
                CommandLine.HelpCommand.class
        })
public class DssCommand implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
