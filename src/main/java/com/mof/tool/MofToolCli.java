package com.mof.tool;

import ch.qos.logback.classic.Level;
import com.mof.tool.command.MatchCommand;
import com.mof.tool.command.PreviewCommand;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(
    name = "mof-tool",
    mixinStandardHelpOptions = true,
    version = "mof-tool 1.0.0",
    description = "CLI tool for matching MOF adsorption records against partial search criteria",
    subcommands = {
        MatchCommand.class,
        PreviewCommand.class
    }
)
public class MofToolCli implements Callable<Integer> {

    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MofToolCli())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose logging")
    void setVerbose(boolean verbose) {
        this.verbose = verbose;
        if (verbose && LoggerFactory.getLogger("com.mof.tool") instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }
}
