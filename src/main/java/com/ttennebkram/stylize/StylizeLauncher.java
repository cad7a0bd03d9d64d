package com.ttennebkram.stylize;

import com.ttennebkram.stylize.cli.BatchCommand;
import com.ttennebkram.stylize.cli.ProcessCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintStream;
import java.io.PrintWriter;

/**
 * Command line entry point.
 *
 * <pre>
 *   stylize process &lt;in&gt; &lt;out&gt; [-e effect] [-c config] [-p preset] [-s seed] [--debug]
 *   stylize batch -i dir -o dir [-e] [-c] [-p] [-v n] [-j n] [--subprocess] [--timeout seconds]
 * </pre>
 *
 * Exit codes: 0 success, 1 failure (diagnostic on stderr), 2 usage error.
 */
@CommandLine.Command(
        name = "stylize",
        description = "Artistic image transformation with pluggable effects.",
        version = "1.0",
        subcommands = {
                ProcessCommand.class,
                BatchCommand.class
        },
        mixinStandardHelpOptions = true
)
public class StylizeLauncher implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StylizeLauncher.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public StylizeLauncher() {
        this(System.out, System.err);
    }

    public StylizeLauncher(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public PrintStream getOut() {
        return out;
    }

    public PrintStream getErr() {
        return err;
    }

    @Override
    public void run() {
        // No subcommand given
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing command: process or batch");
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Parse and execute one command line.
     *
     * @return the process exit code
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLine cmd = new CommandLine(new StylizeLauncher(out, err));
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            log.debug("Command failed", ex);
            err.println("Error: " + (ex.getMessage() != null ? ex.getMessage() : ex.toString()));
            return EXIT_FAILURE;
        });
        return cmd.execute(args);
    }
}
