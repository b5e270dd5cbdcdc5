/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.shell;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.cloudway.lambda.Evaluator;
import com.cloudway.lambda.Result;
import com.cloudway.lambda.reduce.Trace;
import jline.ConsoleReader;
import jline.History;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.PosixParser;

/**
 * The interactive shell. Each line is translated, interpreted and echoed
 * together with its result; two empty lines in a row end the session.
 */
public class REPL
{
    private static final Logger logger = Logger.getLogger(REPL.class.getName());

    /**
     * A source of input lines, such as a line editor.
     */
    @FunctionalInterface
    public interface LineSource {
        /**
         * Reads one line.
         *
         * @return the line, or null at end of input
         */
        String readLine(String prompt) throws IOException;
    }

    private final Interpreter interpreter;
    private final PrintStream out;

    public REPL(Interpreter interpreter, PrintStream out) {
        this.interpreter = interpreter;
        this.out = out;
    }

    public Interpreter getInterpreter() {
        return interpreter;
    }

    /**
     * Reads and interprets lines until input ends or two consecutive empty
     * lines are read.
     */
    public void run(LineSource in, String prompt) throws IOException {
        String line;
        while ((line = in.readLine(prompt)) != null) {
            if (isBlank(line)) {
                line = in.readLine(prompt);
                if (line == null || isBlank(line))
                    break;
            }
            process(line);
        }
    }

    /**
     * Interprets a single line and prints it with its result.
     */
    public Result process(String line) {
        String input = Interpreter.translate(line);
        Result result = interpreter.interpret(input);
        out.println(" - " + input + " - ");
        out.println(result.getValue());
        out.println();
        return result;
    }

    /**
     * Interprets every non-blank line of a file.
     *
     * @return true if all lines succeeded
     */
    public boolean runFile(Path file) throws IOException {
        boolean ok = true;
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!isBlank(line)) {
                ok &= process(line).isOk();
            }
        }
        return ok;
    }

    public void runConsole() throws IOException {
        ConsoleReader console = new ConsoleReader(System.in,
            new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        Config.historyFile().ifPresent(file -> useHistoryFile(console, file));
        run(console::readLine, Config.PROMPT.get());
    }

    private static void useHistoryFile(ConsoleReader console, Path file) {
        try {
            console.setHistory(new History(file.toFile()));
        } catch (IOException ex) {
            logger.log(Level.WARNING, "cannot use history file " + file, ex);
        }
    }

    private static boolean isBlank(String line) {
        return line.trim().isEmpty();
    }

    // -----------------------------------------------------------------------
    // Command line

    @SuppressWarnings("all")
    private static final Option[] OPTIONS = {
        OptionBuilder.withLongOpt("eval")
                     .withArgName("term")
                     .withDescription("Evaluate a term and exit")
                     .hasArg()
                     .create('e'),
        OptionBuilder.withLongOpt("interactive")
                     .withDescription("Enter the interactive shell after running a file")
                     .create('i'),
        OptionBuilder.withLongOpt("help")
                     .withDescription("Show this help message")
                     .create('h')
    };

    private static Options options() {
        Options options = new Options();
        Arrays.stream(OPTIONS).forEach(options::addOption);
        return options;
    }

    private static void printHelp(Options options) {
        List<Option> order = Arrays.asList(OPTIONS);
        Comparator<Option> c = (o1,o2) -> order.indexOf(o1) - order.indexOf(o2);

        HelpFormatter formatter = new HelpFormatter();
        formatter.setOptionComparator(c);
        formatter.printHelp("lambda [OPTION]... [file]", options);
    }

    /**
     * Runs the shell as directed by the command line.
     *
     * @return the process exit status
     */
    static int execute(String[] args, PrintStream out) throws IOException {
        Options options = options();

        CommandLine cmd;
        try {
            CommandLineParser parser = new PosixParser();
            cmd = parser.parse(options, args);
        } catch (ParseException ex) {
            System.err.println(ex.getMessage());
            printHelp(options);
            return 1;
        }

        if (cmd.hasOption('h')) {
            printHelp(options);
            return 0;
        }

        String[] files = cmd.getArgs();
        if (files.length > 1 || (files.length == 1 && cmd.hasOption('e'))) {
            printHelp(options);
            return 1;
        }

        REPL repl = new REPL(new Interpreter(new Evaluator(Trace.to(out))), out);

        if (cmd.hasOption('e')) {
            return repl.process(cmd.getOptionValue('e')).isOk() ? 0 : 1;
        }

        String  filename    = files.length == 1 ? files[0] : null;
        boolean interactive = filename == null || cmd.hasOption('i');
        boolean ok          = true;

        if (filename != null)
            ok = repl.runFile(Paths.get(filename));
        if (interactive)
            repl.runConsole();
        return ok ? 0 : 1;
    }

    public static void main(String[] args) throws IOException {
        System.exit(execute(args, stdout()));
    }

    private static PrintStream stdout() {
        try {
            return new PrintStream(System.out, true, "UTF-8");
        } catch (UnsupportedEncodingException ex) {
            throw new AssertionError(ex);
        }
    }
}
