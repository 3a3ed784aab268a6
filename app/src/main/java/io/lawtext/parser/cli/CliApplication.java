package io.lawtext.parser.cli;

import io.lawtext.parser.ActParser;
import io.lawtext.parser.ActSourceException;
import io.lawtext.parser.config.Config;
import io.lawtext.parser.config.ConfigLoader;
import io.lawtext.parser.config.OutputMode;
import io.lawtext.parser.config.SystemEnvironmentReader;
import io.lawtext.parser.logging.LoggingConfigurator;
import io.lawtext.parser.model.ActIdentity;
import io.lawtext.parser.model.ParsedAct;
import io.lawtext.parser.output.ParsedActJsonWriter;
import io.lawtext.parser.route.ParseStrategy;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and act parser.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_UNREADABLE_INPUT = 1;

    private final ConfigLoader configLoader;
    private final ActParser actParser;
    private final ParsedActJsonWriter jsonWriter;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new ActParser(), new ParsedActJsonWriter(),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, ActParser actParser, ParsedActJsonWriter jsonWriter,
                   PrintWriter out, PrintWriter err) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.actParser = Objects.requireNonNull(actParser, "actParser");
        this.jsonWriter = Objects.requireNonNull(jsonWriter, "jsonWriter");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            err.flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            err.flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        } catch (ActSourceException ex) {
            return reportUnreadable(ex);
        }
        LoggingConfigurator.configure(config.logFormat());

        String rawText;
        try {
            rawText = readInput(config.inputFile());
        } catch (ActSourceException ex) {
            return reportUnreadable(ex);
        }

        ActIdentity identity = config.identity();
        ParseStrategy strategy = actParser.router().route(identity, config.format());
        ParsedAct act = actParser.parse(rawText, identity, strategy);
        if (act.isEmpty()) {
            LOGGER.warn("No provisions recognized in {}", config.inputFile());
        }

        if (config.outputMode() == OutputMode.SUMMARY) {
            out.println(summaryLine(act, strategy));
        } else {
            out.println(jsonWriter.write(act, config.prettyPrint()));
        }
        out.flush();
        return 0;
    }

    static String readInput(Path inputFile) {
        if (!Files.isRegularFile(inputFile)) {
            throw new ActSourceException("Input file not found: " + inputFile);
        }
        try {
            return Files.readString(inputFile, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ActSourceException("Failed to read input file: " + inputFile, ex);
        }
    }

    static String summaryLine(ParsedAct act, ParseStrategy strategy) {
        ActIdentity identity = act.identity();
        String name = identity.shortName().isBlank() ? identity.id() : identity.shortName();
        return name + ' ' + strategy.name().toLowerCase(Locale.ROOT) + ' '
                + act.provisions().size() + ' ' + act.definitions().size();
    }

    private int reportUnreadable(ActSourceException ex) {
        LOGGER.error("{}", ex.getMessage(), ex);
        err.println(ex.getMessage());
        err.flush();
        return EXIT_UNREADABLE_INPUT;
    }
}
