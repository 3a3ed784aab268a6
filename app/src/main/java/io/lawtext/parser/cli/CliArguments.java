package io.lawtext.parser.cli;

import io.lawtext.parser.config.LogFormat;
import io.lawtext.parser.config.OutputMode;
import io.lawtext.parser.model.ActStatus;
import io.lawtext.parser.model.SourceFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "law-text-parser", mixinStandardHelpOptions = true, version = "law-text-parser 0.1.0",
        description = "Parses the text of an already fetched act into provisions and definitions")
public class CliArguments {

    @CommandLine.Parameters(index = "0", description = "HTML page or extracted PDF text of the act", paramLabel = "FILE")
    private Path inputFile;

    @CommandLine.Option(names = "--format", converter = SourceFormatConverter.class,
            description = "Source format: html or text (default: from the file extension)")
    private SourceFormat format;

    @CommandLine.Option(names = "--identity", description = "JSON registry entry describing the act", paramLabel = "FILE")
    private Path identityFile;

    @CommandLine.Option(names = "--act-id", description = "Act identifier (default: input file name without extension)", paramLabel = "ID")
    private String actId;

    @CommandLine.Option(names = "--title", description = "Title in the original language")
    private String title;

    @CommandLine.Option(names = "--title-en", description = "English title")
    private String titleEn;

    @CommandLine.Option(names = "--short-name", description = "Abbreviation of the act")
    private String shortName;

    @CommandLine.Option(names = "--year", description = "Year of enactment")
    private Integer year;

    @CommandLine.Option(names = "--status", converter = ActStatusConverter.class,
            description = "in_force, amended, repealed or not_yet_in_force")
    private ActStatus status;

    @CommandLine.Option(names = "--url", description = "Source URL recorded on the act")
    private String url;

    @CommandLine.Option(names = "--output", converter = OutputModeConverter.class, description = "Output: json or summary")
    private OutputMode outputMode;

    @CommandLine.Option(names = "--pretty", description = "Pretty-print JSON output")
    private boolean pretty;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path inputFile() {
        return inputFile;
    }

    public SourceFormat format() {
        return format;
    }

    public Path identityFile() {
        return identityFile;
    }

    public String actId() {
        return actId;
    }

    public String title() {
        return title;
    }

    public String titleEn() {
        return titleEn;
    }

    public String shortName() {
        return shortName;
    }

    public Integer year() {
        return year;
    }

    public ActStatus status() {
        return status;
    }

    public String url() {
        return url;
    }

    public OutputMode outputMode() {
        return outputMode;
    }

    public boolean pretty() {
        return pretty;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
