package io.lawtext.parser.cli;

import io.lawtext.parser.config.OutputMode;
import picocli.CommandLine;

public class OutputModeConverter implements CommandLine.ITypeConverter<OutputMode> {

    @Override
    public OutputMode convert(String value) {
        return OutputMode.from(value);
    }
}
