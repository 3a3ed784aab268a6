package io.lawtext.parser.cli;

import io.lawtext.parser.model.SourceFormat;
import picocli.CommandLine;

public class SourceFormatConverter implements CommandLine.ITypeConverter<SourceFormat> {

    @Override
    public SourceFormat convert(String value) {
        return SourceFormat.from(value);
    }
}
