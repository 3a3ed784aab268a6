package io.lawtext.parser.cli;

import io.lawtext.parser.model.ActStatus;
import picocli.CommandLine;

/**
 * Accepts wire values such as {@code in_force} as well as enum names.
 */
public class ActStatusConverter implements CommandLine.ITypeConverter<ActStatus> {

    @Override
    public ActStatus convert(String value) {
        return ActStatus.from(value);
    }
}
