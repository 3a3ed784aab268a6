package io.lawtext.parser.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.lawtext.parser.cli.CliArguments;
import io.lawtext.parser.model.ActStatus;
import io.lawtext.parser.model.SourceFormat;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--format", "text",
                "--act-id", "computer-law-1995",
                "--title-en", "Computers Law, 5755-1995",
                "--short-name", "CL",
                "--year", "1995",
                "--status", "amended",
                "--output", "summary",
                "--pretty",
                "--log-format", "json",
                "computers.pdf.txt");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.inputFile()).isEqualTo(Path.of("computers.pdf.txt"));
        assertThat(config.format()).isEqualTo(SourceFormat.TEXT);
        assertThat(config.identity().id()).isEqualTo("computer-law-1995");
        assertThat(config.identity().shortName()).isEqualTo("CL");
        assertThat(config.identity().year()).isEqualTo(1995);
        assertThat(config.identity().status()).isEqualTo(ActStatus.AMENDED);
        assertThat(config.outputMode()).isEqualTo(OutputMode.SUMMARY);
        assertThat(config.prettyPrint()).isTrue();
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_FORMAT, "html");
        envValues.put(ConfigLoader.ENV_OUTPUT, "summary");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "act.txt");

        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments);

        assertThat(config.format()).isEqualTo(SourceFormat.HTML);
        assertThat(config.outputMode()).isEqualTo(OutputMode.SUMMARY);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void defaultsFromInputFileName() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "mirror/privacy-protection-law-1981.HTM");

        Config config = new ConfigLoader(key -> Optional.of("  ")).load(cliArguments);

        assertThat(config.format()).isEqualTo(SourceFormat.HTML);
        assertThat(config.identity().id()).isEqualTo("privacy-protection-law-1981");
        assertThat(config.identity().status()).isEqualTo(ActStatus.IN_FORCE);
        assertThat(config.outputMode()).isEqualTo(OutputMode.JSON);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.prettyPrint()).isFalse();
    }

    @Test
    void inferFormatTreatsEverythingButHtmlAsText() {
        assertThat(ConfigLoader.inferFormat(Path.of("a.html"))).isEqualTo(SourceFormat.HTML);
        assertThat(ConfigLoader.inferFormat(Path.of("a.pdf"))).isEqualTo(SourceFormat.TEXT);
        assertThat(ConfigLoader.inferFormat(Path.of("README"))).isEqualTo(SourceFormat.TEXT);
        assertThat(ConfigLoader.idFromFileName(Path.of("dir/basic-law-human-dignity.txt"))).isEqualTo("basic-law-human-dignity");
    }

    @Test
    void readsIdentityFile(@TempDir Path tempDir) throws Exception {
        Path identityFile = tempDir.resolve("identity.json");
        Files.writeString(identityFile, "{\"id\":\"basic-law-human-dignity\",\"abbreviation\":\"BL-HDL\",\"year\":1992}");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--identity", identityFile.toString(), "source.txt");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.identity().id()).isEqualTo("basic-law-human-dignity");
        assertThat(config.identity().shortName()).isEqualTo("BL-HDL");
        assertThat(config.identity().year()).isEqualTo(1992);
    }

    @Test
    void rejectsIdentityFileCombinedWithInlineIdentity() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--identity", "identity.json", "--act-id", "other", "source.txt");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--identity");
    }

    @Test
    void invalidEnvironmentValueNamesTheVariable() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "act.txt");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(
                key -> ConfigLoader.ENV_FORMAT.equals(key) ? Optional.of("docx") : Optional.empty())
                .load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_FORMAT);
    }

    @Test
    void rejectsNegativeYear() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--year=-1", "act.txt");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--year");
    }
}
