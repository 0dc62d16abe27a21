package dev.flowdoctor.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CommandOutputContractTest {

    private final CommandOutputContract contract = CommandOutputContract.builtIn();

    @Test
    void loadsBuiltInContract() {
        assertThat(contract.outputs("ValidateRegex")).contains(List.of("true", "false", "error"));
        assertThat(contract.declaresError("ValidateRegex")).isTrue();
        assertThat(contract.declaresError("HandleBotError")).isFalse();
    }

    @Test
    void lookupIgnoresCaseAndSurroundingSpace() {
        assertThat(contract.outputs("  platformdetect ")).contains(List.of("ios", "android", "other", "error"));
        assertThat(contract.outputs("UnknownCommand")).isEmpty();
        assertThat(contract.outputs(" ")).isEmpty();
    }

    @Test
    void fileEntriesReplaceBuiltInOnes(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("contracts.json");
        Files.writeString(file, """
            {
              "ValidateRegex": ["match", "no_match"],
              "LookupOrder": ["found", "missing", "error"]
            }
            """);

        CommandOutputContract merged = contract.mergedWith(file);

        assertThat(merged.outputs("ValidateRegex")).contains(List.of("match", "no_match"));
        assertThat(merged.outputs("LookupOrder")).contains(List.of("found", "missing", "error"));
        assertThat(merged.outputs("PlatformDetect")).isPresent();
        assertThat(contract.outputs("ValidateRegex")).contains(List.of("true", "false", "error"));
    }
}
