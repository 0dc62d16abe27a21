package dev.flowdoctor.cli;

import dev.flowdoctor.config.Settings;
import dev.flowdoctor.config.SettingsLoader;
import dev.flowdoctor.engine.StructuralValidator;
import dev.flowdoctor.model.CommandOutputContract;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI entry point for flow-doctor.
 */
@Command(
    name = "flow-doctor",
    mixinStandardHelpOptions = true,
    description = "Validate, repair, renumber and refine conversational flow CSV documents.",
    subcommands = {CheckCommand.class, RepairCommand.class, AssembleCommand.class, RefineCommand.class}
)
public class FlowDoctorCli implements Callable<Integer> {

    static final int OK = 0;
    static final int REMAINING_ERRORS = 1;
    static final int FAILURE = 2;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(System.err);
        return FAILURE;
    }

    static String read(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    static void write(Path path, String content) throws IOException {
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }

    static Settings settings(Path settingsFile) throws IOException {
        return settingsFile == null ? Settings.defaults() : SettingsLoader.loadFromFile(settingsFile);
    }

    static StructuralValidator validator(Path contractFile) throws IOException {
        CommandOutputContract contract = CommandOutputContract.builtIn();
        return new StructuralValidator(contractFile == null ? contract : contract.mergedWith(contractFile));
    }

    public static CommandLine commandLine() {
        return new CommandLine(new FlowDoctorCli());
    }
}
