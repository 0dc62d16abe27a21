package dev.flowdoctor.cli;

import dev.flowdoctor.FlowFixtures;
import dev.flowdoctor.model.FlowNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FlowDoctorCliTest {

    @TempDir
    Path dir;

    @Test
    void checkPassesCleanDocument() throws IOException {
        Path csv = write("clean.csv", FlowFixtures.csv(FlowFixtures.cleanFlow()));

        assertThat(run("check", csv.toString())).isEqualTo(FlowDoctorCli.OK);
    }

    @Test
    void checkReportsRemainingErrors() throws IOException {
        Path csv = write("partial.csv", FlowFixtures.csv(FlowFixtures.cleanFlow().subList(0, 2)));

        assertThat(run("check", csv.toString())).isEqualTo(FlowDoctorCli.REMAINING_ERRORS);
    }

    @Test
    void checkFailsOnMissingFile() {
        assertThat(run("check", dir.resolve("missing.csv").toString())).isEqualTo(FlowDoctorCli.FAILURE);
    }

    @Test
    void repairWritesTheRepairedDocument() throws IOException {
        Path csv = write("partial.csv", FlowFixtures.csv(FlowFixtures.cleanFlow().subList(0, 2)));
        Path output = dir.resolve("repaired.csv");

        int exitCode = run("repair", csv.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(FlowDoctorCli.OK);
        assertThat(Files.readString(output)).contains("\n666,", "\n999,", "\n99990,");
        assertThat(run("check", output.toString())).isEqualTo(FlowDoctorCli.OK);
    }

    @Test
    void assembleRenumbersLaterSegments() throws IOException {
        Path first = write("billing.csv", FlowFixtures.csv(FlowFixtures.cleanFlow(
            FlowNode.Decision.of(50, "Billing", "Billing help").withNextNodes(List.of(200)))));
        Path second = write("shipping.csv", FlowFixtures.csv(FlowFixtures.cleanFlow(
            FlowNode.Decision.of(50, "Shipping", "Shipping help").withNextNodes(List.of(200)))));
        Path output = dir.resolve("assembled.csv");

        int exitCode = run("assemble", first.toString(), second.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(FlowDoctorCli.OK);
        String assembled = Files.readString(output);
        assertThat(assembled).contains("\n402,D,Shipping,");
        assertThat(assembled.lines().filter(line -> line.startsWith("666,"))).hasSize(1);
    }

    @Test
    void refineFailsWhenValidatorIsUnreachable() throws IOException {
        Path csv = write("clean.csv", FlowFixtures.csv(FlowFixtures.cleanFlow()));

        int exitCode = run("refine", csv.toString(),
            "--validator-url", "http://127.0.0.1:1/validate",
            "--repairer-url", "http://127.0.0.1:1/repair",
            "--bot-id", "bot-1", "--token", "token");

        assertThat(exitCode).isEqualTo(FlowDoctorCli.FAILURE);
    }

    @Test
    void noSubcommandPrintsUsage() {
        assertThat(run()).isEqualTo(FlowDoctorCli.FAILURE);
    }

    @Test
    void missingRequiredOptionIsUsageError() throws IOException {
        Path csv = write("clean.csv", FlowFixtures.csv(FlowFixtures.cleanFlow()));

        assertThat(run("refine", csv.toString())).isEqualTo(2);
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private static int run(String... args) {
        return FlowDoctorCli.commandLine().execute(args);
    }
}
