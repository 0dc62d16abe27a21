package dev.flowdoctor.cli;

import dev.flowdoctor.allocate.FlowAssembler;
import dev.flowdoctor.allocate.NodeAllocator;
import dev.flowdoctor.codec.FlowCsvCodec;
import dev.flowdoctor.config.Settings;
import dev.flowdoctor.engine.StructuralValidator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "assemble", mixinStandardHelpOptions = true,
    description = "Renumber flow segments into their bands and merge them into one document.")
class AssembleCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Segment CSV files, in flow order")
    private List<Path> segments;

    @Option(names = {"-o", "--output"}, required = true, description = "Assembled document")
    private Path output;

    @Option(names = "--settings", description = "Settings JSON file")
    private Path settingsFile;

    @Override
    public Integer call() {
        try {
            Settings settings = FlowDoctorCli.settings(settingsFile);
            var validator = StructuralValidator.withBuiltInContract();
            var parsed = new ArrayList<FlowAssembler.Segment>();
            for (int i = 0; i < segments.size(); i++) {
                String text = FlowDoctorCli.read(segments.get(i));
                parsed.add(new FlowAssembler.Segment(i, validator.validate(FlowCsvCodec.parse(text)).records()));
            }

            FlowAssembler.Assembly assembly = new FlowAssembler(new NodeAllocator(settings.bands())).assemble(parsed);
            assembly.warnings().forEach(w -> System.err.println("note: " + w));
            FlowDoctorCli.write(output, FlowCsvCodec.write(assembly.document()));
            System.err.printf("Wrote %d node(s) to %s%n", assembly.document().size(), output);
            return FlowDoctorCli.OK;
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return FlowDoctorCli.FAILURE;
        }
    }
}
