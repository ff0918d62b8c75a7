package com.safety.aralia.cli;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import com.safety.aralia.AraliaConverter;
import com.safety.aralia.ConverterConfig;
import com.safety.aralia.engine.FaultTree;
import com.safety.aralia.io.JsonSnapshotWriter;
import com.safety.aralia.util.FaultTreeExplain;

import lombok.extern.log4j.Log4j2;
import picocli.CommandLine;

@Log4j2
@CommandLine.Command(
        name = "aralia-convert",
        description = "Aralia => Open-PSA MEF XML Converter",
        mixinStandardHelpOptions = true,
        version = "aralia-convert 1.0",
        showDefaultValues = true)
final class ConvertCommand implements Callable<Integer> {

    @CommandLine.Parameters(
            index = "0",
            paramLabel = "INPUT",
            description = "Input file with the Aralia notation.")
    private File inputFile;

    @CommandLine.Option(
            names = "--multi-top",
            description = "Accept multiple top events.")
    private boolean multiTop;

    @CommandLine.Option(
            names = {"-n", "--nest"},
            paramLabel = "DEPTH",
            description = "Levels of child gate formulas inlined into their parents.",
            defaultValue = "0")
    private int nestingDepth;

    @CommandLine.Option(
            names = {"-o", "--out"},
            paramLabel = "FILE",
            description = "Output file (default: input base name with the .xml extension).",
            defaultValue = CommandLine.Option.NULL_VALUE)
    private File outputFile;

    @CommandLine.Option(
            names = "--json",
            paramLabel = "FILE",
            description = "Also write a JSON snapshot of the fault tree.",
            defaultValue = CommandLine.Option.NULL_VALUE)
    private File jsonFile;

    @CommandLine.Option(
            names = "--mermaid",
            paramLabel = "FILE",
            description = "Also write a Mermaid diagram of the fault tree.",
            defaultValue = CommandLine.Option.NULL_VALUE)
    private File mermaidFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        if (nestingDepth < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Nesting depth must be non-negative: " + nestingDepth);
        }
        ConverterConfig config = ConverterConfig.builder()
                .multiTop(multiTop)
                .nestingDepth(nestingDepth)
                .build();

        Path input = inputFile.toPath();
        FaultTree tree = AraliaConverter.convertFile(input, config);
        String xml = AraliaConverter.toXml(tree, config);

        Path out = outputFile != null ? outputFile.toPath() : defaultOutput(input);
        Map<Path, String> outputs = new LinkedHashMap<>();
        outputs.put(out, xml);
        if (jsonFile != null)
            outputs.put(jsonFile.toPath(), new JsonSnapshotWriter().write(tree));
        if (mermaidFile != null)
            outputs.put(mermaidFile.toPath(), new FaultTreeExplain(tree).toMermaid());

        writeAll(outputs);
        return 0;
    }

    /**
     * Writes every rendered output. If one write fails, the files written
     * before it are deleted so that no partial result is left behind.
     */
    static void writeAll(Map<Path, String> outputs) throws IOException {
        List<Path> written = new ArrayList<>();
        try {
            for (Map.Entry<Path, String> output : outputs.entrySet()) {
                Files.writeString(output.getKey(), output.getValue(), StandardCharsets.UTF_8);
                written.add(output.getKey());
            }
        } catch (IOException e) {
            for (Path path : written) {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw e;
        }
        written.forEach(path -> log.info("Wrote {}", path));
    }

    /** The input's base name with its extension replaced by {@code .xml}, in the working directory. */
    static Path defaultOutput(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot > 0)
            name = name.substring(0, dot);
        return Path.of(name + ".xml");
    }
}
