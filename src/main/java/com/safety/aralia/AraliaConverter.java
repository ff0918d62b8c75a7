package com.safety.aralia;

import com.safety.aralia.engine.FaultTree;
import com.safety.aralia.exception.ConversionException;
import com.safety.aralia.io.AraliaParser;
import com.safety.aralia.io.Declarations;
import com.safety.aralia.io.FaultTreeCompiler;
import com.safety.aralia.io.MefXmlWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point of the Aralia to Open-PSA MEF conversion.
 * <p>
 * This class wires the phases together:
 * <ul>
 * <li>Interpreting the input lines with {@link AraliaParser}</li>
 * <li>Compiling and verifying the tree with {@link FaultTreeCompiler}</li>
 * <li>Rendering the document with {@link MefXmlWriter}</li>
 * </ul>
 * A conversion either completes or throws on the first fatal error; no partial
 * tree or document is produced.
 */
public final class AraliaConverter {
    private static final Logger log = LogManager.getLogger(AraliaConverter.class);

    private AraliaConverter() {
        // Utility class
    }

    /** Converts with {@link ConverterConfig#defaults()}. */
    public static FaultTree convert(List<String> lines) {
        return convert(lines, ConverterConfig.defaults());
    }

    /**
     * Builds and verifies a fault tree from Aralia lines.
     *
     * @param lines  Input lines without line terminators.
     * @param config Conversion options.
     * @return The verified fault tree.
     * @throws ConversionException on the first recognition, format or
     *                             structural error.
     */
    public static FaultTree convert(List<String> lines, ConverterConfig config) {
        Declarations declarations = AraliaParser.parse(lines);
        log.debug("Declared {} events for fault tree {}", declarations.events().size(), declarations.treeName());
        return new FaultTreeCompiler(config).compile(declarations);
    }

    /** Reads an Aralia file as UTF-8 and converts its lines. */
    public static FaultTree convertFile(Path input, ConverterConfig config) throws IOException {
        return convert(Files.readAllLines(input, StandardCharsets.UTF_8), config);
    }

    /**
     * Renders a verified tree as an Open-PSA MEF document.
     *
     * @throws IllegalArgumentException if the configured nesting depth is
     *                                  negative.
     */
    public static String toXml(FaultTree tree, ConverterConfig config) {
        return new MefXmlWriter(config.getNestingDepth()).write(tree);
    }

    /** Converts and renders in one call. */
    public static String convertToXml(List<String> lines, ConverterConfig config) {
        return toXml(convert(lines, config), config);
    }
}
