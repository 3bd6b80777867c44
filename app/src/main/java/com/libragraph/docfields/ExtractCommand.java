package com.libragraph.docfields;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.docfields.extraction.api.ExtractedInfo;
import com.libragraph.docfields.extraction.engine.ExtractionEngine;
import com.libragraph.docfields.extraction.engine.NothingExtractedException;
import com.libragraph.docfields.extraction.engine.SchemaNotFoundException;
import com.libragraph.docfields.extraction.schema.SchemaRegistry;
import com.libragraph.docfields.graph.Block;
import com.libragraph.docfields.graph.BlockGraph;
import com.libragraph.docfields.graph.textract.BlockGraphFormatException;
import com.libragraph.docfields.graph.textract.BlockGraphReader;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Command-line entry point: extracts fields from a saved analysis response.
 *
 * <pre>docfields &lt;documentType&gt; &lt;analysis.json&gt;</pre>
 *
 * Prints the extracted fields as JSON on stdout. Logging goes to stderr.
 */
@QuarkusMain
public class ExtractCommand implements QuarkusApplication {

    private static final Logger log = Logger.getLogger(ExtractCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT = 1;
    static final int EXIT_SCHEMA_NOT_FOUND = 2;
    static final int EXIT_NOTHING_EXTRACTED = 3;

    @Inject
    ExtractionEngine engine;

    @Inject
    SchemaRegistry schemas;

    @Inject
    BlockGraphReader reader;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public int run(String... args) throws Exception {
        if (args.length != 2) {
            System.err.println("Usage: docfields <documentType> <analysis.json>");
            System.err.println("Known document types: " + new TreeSet<>(schemas.documentTypes()));
            return EXIT_INPUT;
        }
        String documentType = args[0];

        BlockGraph graph;
        try {
            graph = reader.read(Path.of(args[1]));
        } catch (InvalidPathException | BlockGraphFormatException e) {
            log.errorf("Cannot read %s: %s", args[1], e.getMessage());
            return EXIT_INPUT;
        }

        try {
            ExtractedInfo info = engine.extract(documentType, graph);
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new TreeMap<>(info.fields())));
            return EXIT_OK;
        } catch (SchemaNotFoundException e) {
            log.errorf("%s (known: %s)", e.getMessage(), schemas.documentTypes());
            return EXIT_SCHEMA_NOT_FOUND;
        } catch (NothingExtractedException e) {
            log.warn(e.getMessage());
            for (Block block : e.graph().textBlocks()) {
                log.debugf("  %s: %s", block.type(), block.text());
            }
            return EXIT_NOTHING_EXTRACTED;
        }
    }
}
