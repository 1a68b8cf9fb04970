package com.siccatalog.cli;

import com.siccatalog.core.hierarchy.Hierarchy;
import com.siccatalog.core.model.LeafText;
import com.siccatalog.core.source.CatalogSources;
import com.siccatalog.core.source.SourceReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command to export leaf descriptions and activities as a CSV corpus.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Print to stdout
 * sic-catalog leaf-text
 *
 * # Write to a file
 * sic-catalog leaf-text -o leaf_text.csv
 * }</pre>
 */
@Command(
    name = "leaf-text",
    description = "Export leaf descriptions and activities as CSV",
    mixinStandardHelpOptions = true
)
public class LeafTextCommand extends CatalogCommand {

    private static final Logger log = LoggerFactory.getLogger(LeafTextCommand.class);

    @Option(names = {"-o", "--output"}, description = "Output file (default: stdout)")
    private Path output;

    @Override
    protected int execute(CatalogSources sources) throws Exception {
        Hierarchy hierarchy = sources.loadHierarchy();
        List<LeafText> rows = hierarchy.allLeafText();

        if (output == null) {
            SourceReader.writeLeafText(rows, out());
            out().flush();
        } else {
            try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                SourceReader.writeLeafText(rows, writer);
            }
            log.info("Wrote {} leaf text rows to: {}", rows.size(), output);
        }
        return 0;
    }
}
