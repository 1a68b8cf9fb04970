package com.siccatalog.cli;

import com.siccatalog.core.hierarchy.Hierarchy;
import com.siccatalog.core.hierarchy.Node;
import com.siccatalog.core.source.CatalogSources;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Optional;

/**
 * Command to show one node of the hierarchy.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * sic-catalog code 01.11
 * sic-catalog code A0111x
 * sic-catalog code 01110
 * }</pre>
 */
@Command(
    name = "code",
    description = "Show a SIC node with its parent, children, metadata and activities",
    mixinStandardHelpOptions = true
)
public class CodeCommand extends CatalogCommand {

    @Parameters(index = "0", description = "Code in any supported form, e.g. 01.11, A0111x, 0111")
    private String key;

    @Override
    protected int execute(CatalogSources sources) throws Exception {
        Hierarchy hierarchy = sources.loadHierarchy();
        Optional<Node> node = hierarchy.find(key);
        if (node.isEmpty()) {
            err().println("✗ Unknown SIC code: " + key);
            return 1;
        }
        out().print(node.get().describe());
        out().flush();
        return 0;
    }
}
