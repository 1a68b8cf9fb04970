package com.siccatalog.cli;

import com.siccatalog.core.lookup.DescriptionLookup;
import com.siccatalog.core.model.LookupResult;
import com.siccatalog.core.source.CatalogSources;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command to look up a code from a description.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * sic-catalog lookup "Gamekeeper"
 * sic-catalog lookup "farm" --similarity
 * }</pre>
 */
@Command(
    name = "lookup",
    description = "Look up a SIC code from a description",
    mixinStandardHelpOptions = true
)
public class LookupCommand extends CatalogCommand {

    @Parameters(index = "0", description = "Description to look up")
    private String description;

    @Option(names = {"-s", "--similarity"}, description = "Also list descriptions containing the query")
    private boolean similarity;

    @Override
    protected int execute(CatalogSources sources) throws Exception {
        DescriptionLookup lookup = sources.loadDescriptionLookup();
        LookupResult result = lookup.lookup(description, similarity);
        printJson(result);
        return 0;
    }
}
