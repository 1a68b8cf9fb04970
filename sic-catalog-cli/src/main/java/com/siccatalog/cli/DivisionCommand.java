package com.siccatalog.cli;

import com.siccatalog.core.lookup.ClassificationCandidate;
import com.siccatalog.core.lookup.DescriptionLookup;
import com.siccatalog.core.source.CatalogSources;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * Command to list the distinct divisions of one or more codes.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * sic-catalog division 01700 01120 31010
 * }</pre>
 */
@Command(
    name = "division",
    description = "List the distinct divisions of the given codes",
    mixinStandardHelpOptions = true
)
public class DivisionCommand extends CatalogCommand {

    @Parameters(arity = "1..*", description = "5-digit codes")
    private List<String> codes;

    @Override
    protected int execute(CatalogSources sources) throws Exception {
        DescriptionLookup lookup = sources.loadDescriptionLookup();
        List<ClassificationCandidate> candidates = codes.stream().map(ClassificationCandidate::new).toList();
        printJson(lookup.uniqueCodeDivisions(candidates));
        return 0;
    }
}
