package com.siccatalog.cli;

import com.siccatalog.core.model.RephraseResult;
import com.siccatalog.core.source.CatalogSources;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Command to show the reviewed description of a code.
 *
 * <p>A code without a reviewed description is reported in the JSON output and still exits
 * with 0.
 */
@Command(
    name = "rephrase",
    description = "Show the reviewed description of a SIC code",
    mixinStandardHelpOptions = true
)
public class RephraseCommand extends CatalogCommand {

    @Parameters(index = "0", description = "5-digit code")
    private String code;

    @Override
    protected int execute(CatalogSources sources) throws Exception {
        RephraseResult result = sources.loadRephraseLookup().lookup(code);
        printJson(result);
        return 0;
    }
}
