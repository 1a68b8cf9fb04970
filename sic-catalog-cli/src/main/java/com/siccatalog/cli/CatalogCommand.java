package com.siccatalog.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.siccatalog.core.config.CatalogConfig;
import com.siccatalog.core.config.ConfigLoader;
import com.siccatalog.core.source.CatalogSources;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Base class for commands that read the catalog sources.
 *
 * <p>Handles configuration loading, JSON output and the shared failure path: any exception
 * is logged, reported on stderr and turned into exit code 1.
 */
abstract class CatalogCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CatalogCommand.class);
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @Spec
    CommandSpec spec;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: siccatalog.yaml)"
    )
    private Path configPath = Paths.get("siccatalog.yaml");

    @Override
    public Integer call() {
        try {
            CatalogConfig config = ConfigLoader.load(configPath);
            Path baseDir = configPath.toAbsolutePath().getParent();
            return execute(new CatalogSources(config, baseDir));
        } catch (Exception e) {
            log.error("{} failed", spec.name(), e);
            err().println("✗ " + spec.name() + " failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Runs the command against the configured sources.
     *
     * @param sources catalog sources
     * @return exit code
     * @throws Exception on any failure
     */
    protected abstract int execute(CatalogSources sources) throws Exception;

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    protected void printJson(Object value) throws Exception {
        out().println(JSON_WRITER.writeValueAsString(value));
        out().flush();
    }
}
