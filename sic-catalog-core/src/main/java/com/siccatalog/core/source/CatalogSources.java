package com.siccatalog.core.source;

import com.siccatalog.core.config.CatalogConfig;
import com.siccatalog.core.hierarchy.Hierarchy;
import com.siccatalog.core.hierarchy.HierarchyBuilder;
import com.siccatalog.core.lookup.DescriptionLookup;
import com.siccatalog.core.lookup.RephraseLookup;
import com.siccatalog.core.meta.MetadataLoader;
import com.siccatalog.core.meta.MetadataStore;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Loads catalog components from the sources named in a {@link CatalogConfig}.
 *
 * <p>Relative source locations are resolved against {@code baseDir}, normally the directory
 * of the configuration file. The metadata store is read once and shared by every component
 * built from this instance. Instances are meant for a single loading thread.
 */
public class CatalogSources {

    private final CatalogConfig.SourcesConfig sources;
    private final Path baseDir;
    private MetadataStore metadata;

    public CatalogSources(CatalogConfig config, Path baseDir) {
        this.sources = Objects.requireNonNull(config, "config must not be null").sources();
        this.baseDir = baseDir == null ? Paths.get(".") : baseDir;
    }

    /**
     * Returns the metadata store, reading it on first use.
     *
     * @return metadata store
     * @throws IOException if the metadata file cannot be read
     */
    public MetadataStore metadata() throws IOException {
        if (metadata == null) {
            metadata = MetadataLoader.load(resolve(sources.metadata()));
        }
        return metadata;
    }

    /**
     * Reads the structural, metadata and activity sources and builds the hierarchy.
     *
     * @return built hierarchy
     * @throws IOException if a source cannot be read
     */
    public Hierarchy loadHierarchy() throws IOException {
        return new HierarchyBuilder(metadata()).build(
            SourceReader.readStructure(resolve(sources.structure())),
            SourceReader.readActivities(resolve(sources.activities()))
        );
    }

    public DescriptionLookup loadDescriptionLookup() throws IOException {
        return new DescriptionLookup(SourceReader.readDescriptions(resolve(sources.descriptions())), metadata());
    }

    public RephraseLookup loadRephraseLookup() throws IOException {
        return new RephraseLookup(SourceReader.readRephrases(resolve(sources.rephrases())));
    }

    private Path resolve(String location) {
        return baseDir.resolve(location);
    }
}
