package com.siccatalog.core.hierarchy;

import com.siccatalog.core.code.Code;
import com.siccatalog.core.code.CodeLevel;
import com.siccatalog.core.exception.CodeLookupException;
import com.siccatalog.core.exception.SourceConsistencyException;
import com.siccatalog.core.meta.MetadataStore;
import com.siccatalog.core.model.ActivityRow;
import com.siccatalog.core.model.MetadataRecord;
import com.siccatalog.core.model.StructureRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a {@link Hierarchy} from flat sources.
 *
 * <p>Construction runs in stages, each failing fast:
 * <ol>
 *   <li>Create one node per structural row</li>
 *   <li>Link every node to the parent derived from its code</li>
 *   <li>Attach cleaned metadata (entry count must equal node count)</li>
 *   <li>Attach activities from the activity index</li>
 *   <li>Register every lookup key of every node</li>
 * </ol>
 *
 * <p>Nodes live only in builder-local collections until the last stage succeeds, so a failed
 * build never exposes a partially linked tree.
 */
public class HierarchyBuilder {

    private static final Logger log = LoggerFactory.getLogger(HierarchyBuilder.class);

    private final MetadataStore metadataStore;

    public HierarchyBuilder(MetadataStore metadataStore) {
        this.metadataStore = Objects.requireNonNull(metadataStore, "metadataStore must not be null");
    }

    /**
     * Builds the hierarchy.
     *
     * @param structure rows of the structural source
     * @param activities rows of the activity index
     * @return fully linked, read-only hierarchy
     * @throws com.siccatalog.core.exception.CodeFormatException if a structural row is malformed
     * @throws CodeLookupException if a parent, metadata or activity code is missing
     * @throws SourceConsistencyException if the sources disagree on the number of codes, a code
     *     repeats, or a row lacks its description or activity text
     */
    public Hierarchy build(List<StructureRow> structure, List<ActivityRow> activities) {
        Map<Code, Node> nodesByCode = defineNodes(structure);
        List<Node> nodes = new ArrayList<>(nodesByCode.values());

        linkParents(nodes, nodesByCode);
        attachMetadata(nodes, nodesByCode);
        attachActivities(nodes, activities);
        Map<String, Node> lookup = buildLookup(nodes);

        log.info("Built SIC hierarchy: {} nodes, {} lookup keys, {} activities",
            nodes.size(), lookup.size(), activities.size());
        return new Hierarchy(nodes, lookup);
    }

    private Map<Code, Node> defineNodes(List<StructureRow> structure) {
        Map<Code, Node> nodesByCode = new LinkedHashMap<>();
        for (StructureRow row : structure) {
            Code code = Code.fromParts(row.section(), row.mostDisaggregatedLevel(), row.levelHeadings());
            if (row.description() == null) {
                throw new SourceConsistencyException("Missing description in structure source for '" + code + "'");
            }
            Node previous = nodesByCode.put(code, new Node(code, row.description()));
            if (previous != null) {
                throw new SourceConsistencyException("Duplicate SIC code in structure source: '" + code + "'");
            }
        }
        log.debug("Defined {} nodes", nodesByCode.size());
        return nodesByCode;
    }

    private void linkParents(List<Node> nodes, Map<Code, Node> nodesByCode) {
        for (Node node : nodes) {
            Code parentCode = node.getCode().parentCode();
            if (parentCode == null) {
                continue;
            }
            Node parent = nodesByCode.get(parentCode);
            if (parent == null) {
                throw new CodeLookupException(parentCode.getAlphaCode(),
                    "No parent found for '" + node.getCode() + "': missing '" + parentCode.getAlphaCode() + "'");
            }
            parent.addChild(node);
            node.setParent(parent);
        }
        log.debug("Linked parents for {} nodes", nodes.size());
    }

    private void attachMetadata(List<Node> nodes, Map<Code, Node> nodesByCode) {
        if (metadataStore.size() != nodes.size()) {
            throw new SourceConsistencyException(String.format(
                "Mismatch in SIC data sources: %d metadata entries for %d structure rows",
                metadataStore.size(), nodes.size()));
        }

        for (MetadataRecord meta : metadataStore.entries()) {
            Code code = Code.parse(meta.code());
            Node node = nodesByCode.get(code);
            if (node == null) {
                throw new CodeLookupException(meta.code(), "No SIC node for metadata code: '" + meta.code() + "'");
            }
            node.attachMetadata(TextCleaner.clean(meta));
        }
        log.debug("Attached metadata to {} nodes", nodes.size());
    }

    private void attachActivities(List<Node> nodes, List<ActivityRow> activities) {
        Map<String, Node> byPaddedDigits = new HashMap<>();
        for (Node node : nodes) {
            CodeLevel level = node.getCode().getLevel();
            if (level == CodeLevel.CLASS) {
                byPaddedDigits.put(node.getCode().getNumeric() + "0", node);
            } else if (level == CodeLevel.SUBCLASS) {
                byPaddedDigits.put(node.getCode().getNumeric(), node);
            }
        }

        for (ActivityRow row : activities) {
            String digits = row.code() == null ? "" : row.code().strip();
            Node node = byPaddedDigits.get(digits);
            if (node == null) {
                throw new CodeLookupException(digits, "No SIC node for activity code: '" + digits + "'");
            }
            if (row.activity() == null) {
                throw new SourceConsistencyException("Missing activity text in activity source for '" + digits + "'");
            }
            node.addActivity(row.activity());
        }
        log.debug("Attached {} activities", activities.size());
    }

    private Map<String, Node> buildLookup(List<Node> nodes) {
        Map<String, Node> lookup = new HashMap<>();
        for (Node node : nodes) {
            Code code = node.getCode();
            lookup.put(code.format(), node);
            lookup.put(code.getAlphaCode(), node);
            lookup.put(code.getStripped(), node);
            if (code.getDigitCount() > 1) {
                lookup.put(code.getNumeric(), node);
            }
            if (code.getLevel() == CodeLevel.CLASS && node.isLeaf()) {
                lookup.put(code.getNumeric() + "0", node);
            }
        }
        log.debug("Registered {} lookup keys", lookup.size());
        return lookup;
    }
}
