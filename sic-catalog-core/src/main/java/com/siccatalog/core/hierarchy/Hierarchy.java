package com.siccatalog.core.hierarchy;

import com.siccatalog.core.exception.CodeLookupException;
import com.siccatalog.core.model.CodedText;
import com.siccatalog.core.model.LeafText;

import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only classification catalog produced by {@link HierarchyBuilder}.
 *
 * <p>Nodes are iterated in code order. Each node is reachable under several keys; for class
 * 01.11 in section A these are {@code "01.11"}, {@code "A0111x"}, {@code "A0111"},
 * {@code "0111"} and, when the class has no subclasses, {@code "01110"}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Hierarchy sic = new HierarchyBuilder(metadata).build(structureRows, activityRows);
 * Node node = sic.get("01.11");
 * sic.allLeafText().forEach(row -> System.out.println(row.code() + "," + row.text()));
 * }</pre>
 *
 * <p>Instances are safe to share between threads once built.
 */
public final class Hierarchy implements Iterable<Node> {

    private final List<Node> nodes;
    private final Map<String, Node> lookup;

    Hierarchy(List<Node> nodes, Map<String, Node> lookup) {
        this.nodes = nodes.stream().sorted(Comparator.comparing(Node::getCode)).toList();
        this.lookup = Map.copyOf(lookup);
    }

    /**
     * Returns the node registered under a key.
     *
     * @param key any registered spelling of a code
     * @return matching node
     * @throws CodeLookupException if no node is registered under the key
     */
    public Node get(String key) {
        Node node = key == null ? null : lookup.get(key);
        if (node == null) {
            throw new CodeLookupException(key, "No SIC node for key: '" + key + "'");
        }
        return node;
    }

    /**
     * Returns the node registered under a key, if any.
     *
     * @param key any registered spelling of a code
     * @return matching node, or empty
     */
    public Optional<Node> find(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(lookup.get(key));
    }

    public boolean contains(String key) {
        return find(key).isPresent();
    }

    /** All nodes in code order. */
    public List<Node> getNodes() {
        return nodes;
    }

    /** Registered keys. */
    public Set<String> keys() {
        return lookup.keySet();
    }

    public int size() {
        return nodes.size();
    }

    @Override
    public Iterator<Node> iterator() {
        return nodes.iterator();
    }

    /**
     * Activities of leaf nodes, one entry per activity.
     *
     * <p>The returned iterable is lazy and can be iterated any number of times.
     *
     * @return (code, activity) pairs in code order
     */
    public Iterable<CodedText> allLeafActivities() {
        return () -> nodes.stream()
            .filter(Node::isLeaf)
            .flatMap(node -> node.getActivities().stream().map(activity -> new CodedText(node.getCode(), activity)))
            .iterator();
    }

    /**
     * Descriptions of leaf nodes.
     *
     * <p>The returned iterable is lazy and can be iterated any number of times.
     *
     * @return (code, description) pairs in code order
     */
    public Iterable<CodedText> allLeafDescriptions() {
        return () -> nodes.stream()
            .filter(Node::isLeaf)
            .map(node -> new CodedText(node.getCode(), node.getDescription()))
            .iterator();
    }

    /**
     * Combined leaf descriptions and activities, for use as a text-matching corpus.
     *
     * <p>Duplicate (code, text) pairs are dropped and rows are ordered by code, descriptions
     * before activities within a code.
     *
     * @return rows with the formatted code and text
     */
    public List<LeafText> allLeafText() {
        Set<CodedText> unique = new LinkedHashSet<>();
        allLeafDescriptions().forEach(unique::add);
        allLeafActivities().forEach(unique::add);

        return unique.stream()
            .sorted(Comparator.comparing(CodedText::code))
            .map(row -> new LeafText(row.code().format(), row.text()))
            .toList();
    }
}
