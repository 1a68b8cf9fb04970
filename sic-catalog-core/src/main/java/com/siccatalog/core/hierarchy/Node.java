package com.siccatalog.core.hierarchy;

import com.siccatalog.core.code.Code;
import com.siccatalog.core.code.CodeLevel;
import com.siccatalog.core.model.MetadataRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of the classification tree holding all data attached to one code.
 *
 * <p>The hierarchy is a forest with one root per section. Nodes are wired up by
 * {@link HierarchyBuilder}; once a {@link Hierarchy} is published they are never mutated.
 */
public final class Node {

    private final Code code;
    private final String description;
    private final List<String> activities = new ArrayList<>();
    private final List<Node> children = new ArrayList<>();
    private MetadataRecord metadata;
    private Node parent;

    Node(Code code, String description) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.description = description;
    }

    public Code getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /** Activities in source order. */
    public List<String> getActivities() {
        return Collections.unmodifiableList(activities);
    }

    /** Cleaned metadata; null only while the hierarchy is being built. */
    public MetadataRecord getMetadata() {
        return metadata;
    }

    /** Enclosing node, or null for a section. */
    public Node getParent() {
        return parent;
    }

    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public char getSection() {
        return code.getSection();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Returns the numeric code, extending a 4-digit leaf class with a trailing zero.
     *
     * @return numeric code, e.g. {@code "01110"} for a leaf class 01.11
     */
    public String numericStringPadded() {
        String numeric = code.getNumeric();
        if (code.getLevel() == CodeLevel.CLASS && isLeaf()) {
            return numeric + "0";
        }
        return numeric;
    }

    void addChild(Node child) {
        children.add(child);
    }

    void setParent(Node parent) {
        this.parent = parent;
    }

    void attachMetadata(MetadataRecord metadata) {
        this.metadata = metadata;
    }

    void addActivity(String activity) {
        activities.add(activity);
    }

    /**
     * Renders a multi-line report of this node, its neighbours, metadata and activities.
     *
     * @return report text
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(this).append('\n');
        sb.append("Section: ").append(getSection()).append('\n');
        sb.append("Parent: ").append(parent == null ? "None" : parent.toString()).append('\n');
        sb.append("Children: ").append(children.stream().map(Node::toString).toList()).append('\n');
        sb.append('\n');
        if (metadata != null) {
            sb.append("detail=").append(metadata.detail()).append('\n');
            sb.append("includes=").append(metadata.includes()).append('\n');
            sb.append("excludes=").append(metadata.excludes()).append('\n');
            sb.append('\n');
        }
        sb.append("Activities:\n");
        for (String activity : activities) {
            sb.append("\t- ").append(activity).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return code.format() + ": \"" + description + "\"";
    }
}
