/*
 * PDF-TagSynth - Accessibility Structure-Tree Synthesis
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.tagsynth.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One node of the synthesized structure tree.
 *
 * <p>{@code type} is the role tag used for dispatch; {@code attributes.title} is for display only.
 * A node is owned by exactly one parent; a null {@link #parent()} means it sits directly under the
 * session's {@link StructureRoot}. Nodes are created and moved only through {@link
 * StructureTreeBuilder}.
 */
public final class StructureNode implements StructureChild {
    private final int nodeId;
    private final String type;
    private final NodeAttributes attributes;
    private final List<StructureChild> children = new ArrayList<>();
    private StructureNode parent;

    StructureNode(int nodeId, String type, NodeAttributes attributes) {
        this.nodeId = nodeId;
        this.type = type;
        this.attributes = attributes != null ? attributes : NodeAttributes.NONE;
    }

    public int nodeId() {
        return nodeId;
    }

    public String type() {
        return type;
    }

    public NodeAttributes attributes() {
        return attributes;
    }

    public String title() {
        return attributes.title();
    }

    /** Parent node, or null for a root-level node. */
    public StructureNode parent() {
        return parent;
    }

    public List<StructureChild> children() {
        return Collections.unmodifiableList(children);
    }

    public List<StructureNode> childNodes() {
        List<StructureNode> out = new ArrayList<>();
        for (StructureChild child : children) {
            if (child instanceof StructureNode node) {
                out.add(node);
            }
        }
        return out;
    }

    public List<ContentReference> references() {
        List<ContentReference> out = new ArrayList<>();
        for (StructureChild child : children) {
            if (child instanceof ContentReference ref) {
                out.add(ref);
            }
        }
        return out;
    }

    /** Appends a content reference after the existing children. */
    public void appendReference(ContentReference ref) {
        children.add(ref);
    }

    /** True if {@code candidate} is this node or one of its ancestors. */
    boolean isSelfOrDescendantOf(StructureNode candidate) {
        for (StructureNode n = this; n != null; n = n.parent) {
            if (n == candidate) return true;
        }
        return false;
    }

    void appendChild(StructureNode child) {
        children.add(child);
        child.parent = this;
    }

    boolean removeChild(StructureNode child) {
        boolean removed = children.remove(child);
        if (removed) {
            child.parent = null;
        }
        return removed;
    }

    @Override
    public String toString() {
        String t = attributes.title();
        return "#" + nodeId + " " + type + (t != null ? " \"" + t + "\"" : "");
    }
}
