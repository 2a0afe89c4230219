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
import java.util.List;

/** Text renderings of an in-memory structure tree, for the CLI and for tests. */
public final class TreeDump {
    public static final String ROOT_LABEL = "StructTreeRoot";

    private TreeDump() {}

    public record Node<T>(T value, List<Node<T>> children) {
        /** Creates a leaf node (no children). */
        public static <T> Node<T> leaf(T value) {
            return new Node<>(value, List.of());
        }

        /** Creates a node with children. */
        @SafeVarargs
        public static <T> Node<T> branch(T value, Node<T>... children) {
            return new Node<>(value, List.of(children));
        }

        /** Returns a compact bracket notation, e.g. {@code Table[TR[TH, TH], TR[TD, TD]]}. */
        @Override
        public String toString() {
            if (children.isEmpty()) {
                return String.valueOf(value);
            }
            StringBuilder sb = new StringBuilder();
            sb.append(value).append('[');
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(children.get(i));
            }
            sb.append(']');
            return sb.toString();
        }
    }

    public static Node<String> toRoleTree(StructureNode node) {
        List<Node<String>> childNodes = new ArrayList<>();
        for (StructureNode kid : node.childNodes()) {
            childNodes.add(toRoleTree(kid));
        }
        return new Node<>(node.type(), childNodes);
    }

    public static Node<String> toRoleTree(StructureRoot root) {
        List<Node<String>> childNodes = new ArrayList<>();
        for (StructureNode kid : root.kids()) {
            childNodes.add(toRoleTree(kid));
        }
        return new Node<>(ROOT_LABEL, childNodes);
    }

    /** Role names only, two spaces per level. */
    public static String toIndentedTreeString(StructureRoot root) {
        StringBuilder sb = new StringBuilder();
        for (StructureNode kid : root.kids()) {
            appendIndentedTree(sb, kid, 0);
        }
        return sb.toString();
    }

    public static String toIndentedTreeString(StructureNode node) {
        StringBuilder sb = new StringBuilder();
        appendIndentedTree(sb, node, 0);
        return sb.toString();
    }

    private static void appendIndentedTree(StringBuilder sb, StructureNode node, int depth) {
        sb.append("  ".repeat(depth)).append(node.type()).append('\n');
        for (StructureNode kid : node.childNodes()) {
            appendIndentedTree(sb, kid, depth + 1);
        }
    }

    /**
     * Like {@link #toIndentedTreeString(StructureRoot)}, with titles and with content references
     * shown as {@code [p<page> &<mcid>]} leaves in child order.
     */
    public static String toDetailedTreeString(StructureRoot root) {
        StringBuilder sb = new StringBuilder();
        for (StructureNode kid : root.kids()) {
            appendDetailedTree(sb, kid, 0);
        }
        return sb.toString();
    }

    private static void appendDetailedTree(StringBuilder sb, StructureNode node, int depth) {
        sb.append("  ".repeat(depth)).append(node.type());
        if (node.title() != null) {
            sb.append(" \"").append(node.title()).append('"');
        }
        sb.append('\n');
        for (StructureChild child : node.children()) {
            if (child instanceof StructureNode kid) {
                appendDetailedTree(sb, kid, depth + 1);
            } else if (child instanceof ContentReference ref) {
                sb.append("  ".repeat(depth + 1))
                        .append("[p")
                        .append(ref.page() + 1)
                        .append(" &")
                        .append(ref.mcid())
                        .append("]\n");
            }
        }
    }
}
