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
package net.boyechko.pdf.tagsynth.composite;

import net.boyechko.pdf.tagsynth.core.OperationResult;
import net.boyechko.pdf.tagsynth.issue.DiagnosticList;
import net.boyechko.pdf.tagsynth.issue.DiagnosticLoc;
import net.boyechko.pdf.tagsynth.issue.DiagnosticSev;
import net.boyechko.pdf.tagsynth.issue.DiagnosticType;
import net.boyechko.pdf.tagsynth.structure.NodeAttributes;
import net.boyechko.pdf.tagsynth.structure.StructureNode;
import net.boyechko.pdf.tagsynth.structure.StructureTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands declarative table and list specs into subtrees.
 *
 * <p>Expansion is lenient: once the container node exists, a child that cannot be created or
 * attached is skipped and reported, and the container is still returned. Only a failure to create
 * the container itself fails the operation.
 */
public final class CompositeExpander {
    private static final Logger logger = LoggerFactory.getLogger(CompositeExpander.class);

    static final String BULLET = "•";

    private final StructureTreeBuilder builder;

    public CompositeExpander(StructureTreeBuilder builder) {
        this.builder = builder;
    }

    /**
     * Builds {@code Table > TR > TH|TD}. Row 0 of a table with a header row gets TH cells titled
     * by {@code headers}; every other cell is titled {@code "Cell r,c"} (1-based).
     */
    public OperationResult<StructureNode> createTable(TableSpec spec) {
        OperationResult<StructureNode> tableResult =
                builder.createNode("Table", NodeAttributes.titled(spec.title()));
        if (tableResult.isFailure()) {
            return tableResult;
        }
        StructureNode table = tableResult.value();
        DiagnosticList diagnostics = new DiagnosticList(tableResult.diagnostics());

        for (int r = 0; r < spec.rows(); r++) {
            boolean headerRow = spec.hasHeaderRow() && r == 0;
            String rowTitle = "Row " + (r + 1) + (headerRow ? " (Header)" : "");
            StructureNode row =
                    createChild(table, "TR", NodeAttributes.titled(rowTitle), diagnostics);
            if (row == null) {
                continue;
            }
            for (int c = 0; c < spec.cols(); c++) {
                String cellTitle =
                        headerRow && c < spec.headers().size()
                                ? spec.headers().get(c)
                                : "Cell " + (r + 1) + "," + (c + 1);
                createChild(
                        row,
                        headerRow ? "TH" : "TD",
                        NodeAttributes.titled(cellTitle),
                        diagnostics);
            }
        }

        logger.debug(
                "Expanded table {} ({}x{}, {} problem(s))",
                table,
                spec.rows(),
                spec.cols(),
                diagnostics.size());
        return OperationResult.ok(table, diagnostics);
    }

    /** Builds {@code L > LI > (Lbl, LBody)}, numbering labels for ordered lists. */
    public OperationResult<StructureNode> createList(ListSpec spec) {
        OperationResult<StructureNode> listResult =
                builder.createNode("L", NodeAttributes.titled(spec.title()));
        if (listResult.isFailure()) {
            return listResult;
        }
        StructureNode list = listResult.value();
        DiagnosticList diagnostics = new DiagnosticList(listResult.diagnostics());

        for (int i = 0; i < spec.items().size(); i++) {
            String itemText = spec.items().get(i);
            StructureNode item =
                    createChild(list, "LI", NodeAttributes.titled("Item " + (i + 1)), diagnostics);
            if (item == null) {
                continue;
            }
            String label = spec.isOrdered() ? (i + 1) + "." : BULLET;
            createChild(item, "Lbl", new NodeAttributes(label, null, label, null), diagnostics);
            createChild(
                    item, "LBody", new NodeAttributes(itemText, null, itemText, null), diagnostics);
        }

        logger.debug(
                "Expanded list {} ({} items, {} problem(s))",
                list,
                spec.items().size(),
                diagnostics.size());
        return OperationResult.ok(list, diagnostics);
    }

    private StructureNode createChild(
            StructureNode parent, String type, NodeAttributes attrs, DiagnosticList diagnostics) {
        OperationResult<StructureNode> created = builder.createNode(type, attrs);
        diagnostics.addAll(created.diagnostics());
        if (created.isFailure()) {
            diagnostics.report(
                    DiagnosticType.NODE_CREATION_FAILED,
                    DiagnosticSev.WARNING,
                    DiagnosticLoc.atNode(parent.nodeId(), parent.type()),
                    "Skipped " + type + " child of " + parent);
            return null;
        }
        OperationResult<StructureNode> attached = builder.attach(parent, created.value());
        diagnostics.addAll(attached.diagnostics());
        if (attached.isFailure()) {
            logger.warn("Could not attach {} under {}", created.value(), parent);
            return null;
        }
        return created.value();
    }
}
