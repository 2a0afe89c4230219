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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.pdf.tagsynth.core.OperationResult;
import net.boyechko.pdf.tagsynth.structure.StructureNode;
import net.boyechko.pdf.tagsynth.structure.StructureTreeBuilder;
import net.boyechko.pdf.tagsynth.structure.TreeDump;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CompositeExpanderTest {
    private StructureTreeBuilder builder;
    private CompositeExpander expander;

    @BeforeEach
    void setUp() {
        builder = new StructureTreeBuilder();
        builder.initRoot(null);
        expander = new CompositeExpander(builder);
    }

    @Test
    void tableWithHeaderRowHasHeaderCellsThenDataCells() {
        TableSpec spec = TableSpec.withHeaders(3, 3, List.of("Name", "Age", "City"));

        OperationResult<StructureNode> result = expander.createTable(spec);

        assertTrue(result.isSuccess());
        StructureNode table = result.value();
        assertEquals("Table", table.type());
        assertEquals(13, builder.nodeCount());
        assertEquals(List.of(table), builder.root().kids());

        List<StructureNode> rows = table.childNodes();
        assertEquals(3, rows.size());
        assertEquals("Row 1 (Header)", rows.get(0).title());
        assertEquals(List.of("Name", "Age", "City"), titles(rows.get(0).childNodes()));
        assertTrue(rows.get(0).childNodes().stream().allMatch(c -> c.type().equals("TH")));
        assertEquals(List.of("Cell 2,1", "Cell 2,2", "Cell 2,3"), titles(rows.get(1).childNodes()));
        assertEquals(List.of("Cell 3,1", "Cell 3,2", "Cell 3,3"), titles(rows.get(2).childNodes()));
        assertTrue(rows.get(2).childNodes().stream().allMatch(c -> c.type().equals("TD")));
        assertEquals(
                "StructTreeRoot[Table[TR[TH, TH, TH], TR[TD, TD, TD], TR[TD, TD, TD]]]",
                TreeDump.toRoleTree(builder.root()).toString());
    }

    @Test
    void missingHeaderTitlesFallBackToCellNames() {
        TableSpec spec = TableSpec.withHeaders(2, 3, List.of("Only"));

        StructureNode table = expander.createTable(spec).value();

        assertEquals(
                List.of("Only", "Cell 1,2", "Cell 1,3"),
                titles(table.childNodes().get(0).childNodes()));
    }

    @Test
    void tableWithoutHeaderRowUsesDataCellsOnly() {
        StructureNode table =
                expander.createTable(new TableSpec("Grid", 2, 2, List.of(), false)).value();

        assertEquals("Grid", table.title());
        assertEquals("Row 1", table.childNodes().get(0).title());
        assertEquals("TD", table.childNodes().get(0).childNodes().get(0).type());
    }

    @Test
    void emptyTableHasNoRows() {
        StructureNode table = expander.createTable(TableSpec.withHeaders(0, 0, null)).value();

        assertTrue(table.children().isEmpty());
        assertEquals(1, builder.nodeCount());
    }

    @Test
    void orderedListNumbersLabels() {
        StructureNode list =
                expander.createList(
                                new ListSpec(
                                        "Steps", List.of("Open", "Edit", "Save"), ListSpec.ORDERED))
                        .value();

        assertEquals("L", list.type());
        List<StructureNode> items = list.childNodes();
        assertEquals(3, items.size());
        StructureNode second = items.get(1);
        assertEquals("Item 2", second.title());
        assertEquals("Lbl", second.childNodes().get(0).type());
        assertEquals("2.", second.childNodes().get(0).title());
        assertEquals("2.", second.childNodes().get(0).attributes().actualText());
        assertEquals("LBody", second.childNodes().get(1).type());
        assertEquals("Edit", second.childNodes().get(1).attributes().actualText());
    }

    @Test
    void unorderedListUsesBullets() {
        StructureNode list =
                expander.createList(new ListSpec("Fruit", List.of("Apple", "Pear"), null)).value();

        for (StructureNode item : list.childNodes()) {
            assertEquals(CompositeExpander.BULLET, item.childNodes().get(0).title());
        }
        assertEquals(
                "L[LI[Lbl, LBody], LI[Lbl, LBody]]", TreeDump.toRoleTree(list).toString());
    }

    @Test
    void expansionFailsBeforeRootInit() {
        CompositeExpander unready = new CompositeExpander(new StructureTreeBuilder());

        assertTrue(unready.createTable(TableSpec.withHeaders(1, 1, List.of("A"))).isFailure());
        assertTrue(unready.createList(new ListSpec("L", List.of("a"), null)).isFailure());
    }

    private static List<String> titles(List<StructureNode> nodes) {
        return nodes.stream().map(StructureNode::title).toList();
    }
}
