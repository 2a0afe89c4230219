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
package net.boyechko.pdf.tagsynth.sidecar;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.pdf.tagsynth.composite.ListSpec;
import net.boyechko.pdf.tagsynth.composite.TableSpec;
import net.boyechko.pdf.tagsynth.issue.DiagnosticType;
import net.boyechko.pdf.tagsynth.model.BoundingBox;
import net.boyechko.pdf.tagsynth.model.Element;
import net.boyechko.pdf.tagsynth.model.SidecarOverride;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SidecarStoreTest {
    @TempDir Path tempDir;

    private final SidecarStore store = new SidecarStore();

    @Test
    void readsCanonicalShape() throws Exception {
        String json =
                """
                {
                  "document": {"title": "Annual Report", "language": "de-DE", "tagged": false},
                  "pages": {
                    "0": {"elements": [
                      {"id": "text_0_0", "role": "H1", "bbox": [72, 700, 300, 714],
                       "properties": {"title": "Heading"}}
                    ]}
                  }
                }
                """;

        Sidecar sidecar = store.readString(json);

        assertEquals("Annual Report", sidecar.document().title());
        assertEquals("de-DE", sidecar.document().language());
        SidecarOverride override = sidecar.overridesFor(0).get("text_0_0");
        assertEquals("H1", override.role());
        assertEquals(new BoundingBox(72, 700, 300, 714), override.bbox());
        assertEquals("Heading", override.properties().get(Element.TITLE));
        assertFalse(override.hasText());
        assertTrue(store.warnings().isEmpty());
    }

    @Test
    void readsPagesAsArrayAndElementsKeyedById() throws Exception {
        String json =
                """
                {"pages": [
                  {"elements": {"text_0_0": {"role": "H2"}}},
                  [{"id": "image_1_0_0", "alt_text": "Logo"}]
                ]}
                """;

        Sidecar sidecar = store.readString(json);

        assertEquals("H2", sidecar.overridesFor(0).get("text_0_0").role());
        SidecarOverride logo = sidecar.overridesFor(1).get("image_1_0_0");
        assertEquals("Logo", logo.properties().get(Element.ALT_TEXT));
        assertNull(logo.role());
    }

    @Test
    void roleInsidePropertiesIsLiftedOut() throws Exception {
        Sidecar sidecar =
                store.readString(
                        "{\"pages\": {\"2\": {\"elements\": [{\"id\": \"text_2_0\","
                                + " \"properties\": {\"role\": \"Caption\","
                                + " \"scope\": \"Row\"}}]}}}");

        SidecarOverride override = sidecar.overridesFor(2).get("text_2_0");
        assertEquals("Caption", override.role());
        assertFalse(override.properties().containsKey("role"));
        assertEquals("Row", override.properties().get(Element.SCOPE));
    }

    @Test
    void jsonNullPropertiesAreTreatedAsAbsent() throws Exception {
        Sidecar sidecar =
                store.readString(
                        "{\"pages\": {\"0\": {\"elements\": [{\"id\": \"image_0_0_0\","
                                + " \"actual_text\": null,"
                                + " \"properties\": {\"alt_text\": null,"
                                + " \"title\": \"Map\"}}]}}}");

        SidecarOverride override = sidecar.overridesFor(0).get("image_0_0_0");
        assertFalse(override.properties().containsKey(Element.ALT_TEXT));
        assertFalse(override.properties().containsKey(Element.ACTUAL_TEXT));
        assertEquals("Map", override.properties().get(Element.TITLE));
    }

    @Test
    void malformedEntriesAreSkippedWithWarnings() throws Exception {
        Sidecar sidecar =
                store.readString(
                        """
                        {"pages": {
                          "x": {"elements": []},
                          "0": {"elements": [
                            {"role": "P"},
                            {"id": "text_0_1", "bbox": [1, 2, 3]}
                          ]}
                        }}
                        """);

        assertEquals(3, store.warnings().size());
        assertTrue(
                store.warnings().stream()
                        .allMatch(d -> d.type() == DiagnosticType.SIDECAR_ENTRY_IGNORED));
        SidecarOverride kept = sidecar.overridesFor(0).get("text_0_1");
        assertNotNull(kept);
        assertFalse(kept.hasBbox());
    }

    @Test
    void repeatedIdsMergeFieldByField() throws Exception {
        Sidecar sidecar =
                store.readString(
                        """
                        {"pages": {"0": {"elements": [
                          {"id": "text_0_0", "role": "H1"},
                          {"id": "text_0_0", "text": "Fixed text"}
                        ]}}}
                        """);

        SidecarOverride merged = sidecar.overridesFor(0).get("text_0_0");
        assertEquals("H1", merged.role());
        assertEquals("Fixed text", merged.text());
        assertEquals(1, sidecar.overrideCount());
    }

    @Test
    void nonObjectRootIsRejected() {
        assertThrows(Exception.class, () -> store.readString("[1, 2]"));
    }

    @Test
    void readsTablesAndLists() throws Exception {
        Sidecar sidecar =
                store.readString(
                        """
                        {"pages": {"0": {
                          "tables": [{"title": "People", "rows": 3, "cols": 3,
                                      "headers": ["Name", "Age", "City"], "has_header_row": true}],
                          "lists": [{"title": "Steps", "items": ["a", "b"], "list_type": "ordered"}]
                        }}}
                        """);

        TableSpec table = sidecar.tablesFor(0).get(0);
        assertEquals(List.of("Name", "Age", "City"), table.headers());
        assertTrue(table.hasHeaderRow());
        ListSpec list = sidecar.listsFor(0).get(0);
        assertTrue(list.isOrdered());
    }

    @Test
    void writtenSidecarReadsBackEqual() throws Exception {
        Sidecar original = new Sidecar(new Sidecar.DocumentMeta("Report", "fr-FR", true));
        original.recordEdit(0, SidecarOverride.ofRole("text_0_0", "H1"));
        original.recordEdit(
                0, SidecarOverride.ofProperty("image_0_0_0", Element.ALT_TEXT, "Company logo"));
        original.recordEdit(
                3,
                new SidecarOverride(
                        "text_3_1", "Note", new BoundingBox(10, 20, 30, 40), "See below", null));
        original.addTable(3, TableSpec.withHeaders(2, 2, List.of("K", "V")));
        original.addList(3, new ListSpec("Bullets", List.of("x"), ListSpec.UNORDERED));

        Path path = tempDir.resolve("nested/report_sidecar.json");
        store.write(original, path);
        Sidecar reread = store.read(path);

        assertTrue(Files.exists(path));
        assertEquals(original.document(), reread.document());
        assertEquals(original.pageIndices(), reread.pageIndices());
        assertEquals(original.overridesFor(0), reread.overridesFor(0));
        assertEquals(original.overridesFor(3), reread.overridesFor(3));
        assertEquals(original.tablesFor(3), reread.tablesFor(3));
        assertEquals(original.listsFor(3), reread.listsFor(3));
    }

    @Test
    void initialSidecarHasOneEmptyPagePerPage() throws Exception {
        String json = store.toJson(Sidecar.initial(2));

        Sidecar reread = store.readString(json);

        assertEquals(List.of(0, 1), List.copyOf(reread.pageIndices()));
        assertEquals("en-US", reread.document().language());
        assertFalse(reread.document().tagged());
        assertEquals(0, reread.overrideCount());
    }

    @Test
    void sidecarPathSitsNextToThePdf() {
        assertEquals(
                Path.of("/docs/report_sidecar.json"),
                SidecarStore.sidecarPathFor(Path.of("/docs/report.pdf")));
    }
}
