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
package net.boyechko.pdf.tagsynth.reconcile;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.tagsynth.model.BoundingBox;
import net.boyechko.pdf.tagsynth.model.Element;
import net.boyechko.pdf.tagsynth.model.ElementKind;
import net.boyechko.pdf.tagsynth.model.SidecarOverride;
import org.junit.jupiter.api.Test;

class ReconcilerTest {
    private static final BoundingBox BOX = new BoundingBox(72, 700, 300, 714);

    private final Reconciler reconciler = new Reconciler();

    @Test
    void extractedElementsPassThroughWithoutOverrides() {
        List<Element> extracted =
                List.of(
                        Element.text("text_0_0", BOX, "Hello"),
                        Element.text("text_0_1", BOX, "Bye"));

        List<Element> merged = reconciler.reconcile(0, extracted, Map.of());

        assertEquals(extracted, merged);
    }

    @Test
    void overrideReplacesOnlyTheFieldsItCarries() {
        Element original = Element.text("text_0_0", BOX, "Introduction");
        Map<String, SidecarOverride> overrides =
                Map.of("text_0_0", SidecarOverride.ofRole("text_0_0", "H1"));

        Element merged = reconciler.reconcile(0, List.of(original), overrides).get(0);

        assertEquals("H1", merged.role());
        assertEquals("Introduction", merged.text());
        assertEquals(BOX, merged.bbox());
        assertEquals(ElementKind.TEXT, merged.kind());
    }

    @Test
    void overridePropertiesMergeKeyByKey() {
        Element original =
                Element.image("image_0_0_0", BOX).withProperty(Element.TITLE, "Chart");
        Map<String, SidecarOverride> overrides =
                Map.of(
                        "image_0_0_0",
                        SidecarOverride.ofProperty("image_0_0_0", Element.ALT_TEXT, "Sales chart"));

        Element merged = reconciler.reconcile(0, List.of(original), overrides).get(0);

        assertEquals("Chart", merged.stringProperty(Element.TITLE));
        assertEquals("Sales chart", merged.stringProperty(Element.ALT_TEXT));
        assertEquals("Figure", merged.role());
    }

    @Test
    void nullPropertyInOverrideKeepsExtractedValue() {
        Element original =
                Element.image("image_0_0_0", BOX).withProperty(Element.ALT_TEXT, "Chart");
        Map<String, SidecarOverride> overrides =
                Map.of(
                        "image_0_0_0",
                        SidecarOverride.ofProperty("image_0_0_0", Element.ALT_TEXT, null));

        Element merged = reconciler.reconcile(0, List.of(original), overrides).get(0);

        assertEquals("Chart", merged.stringProperty(Element.ALT_TEXT));
    }

    @Test
    void sidecarOnlyElementsAreAppendedInOverrideOrder() {
        Map<String, SidecarOverride> overrides = new LinkedHashMap<>();
        overrides.put("text_0_9", new SidecarOverride("text_0_9", null, null, "Footnote", null));
        overrides.put("image_0_3_0", SidecarOverride.ofRole("image_0_3_0", "Figure"));

        List<Element> merged =
                reconciler.reconcile(0, List.of(Element.text("text_0_0", BOX, "Body")), overrides);

        assertEquals(List.of("text_0_0", "text_0_9", "image_0_3_0"), ids(merged));
        Element footnote = merged.get(1);
        assertEquals("P", footnote.role());
        assertEquals(BoundingBox.PLACEHOLDER, footnote.bbox());
        assertEquals("Footnote", footnote.text());
        assertEquals(ElementKind.IMAGE, merged.get(2).kind());
    }

    @Test
    void configuredDefaultsApplyToSidecarOnlyElements() {
        Reconciler custom = new Reconciler(new BoundingBox(1, 2, 3, 4), "Span");
        Map<String, SidecarOverride> overrides =
                Map.of("text_2_0", new SidecarOverride("text_2_0", null, null, "x", null));

        Element synthesized = custom.reconcile(2, List.of(), overrides).get(0);

        assertEquals("Span", synthesized.role());
        assertEquals(new BoundingBox(1, 2, 3, 4), synthesized.bbox());
    }

    @Test
    void duplicateExtractedIdIsRejected() {
        List<Element> extracted =
                List.of(Element.text("text_0_0", BOX, "a"), Element.text("text_0_0", BOX, "b"));

        assertThrows(
                IllegalArgumentException.class, () -> reconciler.reconcile(0, extracted, Map.of()));
    }

    @Test
    void reconcilingTwiceGivesEqualResults() {
        List<Element> extracted = List.of(Element.text("text_0_0", BOX, "Body"));
        Map<String, SidecarOverride> overrides = new LinkedHashMap<>();
        overrides.put("text_0_0", SidecarOverride.ofRole("text_0_0", "H2"));
        overrides.put("text_0_5", SidecarOverride.ofRole("text_0_5", "Note"));

        assertEquals(
                reconciler.reconcile(0, extracted, overrides),
                reconciler.reconcile(0, extracted, overrides));
    }

    @Test
    void nullInputsYieldEmptyResult() {
        assertTrue(reconciler.reconcile(0, null, null).isEmpty());
    }

    private static List<String> ids(List<Element> elements) {
        return elements.stream().map(Element::id).toList();
    }
}
