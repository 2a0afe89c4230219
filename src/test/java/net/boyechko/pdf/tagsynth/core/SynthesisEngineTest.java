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
package net.boyechko.pdf.tagsynth.core;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import net.boyechko.pdf.tagsynth.composite.ListSpec;
import net.boyechko.pdf.tagsynth.composite.TableSpec;
import net.boyechko.pdf.tagsynth.issue.DiagnosticList;
import net.boyechko.pdf.tagsynth.issue.DiagnosticType;
import net.boyechko.pdf.tagsynth.model.BoundingBox;
import net.boyechko.pdf.tagsynth.model.Element;
import net.boyechko.pdf.tagsynth.model.SidecarOverride;
import net.boyechko.pdf.tagsynth.model.TextPosition;
import net.boyechko.pdf.tagsynth.sidecar.Sidecar;
import net.boyechko.pdf.tagsynth.structure.ContentReference;
import net.boyechko.pdf.tagsynth.structure.ExistingRoot;
import net.boyechko.pdf.tagsynth.structure.StructureNode;
import net.boyechko.pdf.tagsynth.structure.TreeDump;
import org.junit.jupiter.api.Test;

class SynthesisEngineTest {
    private static final BoundingBox BOX = new BoundingBox(72, 700, 300, 714);

    /** In-memory document: each page lists its elements, positions anchor to them one to one. */
    private static final class FakeSource implements DocumentSource {
        final Map<Integer, List<Element>> pages = new HashMap<>();
        final Set<Integer> brokenPages = new HashSet<>();
        ExistingRoot existing;
        Runnable onExtract = () -> {};

        FakeSource page(int page, Element... elements) {
            pages.put(page, List.of(elements));
            return this;
        }

        @Override
        public int pageCount() {
            return pages.size();
        }

        @Override
        public ExistingRoot existingRoot() {
            return existing;
        }

        @Override
        public List<Element> extractElements(int page) throws IOException {
            onExtract.run();
            if (brokenPages.contains(page)) {
                throw new IOException("corrupt page");
            }
            return pages.getOrDefault(page, List.of());
        }

        @Override
        public List<TextPosition> extractPositions(int page) throws IOException {
            List<TextPosition> positions = new ArrayList<>();
            for (Element element : pages.getOrDefault(page, List.of())) {
                if (!element.text().isBlank()) {
                    positions.add(TextPosition.anchored(element.id(), element.text()));
                }
            }
            return positions;
        }
    }

    /** Records checkpoints in order. */
    private static final class RecordingListener extends NoOpProcessingListener {
        final List<String> checkpoints = new ArrayList<>();

        @Override
        public void onCheckpoint(Checkpoint checkpoint, int page) {
            checkpoints.add(checkpoint + "@" + page);
        }
    }

    private static FakeSource twoPageSource() {
        return new FakeSource()
                .page(
                        0,
                        Element.text("text_0_0", BOX, "Annual Report"),
                        Element.text("text_0_1", BOX, "Revenue grew this year."))
                .page(
                        1,
                        Element.text("text_1_0", BOX, "Outlook"),
                        Element.image("image_1_0_0", BOX));
    }

    @Test
    void createsOneNodePerElementAndOneReferencePerPosition() {
        SynthesisEngine engine = new SynthesisEngine(EngineConfig.defaults());

        OperationResult<SynthesisResult> result = engine.synthesize(twoPageSource(), new Sidecar());

        assertTrue(result.isSuccess());
        SynthesisResult synthesis = result.value();
        assertFalse(synthesis.cancelled());
        assertEquals(2, synthesis.pagesProcessed());
        assertEquals(4, synthesis.nodeCount());
        assertEquals(4, synthesis.elementCount());
        assertEquals(3, synthesis.referenceCount());
        assertEquals("Figure", synthesis.nodeByElementId().get("image_1_0_0").type());
        assertTrue(synthesis.nodeByElementId().get("image_1_0_0").references().isEmpty());
        assertEquals(
                List.of(new ContentReference(1, 2)),
                synthesis.nodeByElementId().get("text_1_0").references());
    }

    @Test
    void sidecarRolesAndAttributesReachTheNodes() {
        Sidecar sidecar = new Sidecar();
        sidecar.recordEdit(0, SidecarOverride.ofRole("text_0_0", "H1"));
        sidecar.recordEdit(
                1, SidecarOverride.ofProperty("image_1_0_0", Element.ALT_TEXT, "Growth chart"));
        sidecar.recordEdit(1, new SidecarOverride("text_1_9", "Note", null, "Added note", null));

        SynthesisResult synthesis =
                new SynthesisEngine(EngineConfig.defaults())
                        .synthesize(twoPageSource(), sidecar)
                        .value();

        assertEquals("H1", synthesis.nodeByElementId().get("text_0_0").type());
        assertEquals(
                "Growth chart",
                synthesis.nodeByElementId().get("image_1_0_0").attributes().altText());
        StructureNode note = synthesis.nodeByElementId().get("text_1_9");
        assertEquals("Note", note.type());
        assertEquals("Added note", note.attributes().actualText());
    }

    @Test
    void actualTextIsTruncatedToConfiguredLimit() {
        EngineConfig config = EngineConfig.defaults();
        config.actual_text_limit = 7;
        FakeSource source = new FakeSource().page(0, Element.text("text_0_0", BOX, "Revenue grew"));

        SynthesisResult synthesis =
                new SynthesisEngine(config).synthesize(source, null).value();

        assertEquals(
                "Revenue...",
                synthesis.nodeByElementId().get("text_0_0").attributes().actualText());
    }

    @Test
    void unknownSidecarRoleFallsBackToKindDefault() {
        Sidecar sidecar = new Sidecar();
        sidecar.recordEdit(0, SidecarOverride.ofRole("text_0_0", "Banner"));

        OperationResult<SynthesisResult> result =
                new SynthesisEngine(EngineConfig.defaults()).synthesize(twoPageSource(), sidecar);

        assertEquals("P", result.value().nodeByElementId().get("text_0_0").type());
        assertEquals(1, result.diagnostics().ofType(DiagnosticType.ROLE_FALLBACK).size());
    }

    @Test
    void blankTextElementsAreSkipped() {
        FakeSource source =
                new FakeSource()
                        .page(
                                0,
                                Element.text("text_0_0", BOX, "  "),
                                Element.text("text_0_1", BOX, "x"));

        OperationResult<SynthesisResult> result =
                new SynthesisEngine(EngineConfig.defaults()).synthesize(source, null);

        assertEquals(1, result.value().nodeCount());
        assertEquals(1, result.diagnostics().ofType(DiagnosticType.BLANK_ELEMENT_SKIPPED).size());
    }

    @Test
    void sidecarTablesAndListsAreExpandedOnTheirPage() {
        Sidecar sidecar = new Sidecar();
        sidecar.addTable(0, TableSpec.withHeaders(3, 3, List.of("Name", "Age", "City")));
        sidecar.addList(1, new ListSpec("Steps", List.of("One", "Two"), ListSpec.ORDERED));

        SynthesisResult synthesis =
                new SynthesisEngine(EngineConfig.defaults())
                        .synthesize(twoPageSource(), sidecar)
                        .value();

        assertEquals(
                "StructTreeRoot[P, P, Table[TR[TH, TH, TH], TR[TD, TD, TD], TR[TD, TD, TD]],"
                        + " P, Figure, L[LI[Lbl, LBody], LI[Lbl, LBody]]]",
                TreeDump.toRoleTree(synthesis.root()).toString());
    }

    @Test
    void wrapInDocumentGroupsPagesIntoParts() {
        EngineConfig config = EngineConfig.defaults();
        config.wrap_in_document = true;

        SynthesisResult synthesis =
                new SynthesisEngine(config).synthesize(twoPageSource(), null).value();

        assertEquals(
                "StructTreeRoot[Document[Part[P, P], Part[P, Figure]]]",
                TreeDump.toRoleTree(synthesis.root()).toString());
        assertEquals("Page 2", synthesis.root().kids().get(0).childNodes().get(1).title());
    }

    @Test
    void unrecognizedExistingRootAbortsTheSession() {
        FakeSource source = twoPageSource();
        source.existing = ExistingRoot.unrecognized("PdfArray");

        OperationResult<SynthesisResult> result =
                new SynthesisEngine(EngineConfig.defaults()).synthesize(source, null);

        assertTrue(result.isFailure());
        assertTrue(result.diagnostics().hasFatal());
    }

    @Test
    void existingRootIsExtended() {
        FakeSource source = twoPageSource();
        source.existing = ExistingRoot.keyed(Map.of("Heading", "H1"), 2);
        Sidecar sidecar = new Sidecar();
        sidecar.recordEdit(0, SidecarOverride.ofRole("text_0_0", "Heading"));

        SynthesisResult synthesis =
                new SynthesisEngine(EngineConfig.defaults()).synthesize(source, sidecar).value();

        assertTrue(synthesis.root().isPreexisting());
        assertEquals("Heading", synthesis.nodeByElementId().get("text_0_0").type());
    }

    @Test
    void extractionFailureSkipsOnlyThatPage() {
        FakeSource source = twoPageSource();
        source.brokenPages.add(0);

        OperationResult<SynthesisResult> result =
                new SynthesisEngine(EngineConfig.defaults()).synthesize(source, null);

        assertTrue(result.isSuccess());
        assertEquals(2, result.value().nodeCount());
        DiagnosticList failures =
                result.diagnostics().ofType(DiagnosticType.ELEMENT_EXTRACTION_FAILED);
        assertEquals(Integer.valueOf(0), failures.get(0).where().pageIndex());
    }

    @Test
    void checkpointsArriveInOrder() {
        RecordingListener listener = new RecordingListener();

        new SynthesisEngine(EngineConfig.defaults(), listener)
                .synthesize(new FakeSource().page(0, Element.text("text_0_0", BOX, "x")), null);

        assertEquals(
                List.of(
                        "ROOT_CREATED@-1",
                        "ELEMENTS_RECONCILED@0",
                        "NODES_CREATED@0",
                        "CORRELATION_DONE@0",
                        "SESSION_COMPLETE@-1"),
                listener.checkpoints);
    }

    @Test
    void cancellationKeepsWhatWasBuilt() {
        RecordingListener listener = new RecordingListener();
        SynthesisEngine engine = new SynthesisEngine(EngineConfig.defaults(), listener);

        OperationResult<SynthesisResult> result =
                engine.synthesize(
                        twoPageSource(),
                        null,
                        () -> listener.checkpoints.contains("NODES_CREATED@1"));

        assertTrue(result.isSuccess());
        SynthesisResult synthesis = result.value();
        assertTrue(synthesis.cancelled());
        assertEquals(1, synthesis.pagesProcessed());
        assertEquals(4, synthesis.nodeCount());
        assertEquals(2, synthesis.referenceCount());
        assertEquals(1, result.diagnostics().ofType(DiagnosticType.SESSION_CANCELLED).size());
    }

    @Test
    void secondSessionStartsFromScratch() {
        SynthesisEngine engine = new SynthesisEngine(EngineConfig.defaults());
        engine.synthesize(twoPageSource(), null);

        SynthesisResult second = engine.synthesize(twoPageSource(), null).value();

        assertEquals(4, second.nodeCount());
        assertEquals(1, second.nodes().get(0).nodeId());
        assertEquals(0, second.nodeByElementId().get("text_0_0").references().get(0).mcid());
    }

    @Test
    void reentrantSynthesisIsRejected() {
        SynthesisEngine engine = new SynthesisEngine(EngineConfig.defaults());
        FakeSource source = twoPageSource();
        AtomicReference<Throwable> inner = new AtomicReference<>();
        source.onExtract =
                () -> {
                    if (inner.get() == null) {
                        inner.set(
                                assertThrows(
                                        IllegalStateException.class,
                                        () -> engine.synthesize(twoPageSource(), null)));
                    }
                };

        assertTrue(engine.synthesize(source, null).isSuccess());
        assertNotNull(inner.get());
    }
}
