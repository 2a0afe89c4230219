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

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.tagsynth.PdfTestBase;
import net.boyechko.pdf.tagsynth.document.PdfCustodian;
import net.boyechko.pdf.tagsynth.issue.DiagnosticList;
import net.boyechko.pdf.tagsynth.issue.DiagnosticType;
import net.boyechko.pdf.tagsynth.model.SidecarOverride;
import net.boyechko.pdf.tagsynth.sidecar.Sidecar;
import net.boyechko.pdf.tagsynth.sidecar.SidecarStore;
import org.junit.jupiter.api.Test;

/** Test suite for ProcessingService. */
public class ProcessingServiceTest extends PdfTestBase {

    @Test
    void untaggedPdfIsTagged() throws Exception {
        Path input = createUntaggedPdf(lines("Introduction", 700, "Body text", 500));

        ProcessingResult result = createProcessingService(input, null).synthesize();
        Path saved = saveTaggedPdf(result);

        assertFalse(result.isAborted());
        assertEquals(2, result.synthesis().nodeCount());
        assertEquals(2, result.written().referencesMarked());
        assertTrue(result.documentMeta().tagged());
        try (PdfDocument doc = new PdfDocument(new PdfReader(saved.toString()))) {
            assertTrue(doc.isTagged());
            assertEquals(2, doc.getStructTreeRoot().getKids().size());
        }
    }

    @Test
    void sidecarOverridesAreApplied() throws Exception {
        Path input = createUntaggedPdf(lines("Introduction", 700, "Body text", 500));
        Sidecar sidecar = new Sidecar(new Sidecar.DocumentMeta("Guide", "en-US", false));
        sidecar.recordEdit(0, SidecarOverride.ofRole("text_0_0", "H1"));
        Path sidecarPath = SidecarStore.sidecarPathFor(input);
        new SidecarStore().write(sidecar, sidecarPath);

        ProcessingService service = createProcessingService(input, sidecarPath);
        ProcessingResult result = service.synthesize();
        saveTaggedPdf(result);

        assertEquals(1, service.sidecar().overrideCount());
        assertEquals("H1", result.synthesis().nodeByElementId().get("text_0_0").type());
        assertEquals("Guide", result.documentMeta().title());
    }

    @Test
    void missingSidecarMeansExtractedElementsOnly() throws Exception {
        Path input = createUntaggedPdf(lines("Body text", 700));
        RecordingListener listener = new RecordingListener();

        ProcessingResult result =
                new ProcessingService.ProcessingServiceBuilder()
                        .withPdfCustodian(new PdfCustodian(input))
                        .withListener(listener)
                        .withConfig(EngineConfig.defaults())
                        .withSidecarPath(tempDir.resolve("absent_sidecar.json"))
                        .build()
                        .synthesize();
        saveTaggedPdf(result);

        assertTrue(listener.infos.stream().anyMatch(m -> m.startsWith("No sidecar")));
        assertTrue(listener.phases.containsAll(List.of("Sidecar", "Structure synthesis")));
        assertEquals(1, listener.summaries);
    }

    @Test
    void unrecognizedRootAbortsWithoutOutput() throws Exception {
        Path input = testOutputPath("array_root.pdf");
        try (PdfDocument doc = new PdfDocument(new PdfWriter(input.toString()))) {
            doc.addNewPage();
            doc.getCatalog().getPdfObject().put(PdfName.StructTreeRoot, new PdfArray());
        }
        RecordingListener listener = new RecordingListener();

        ProcessingResult result =
                new ProcessingService.ProcessingServiceBuilder()
                        .withPdfCustodian(new PdfCustodian(input))
                        .withListener(listener)
                        .withConfig(EngineConfig.defaults())
                        .build()
                        .synthesize();

        assertTrue(result.isAborted());
        assertNull(result.tempOutputFile());
        assertFalse(result.diagnostics().ofType(DiagnosticType.UNRECOGNIZED_ROOT).isEmpty());
        assertFalse(listener.errors.isEmpty());
    }

    @Test
    void cancelledSessionKeepsPartialTree() throws Exception {
        Path input = createUntaggedPdf(lines("One", 700), lines("Two", 700));

        ProcessingResult result =
                new ProcessingService.ProcessingServiceBuilder()
                        .withPdfCustodian(new PdfCustodian(input))
                        .withListener(new NoOpProcessingListener())
                        .withConfig(EngineConfig.defaults())
                        .withCancelSignal(() -> true)
                        .build()
                        .synthesize();
        saveTaggedPdf(result);

        assertTrue(result.isCancelled());
        assertEquals(0, result.synthesis().pagesProcessed());
        assertFalse(result.diagnostics().ofType(DiagnosticType.SESSION_CANCELLED).isEmpty());
    }

    @Test
    void builderRequiresCustodianAndListener() {
        assertThrows(
                IllegalStateException.class,
                () ->
                        new ProcessingService.ProcessingServiceBuilder()
                                .withListener(new NoOpProcessingListener())
                                .build());
        assertThrows(
                IllegalStateException.class,
                () ->
                        new ProcessingService.ProcessingServiceBuilder()
                                .withPdfCustodian(new PdfCustodian(tempDir.resolve("x.pdf")))
                                .build());
    }

    @Test
    void tempOutputIsCreatedPerRun() throws Exception {
        Path input = createUntaggedPdf(lines("Body text", 700));

        ProcessingResult first = createProcessingService(input, null).synthesize();
        ProcessingResult second = createProcessingService(input, null).synthesize();

        assertNotEquals(first.tempOutputFile(), second.tempOutputFile());
        assertTrue(Files.exists(first.tempOutputFile()));
        Files.deleteIfExists(first.tempOutputFile());
        Files.deleteIfExists(second.tempOutputFile());
    }

    private static ProcessingService createProcessingService(Path input, Path sidecarPath) {
        return new ProcessingService.ProcessingServiceBuilder()
                .withPdfCustodian(new PdfCustodian(input))
                .withListener(new NoOpProcessingListener())
                .withConfig(EngineConfig.defaults())
                .withSidecarPath(sidecarPath)
                .build();
    }

    private static final class RecordingListener implements ProcessingListener {
        final List<String> phases = new ArrayList<>();
        final List<String> infos = new ArrayList<>();
        final List<String> errors = new ArrayList<>();
        int summaries = 0;

        @Override
        public void onPhaseStart(String phaseName) {
            phases.add(phaseName);
        }

        @Override
        public void onSuccess(String message) {}

        @Override
        public void onWarning(String message) {}

        @Override
        public void onError(String message) {
            errors.add(message);
        }

        @Override
        public void onInfo(String message) {
            infos.add(message);
        }

        @Override
        public void onSummary(DiagnosticList allDiagnostics) {
            summaries++;
        }
    }
}
