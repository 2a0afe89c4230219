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

import com.itextpdf.kernel.pdf.PdfDocument;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import net.boyechko.pdf.tagsynth.document.PdfCustodian;
import net.boyechko.pdf.tagsynth.document.PdfDocumentSource;
import net.boyechko.pdf.tagsynth.document.PdfStructureWriter;
import net.boyechko.pdf.tagsynth.issue.Diagnostic;
import net.boyechko.pdf.tagsynth.issue.DiagnosticList;
import net.boyechko.pdf.tagsynth.issue.DiagnosticSev;
import net.boyechko.pdf.tagsynth.issue.DiagnosticType;
import net.boyechko.pdf.tagsynth.sidecar.Sidecar;
import net.boyechko.pdf.tagsynth.sidecar.SidecarStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Orchestrates tagging of one PDF: sidecar loading, synthesis, and writing the tagged copy. */
public class ProcessingService {
    private static final Logger logger = LoggerFactory.getLogger(ProcessingService.class);

    private static final int MIN_GROUP_SIZE_FOR_GROUPING = 3;

    private final PdfCustodian custodian;
    private final ProcessingListener listener;
    private final EngineConfig config;
    private final Path sidecarPath;
    private final BooleanSupplier cancelRequested;
    private final SidecarStore sidecarStore = new SidecarStore();
    private Sidecar sidecar;

    public static class ProcessingServiceBuilder {
        private PdfCustodian custodian;
        private ProcessingListener listener;
        private EngineConfig config;
        private Path sidecarPath;
        private BooleanSupplier cancelRequested = () -> false;

        public ProcessingServiceBuilder withPdfCustodian(PdfCustodian custodian) {
            this.custodian = custodian;
            return this;
        }

        public ProcessingServiceBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        public ProcessingServiceBuilder withConfig(EngineConfig config) {
            this.config = config;
            return this;
        }

        /** Sidecar to apply; a path that does not exist means "no sidecar". */
        public ProcessingServiceBuilder withSidecarPath(Path sidecarPath) {
            this.sidecarPath = sidecarPath;
            return this;
        }

        public ProcessingServiceBuilder withCancelSignal(BooleanSupplier cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public ProcessingService build() {
            if (custodian == null) {
                throw new IllegalStateException(
                        "PdfCustodian must be provided via withPdfCustodian(...) before building"
                                + " ProcessingService");
            }
            if (listener == null) {
                throw new IllegalStateException(
                        "ProcessingListener must be provided via withListener(...) before building"
                                + " ProcessingService");
            }
            return new ProcessingService(this);
        }
    }

    private ProcessingService(ProcessingServiceBuilder builder) {
        this.custodian = builder.custodian;
        this.listener = builder.listener;
        this.config = builder.config != null ? builder.config : EngineConfig.loadDefault();
        this.sidecarPath = builder.sidecarPath;
        this.cancelRequested = builder.cancelRequested;
    }

    /**
     * Synthesizes a structure tree for the input and writes a tagged copy to a temporary file,
     * which the caller moves into place. Returns an aborted result on fatal diagnostics.
     */
    public ProcessingResult synthesize() throws IOException {
        DiagnosticList all = new DiagnosticList();

        listener.onPhaseStart("Sidecar");
        sidecar = loadSidecar(all);

        Path tempOutput = Files.createTempFile("tagsynth-", ".pdf");
        ProcessingResult result;
        try (PdfDocument doc = custodian.openForTagging(tempOutput)) {
            result = synthesizeInto(doc, sidecar, all, tempOutput);
        } catch (IOException | RuntimeException e) {
            discard(tempOutput);
            throw e;
        }

        listener.onSummary(all);
        if (result.isAborted()) {
            discard(tempOutput);
        }
        return result;
    }

    private ProcessingResult synthesizeInto(
            PdfDocument doc, Sidecar applied, DiagnosticList all, Path tempOutput) {
        listener.onPhaseStart("Structure synthesis");
        SynthesisEngine engine = new SynthesisEngine(config, listener);
        OperationResult<SynthesisResult> synthesized =
                engine.synthesize(new PdfDocumentSource(doc, config), applied, cancelRequested);
        all.addAll(synthesized.diagnostics());
        reportDiagnosticsGrouped(synthesized.diagnostics());

        if (synthesized.isFailure() || all.hasFatal()) {
            listener.onError("Structure synthesis failed: " + synthesized.describe());
            return ProcessingResult.aborted(all);
        }
        SynthesisResult synthesis = synthesized.value();
        listener.onSuccess(
                "Created "
                        + synthesis.nodeCount()
                        + " node(s) for "
                        + synthesis.elementCount()
                        + " element(s) on "
                        + synthesis.pagesProcessed()
                        + " page(s)");

        listener.onPhaseStart("Writing tagged PDF");
        OperationResult<PdfStructureWriter.WriteSummary> writeResult =
                new PdfStructureWriter(config).write(doc, synthesis, applied.document());
        all.addAll(writeResult.diagnostics());
        reportDiagnosticsGrouped(writeResult.diagnostics());
        if (writeResult.isFailure()) {
            listener.onError("Writing the structure tree failed: " + writeResult.describe());
            return ProcessingResult.aborted(all);
        }
        PdfStructureWriter.WriteSummary written = writeResult.value();
        listener.onSuccess(
                "Wrote "
                        + written.elementsWritten()
                        + " structure element(s) with "
                        + written.referencesMarked()
                        + " content reference(s)");

        return new ProcessingResult(
                synthesis, written, all, applied.document().withTagged(true), tempOutput);
    }

    /** The sidecar applied by the last {@link #synthesize()} call; null before the first. */
    public Sidecar sidecar() {
        return sidecar;
    }

    private Sidecar loadSidecar(DiagnosticList all) throws IOException {
        if (sidecarPath == null || !Files.exists(sidecarPath)) {
            listener.onInfo("No sidecar; using extracted elements only");
            return new Sidecar();
        }
        Sidecar loaded = sidecarStore.read(sidecarPath);
        DiagnosticList warnings = sidecarStore.warnings();
        all.addAll(warnings);
        reportDiagnosticsGrouped(warnings);
        listener.onSuccess(
                "Loaded "
                        + loaded.overrideCount()
                        + " override(s) from "
                        + sidecarPath.getFileName());
        return loaded;
    }

    private void discard(Path tempOutput) {
        try {
            Files.deleteIfExists(tempOutput);
        } catch (IOException e) {
            logger.warn("Could not delete temporary output {}: {}", tempOutput, e.getMessage());
        }
    }

    /** Reports diagnostics of WARNING and above, grouping types that occur often. */
    private void reportDiagnosticsGrouped(DiagnosticList diagnostics) {
        Map<DiagnosticType, List<Diagnostic>> grouped =
                diagnostics.atLeast(DiagnosticSev.WARNING).stream()
                        .collect(Collectors.groupingBy(Diagnostic::type));

        for (Map.Entry<DiagnosticType, List<Diagnostic>> entry : grouped.entrySet()) {
            List<Diagnostic> group = entry.getValue();
            if (group.size() >= MIN_GROUP_SIZE_FOR_GROUPING) {
                listener.onDiagnosticGroup(entry.getKey().groupLabel(), group);
            } else {
                for (Diagnostic diagnostic : group) {
                    report(diagnostic);
                }
            }
        }
    }

    private void report(Diagnostic diagnostic) {
        String message = diagnostic.message() + diagnostic.where().describe();
        if (diagnostic.severity().isAtLeast(DiagnosticSev.ERROR)) {
            listener.onError(message);
        } else {
            listener.onWarning(message);
        }
    }
}
