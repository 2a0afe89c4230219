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
package net.boyechko.pdf.tagsynth.ui;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import net.boyechko.pdf.tagsynth.core.ProcessingResult;
import net.boyechko.pdf.tagsynth.core.SynthesisResult;
import net.boyechko.pdf.tagsynth.document.PdfStructureWriter;
import net.boyechko.pdf.tagsynth.issue.Diagnostic;
import net.boyechko.pdf.tagsynth.issue.DiagnosticList;
import net.boyechko.pdf.tagsynth.issue.DiagnosticSev;
import net.boyechko.pdf.tagsynth.sidecar.Sidecar;
import net.boyechko.pdf.tagsynth.sidecar.SidecarStore;

/**
 * Generates a JSON remediation report from processing results: the metadata that was applied, the
 * sidecar edits per page, what the synthesis produced, and the diagnostics raised along the way.
 */
public final class RemediationReport {
    private static final ObjectMapper mapper =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private RemediationReport() {}

    /**
     * Writes the report to the given path.
     *
     * @param result the processing result
     * @param sidecar the sidecar that was applied (may be empty)
     * @param inputPath the original PDF
     * @param outputPath the tagged PDF (may be null if not saved)
     * @param reportPath where the report is written
     */
    public static void write(
            ProcessingResult result,
            Sidecar sidecar,
            Path inputPath,
            Path outputPath,
            Path reportPath)
            throws IOException {
        Path reportParent = reportPath.toAbsolutePath().getParent();
        if (reportParent != null) {
            Files.createDirectories(reportParent);
        }
        mapper.writeValue(reportPath.toFile(), build(result, sidecar, inputPath, outputPath));
    }

    static ObjectNode build(
            ProcessingResult result, Sidecar sidecar, Path inputPath, Path outputPath)
            throws IOException {
        ObjectNode root = mapper.createObjectNode();

        ObjectNode info = root.putObject("report_info");
        info.put("generated_at", OffsetDateTime.now().toString());
        info.put("tool_name", PdfStructureWriter.CREATOR);
        info.put("source_file", inputPath.getFileName().toString());
        info.put("export_file", outputPath != null ? outputPath.getFileName().toString() : "N/A");
        info.put("aborted", result.isAborted());
        info.put("cancelled", result.isCancelled());

        ObjectNode metadata = root.putObject("metadata_changes");
        Sidecar.DocumentMeta meta = result.documentMeta();
        boolean titled = meta != null && meta.title() != null && !meta.title().isBlank();
        metadata.put("title", titled ? meta.title() : "Not set");
        metadata.put(
                "language", meta != null && meta.language() != null ? meta.language() : "Not set");
        metadata.put("marked_flag", !result.isAborted());
        metadata.put("accessibility_flags_set", !result.isAborted());

        ObjectNode modifications = root.putObject("element_modifications");
        modifications.put("total_elements_modified", sidecar.overrideCount());
        modifications.put(
                "pages_with_changes",
                sidecar.pageIndices().stream()
                        .filter(p -> !sidecar.overridesFor(p).isEmpty())
                        .count());
        modifications.set("details", mapper.readTree(new SidecarStore().toJson(sidecar)));

        SynthesisResult synthesis = result.synthesis();
        if (synthesis != null) {
            ObjectNode synth = root.putObject("synthesis");
            synth.put("pages_processed", synthesis.pagesProcessed());
            synth.put("elements", synthesis.elementCount());
            synth.put("nodes", synthesis.nodeCount());
            synth.put("content_references", synthesis.referenceCount());
            PdfStructureWriter.WriteSummary written = result.written();
            if (written != null) {
                synth.put("elements_written", written.elementsWritten());
                synth.put("references_marked", written.referencesMarked());
                synth.put("role_mappings_added", written.mappingsAdded());
            }
        }

        root.set("diagnostics_summary", diagnosticsSummary(result.diagnostics()));
        return root;
    }

    private static ObjectNode diagnosticsSummary(DiagnosticList diagnostics) {
        ObjectNode summary = mapper.createObjectNode();
        summary.put("total", diagnostics.size());
        summary.put("errors", diagnostics.atLeast(DiagnosticSev.ERROR).size());
        summary.put(
                "warnings",
                diagnostics.stream().filter(d -> d.severity() == DiagnosticSev.WARNING).count());
        ArrayNode items = summary.putArray("diagnostics");
        for (Diagnostic diagnostic : diagnostics) {
            ObjectNode item = items.addObject();
            item.put("type", diagnostic.type().name());
            item.put("severity", diagnostic.severity().name());
            item.put("message", diagnostic.message());
            Integer page = diagnostic.where().pageIndex();
            if (page != null) {
                item.put("page", page + 1);
            } else {
                item.putNull("page");
            }
        }
        return summary;
    }
}
