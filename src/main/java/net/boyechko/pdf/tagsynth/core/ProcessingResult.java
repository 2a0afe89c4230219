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

import java.nio.file.Path;
import net.boyechko.pdf.tagsynth.document.PdfStructureWriter;
import net.boyechko.pdf.tagsynth.issue.DiagnosticList;
import net.boyechko.pdf.tagsynth.issue.DiagnosticSev;
import net.boyechko.pdf.tagsynth.sidecar.Sidecar;

/**
 * Outcome of processing one document.
 *
 * @param synthesis the synthesized tree; null when aborted
 * @param written what was written to the output; null when aborted
 * @param diagnostics everything reported, from sidecar loading to writing
 * @param documentMeta document metadata that was applied
 * @param tempOutputFile the tagged copy, to be moved into place by the caller; null when aborted
 */
public record ProcessingResult(
        SynthesisResult synthesis,
        PdfStructureWriter.WriteSummary written,
        DiagnosticList diagnostics,
        Sidecar.DocumentMeta documentMeta,
        Path tempOutputFile) {

    /** Returns an aborted result with no output file and the given diagnostics. */
    public static ProcessingResult aborted(DiagnosticList diagnostics) {
        return new ProcessingResult(null, null, diagnostics, null, null);
    }

    public boolean isAborted() {
        return tempOutputFile == null;
    }

    public boolean isCancelled() {
        return synthesis != null && synthesis.cancelled();
    }

    public int errorCount() {
        return diagnostics.atLeast(DiagnosticSev.ERROR).size();
    }

    public int warningCount() {
        return (int)
                diagnostics.stream().filter(d -> d.severity() == DiagnosticSev.WARNING).count();
    }
}
