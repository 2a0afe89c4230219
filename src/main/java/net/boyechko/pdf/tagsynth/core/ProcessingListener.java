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

import java.util.List;
import net.boyechko.pdf.tagsynth.issue.Diagnostic;
import net.boyechko.pdf.tagsynth.issue.DiagnosticList;

/**
 * Interface for reporting progress and results of the processing. Callbacks run synchronously on
 * the processing thread and must not block.
 */
public interface ProcessingListener {
    void onPhaseStart(String phaseName);

    void onSuccess(String message);

    void onWarning(String message);

    void onSummary(DiagnosticList allDiagnostics);

    default void onError(String message) {}

    default void onInfo(String message) {}

    default void onVerboseOutput(String message) {}

    default void onSubsection(String header) {}

    /** Called at each session checkpoint; {@code page} is -1 for session-wide checkpoints. */
    default void onCheckpoint(Checkpoint checkpoint, int page) {}

    default void onDiagnosticGroup(String groupLabel, List<Diagnostic> diagnostics) {
        for (Diagnostic diagnostic : diagnostics) {
            onWarning(diagnostic.message() + diagnostic.where().describe());
        }
    }
}
