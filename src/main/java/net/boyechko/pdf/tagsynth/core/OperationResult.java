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

import java.util.function.Consumer;
import net.boyechko.pdf.tagsynth.issue.Diagnostic;
import net.boyechko.pdf.tagsynth.issue.DiagnosticList;
import net.boyechko.pdf.tagsynth.issue.DiagnosticLoc;
import net.boyechko.pdf.tagsynth.issue.DiagnosticSev;
import net.boyechko.pdf.tagsynth.issue.DiagnosticType;

/**
 * Outcome of an engine operation: a success flag, the produced value (may be null on failure or
 * for partial results) and the diagnostics raised along the way. Engine operations return this
 * instead of throwing.
 */
public final class OperationResult<T> {
    private final boolean success;
    private final T value;
    private final DiagnosticList diagnostics;

    private OperationResult(boolean success, T value, DiagnosticList diagnostics) {
        this.success = success;
        this.value = value;
        this.diagnostics = diagnostics != null ? diagnostics : new DiagnosticList();
    }

    public static <T> OperationResult<T> ok(T value) {
        return new OperationResult<>(true, value, new DiagnosticList());
    }

    public static <T> OperationResult<T> ok(T value, DiagnosticList diagnostics) {
        return new OperationResult<>(true, value, diagnostics);
    }

    public static <T> OperationResult<T> failed(DiagnosticList diagnostics) {
        return new OperationResult<>(false, null, diagnostics);
    }

    public static <T> OperationResult<T> failed(
            DiagnosticType type, DiagnosticSev sev, DiagnosticLoc where, String message) {
        return failed(new DiagnosticList(new Diagnostic(type, sev, where, message)));
    }

    public static <T> OperationResult<T> failed(DiagnosticType type, String message) {
        return failed(type, DiagnosticSev.ERROR, DiagnosticLoc.none(), message);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public T value() {
        return value;
    }

    public DiagnosticList diagnostics() {
        return diagnostics;
    }

    /** Runs {@code action} on the value when successful; returns this for chaining. */
    public OperationResult<T> ifSuccess(Consumer<T> action) {
        if (success) {
            action.accept(value);
        }
        return this;
    }

    /** Short summary for logging. */
    public String describe() {
        if (success) {
            return diagnostics.isEmpty()
                    ? "ok"
                    : "ok with " + diagnostics.size() + " diagnostic(s)";
        }
        return diagnostics.isEmpty() ? "failed" : "failed: " + diagnostics.get(0).message();
    }

    @Override
    public String toString() {
        return "OperationResult[" + describe() + "]";
    }
}
