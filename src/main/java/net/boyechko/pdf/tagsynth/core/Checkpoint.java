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

/** Fixed points in a synthesis session where progress is reported and cancellation is checked. */
public enum Checkpoint {
    ROOT_CREATED("Structure root ready"),
    ELEMENTS_RECONCILED("Elements reconciled"),
    NODES_CREATED("Nodes created"),
    CORRELATION_DONE("Content correlated"),
    SESSION_COMPLETE("Session complete");

    private final String label;

    Checkpoint(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** True for checkpoints reached once per page. */
    public boolean isPerPage() {
        return this == ELEMENTS_RECONCILED || this == NODES_CREATED || this == CORRELATION_DONE;
    }
}
