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
package net.boyechko.pdf.tagsynth.model;

/**
 * Synthetic element ids. Ids depend only on the 0-based page index and extraction order, so the
 * same document extracted twice yields the same ids and sidecar overrides keep applying.
 */
public final class ElementIds {
    private ElementIds() {}

    /** {@code text_<page>_<blockOrdinal>} */
    public static String text(int page, int blockOrdinal) {
        return ElementKind.TEXT.idPrefix() + "_" + page + "_" + blockOrdinal;
    }

    /** {@code image_<page>_<imgOrdinal>_<rectOrdinal>} */
    public static String image(int page, int imageOrdinal, int rectOrdinal) {
        return ElementKind.IMAGE.idPrefix() + "_" + page + "_" + imageOrdinal + "_" + rectOrdinal;
    }
}
