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
 * A run of text located on a page, produced for the correlation pass only.
 *
 * @param elementId id of the element this run was extracted for; null for raw content-stream runs
 * @param text the run's text
 * @param bbox run bounds; null when unknown
 * @param font font name; may be null
 * @param size font size in points
 * @param blockIdx block ordinal within the page
 * @param lineIdx line ordinal within the block
 * @param spanIdx span ordinal within the line
 * @param operatorIndex ordinal of the text-showing operator in the page content, or -1
 */
public record TextPosition(
        String elementId,
        String text,
        BoundingBox bbox,
        String font,
        float size,
        int blockIdx,
        int lineIdx,
        int spanIdx,
        int operatorIndex) {

    public TextPosition {
        text = text != null ? text : "";
    }

    /** A position anchored to an element, with no content-stream operator. */
    public static TextPosition anchored(String elementId, String text) {
        return new TextPosition(elementId, text, null, null, 0, 0, 0, 0, -1);
    }

    /** A raw run with no element anchor. */
    public static TextPosition raw(String text, int operatorIndex) {
        return new TextPosition(null, text, null, null, 0, -1, -1, -1, operatorIndex);
    }

    public boolean hasElementId() {
        return elementId != null && !elementId.isEmpty();
    }

    public boolean hasOperator() {
        return operatorIndex >= 0;
    }
}
