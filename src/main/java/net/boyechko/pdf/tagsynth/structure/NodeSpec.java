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
package net.boyechko.pdf.tagsynth.structure;

/**
 * One entry of a batch node creation.
 *
 * @param parentId node id of a node created earlier in the same session, or null for root level
 */
public record NodeSpec(
        String type,
        String title,
        String altText,
        String actualText,
        String language,
        Integer parentId) {

    public static NodeSpec of(String type, String title) {
        return new NodeSpec(type, title, null, null, null, null);
    }

    public NodeSpec under(Integer parent) {
        return new NodeSpec(type, title, altText, actualText, language, parent);
    }
}
