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

/** The kind of content an element stands for. */
public enum ElementKind {
    TEXT("text", "P"),
    IMAGE("image", "Figure");

    private final String idPrefix;
    private final String defaultRole;

    ElementKind(String idPrefix, String defaultRole) {
        this.idPrefix = idPrefix;
        this.defaultRole = defaultRole;
    }

    /** The leading segment of element ids of this kind, without the underscore. */
    public String idPrefix() {
        return idPrefix;
    }

    /** Role assigned by extraction before any sidecar edits. */
    public String defaultRole() {
        return defaultRole;
    }

    /** Infers the kind from an element id: {@code image_...} is an image, anything else text. */
    public static ElementKind fromId(String id) {
        if (id != null && id.startsWith(IMAGE.idPrefix + "_")) {
            return IMAGE;
        }
        return TEXT;
    }
}
