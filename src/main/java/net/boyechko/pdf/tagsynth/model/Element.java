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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One content unit on one page, as produced by extraction and patched by the sidecar.
 *
 * @param id stable id, unique within its page (see {@link ElementIds})
 * @param kind text or image
 * @param bbox position on the page
 * @param role standard structure type, or a custom type resolved through the role map
 * @param text text content; empty for images
 * @param properties ordered extra attributes such as {@code alt_text}, {@code language}, {@code
 *     actual_text}, {@code scope}, {@code title}
 */
public record Element(
        String id,
        ElementKind kind,
        BoundingBox bbox,
        String role,
        String text,
        Map<String, Object> properties) {

    public static final String ALT_TEXT = "alt_text";
    public static final String ACTUAL_TEXT = "actual_text";
    public static final String LANGUAGE = "language";
    public static final String TITLE = "title";
    public static final String SCOPE = "scope";

    public Element {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Element id is required");
        }
        kind = kind != null ? kind : ElementKind.fromId(id);
        text = text != null ? text : "";
        properties =
                properties == null || properties.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static Element text(String id, BoundingBox bbox, String text) {
        return new Element(id, ElementKind.TEXT, bbox, ElementKind.TEXT.defaultRole(), text, null);
    }

    public static Element image(String id, BoundingBox bbox) {
        return new Element(id, ElementKind.IMAGE, bbox, ElementKind.IMAGE.defaultRole(), "", null);
    }

    /** Returns the property as a string, or null when absent. */
    public String stringProperty(String key) {
        Object value = properties.get(key);
        return value != null ? value.toString() : null;
    }

    public Element withRole(String newRole) {
        return new Element(id, kind, bbox, newRole, text, properties);
    }

    public Element withProperty(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(properties);
        merged.put(key, value);
        return new Element(id, kind, bbox, role, text, merged);
    }

    /** True for text elements that carry nothing a reader could announce. */
    public boolean isBlankText() {
        if (kind != ElementKind.TEXT) {
            return false;
        }
        String actual = stringProperty(ACTUAL_TEXT);
        return text.isBlank() && (actual == null || actual.isBlank());
    }
}
