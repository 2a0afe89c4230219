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
 * A persisted per-id patch. A null field means "absent": the extracted value stays in effect. An
 * empty string or empty map is a value, not an absence. Null-valued property keys are dropped, so
 * a null property is absent as well.
 */
public record SidecarOverride(
        String id, String role, BoundingBox bbox, String text, Map<String, Object> properties) {

    public SidecarOverride {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Override id is required");
        }
        if (properties != null) {
            Map<String, Object> present = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : properties.entrySet()) {
                if (entry.getValue() != null) {
                    present.put(entry.getKey(), entry.getValue());
                }
            }
            properties = Collections.unmodifiableMap(present);
        }
    }

    public static SidecarOverride ofRole(String id, String role) {
        return new SidecarOverride(id, role, null, null, null);
    }

    public static SidecarOverride ofProperty(String id, String key, Object value) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(key, value);
        return new SidecarOverride(id, null, null, null, props);
    }

    public boolean hasRole() {
        return role != null;
    }

    public boolean hasBbox() {
        return bbox != null;
    }

    public boolean hasText() {
        return text != null;
    }

    public boolean hasProperties() {
        return properties != null;
    }

    /**
     * Layers {@code newer} on top of this override: fields present in {@code newer} win, and
     * property keys merge individually.
     */
    public SidecarOverride mergedWith(SidecarOverride newer) {
        if (!id.equals(newer.id())) {
            throw new IllegalArgumentException(
                    "Cannot merge override " + newer.id() + " into " + id);
        }
        Map<String, Object> mergedProps = properties;
        if (newer.hasProperties()) {
            mergedProps = new LinkedHashMap<>(properties != null ? properties : Map.of());
            mergedProps.putAll(newer.properties());
        }
        return new SidecarOverride(
                id,
                newer.hasRole() ? newer.role() : role,
                newer.hasBbox() ? newer.bbox() : bbox,
                newer.hasText() ? newer.text() : text,
                mergedProps);
    }
}
