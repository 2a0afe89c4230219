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
package net.boyechko.pdf.tagsynth.reconcile;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.pdf.tagsynth.model.BoundingBox;
import net.boyechko.pdf.tagsynth.model.Element;
import net.boyechko.pdf.tagsynth.model.ElementKind;
import net.boyechko.pdf.tagsynth.model.SidecarOverride;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges extracted elements with sidecar overrides into the effective element list of one page.
 *
 * <p>Extracted elements keep their order and are patched field by field; overrides with no
 * extracted counterpart are appended as standalone elements in the override map's order. The
 * result never contains duplicate ids, and for the same inputs it is always equal to the previous
 * result.
 */
public final class Reconciler {
    private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

    private final BoundingBox defaultBbox;
    private final String defaultRole;

    public Reconciler() {
        this(BoundingBox.PLACEHOLDER, "P");
    }

    public Reconciler(BoundingBox defaultBbox, String defaultRole) {
        this.defaultBbox = defaultBbox != null ? defaultBbox : BoundingBox.PLACEHOLDER;
        this.defaultRole = defaultRole != null && !defaultRole.isBlank() ? defaultRole : "P";
    }

    /**
     * Returns the effective elements for {@code page}.
     *
     * @throws IllegalArgumentException if {@code extracted} repeats an id
     */
    public List<Element> reconcile(
            int page, List<Element> extracted, Map<String, SidecarOverride> overrides) {
        List<Element> source = extracted != null ? extracted : List.of();
        Map<String, SidecarOverride> patches = overrides != null ? overrides : Map.of();

        List<Element> merged = new ArrayList<>(source.size() + patches.size());
        Set<String> seen = new HashSet<>();
        int patched = 0;

        for (Element element : source) {
            if (!seen.add(element.id())) {
                throw new IllegalArgumentException(
                        "Duplicate element id " + element.id() + " on page " + page);
            }
            SidecarOverride override = patches.get(element.id());
            if (override != null) {
                merged.add(apply(element, override));
                patched++;
            } else {
                merged.add(element);
            }
        }

        int synthesized = 0;
        for (Map.Entry<String, SidecarOverride> entry : patches.entrySet()) {
            if (seen.contains(entry.getKey())) {
                continue;
            }
            seen.add(entry.getKey());
            merged.add(synthesize(entry.getValue()));
            synthesized++;
        }

        logger.debug(
                "Page {}: {} extracted, {} patched, {} sidecar-only",
                page,
                source.size(),
                patched,
                synthesized);
        return merged;
    }

    /** Field-level patch: only fields present in the override replace the extracted values. */
    Element apply(Element element, SidecarOverride override) {
        Map<String, Object> properties = element.properties();
        if (override.hasProperties()) {
            Map<String, Object> patchedProps = new LinkedHashMap<>(element.properties());
            patchedProps.putAll(override.properties());
            properties = patchedProps;
        }
        return new Element(
                element.id(),
                element.kind(),
                override.hasBbox() ? override.bbox() : element.bbox(),
                override.hasRole() ? override.role() : element.role(),
                override.hasText() ? override.text() : element.text(),
                properties);
    }

    /** Builds an element that only the sidecar knows about. */
    Element synthesize(SidecarOverride override) {
        return new Element(
                override.id(),
                ElementKind.fromId(override.id()),
                override.hasBbox() ? override.bbox() : defaultBbox,
                override.hasRole() ? override.role() : defaultRole,
                override.hasText() ? override.text() : "",
                override.properties());
    }
}
