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

import java.util.List;

/** Axis-aligned box in PDF user space: (x0, y0) is the lower-left corner. */
public record BoundingBox(float x0, float y0, float x1, float y1) {

    /** Box given to sidecar-only elements that carry no bbox of their own. */
    public static final BoundingBox PLACEHOLDER = new BoundingBox(0, 0, 100, 20);

    /** Builds a box from a four-number list; returns null when the list is not exactly that. */
    public static BoundingBox fromList(List<? extends Number> values) {
        if (values == null || values.size() != 4) {
            return null;
        }
        for (Number n : values) {
            if (n == null) {
                return null;
            }
        }
        return new BoundingBox(
                values.get(0).floatValue(),
                values.get(1).floatValue(),
                values.get(2).floatValue(),
                values.get(3).floatValue());
    }

    public List<Float> toList() {
        return List.of(x0, y0, x1, y1);
    }

    public float width() {
        return x1 - x0;
    }

    public float height() {
        return y1 - y0;
    }

    public float area() {
        return Math.max(0, width()) * Math.max(0, height());
    }

    /** Smallest box containing both; null-tolerant on either side. */
    public static BoundingBox union(BoundingBox a, BoundingBox b) {
        if (a == null) return b;
        if (b == null) return a;
        return new BoundingBox(
                Math.min(a.x0, b.x0),
                Math.min(a.y0, b.y0),
                Math.max(a.x1, b.x1),
                Math.max(a.y1, b.y1));
    }
}
