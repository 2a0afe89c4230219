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
package net.boyechko.pdf.tagsynth.document;

import com.itextpdf.kernel.geom.LineSegment;
import com.itextpdf.kernel.geom.Matrix;
import com.itextpdf.kernel.geom.Vector;
import com.itextpdf.kernel.pdf.PdfIndirectReference;
import com.itextpdf.kernel.pdf.canvas.parser.EventType;
import com.itextpdf.kernel.pdf.canvas.parser.data.IEventData;
import com.itextpdf.kernel.pdf.canvas.parser.data.ImageRenderInfo;
import com.itextpdf.kernel.pdf.canvas.parser.data.TextRenderInfo;
import com.itextpdf.kernel.pdf.canvas.parser.listener.IEventListener;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.pdf.tagsynth.model.BoundingBox;

/**
 * Collects the text spans and image placements of one page in content order. Text chunks produced
 * by the same operator are merged into one span.
 */
class PageLayoutListener implements IEventListener {

    /** Text drawn by one operator. */
    static final class Span {
        final int operatorIndex;
        final StringBuilder text = new StringBuilder();
        BoundingBox bbox;
        float baseline;
        float size;
        float endX = Float.NaN;
        String font;

        Span(int operatorIndex) {
            this.operatorIndex = operatorIndex;
        }

        String text() {
            return text.toString();
        }
    }

    /** One placement of an image; {@code imageOrdinal} counts distinct images on the page. */
    record ImageHit(int imageOrdinal, int occurrence, BoundingBox bbox) {}

    private static final float WORD_GAP_RATIO = 0.25f;

    private final TextOperatorProcessor processor;
    private final List<Span> spans = new ArrayList<>();
    private final List<ImageHit> images = new ArrayList<>();
    private final Map<Object, Integer> imageOrdinals = new HashMap<>();
    private final Map<Integer, Integer> imageOccurrences = new HashMap<>();
    private Span current;

    PageLayoutListener() {
        this.processor = new TextOperatorProcessor(this);
    }

    TextOperatorProcessor processor() {
        return processor;
    }

    List<Span> spans() {
        return spans;
    }

    List<ImageHit> images() {
        return images;
    }

    @Override
    public void eventOccurred(IEventData data, EventType type) {
        if (type == EventType.RENDER_TEXT) {
            onText((TextRenderInfo) data);
        } else if (type == EventType.RENDER_IMAGE) {
            onImage((ImageRenderInfo) data);
        }
    }

    @Override
    public Set<EventType> getSupportedEvents() {
        return Set.of(EventType.RENDER_TEXT, EventType.RENDER_IMAGE);
    }

    private void onText(TextRenderInfo info) {
        String text = info.getText();
        if (text == null || text.isEmpty()) {
            return;
        }
        int operator = processor.currentOperator();
        if (current == null || operator < 0 || current.operatorIndex != operator) {
            current = new Span(operator);
            current.baseline = info.getBaseline().getStartPoint().get(Vector.I2);
            current.font = fontName(info);
            spans.add(current);
        }
        BoundingBox chunk = rectFromText(info);
        if (chunk != null && needsWordGap(current, chunk, text)) {
            current.text.append(' ');
        }
        current.text.append(text);
        if (chunk != null) {
            current.endX = chunk.x1();
        }
        current.bbox = BoundingBox.union(current.bbox, chunk);
        if (chunk != null) {
            current.size = Math.max(current.size, chunk.height());
        }
        if (current.size <= 0) {
            current.size = info.getFontSize();
        }
    }

    /** Kerned TJ arrays often encode word spaces as positioning only. */
    private static boolean needsWordGap(Span span, BoundingBox chunk, String text) {
        if (span.text.length() == 0 || Float.isNaN(span.endX) || span.size <= 0) {
            return false;
        }
        char last = span.text.charAt(span.text.length() - 1);
        if (Character.isWhitespace(last) || Character.isWhitespace(text.charAt(0))) {
            return false;
        }
        return chunk.x0() - span.endX > span.size * WORD_GAP_RATIO;
    }

    private void onImage(ImageRenderInfo info) {
        BoundingBox bbox = rectFromImage(info);
        if (bbox == null) {
            return;
        }
        Object key = imageKey(info);
        Integer ordinal = imageOrdinals.get(key);
        if (ordinal == null) {
            ordinal = imageOrdinals.size();
            imageOrdinals.put(key, ordinal);
        }
        int occurrence = imageOccurrences.merge(ordinal, 1, Integer::sum) - 1;
        images.add(new ImageHit(ordinal, occurrence, bbox));
    }

    private static Object imageKey(ImageRenderInfo info) {
        if (info.getImage() != null) {
            PdfIndirectReference ref = info.getImage().getPdfObject().getIndirectReference();
            if (ref != null) {
                return ref;
            }
        }
        // Inline images have no identity of their own
        return new Object();
    }

    private static String fontName(TextRenderInfo info) {
        if (info.getFont() == null || info.getFont().getFontProgram() == null) {
            return null;
        }
        return info.getFont().getFontProgram().getFontNames().getFontName();
    }

    private static BoundingBox rectFromText(TextRenderInfo info) {
        String text = info.getText();
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        LineSegment ascent = info.getAscentLine();
        LineSegment descent = info.getDescentLine();
        return rectFromPoints(
                ascent.getStartPoint(),
                ascent.getEndPoint(),
                descent.getStartPoint(),
                descent.getEndPoint());
    }

    private static BoundingBox rectFromImage(ImageRenderInfo info) {
        Matrix ctm = info.getImageCtm();
        if (ctm == null) {
            return null;
        }
        Vector p0 = new Vector(0, 0, 1).cross(ctm);
        Vector p1 = new Vector(1, 0, 1).cross(ctm);
        Vector p2 = new Vector(1, 1, 1).cross(ctm);
        Vector p3 = new Vector(0, 1, 1).cross(ctm);
        return rectFromPoints(p0, p1, p2, p3);
    }

    private static BoundingBox rectFromPoints(Vector... points) {
        float minX = Float.MAX_VALUE;
        float minY = Float.MAX_VALUE;
        float maxX = -Float.MAX_VALUE;
        float maxY = -Float.MAX_VALUE;
        boolean any = false;
        for (Vector point : points) {
            if (point == null) {
                continue;
            }
            float x = point.get(Vector.I1);
            float y = point.get(Vector.I2);
            minX = Math.min(minX, x);
            minY = Math.min(minY, y);
            maxX = Math.max(maxX, x);
            maxY = Math.max(maxY, y);
            any = true;
        }
        return any ? new BoundingBox(minX, minY, maxX, maxY) : null;
    }
}
