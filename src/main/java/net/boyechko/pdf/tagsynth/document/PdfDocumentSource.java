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

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.tagging.PdfStructTreeRoot;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.tagsynth.core.DocumentSource;
import net.boyechko.pdf.tagsynth.core.EngineConfig;
import net.boyechko.pdf.tagsynth.model.BoundingBox;
import net.boyechko.pdf.tagsynth.model.Element;
import net.boyechko.pdf.tagsynth.model.ElementIds;
import net.boyechko.pdf.tagsynth.model.TextPosition;
import net.boyechko.pdf.tagsynth.structure.ExistingRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DocumentSource} over an open iText document. Text is grouped into blocks of lines by
 * baseline and vertical gap; each block becomes one text element and each placed image one image
 * element. Layouts are computed once per page and cached.
 */
public class PdfDocumentSource implements DocumentSource {
    private static final Logger logger = LoggerFactory.getLogger(PdfDocumentSource.class);

    private final PdfDocument document;
    private final EngineConfig config;
    private final Map<Integer, PageLayout> layouts = new HashMap<>();

    /** Elements and positions of one page. */
    record PageLayout(List<Element> elements, List<TextPosition> positions) {}

    public PdfDocumentSource(PdfDocument document, EngineConfig config) {
        this.document = document;
        this.config = config;
    }

    public PdfDocumentSource(PdfDocument document) {
        this(document, EngineConfig.defaults());
    }

    @Override
    public int pageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public ExistingRoot existingRoot() {
        PdfObject raw = document.getCatalog().getPdfObject().get(PdfName.StructTreeRoot);
        if (raw == null) {
            return null;
        }
        PdfStructTreeRoot root = document.getStructTreeRoot();
        if (!(raw instanceof PdfDictionary) || root == null) {
            return ExistingRoot.unrecognized(
                    "StructTreeRoot is a " + raw.getClass().getSimpleName() + ", not a dictionary");
        }

        Map<String, String> roleMap = new LinkedHashMap<>();
        PdfDictionary rawRoleMap = root.getRoleMap();
        if (rawRoleMap != null) {
            for (PdfName key : rawRoleMap.keySet()) {
                PdfName target = rawRoleMap.getAsName(key);
                if (target != null) {
                    roleMap.put(key.getValue(), target.getValue());
                } else {
                    logger.debug("Ignoring non-name role map entry for {}", key.getValue());
                }
            }
        }
        int kidCount = root.getKids() != null ? root.getKids().size() : 0;
        return ExistingRoot.keyed(roleMap, kidCount);
    }

    @Override
    public List<Element> extractElements(int page) throws IOException {
        return layout(page).elements();
    }

    @Override
    public List<TextPosition> extractPositions(int page) throws IOException {
        return layout(page).positions();
    }

    PageLayout layout(int page) throws IOException {
        PageLayout cached = layouts.get(page);
        if (cached != null) {
            return cached;
        }
        if (page < 0 || page >= pageCount()) {
            throw new IOException("Page index " + page + " out of range 0.." + (pageCount() - 1));
        }
        PageLayout computed = computeLayout(page, document.getPage(page + 1));
        layouts.put(page, computed);
        return computed;
    }

    private PageLayout computeLayout(int page, PdfPage pdfPage) throws IOException {
        PageLayoutListener listener = new PageLayoutListener();
        try {
            listener.processor().processPageContent(pdfPage);
        } catch (RuntimeException e) {
            throw new IOException("Cannot process content of page " + (page + 1), e);
        }

        List<Element> elements = new ArrayList<>();
        List<TextPosition> positions = new ArrayList<>();

        List<List<List<PageLayoutListener.Span>>> blocks = groupIntoBlocks(listener.spans());
        for (int b = 0; b < blocks.size(); b++) {
            String elementId = ElementIds.text(page, b);
            List<List<PageLayoutListener.Span>> lines = blocks.get(b);
            BoundingBox blockBox = null;
            List<String> lineTexts = new ArrayList<>();

            for (int l = 0; l < lines.size(); l++) {
                StringBuilder lineText = new StringBuilder();
                List<PageLayoutListener.Span> spans = lines.get(l);
                for (int s = 0; s < spans.size(); s++) {
                    PageLayoutListener.Span span = spans.get(s);
                    if (lineText.length() > 0 && startsAfterGap(spans.get(s - 1), span)) {
                        lineText.append(' ');
                    }
                    lineText.append(span.text());
                    blockBox = BoundingBox.union(blockBox, span.bbox);
                    positions.add(
                            new TextPosition(
                                    elementId,
                                    span.text(),
                                    span.bbox,
                                    span.font,
                                    span.size,
                                    b,
                                    l,
                                    s,
                                    span.operatorIndex));
                }
                lineTexts.add(lineText.toString());
            }
            elements.add(Element.text(elementId, blockBox, cleanExtractedText(lineTexts)));
        }

        for (PageLayoutListener.ImageHit hit : listener.images()) {
            elements.add(
                    Element.image(
                            ElementIds.image(page, hit.imageOrdinal(), hit.occurrence()),
                            hit.bbox()));
        }

        if (config.include_raw_runs) {
            positions.addAll(ContentStreamRuns.read(pdfPage));
        }

        logger.debug(
                "Page {}: {} text block(s), {} image(s), {} position(s), {} text operator(s)",
                page + 1,
                blocks.size(),
                listener.images().size(),
                positions.size(),
                listener.processor().textOperatorCount());
        return new PageLayout(List.copyOf(elements), List.copyOf(positions));
    }

    /** Spans in content order, grouped into lines by baseline and lines into blocks by gap. */
    private List<List<List<PageLayoutListener.Span>>> groupIntoBlocks(
            List<PageLayoutListener.Span> spans) {
        List<List<List<PageLayoutListener.Span>>> blocks = new ArrayList<>();
        List<List<PageLayoutListener.Span>> block = null;
        List<PageLayoutListener.Span> line = null;
        BoundingBox lineBox = null;
        float lineBaseline = 0;

        for (PageLayoutListener.Span span : spans) {
            if (span.text().isBlank() || span.bbox == null) {
                continue;
            }
            if (line != null
                    && Math.abs(span.baseline - lineBaseline) <= config.line_merge_tolerance) {
                line.add(span);
                lineBox = BoundingBox.union(lineBox, span.bbox);
                continue;
            }
            if (block == null || startsNewBlock(lineBox, span.bbox)) {
                block = new ArrayList<>();
                blocks.add(block);
            }
            line = new ArrayList<>();
            line.add(span);
            block.add(line);
            lineBox = span.bbox;
            lineBaseline = span.baseline;
        }
        return blocks;
    }

    private boolean startsNewBlock(BoundingBox previousLine, BoundingBox next) {
        float height = Math.max(previousLine.height(), next.height());
        if (height <= 0) {
            return true;
        }
        float gap = previousLine.y0() - next.y1();
        // Moving up the page means a new column or a new region
        boolean movedUp = next.y0() > previousLine.y1();
        return movedUp || gap > config.block_gap_ratio * height;
    }

    private static boolean startsAfterGap(
            PageLayoutListener.Span previous, PageLayoutListener.Span next) {
        if (previous.text().endsWith(" ") || next.text().startsWith(" ")) {
            return false;
        }
        return next.bbox.x0() - previous.bbox.x1() > Math.max(previous.size, next.size) * 0.25f;
    }

    /** Joins lines and normalizes whitespace, dropping replacement characters. */
    private static String cleanExtractedText(List<String> lines) {
        String joined = String.join(" ", lines).replace("\uFFFD", "");
        return joined.replaceAll("\\s+", " ").trim();
    }
}
