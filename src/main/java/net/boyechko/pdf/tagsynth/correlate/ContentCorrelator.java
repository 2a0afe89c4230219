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
package net.boyechko.pdf.tagsynth.correlate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.tagsynth.core.OperationResult;
import net.boyechko.pdf.tagsynth.issue.DiagnosticList;
import net.boyechko.pdf.tagsynth.issue.DiagnosticLoc;
import net.boyechko.pdf.tagsynth.issue.DiagnosticSev;
import net.boyechko.pdf.tagsynth.issue.DiagnosticType;
import net.boyechko.pdf.tagsynth.model.TextPosition;
import net.boyechko.pdf.tagsynth.structure.ContentReference;
import net.boyechko.pdf.tagsynth.structure.StructureNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Links structure nodes to marked content by handing out MCIDs.
 *
 * <p>A position anchored to an element id goes straight to that element's node. A position with
 * no anchor, such as a raw run read from the content stream, is matched by text against the
 * anchored positions of the same page; the first plausible match wins and nothing guarantees it
 * is the right one when a page repeats text. Unmatched runs are skipped.
 *
 * <p>MCIDs come from one counter per session: strictly increasing, never reused, and reset only
 * by {@link #reset()}.
 */
public final class ContentCorrelator {
    private static final Logger logger = LoggerFactory.getLogger(ContentCorrelator.class);

    public static final int DEFAULT_PREFIX_LENGTH = 10;
    public static final int DEFAULT_MIN_LENGTH = 3;

    private final int prefixLength;
    private final int minLength;

    private int nextMcid = 0;
    private final Map<String, List<Integer>> mcidsByElementId = new LinkedHashMap<>();
    private final Map<Integer, TextPosition> anchorsByMcid = new LinkedHashMap<>();

    public ContentCorrelator() {
        this(DEFAULT_PREFIX_LENGTH, DEFAULT_MIN_LENGTH);
    }

    public ContentCorrelator(int prefixLength, int minLength) {
        this.prefixLength = Math.max(1, prefixLength);
        this.minLength = Math.max(0, minLength);
    }

    /** Clears all session state, including the MCID counter. */
    public void reset() {
        nextMcid = 0;
        mcidsByElementId.clear();
        anchorsByMcid.clear();
    }

    /** The MCID the next reference will get. */
    public int nextMcid() {
        return nextMcid;
    }

    /** MCIDs assigned so far, by element id, in assignment order. */
    public Map<String, List<Integer>> mcidsByElementId() {
        Map<String, List<Integer>> copy = new LinkedHashMap<>();
        mcidsByElementId.forEach((id, mcids) -> copy.put(id, List.copyOf(mcids)));
        return Collections.unmodifiableMap(copy);
    }

    /** The position each MCID was assigned for. */
    public Map<Integer, TextPosition> anchorsByMcid() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(anchorsByMcid));
    }

    /**
     * Fetches the positions of {@code page} and correlates them. If the source fails, the page
     * gets no references and a page-level warning; the session goes on.
     */
    public OperationResult<List<ContentReference>> correlatePage(
            int page, PositionSource source, Map<String, StructureNode> nodeByElementId) {
        List<TextPosition> positions;
        try {
            positions = source.positions(page);
        } catch (Exception e) {
            logger.warn("Page {}: content stream unreadable: {}", page + 1, e.getMessage());
            return OperationResult.ok(
                    List.of(),
                    new DiagnosticList()
                            .report(
                                    DiagnosticType.CONTENT_STREAM_UNREADABLE,
                                    DiagnosticSev.WARNING,
                                    DiagnosticLoc.atPage(page),
                                    "Could not read text positions: " + e.getMessage()));
        }
        return correlate(page, positions, nodeByElementId);
    }

    public OperationResult<List<ContentReference>> correlate(
            int page, List<TextPosition> positions, Map<String, StructureNode> nodeByElementId) {
        List<TextPosition> all = positions != null ? positions : List.of();
        Map<String, StructureNode> nodes = nodeByElementId != null ? nodeByElementId : Map.of();

        List<TextPosition> anchored = new ArrayList<>();
        for (TextPosition pos : all) {
            if (pos.hasElementId()) {
                anchored.add(pos);
            }
        }

        List<ContentReference> refs = new ArrayList<>();
        DiagnosticList diagnostics = new DiagnosticList();
        int direct = 0;
        int fuzzy = 0;

        for (TextPosition pos : all) {
            if (pos.hasElementId()) {
                StructureNode node = nodes.get(pos.elementId());
                if (node != null) {
                    refs.add(assign(page, pos.elementId(), node, pos));
                    direct++;
                } else {
                    logger.debug("Page {}: no node for element {}", page + 1, pos.elementId());
                }
                continue;
            }

            String candidate = normalize(pos.text());
            if (candidate.isEmpty()) continue;

            TextPosition match = findTextMatch(candidate, anchored);
            StructureNode node = match != null ? nodes.get(match.elementId()) : null;
            if (node != null) {
                refs.add(assign(page, match.elementId(), node, pos));
                fuzzy++;
            } else {
                diagnostics.report(
                        DiagnosticType.CORRELATION_MISS,
                        DiagnosticSev.INFO,
                        DiagnosticLoc.atPage(page),
                        "No element matches text run \"" + abbreviate(candidate) + "\"");
            }
        }

        logger.debug(
                "Page {}: {} direct, {} by text, {} unmatched",
                page + 1,
                direct,
                fuzzy,
                diagnostics.size());
        return OperationResult.ok(refs, diagnostics);
    }

    /**
     * Returns the first anchored position whose text contains the candidate or is contained in
     * it, else the first whose text contains the candidate's prefix; null if none.
     */
    TextPosition findTextMatch(String candidate, List<TextPosition> anchored) {
        for (TextPosition pos : anchored) {
            String stored = pos.text().trim();
            if (stored.isEmpty()) continue;
            if (stored.contains(candidate) || candidate.contains(stored)) {
                return pos;
            }
        }
        if (candidate.length() > minLength) {
            String prefix = candidate.substring(0, Math.min(prefixLength, candidate.length()));
            for (TextPosition pos : anchored) {
                if (pos.text().contains(prefix)) {
                    return pos;
                }
            }
        }
        return null;
    }

    /** Trims and strips the parentheses and backslashes of content-stream string literals. */
    static String normalize(String text) {
        if (text == null) return "";
        return text.replace("\\", "").replace("(", "").replace(")", "").trim();
    }

    private ContentReference assign(
            int page, String elementId, StructureNode node, TextPosition source) {
        int mcid = nextMcid++;
        ContentReference ref = new ContentReference(page, mcid);
        node.appendReference(ref);
        mcidsByElementId.computeIfAbsent(elementId, k -> new ArrayList<>()).add(mcid);
        anchorsByMcid.put(mcid, source);
        return ref;
    }

    private static String abbreviate(String text) {
        return text.length() <= 40 ? text : text.substring(0, 40) + "...";
    }
}
