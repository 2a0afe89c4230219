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
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfResources;
import com.itextpdf.kernel.pdf.PdfStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps text-showing operators of a page in {@code BDC}/{@code EMC} pairs carrying the MCIDs the
 * structure tree will reference. Operators already inside marked content are left alone, as are
 * MCIDs the page content already uses.
 */
final class MarkedContentInjector {
    private static final Logger logger = LoggerFactory.getLogger(MarkedContentInjector.class);
    private static final String FALLBACK_TAG = "Span";

    /** Mark operator {@code operatorIndex} with {@code mcid} under the given tag. */
    record Target(int operatorIndex, int mcid, String tag) {}

    /**
     * @param marked MCIDs now present in the page content
     * @param skipped MCIDs that could not be marked, with the reason
     */
    record Outcome(Set<Integer> marked, Map<Integer, String> skipped) {}

    private MarkedContentInjector() {}

    static Outcome inject(PdfPage page, List<Target> targets) throws IOException {
        Set<Integer> marked = new LinkedHashSet<>();
        Map<Integer, String> skipped = new LinkedHashMap<>();
        if (targets.isEmpty()) {
            return new Outcome(marked, skipped);
        }

        byte[] contentBytes = page.getContentBytes();
        PdfResources resources = page.getResources();
        Set<Integer> existingMcids = collectExistingMcids(contentBytes, resources);

        Map<Integer, Target> byOperator = new LinkedHashMap<>();
        for (Target target : targets) {
            Target claimed = byOperator.get(target.operatorIndex());
            if (existingMcids.contains(target.mcid())) {
                skipped.put(target.mcid(), "MCID already used in the page content");
            } else if (claimed != null) {
                skipped.put(
                        target.mcid(),
                        "text operator "
                                + target.operatorIndex()
                                + " already marked as MCID "
                                + claimed.mcid());
            } else {
                byOperator.put(target.operatorIndex(), target);
            }
        }

        ByteArrayOutputStream rewritten = new ByteArrayOutputStream(contentBytes.length + 64);
        int[] lastCopied = {0};
        int[] depth = {0};
        int[] ordinal = {0};

        ContentStreamScanner.scan(
                contentBytes,
                resources,
                (operator, operands, start, end) -> {
                    if ("BMC".equals(operator) || "BDC".equals(operator)) {
                        depth[0]++;
                        return;
                    }
                    if ("EMC".equals(operator)) {
                        depth[0] = Math.max(0, depth[0] - 1);
                        return;
                    }
                    if (!TextOperatorProcessor.TEXT_SHOW_OPERATORS.contains(operator)) {
                        return;
                    }
                    Target target = byOperator.remove(ordinal[0]++);
                    if (target == null) {
                        return;
                    }
                    if (depth[0] > 0) {
                        skipped.put(
                                target.mcid(), "text operator is inside existing marked content");
                        return;
                    }
                    rewritten.write(contentBytes, lastCopied[0], start - lastCopied[0]);
                    String tag = sanitizeTag(target.tag());
                    rewritten.write(ascii("\n/" + tag + " <</MCID " + target.mcid() + ">> BDC"));
                    rewritten.write(contentBytes, start, end - start);
                    rewritten.write(ascii("\nEMC"));
                    lastCopied[0] = end;
                    marked.add(target.mcid());
                });

        for (Target unseen : byOperator.values()) {
            skipped.put(unseen.mcid(), "page has no text operator " + unseen.operatorIndex());
        }

        if (!marked.isEmpty()) {
            rewritten.write(contentBytes, lastCopied[0], contentBytes.length - lastCopied[0]);
            PdfStream stream = new PdfStream(rewritten.toByteArray());
            stream.makeIndirect(page.getDocument());
            page.getPdfObject().put(PdfName.Contents, stream);
            page.setModified();
        }
        logger.debug("Marked {} MCID(s), skipped {}", marked.size(), skipped.size());
        return new Outcome(marked, skipped);
    }

    private static Set<Integer> collectExistingMcids(byte[] contentBytes, PdfResources resources)
            throws IOException {
        Set<Integer> mcids = new HashSet<>();
        ContentStreamScanner.scan(
                contentBytes,
                resources,
                (operator, operands, start, end) -> {
                    if (!"BDC".equals(operator) || operands.size() < 3) {
                        return;
                    }
                    Integer mcid = resolveMcid(operands.get(1), resources);
                    if (mcid != null) {
                        mcids.add(mcid);
                    }
                });
        return mcids;
    }

    private static Integer resolveMcid(PdfObject propertiesOperand, PdfResources resources) {
        if (propertiesOperand instanceof PdfDictionary dict) {
            return dict.getAsInt(PdfName.MCID);
        }
        if (propertiesOperand instanceof PdfName name && resources != null) {
            PdfObject propertiesObj = resources.getProperties(name);
            if (propertiesObj instanceof PdfDictionary propertiesDict) {
                return propertiesDict.getAsInt(PdfName.MCID);
            }
        }
        return null;
    }

    /** Keeps a structure type usable as a content-stream name. */
    static String sanitizeTag(String tag) {
        String cleaned = tag != null ? tag.replaceAll("[^A-Za-z0-9]", "") : "";
        return cleaned.isEmpty() ? FALLBACK_TAG : cleaned;
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }
}
