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

import com.itextpdf.io.font.PdfEncodings;
import com.itextpdf.kernel.pdf.PdfBoolean;
import com.itextpdf.kernel.pdf.PdfCatalog;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfDocumentInfo;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfString;
import com.itextpdf.kernel.pdf.tagging.PdfMcrDictionary;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import com.itextpdf.kernel.pdf.tagging.PdfStructTreeRoot;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import net.boyechko.pdf.tagsynth.core.EngineConfig;
import net.boyechko.pdf.tagsynth.core.OperationResult;
import net.boyechko.pdf.tagsynth.core.SynthesisResult;
import net.boyechko.pdf.tagsynth.issue.DiagnosticList;
import net.boyechko.pdf.tagsynth.issue.DiagnosticLoc;
import net.boyechko.pdf.tagsynth.issue.DiagnosticSev;
import net.boyechko.pdf.tagsynth.issue.DiagnosticType;
import net.boyechko.pdf.tagsynth.model.TextPosition;
import net.boyechko.pdf.tagsynth.sidecar.Sidecar;
import net.boyechko.pdf.tagsynth.structure.ContentReference;
import net.boyechko.pdf.tagsynth.structure.NodeAttributes;
import net.boyechko.pdf.tagsynth.structure.RoleMap;
import net.boyechko.pdf.tagsynth.structure.StructureChild;
import net.boyechko.pdf.tagsynth.structure.StructureNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Materializes a synthesized tree in a document opened for tagging: structure elements under the
 * structure tree root, marked-content references for every MCID that could be marked in the page
 * content, the role mappings the tree relies on, and the document-level accessibility settings.
 *
 * <pre>
 * StructTreeRoot
 * ├── (existing kids, untouched)
 * └── synthesized nodes, in creation order
 *     └── MCR (page, MCID) ...
 * </pre>
 */
public class PdfStructureWriter {
    private static final Logger logger = LoggerFactory.getLogger(PdfStructureWriter.class);

    public static final String CREATOR = "PDF-TagSynth";
    static final String DEFAULT_SUBJECT = "Structure tree synthesized by " + CREATOR;

    private final EngineConfig config;

    /** What was written to the document. */
    public record WriteSummary(int elementsWritten, int referencesMarked, int mappingsAdded) {}

    public PdfStructureWriter(EngineConfig config) {
        this.config = config;
    }

    public OperationResult<WriteSummary> write(
            PdfDocument doc, SynthesisResult result, Sidecar.DocumentMeta meta) {
        DiagnosticList diagnostics = new DiagnosticList();

        if (!doc.isTagged()) {
            doc.setTagged();
        }
        PdfStructTreeRoot treeRoot = doc.getStructTreeRoot();
        if (treeRoot == null) {
            return OperationResult.failed(
                    DiagnosticType.ROOT_INIT_FAILED,
                    DiagnosticSev.FATAL,
                    DiagnosticLoc.none(),
                    "Document has no structure tree root after enabling tagging");
        }

        int mappingsAdded = writeRoleMap(treeRoot, result.root().roleMap(), result);
        Map<Integer, Set<Integer>> marked = markContent(doc, result, diagnostics);

        int[] written = {0};
        int referencesMarked = 0;
        for (StructureNode kid : result.root().kids()) {
            PdfStructElem elem = treeRoot.addKid(newElement(doc, kid));
            referencesMarked += writeChildren(doc, elem, kid, marked, written);
            written[0]++;
        }

        applyDocumentSettings(doc, meta, diagnostics);

        logger.info(
                "Wrote {} structure element(s), {} content reference(s), {} role mapping(s)",
                written[0],
                referencesMarked,
                mappingsAdded);
        return OperationResult.ok(
                new WriteSummary(written[0], referencesMarked, mappingsAdded), diagnostics);
    }

    /** Adds the non-identity mappings the session introduced that the document lacks. */
    private int writeRoleMap(PdfStructTreeRoot treeRoot, RoleMap roleMap, SynthesisResult result) {
        PdfDictionary existing = treeRoot.getPdfObject().getAsDictionary(PdfName.RoleMap);
        int added = 0;
        for (String role : result.root().addedMappings()) {
            String target = roleMap.get(role);
            if (target == null || role.equals(target)) {
                continue;
            }
            if (existing != null && existing.containsKey(new PdfName(role))) {
                continue;
            }
            treeRoot.addRoleMapping(role, target);
            added++;
        }
        logger.debug("Added {} role mapping(s)", added);
        return added;
    }

    /** Injects marked content per page; returns the MCIDs now present, per 0-based page. */
    private Map<Integer, Set<Integer>> markContent(
            PdfDocument doc, SynthesisResult result, DiagnosticList diagnostics) {
        Map<Integer, List<MarkedContentInjector.Target>> targetsByPage = new TreeMap<>();
        Map<Integer, Map<Integer, Integer>> operatorOwners = new HashMap<>();

        for (StructureNode node : result.nodes()) {
            for (ContentReference ref : node.references()) {
                DiagnosticLoc where = DiagnosticLoc.atMcid(ref.page(), ref.mcid());
                TextPosition anchor = result.anchorsByMcid().get(ref.mcid());
                if (ref.page() >= doc.getNumberOfPages()) {
                    diagnostics.report(
                            DiagnosticType.REFERENCE_NOT_MARKED,
                            DiagnosticSev.WARNING,
                            where,
                            "Reference points past the last page");
                    continue;
                }
                if (anchor == null || !anchor.hasOperator()) {
                    diagnostics.report(
                            DiagnosticType.REFERENCE_NOT_MARKED,
                            DiagnosticSev.WARNING,
                            where,
                            "No page-level text operator recorded for " + node);
                    continue;
                }
                Integer owner =
                        operatorOwners
                                .computeIfAbsent(ref.page(), p -> new HashMap<>())
                                .putIfAbsent(anchor.operatorIndex(), ref.mcid());
                if (owner != null) {
                    diagnostics.report(
                            DiagnosticType.REFERENCE_NOT_MARKED,
                            DiagnosticSev.INFO,
                            where,
                            "Text operator already marked as MCID " + owner);
                    continue;
                }
                targetsByPage
                        .computeIfAbsent(ref.page(), p -> new ArrayList<>())
                        .add(
                                new MarkedContentInjector.Target(
                                        anchor.operatorIndex(), ref.mcid(), node.type()));
            }
        }

        Map<Integer, Set<Integer>> marked = new HashMap<>();
        for (Map.Entry<Integer, List<MarkedContentInjector.Target>> entry :
                targetsByPage.entrySet()) {
            int page = entry.getKey();
            try {
                MarkedContentInjector.Outcome outcome =
                        MarkedContentInjector.inject(doc.getPage(page + 1), entry.getValue());
                marked.put(page, new HashSet<>(outcome.marked()));
                outcome.skipped()
                        .forEach(
                                (mcid, reason) ->
                                        diagnostics.report(
                                                DiagnosticType.REFERENCE_NOT_MARKED,
                                                DiagnosticSev.WARNING,
                                                DiagnosticLoc.atMcid(page, mcid),
                                                reason));
            } catch (IOException | RuntimeException e) {
                logger.warn("Cannot rewrite content of page {}: {}", page + 1, e.getMessage());
                diagnostics.report(
                        DiagnosticType.REFERENCE_NOT_MARKED,
                        DiagnosticSev.WARNING,
                        DiagnosticLoc.atPage(page),
                        "Page content could not be rewritten ("
                                + e.getMessage()
                                + "); "
                                + entry.getValue().size()
                                + " reference(s) left unmarked");
            }
        }
        return marked;
    }

    private PdfStructElem newElement(PdfDocument doc, StructureNode node) {
        PdfStructElem elem = new PdfStructElem(doc, new PdfName(node.type()));
        NodeAttributes attrs = node.attributes();
        if (hasText(attrs.title())) {
            elem.getPdfObject().put(PdfName.T, pdfText(attrs.title()));
        }
        if (hasText(attrs.altText())) {
            elem.setAlt(pdfText(attrs.altText()));
        }
        if (hasText(attrs.actualText())) {
            elem.setActualText(pdfText(attrs.actualText()));
        }
        if (hasText(attrs.language())) {
            elem.setLang(new PdfString(attrs.language()));
        }
        return elem;
    }

    /** Writes the children of {@code node} under {@code elem}; returns MCRs written. */
    private int writeChildren(
            PdfDocument doc,
            PdfStructElem elem,
            StructureNode node,
            Map<Integer, Set<Integer>> marked,
            int[] written) {
        int references = 0;
        for (StructureChild child : node.children()) {
            if (child instanceof StructureNode childNode) {
                PdfStructElem childElem = elem.addKid(newElement(doc, childNode));
                references += writeChildren(doc, childElem, childNode, marked, written);
                written[0]++;
            } else if (child instanceof ContentReference ref) {
                if (!marked.getOrDefault(ref.page(), Set.of()).contains(ref.mcid())) {
                    continue;
                }
                PdfPage page = doc.getPage(ref.page() + 1);
                if (elem.getPdfObject().get(PdfName.Pg) == null) {
                    elem.getPdfObject().put(PdfName.Pg, page.getPdfObject());
                }
                PdfDictionary mcrDict = new PdfDictionary();
                mcrDict.put(PdfName.Type, PdfName.MCR);
                mcrDict.put(PdfName.MCID, new PdfNumber(ref.mcid()));
                mcrDict.put(PdfName.Pg, page.getPdfObject());
                elem.addKid(new PdfMcrDictionary(mcrDict, elem));
                references++;
                logger.trace("Linked MCID {} on page {} to {}", ref.mcid(), ref.page() + 1, node);
            }
        }
        return references;
    }

    private void applyDocumentSettings(
            PdfDocument doc, Sidecar.DocumentMeta meta, DiagnosticList diagnostics) {
        PdfCatalog catalog = doc.getCatalog();
        PdfDocumentInfo info = doc.getDocumentInfo();
        List<String> updates = new ArrayList<>();

        String language =
                meta != null && hasText(meta.language())
                        ? meta.language()
                        : config.default_language;
        catalog.setLang(new PdfString(language));
        updates.add("language " + language);

        if (meta != null && hasText(meta.title())) {
            info.setTitle(meta.title());
            updates.add("title");
        }
        if (hasText(info.getTitle())) {
            PdfDictionary prefs =
                    catalog.getPdfObject().getAsDictionary(PdfName.ViewerPreferences);
            if (prefs == null) {
                prefs = new PdfDictionary();
                catalog.getPdfObject().put(PdfName.ViewerPreferences, prefs);
            }
            prefs.put(PdfName.DisplayDocTitle, PdfBoolean.TRUE);
        } else {
            diagnostics.report(
                    DiagnosticType.METADATA_UPDATED,
                    DiagnosticSev.WARNING,
                    DiagnosticLoc.none(),
                    "Document has no title; set one in the sidecar's document section");
        }
        if (!hasText(info.getSubject())) {
            info.setSubject(DEFAULT_SUBJECT);
        }
        info.setCreator(CREATOR);

        PdfDictionary markInfo = catalog.getPdfObject().getAsDictionary(PdfName.MarkInfo);
        if (markInfo == null) {
            markInfo = new PdfDictionary();
            catalog.getPdfObject().put(PdfName.MarkInfo, markInfo);
        }
        markInfo.put(PdfName.Marked, PdfBoolean.TRUE);
        markInfo.put(PdfName.UserProperties, PdfBoolean.FALSE);
        markInfo.put(PdfName.Suspects, PdfBoolean.FALSE);
        updates.add("MarkInfo");

        int pageCount = doc.getNumberOfPages();
        for (int i = 1; i <= pageCount; i++) {
            doc.getPage(i).setTabOrder(PdfName.S);
        }
        updates.add("tab order on " + pageCount + " page(s)");

        diagnostics.report(
                DiagnosticType.METADATA_UPDATED,
                DiagnosticSev.INFO,
                DiagnosticLoc.none(),
                "Updated " + String.join(", ", updates));
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    /** PDFDocEncoding for plain ASCII, UTF-16BE otherwise. */
    private static PdfString pdfText(String s) {
        if (StandardCharsets.US_ASCII.newEncoder().canEncode(s)) {
            return new PdfString(s);
        }
        return new PdfString(s, PdfEncodings.UNICODE_BIG);
    }
}
