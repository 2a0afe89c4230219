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
package net.boyechko.pdf.tagsynth.sidecar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.tagsynth.composite.ListSpec;
import net.boyechko.pdf.tagsynth.composite.TableSpec;
import net.boyechko.pdf.tagsynth.issue.DiagnosticList;
import net.boyechko.pdf.tagsynth.issue.DiagnosticLoc;
import net.boyechko.pdf.tagsynth.issue.DiagnosticSev;
import net.boyechko.pdf.tagsynth.issue.DiagnosticType;
import net.boyechko.pdf.tagsynth.model.BoundingBox;
import net.boyechko.pdf.tagsynth.model.Element;
import net.boyechko.pdf.tagsynth.model.SidecarOverride;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes sidecar JSON.
 *
 * <p>Reading accepts every shape older sidecars were saved in and normalizes it here, once:
 *
 * <ul>
 *   <li>{@code pages} as an object keyed by page index or as an array indexed by position
 *   <li>{@code elements} as an array of objects or as an object keyed by element id
 *   <li>a page given directly as its element array
 *   <li>{@code title}, {@code alt_text}, {@code actual_text}, {@code language} and {@code scope}
 *       written next to {@code id} instead of inside {@code properties}
 *   <li>{@code role} written inside {@code properties}
 * </ul>
 *
 * Writing always produces the canonical shape: {@code pages} keyed by index, {@code elements} as
 * an array, extra attributes inside {@code properties}.
 */
public final class SidecarStore {
    private static final Logger logger = LoggerFactory.getLogger(SidecarStore.class);

    public static final String SIDECAR_SUFFIX = "_sidecar.json";

    private static final List<String> FOLDED_KEYS =
            List.of(
                    Element.TITLE,
                    Element.ALT_TEXT,
                    Element.ACTUAL_TEXT,
                    Element.LANGUAGE,
                    Element.SCOPE);

    private final ObjectMapper mapper;
    private final DiagnosticList warnings = new DiagnosticList();

    public SidecarStore() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** Returns {@code <dir>/<base>_sidecar.json} for {@code <dir>/<base>.pdf}. */
    public static Path sidecarPathFor(Path pdfPath) {
        String baseName = pdfPath.getFileName().toString().replaceFirst("[.][^.]+$", "");
        return pdfPath.resolveSibling(baseName + SIDECAR_SUFFIX);
    }

    /** Entries skipped during the most recent read. */
    public DiagnosticList warnings() {
        return new DiagnosticList(warnings);
    }

    // ── Reading ─────────────────────────────────────────────────────────

    public Sidecar read(Path path) throws IOException {
        logger.debug("Reading sidecar {}", path);
        return parse(mapper.readTree(path.toFile()));
    }

    public Sidecar readString(String json) throws IOException {
        return parse(mapper.readTree(json));
    }

    private Sidecar parse(JsonNode root) throws IOException {
        warnings.clear();
        if (root == null || !root.isObject()) {
            throw new IOException("Sidecar root must be a JSON object");
        }

        Sidecar sidecar = new Sidecar(parseDocument(root.get("document")));
        JsonNode pages = root.get("pages");
        if (pages == null || pages.isNull()) {
            return sidecar;
        }

        if (pages.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = pages.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Integer page = parsePageIndex(field.getKey());
                if (page == null) {
                    ignore(DiagnosticLoc.none(), "page key '" + field.getKey() + "'");
                    continue;
                }
                parsePage(sidecar, page, field.getValue());
            }
        } else if (pages.isArray()) {
            for (int page = 0; page < pages.size(); page++) {
                parsePage(sidecar, page, pages.get(page));
            }
        } else {
            ignore(DiagnosticLoc.none(), "'pages' of type " + pages.getNodeType());
        }

        logger.debug(
                "Read sidecar with {} page(s) and {} override(s)",
                sidecar.pageIndices().size(),
                sidecar.overrideCount());
        return sidecar;
    }

    private Sidecar.DocumentMeta parseDocument(JsonNode doc) {
        if (doc == null || !doc.isObject()) {
            return Sidecar.DocumentMeta.initial();
        }
        return new Sidecar.DocumentMeta(
                textOrNull(doc.get("title")),
                textOrNull(doc.get("language")),
                doc.path("tagged").asBoolean(false));
    }

    private static Integer parsePageIndex(String key) {
        try {
            int page = Integer.parseInt(key.trim());
            return page >= 0 ? page : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void parsePage(Sidecar sidecar, int page, JsonNode pageNode) {
        sidecar.page(page);
        if (pageNode == null || pageNode.isNull()) {
            return;
        }
        JsonNode elements = pageNode.isArray() ? pageNode : pageNode.get("elements");
        if (elements != null && elements.isArray()) {
            for (JsonNode elementNode : elements) {
                String id = textOrNull(elementNode.get("id"));
                addOverride(sidecar, page, id, elementNode);
            }
        } else if (elements != null && elements.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = elements.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                addOverride(sidecar, page, field.getKey(), field.getValue());
            }
        } else if (elements != null && !elements.isNull()) {
            ignore(DiagnosticLoc.atPage(page), "'elements' of type " + elements.getNodeType());
        }

        if (pageNode.isObject()) {
            for (JsonNode table : pageNode.path("tables")) {
                sidecar.addTable(page, parseTable(table));
            }
            for (JsonNode list : pageNode.path("lists")) {
                sidecar.addList(page, parseList(list));
            }
        }
    }

    private void addOverride(Sidecar sidecar, int page, String id, JsonNode node) {
        if (id == null || id.isBlank() || node == null || !node.isObject()) {
            ignore(DiagnosticLoc.atPage(page), "element entry without an id");
            return;
        }
        Map<String, Object> properties = null;
        JsonNode propsNode = node.get("properties");
        if (propsNode != null && propsNode.isObject()) {
            properties = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = propsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                properties.put(field.getKey(), toValue(field.getValue()));
            }
        }
        for (String key : FOLDED_KEYS) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                continue;
            }
            if (properties == null) {
                properties = new LinkedHashMap<>();
            }
            properties.putIfAbsent(key, toValue(value));
        }

        String role = textOrNull(node.get("role"));
        if (properties != null && properties.containsKey("role")) {
            Object nested = properties.remove("role");
            if (role == null && nested != null) {
                role = nested.toString();
            }
        }

        BoundingBox bbox = null;
        JsonNode bboxNode = node.get("bbox");
        if (bboxNode != null && !bboxNode.isNull()) {
            bbox = parseBbox(bboxNode);
            if (bbox == null) {
                ignore(DiagnosticLoc.atElement(page, id), "malformed bbox " + bboxNode);
            }
        }

        sidecar.recordEdit(
                page,
                new SidecarOverride(id, role, bbox, textOrNull(node.get("text")), properties));
    }

    private static BoundingBox parseBbox(JsonNode node) {
        if (!node.isArray() || node.size() != 4) {
            return null;
        }
        List<Float> values = new ArrayList<>(4);
        for (JsonNode n : node) {
            if (!n.isNumber()) {
                return null;
            }
            values.add(n.floatValue());
        }
        return BoundingBox.fromList(values);
    }

    private static TableSpec parseTable(JsonNode node) {
        List<String> headers = new ArrayList<>();
        for (JsonNode header : node.path("headers")) {
            headers.add(header.asText(""));
        }
        return new TableSpec(
                textOrNull(node.get("title")),
                node.path("rows").asInt(0),
                node.path("cols").asInt(0),
                headers,
                node.path("has_header_row").asBoolean(false));
    }

    private static ListSpec parseList(JsonNode node) {
        List<String> items = new ArrayList<>();
        for (JsonNode item : node.path("items")) {
            items.add(item.asText(""));
        }
        return new ListSpec(
                textOrNull(node.get("title")), items, textOrNull(node.get("list_type")));
    }

    private Object toValue(JsonNode node) {
        return mapper.convertValue(node, Object.class);
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private void ignore(DiagnosticLoc where, String what) {
        logger.warn("Ignoring sidecar {}{}", what, where.describe());
        warnings.report(
                DiagnosticType.SIDECAR_ENTRY_IGNORED,
                DiagnosticSev.WARNING,
                where,
                "Ignored sidecar " + what);
    }

    // ── Writing ─────────────────────────────────────────────────────────

    public void write(Sidecar sidecar, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(path.toFile(), toTree(sidecar));
        logger.debug("Wrote sidecar {}", path);
    }

    public String toJson(Sidecar sidecar) throws IOException {
        return mapper.writeValueAsString(toTree(sidecar));
    }

    private ObjectNode toTree(Sidecar sidecar) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode doc = root.putObject("document");
        doc.put("title", sidecar.document().title());
        doc.put("language", sidecar.document().language());
        doc.put("tagged", sidecar.document().tagged());

        ObjectNode pages = root.putObject("pages");
        for (int page : sidecar.pageIndices()) {
            ObjectNode pageNode = pages.putObject(Integer.toString(page));
            ArrayNode elements = pageNode.putArray("elements");
            for (SidecarOverride override : sidecar.overridesFor(page).values()) {
                elements.add(toTree(override));
            }
            List<TableSpec> tables = sidecar.tablesFor(page);
            if (!tables.isEmpty()) {
                ArrayNode tablesNode = pageNode.putArray("tables");
                for (TableSpec table : tables) {
                    ObjectNode t = tablesNode.addObject();
                    t.put("title", table.title());
                    t.put("rows", table.rows());
                    t.put("cols", table.cols());
                    ArrayNode headers = t.putArray("headers");
                    table.headers().forEach(headers::add);
                    t.put("has_header_row", table.hasHeaderRow());
                }
            }
            List<ListSpec> lists = sidecar.listsFor(page);
            if (!lists.isEmpty()) {
                ArrayNode listsNode = pageNode.putArray("lists");
                for (ListSpec list : lists) {
                    ObjectNode l = listsNode.addObject();
                    l.put("title", list.title());
                    ArrayNode items = l.putArray("items");
                    list.items().forEach(items::add);
                    l.put("list_type", list.listType());
                }
            }
        }
        return root;
    }

    private ObjectNode toTree(SidecarOverride override) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", override.id());
        if (override.hasRole()) {
            node.put("role", override.role());
        }
        if (override.hasBbox()) {
            ArrayNode bbox = node.putArray("bbox");
            override.bbox().toList().forEach(bbox::add);
        }
        if (override.hasText()) {
            node.put("text", override.text());
        }
        if (override.hasProperties()) {
            ObjectNode props = node.putObject("properties");
            override.properties().forEach((k, v) -> props.set(k, mapper.valueToTree(v)));
        }
        return node;
    }
}
