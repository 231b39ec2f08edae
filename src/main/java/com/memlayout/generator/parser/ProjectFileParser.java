package com.memlayout.generator.parser;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.memlayout.generator.model.Node;
import com.memlayout.generator.model.NodeKind;
import com.memlayout.generator.model.NodeTree;
import com.memlayout.generator.model.TypeAliases;

/**
 * Reads a layout project file: a JSON object with a {@code nodes} array and an
 * optional {@code typeAliases} object keyed by kind name.
 *
 * Ids are written as decimal strings; numeric ids are accepted as well.
 * Missing fields take their defaults and unknown kind names load as Hex8.
 */
public class ProjectFileParser {
    private static final Logger log = LoggerFactory.getLogger(ProjectFileParser.class);

    public ProjectDocument parse(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ProjectFileException("Project file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ProjectDocument document = parse(reader, path);
            log.info("Loaded {} nodes from {}", document.getTree().size(), path);
            return document;
        } catch (IOException e) {
            throw new ProjectFileException("Failed to read project file: " + path, e);
        }
    }

    public ProjectDocument parse(String json) {
        return parse(new StringReader(json), null);
    }

    private ProjectDocument parse(Reader reader, Path source) {
        JsonObject root;
        try {
            JsonElement element = JsonParser.parseReader(reader);
            if (!element.isJsonObject()) {
                throw new ProjectFileException("Project file is not a JSON object: " + describe(source));
            }
            root = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new ProjectFileException("Malformed project file: " + describe(source), e);
        }

        List<String> warnings = new ArrayList<>();
        List<Node> nodes = new ArrayList<>();
        JsonArray array = root.has("nodes") && root.get("nodes").isJsonArray()
                ? root.getAsJsonArray("nodes")
                : new JsonArray();
        for (JsonElement e : array) {
            if (!e.isJsonObject()) {
                warnings.add("Skipping non-object node entry: " + e);
                continue;
            }
            nodes.add(readNode(e.getAsJsonObject(), warnings));
        }

        long baseAddress = parseHex(string(root, "baseAddress").orElse("400000"), NodeTree.DEFAULT_BASE_ADDRESS);

        ProjectDocument.ProjectDocumentBuilder builder = ProjectDocument.builder()
                .sourcePath(source)
                .tree(new NodeTree(nodes, baseAddress))
                .typeAliases(readAliases(root, warnings));
        warnings.forEach(builder::warning);
        return builder.build();
    }

    private Node readNode(JsonObject o, List<String> warnings) {
        String kindName = string(o, "kind").orElse("Hex8");
        Optional<NodeKind> kind = NodeKind.fromDisplayName(kindName);
        if (kind.isEmpty()) {
            warnings.add("Unknown node kind '" + kindName + "'; loading as Hex8");
        }
        return Node.builder()
                .id(id(o, "id"))
                .kind(kind.orElse(NodeKind.HEX8))
                .name(string(o, "name").orElse(""))
                .parentId(id(o, "parentId"))
                .offset(nonNegative(o, "offset", 0, warnings))
                .arrayLen(nonNegative(o, "arrayLen", 0, warnings))
                .strLen(nonNegative(o, "strLen", Node.DEFAULT_STRING_LENGTH, warnings))
                .elementKind(string(o, "elementKind").map(NodeKind::fromDisplayNameOrHex).orElse(NodeKind.UINT8))
                .refId(id(o, "refId"))
                .structTypeName(string(o, "structTypeName").orElse(""))
                .classKeyword(string(o, "classKeyword").orElse(""))
                .build();
    }

    private TypeAliases readAliases(JsonObject root, List<String> warnings) {
        if (!root.has("typeAliases") || !root.get("typeAliases").isJsonObject()) {
            return TypeAliases.empty();
        }
        Map<NodeKind, String> aliases = new EnumMap<>(NodeKind.class);
        for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject("typeAliases").entrySet()) {
            Optional<NodeKind> kind = NodeKind.fromDisplayName(entry.getKey());
            if (kind.isEmpty()) {
                warnings.add("Ignoring alias for unknown kind '" + entry.getKey() + "'");
                continue;
            }
            if (entry.getValue().isJsonPrimitive()) {
                aliases.put(kind.get(), entry.getValue().getAsString());
            }
        }
        return TypeAliases.of(aliases);
    }

    private static Optional<String> string(JsonObject o, String field) {
        JsonElement e = o.get(field);
        if (e == null || e.isJsonNull() || !e.isJsonPrimitive()) {
            return Optional.empty();
        }
        return Optional.of(e.getAsString());
    }

    private static int integer(JsonObject o, String field, int fallback) {
        JsonElement e = o.get(field);
        if (e == null || !e.isJsonPrimitive()) {
            return fallback;
        }
        try {
            return e.getAsInt();
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static int nonNegative(JsonObject o, String field, int fallback, List<String> warnings) {
        int value = integer(o, field, fallback);
        if (value < 0) {
            warnings.add(String.format("Node %s has negative %s %d; using 0",
                    string(o, "id").orElse("?"), field, value));
            return 0;
        }
        return value;
    }

    private static long id(JsonObject o, String field) {
        Optional<String> raw = string(o, field);
        if (raw.isEmpty()) {
            return 0;
        }
        try {
            return Long.parseUnsignedLong(raw.get().trim());
        } catch (NumberFormatException e) {
            throw new ProjectFileException("Invalid id for '" + field + "': " + raw.get(), e);
        }
    }

    private static long parseHex(String value, long fallback) {
        try {
            return Long.parseUnsignedLong(value.trim(), 16);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static String describe(Path source) {
        return source == null ? "<inline>" : source.toString();
    }
}
