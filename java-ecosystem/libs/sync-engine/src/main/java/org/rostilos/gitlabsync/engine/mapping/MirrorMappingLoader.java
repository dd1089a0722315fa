package org.rostilos.gitlabsync.engine.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rostilos.gitlabsync.gitlabclient.model.Visibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the JSON mirror mapping file:
 * <pre>
 * {
 *   "projects": { "group/project": { "destination_path": "other/project", "issues": true } },
 *   "groups":   { "group":         { "destination_path": "other/group", "visibility": "private" } }
 * }
 * </pre>
 * Every validation problem of the file is reported at once through {@link MirrorMappingException}.
 */
public class MirrorMappingLoader {

    private static final Logger log = LoggerFactory.getLogger(MirrorMappingLoader.class);

    private static final String PROJECT = "project";
    private static final String GROUP = "group";

    private final ObjectMapper objectMapper;

    public MirrorMappingLoader() {
        this(new ObjectMapper());
    }

    public MirrorMappingLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public MirrorMapping load(Path file) {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new MirrorMappingException("Cannot read mirror mapping " + file + ": " + e.getMessage(), e);
        }
        MirrorMapping mapping = parse(content);
        log.info("Loaded mirror mapping {} ({} project(s), {} group(s))",
                file, mapping.projectCount(), mapping.groupCount());
        return mapping;
    }

    public MirrorMapping parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MirrorMappingException("Mirror mapping is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MirrorMappingException(List.of("mirror mapping must be a JSON object"));
        }

        List<String> problems = new ArrayList<>();
        Map<String, MirrorOptions> projects = readSection(root.get("projects"), PROJECT, problems);
        Map<String, MirrorOptions> groups = readSection(root.get("groups"), GROUP, problems);

        if (projects.isEmpty() && groups.isEmpty()) {
            problems.add("no projects or groups defined in the mapping");
        }
        checkUniqueDestinations(projects, groups, problems);

        if (!problems.isEmpty()) {
            throw new MirrorMappingException(problems);
        }
        return new MirrorMapping(projects, groups);
    }

    private Map<String, MirrorOptions> readSection(JsonNode section, String kind, List<String> problems) {
        Map<String, MirrorOptions> entries = new LinkedHashMap<>();
        if (section == null || section.isNull()) {
            return entries;
        }
        if (!section.isObject()) {
            problems.add("\"" + kind + "s\" must be a JSON object");
            return entries;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = section.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String sourcePath = field.getKey();
            JsonNode options = field.getValue();
            if (options == null || !options.isObject()) {
                problems.add("options of " + kind + " " + sourcePath + " must be a JSON object");
                continue;
            }
            MirrorOptions parsed = parseOptions(sourcePath, options, kind);
            checkPaths(sourcePath, parsed.destinationPath(), kind, problems);
            entries.put(sourcePath, parsed);
        }
        return entries;
    }

    private MirrorOptions parseOptions(String sourcePath, JsonNode node, String kind) {
        boolean issues = node.has("issues")
                ? node.path("issues").asBoolean(false)
                : node.path("mirror_issues").asBoolean(false);
        return new MirrorOptions(
                getTextOrNull(node, "destination_path"),
                node.path("ci_cd_catalog").asBoolean(false),
                issues,
                node.path("mirror_trigger_builds").asBoolean(false),
                parseVisibility(sourcePath, getTextOrNull(node, "visibility"), kind),
                node.path("mirror_releases").asBoolean(false)
        );
    }

    private Visibility parseVisibility(String sourcePath, String value, String kind) {
        if (value == null || value.isBlank()) {
            return null;
        }
        Visibility visibility = Visibility.fromApiValue(value);
        if (visibility == null) {
            // Permissive default kept from the historical behaviour of the tool
            log.warn("Invalid {} visibility '{}' for {}, using public", kind, value, sourcePath);
            return Visibility.PUBLIC;
        }
        return visibility;
    }

    private void checkPaths(String sourcePath, String destinationPath, String kind, List<String> problems) {
        if (sourcePath == null || sourcePath.isBlank() || destinationPath == null || destinationPath.isBlank()) {
            problems.add("invalid (empty) path in " + kind + " mapping: "
                    + (sourcePath == null || sourcePath.isBlank() ? "<empty>" : sourcePath));
            return;
        }
        if (hasBoundarySlash(sourcePath)) {
            problems.add("invalid " + kind + " mapping (must not start or end with /): " + sourcePath);
        }
        if (hasBoundarySlash(destinationPath)) {
            problems.add("invalid destination path (must not start or end with /): " + destinationPath);
        }
        if (PROJECT.equals(kind) && destinationPath.indexOf(MappingPaths.SEPARATOR) < 0) {
            problems.add("invalid project destination path (must be in a namespace): " + destinationPath);
        }
        if (!MappingPaths.baseName(trimSlashes(sourcePath)).equals(MappingPaths.baseName(trimSlashes(destinationPath)))) {
            problems.add("source and destination paths must have the same base name: "
                    + sourcePath + " != " + destinationPath);
        }
    }

    private void checkUniqueDestinations(Map<String, MirrorOptions> projects, Map<String, MirrorOptions> groups,
                                         List<String> problems) {
        Map<String, String> seen = new HashMap<>();
        projects.forEach((source, options) -> checkUnique(seen, PROJECT, source, options, problems));
        groups.forEach((source, options) -> checkUnique(seen, GROUP, source, options, problems));
    }

    private void checkUnique(Map<String, String> seen, String kind, String sourcePath, MirrorOptions options,
                             List<String> problems) {
        String destination = options.destinationPath();
        if (destination == null || destination.isBlank()) {
            return;
        }
        String previous = seen.putIfAbsent(destination, kind + " " + sourcePath);
        if (previous != null) {
            problems.add("duplicate destination path " + destination + " (" + previous + ", "
                    + kind + " " + sourcePath + ")");
        }
    }

    private static boolean hasBoundarySlash(String path) {
        return path.startsWith("/") || path.endsWith("/");
    }

    private static String trimSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == MappingPaths.SEPARATOR) {
            start++;
        }
        while (end > start && path.charAt(end - 1) == MappingPaths.SEPARATOR) {
            end--;
        }
        return path.substring(start, end);
    }

    private static String getTextOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
