package com.williamcallahan.procaudit.service.procedure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.williamcallahan.procaudit.domain.procedure.ProcessingWarning.WarningType;
import com.williamcallahan.procaudit.support.TextNormalizer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts a YAML steps file into a procedure container block.
 *
 * <p>Each YAML document is one step: {@code title} (a string or a map with {@code text}),
 * then {@code pre}, {@code action} and {@code post}. An action is a map or a list of maps whose
 * {@code code} is rendered as a code block in {@code language}. Step bodies are scanned like
 * any other reStructuredText so lists and tabs inside them are detected.</p>
 */
final class StepsYamlConverter {

    /** Marker carried by procedure blocks that came from a YAML steps file. */
    static final String YAML_MARKER = "yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final BlockScanner scanner;

    StepsYamlConverter(BlockScanner scanner) {
        this.scanner = scanner;
    }

    /**
     * Returns true when the path names a steps file ({@code steps-*.yaml}).
     */
    static boolean isStepsFile(String path) {
        if (path == null) {
            return false;
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        return name.startsWith("steps-") && name.endsWith(".yaml");
    }

    /**
     * Converts the file. Documents that are not mappings are skipped with a warning; a syntax error
     * stops reading and keeps the steps read so far.
     *
     * @param path steps file path, used for warnings and child scans
     * @param text YAML text
     * @param line line of the inclusion reference, used as the procedure's line
     * @param warnings collector for this parse
     * @return one procedure block, possibly without steps
     */
    Block convert(String path, String text, int line, WarningCollector warnings) {
        List<Block> steps = new ArrayList<>();
        try (MappingIterator<JsonNode> documents = yamlMapper.readerFor(JsonNode.class).readValues(text)) {
            while (documents.hasNextValue()) {
                int documentLine = documents.getParser().getTokenLocation().getLineNr();
                JsonNode root = documents.nextValue();
                Block step = convertDocument(path, root, documentLine, warnings);
                if (step != null) {
                    steps.add(step);
                }
            }
        } catch (JsonProcessingException parseError) {
            int errorLine = parseError.getLocation() == null ? line : parseError.getLocation().getLineNr();
            warnings.add(WarningType.MALFORMED_STEPS_FILE,
                String.format(Locale.ROOT, "Stopped reading steps file: %s", parseError.getOriginalMessage()),
                errorLine, path);
        } catch (IOException readFailure) {
            throw new ProcedureParsingException(
                String.format(Locale.ROOT, "Failed to read steps file '%s'", path), readFailure);
        }
        Block procedure = Block.container(BlockKind.PROCEDURE, line, "", Map.of(), steps);
        return procedure.withMarker(YAML_MARKER);
    }

    private Block convertDocument(String path, JsonNode root, int line, WarningCollector warnings) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return null;
        }
        if (!root.isObject()) {
            warnings.add(WarningType.MALFORMED_STEPS_FILE, "Skipped steps document that is not a mapping", line, path);
            return null;
        }

        StringBuilder body = new StringBuilder();
        appendText(body, root.get("pre"));
        JsonNode action = root.get("action");
        if (action != null && action.isArray()) {
            for (JsonNode entry : action) {
                appendAction(body, entry);
            }
        } else if (action != null) {
            appendAction(body, action);
        }
        appendText(body, root.get("post"));

        List<Block> children = scanner.scan(path, body.toString(), warnings);
        return Block.container(BlockKind.STEP, line, titleOf(root.get("title")), Map.of(), children);
    }

    private static String titleOf(JsonNode title) {
        if (title == null || title.isNull()) {
            return "";
        }
        if (title.isObject()) {
            return title.path("text").asText("").strip();
        }
        return title.asText("").strip();
    }

    private static void appendAction(StringBuilder body, JsonNode action) {
        if (action == null || !action.isObject()) {
            return;
        }
        appendText(body, action.get("pre"));
        JsonNode code = action.get("code");
        if (code != null && !code.asText("").isBlank()) {
            String language = action.path("language").asText("").strip();
            String directive = language.isEmpty() ? ".. code-block::" : ".. code-block:: " + language;
            append(body, directive + "\n\n" + TextNormalizer.indent(code.asText().strip(), 3));
        }
        appendText(body, action.get("content"));
        appendText(body, action.get("post"));
    }

    private static void appendText(StringBuilder body, JsonNode node) {
        if (node != null && node.isTextual() && !node.asText().isBlank()) {
            append(body, node.asText().strip());
        }
    }

    private static void append(StringBuilder body, String block) {
        if (body.length() > 0) {
            body.append("\n\n");
        }
        body.append(block);
    }
}
