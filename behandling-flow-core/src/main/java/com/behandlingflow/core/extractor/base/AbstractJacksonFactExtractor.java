package com.behandlingflow.core.extractor.base;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.behandlingflow.core.extractor.ExtractionContext;
import com.behandlingflow.core.extractor.ExtractionResult;
import com.behandlingflow.core.extractor.FactDocument;
import com.behandlingflow.core.model.ClassFact;
import com.behandlingflow.core.model.FactSet;
import com.behandlingflow.core.model.ProcessorFact;
import com.behandlingflow.core.model.Transition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Base class for extractors that read fact documents with a Jackson mapper.
 *
 * <p>Subclasses only choose the mapper (JSON, YAML) and the file patterns. The document layout
 * is shared:
 * <pre>
 * classes:
 *   - name: CycleTestBehandling
 *     sourceLocation: CycleTest.kt
 *     supertypes: [Behandling]
 *     initialActivity: StartAktivitet
 * processors:
 *   - activity: SjekkDataAktivitet
 *     processor: SjekkDataAktivitetProcessor
 *     createsManualTask: false
 *     transitions:
 *       - target: BehandleDataAktivitet
 *         condition: dataErKlar()
 *       - targets: [A, B]
 *       - target: C
 *         collection: true
 *         featureFlag: PEN_FLAG
 * </pre>
 *
 * <p>Entries missing a required property are skipped with a warning; a file that cannot be
 * parsed is skipped with a warning and the remaining files are still read.
 */
public abstract class AbstractJacksonFactExtractor extends AbstractFactExtractor {

    // Document properties
    private static final String CLASSES = "classes";
    private static final String PROCESSORS = "processors";
    private static final String TRANSITIONS = "transitions";

    /**
     * Mapper for parsing fact documents.
     * Thread-safe and reusable across parse operations.
     */
    protected final ObjectMapper objectMapper;

    protected AbstractJacksonFactExtractor(ObjectMapper objectMapper) {
        super();
        this.objectMapper = objectMapper;
    }

    @Override
    public ExtractionResult extract(ExtractionContext context) {
        List<Path> files = findSupportedFiles(context);
        if (files.isEmpty()) {
            log.debug("No {} files found in {}", getDisplayName(), context.rootPath());
            return emptyResult();
        }

        List<FactDocument> documents = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (Path file : files) {
            try {
                JsonNode root = objectMapper.readTree(readFileContent(file));
                String source = context.rootPath().relativize(file).toString();
                documents.add(new FactDocument(file, parseDocument(root, source, warnings)));
            } catch (IOException e) {
                log.warn("Failed to parse fact document: {} - {}", file, e.getMessage());
                warnings.add("Failed to parse " + file + ": " + e.getMessage());
            }
        }

        int classes = documents.stream().mapToInt(d -> d.facts().classes().size()).sum();
        int processors = documents.stream().mapToInt(d -> d.facts().processors().size()).sum();
        log.info("Read {} classes and {} processors from {} {} file(s)",
            classes, processors, documents.size(), getDisplayName());

        return successResult(documents, warnings);
    }

    // ==================== Document Parsing ====================

    /**
     * Converts a parsed document into facts.
     *
     * @param root document root
     * @param source file path relative to the root, used as default source location
     * @param warnings collector for skipped entries
     * @return facts in document order
     */
    protected FactSet parseDocument(JsonNode root, String source, List<String> warnings) {
        if (root == null || !root.isObject()) {
            warnings.add(source + ": document root is not an object");
            return FactSet.empty();
        }

        List<ClassFact> classes = new ArrayList<>();
        for (JsonNode node : normalizeToArray(root.get(CLASSES))) {
            String name = extractText(node, "name");
            if (name == null || name.isBlank()) {
                warnings.add(source + ": class entry without name skipped");
                continue;
            }
            classes.add(new ClassFact(
                name,
                getTextOrDefault(node.get("sourceLocation"), source),
                extractTextList(node.get("supertypes")),
                extractText(node, "initialActivity")));
        }

        List<ProcessorFact> processors = new ArrayList<>();
        for (JsonNode node : normalizeToArray(root.get(PROCESSORS))) {
            String activity = extractText(node, "activity");
            if (activity == null || activity.isBlank()) {
                warnings.add(source + ": processor entry without activity skipped");
                continue;
            }
            processors.add(new ProcessorFact(
                activity,
                extractText(node, "processor"),
                parseTransitions(node.get(TRANSITIONS), activity, source, warnings),
                node.path("createsManualTask").asBoolean(false)));
        }

        return new FactSet(classes, processors);
    }

    private List<Transition> parseTransitions(JsonNode node, String activity, String source, List<String> warnings) {
        List<Transition> transitions = new ArrayList<>();
        for (JsonNode transition : normalizeToArray(node)) {
            List<String> targets = new ArrayList<>(extractTextList(transition.get("targets")));
            String target = extractText(transition, "target");
            if (target != null && !target.isBlank()) {
                targets.add(0, target);
            }
            if (targets.isEmpty()) {
                warnings.add(source + ": transition of " + activity + " without target skipped");
                continue;
            }
            transitions.add(new Transition(
                targets,
                extractText(transition, "condition"),
                transition.path("featureFlagged").asBoolean(false),
                extractText(transition, "featureFlag"),
                transition.path("collection").asBoolean(false)));
        }
        return transitions;
    }

    // ==================== JsonNode Navigation Utilities ====================

    /**
     * Extracts a text value from a child node.
     *
     * @param node parent node
     * @param childName child property name
     * @return text value, or null if absent or null
     */
    protected String extractText(JsonNode node, String childName) {
        if (node == null) {
            return null;
        }
        JsonNode childNode = node.get(childName);
        if (childNode == null || childNode.isNull()) {
            return null;
        }
        return childNode.asText();
    }

    /**
     * Safely gets a text value with a default fallback.
     *
     * @param node node to read
     * @param defaultValue value to return if node is null or not textual
     * @return text value or default
     */
    protected String getTextOrDefault(JsonNode node, String defaultValue) {
        if (node == null || !node.isTextual()) {
            return defaultValue;
        }
        return node.asText();
    }

    /**
     * Reads a string or an array of strings as a list.
     *
     * @param node single value, array or null
     * @return values, empty if absent
     */
    protected List<String> extractTextList(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : normalizeToArray(node)) {
            if (item.isValueNode() && !item.asText().isBlank()) {
                values.add(item.asText());
            }
        }
        return values;
    }

    /**
     * Normalizes a node to always be an array.
     *
     * <p>An array is returned as is, a single value is wrapped, null becomes an empty array.
     *
     * @param node node to normalize
     * @return array node
     */
    protected JsonNode normalizeToArray(JsonNode node) {
        if (node == null || node.isNull()) {
            return objectMapper.createArrayNode();
        }
        if (node.isArray()) {
            return node;
        }
        return objectMapper.createArrayNode().add(node);
    }
}
