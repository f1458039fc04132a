package org.lite.knowledge.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.knowledge.enums.LlmProviderType;
import org.lite.knowledge.model.ExtractedKnowledge;
import org.lite.knowledge.model.GraphSchema;
import org.lite.knowledge.provider.LlmProvider;
import org.lite.knowledge.provider.LlmProviderFactory;
import org.lite.knowledge.service.KnowledgeGraphExtractionService;
import org.lite.knowledge.util.CypherNames;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@Slf4j
@RequiredArgsConstructor
public class KnowledgeGraphExtractionServiceImpl implements KnowledgeGraphExtractionService {

    private static final String SCHEMA_PROMPT = """
            Analyze the following text and propose a knowledge graph schema for it.
            Respond with JSON only, using exactly this shape:
            {"node_labels": ["Label", ...], "relationship_types": ["RELATIONSHIP_TYPE", ...]}
            Use at most 10 node labels and 10 relationship types.

            Text:
            %s
            """;

    private static final String EXTRACTION_PROMPT = """
            Extract entities and relationships from the text below.
            Allowed node labels: %s
            Allowed relationship types: %s
            Respond with JSON only, using exactly this shape:
            {"entities": [{"label": "Label", "name": "entity name"}],
             "relationships": [{"source": "entity name", "target": "entity name", "type": "RELATIONSHIP_TYPE"}]}

            Text:
            %s
            """;

    private final LlmProviderFactory providerFactory;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<GraphSchema> inferSchema(String sample, LlmProviderType providerType) {
        if (sample == null || sample.isBlank()) {
            return Mono.just(GraphSchema.fallback());
        }
        return Mono.defer(() -> {
            LlmProvider provider = resolve(providerType);
            return provider.isAvailable()
                    .flatMap(healthy -> {
                        if (!Boolean.TRUE.equals(healthy)) {
                            log.warn("Provider {} is not healthy, using fallback schema", provider.type().getId());
                            return Mono.just(GraphSchema.fallback());
                        }
                        return provider.generateText(String.format(SCHEMA_PROMPT, sample), true)
                                .map(this::parseSchema);
                    });
        }).onErrorResume(error -> {
            log.warn("Schema inference failed, using fallback schema: {}", error.getMessage());
            return Mono.just(GraphSchema.fallback());
        });
    }

    @Override
    public Mono<ExtractedKnowledge> extract(String chunkText, GraphSchema schema, LlmProviderType providerType) {
        if (chunkText == null || chunkText.isBlank()) {
            return Mono.just(ExtractedKnowledge.empty());
        }
        GraphSchema effective = schema != null ? schema : GraphSchema.fallback();
        return Mono.defer(() -> {
            LlmProvider provider = resolve(providerType);
            String prompt = String.format(EXTRACTION_PROMPT,
                    String.join(", ", effective.nodeLabels()),
                    String.join(", ", effective.relationshipTypes()),
                    chunkText);
            return provider.generateText(prompt, true).map(this::parseKnowledge);
        }).onErrorResume(error -> {
            log.warn("Entity extraction failed, skipping chunk: {}", error.getMessage());
            return Mono.just(ExtractedKnowledge.empty());
        });
    }

    GraphSchema parseSchema(String response) {
        JsonNode root = readJson(response);
        if (root == null) {
            return GraphSchema.fallback();
        }
        List<String> labels = sanitized(root.path("node_labels"), true);
        List<String> types = sanitized(root.path("relationship_types"), false);
        if (labels.isEmpty() || types.isEmpty()) {
            log.warn("Schema response is missing labels or relationship types, using fallback schema");
            return GraphSchema.fallback();
        }
        return new GraphSchema(labels, types);
    }

    ExtractedKnowledge parseKnowledge(String response) {
        JsonNode root = readJson(response);
        if (root == null) {
            return ExtractedKnowledge.empty();
        }

        Map<String, ExtractedKnowledge.Entity> entities = new LinkedHashMap<>();
        for (JsonNode node : root.path("entities")) {
            String name = node.path("name").asText("").trim();
            String label = CypherNames.label(node.path("label").asText(null));
            if (!name.isEmpty() && label != null) {
                entities.putIfAbsent(name, new ExtractedKnowledge.Entity(label, name));
            }
        }

        List<ExtractedKnowledge.Relationship> relationships = new ArrayList<>();
        for (JsonNode node : root.path("relationships")) {
            String source = node.path("source").asText("").trim();
            String target = node.path("target").asText("").trim();
            String type = CypherNames.relationshipType(node.path("type").asText(null));
            if (type != null && entities.containsKey(source) && entities.containsKey(target)) {
                relationships.add(new ExtractedKnowledge.Relationship(source, target, type));
            }
        }
        return new ExtractedKnowledge(new ArrayList<>(entities.values()), relationships);
    }

    private JsonNode readJson(String response) {
        if (response == null || response.isBlank()) {
            log.warn("Empty response from provider");
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(cleanJsonText(response));
            if (root == null || !root.isObject()) {
                log.warn("Provider response is not a JSON object");
                return null;
            }
            return root;
        } catch (JsonProcessingException e) {
            log.warn("Could not parse provider response as JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static List<String> sanitized(JsonNode array, boolean labels) {
        Set<String> values = new LinkedHashSet<>();
        for (JsonNode node : array) {
            if (!node.isTextual()) {
                continue;
            }
            String value = labels ? CypherNames.label(node.asText()) : CypherNames.relationshipType(node.asText());
            if (value != null) {
                values.add(value);
            }
        }
        return new ArrayList<>(values);
    }

    private static String cleanJsonText(String text) {
        // models sometimes wrap JSON in markdown fences even in JSON mode
        text = text.trim();
        if (text.startsWith("```json")) {
            text = text.substring(7);
        } else if (text.startsWith("```")) {
            text = text.substring(3);
        }
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3);
        }
        return text.trim();
    }

    private LlmProvider resolve(LlmProviderType type) {
        return type != null ? providerFactory.getProvider(type) : providerFactory.getDefaultProvider();
    }
}
