package com.vectorstore.dedup.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vectorstore.dedup.audit.AuditEntry;
import com.vectorstore.dedup.cluster.DuplicationAnalysis;
import com.vectorstore.dedup.core.model.AttributeValue;
import com.vectorstore.dedup.core.model.DuplicateGroup;
import com.vectorstore.dedup.core.model.GroupMember;
import com.vectorstore.dedup.core.model.RecommendedAction;
import com.vectorstore.dedup.deletion.DeletionResult;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON mapping for duplicate groups, analyses and deletion results.
 *
 * <p>Group wire shape, as produced for review and resubmitted for deletion:</p>
 * <pre>
 * {"id": "group-1", "similarityScore": 95.0,
 *  "documents": [{"id": "a", "metadata": {...}, "lastModified": "2024-06-01"}],
 *  "recommendedAction": "keep-first", "reason": "...", "matchingFields": ["url"]}
 * </pre>
 */
public class DuplicateGroupCodec {

    private final ObjectMapper objectMapper;

    public DuplicateGroupCodec() {
        this(new ObjectMapper());
    }

    public DuplicateGroupCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads a JSON array of groups.
     *
     * @throws IllegalArgumentException if the payload is not valid JSON or a group is malformed
     */
    public List<DuplicateGroup> readGroups(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid duplicate groups JSON: " + e.getOriginalMessage(), e);
        }
        return readGroups(root);
    }

    public List<DuplicateGroup> readGroups(JsonNode root) {
        if (root == null || !root.isArray() || root.isEmpty()) {
            throw new IllegalArgumentException("Invalid duplicate groups data");
        }
        List<DuplicateGroup> groups = new ArrayList<>();
        for (JsonNode node : root) {
            groups.add(readGroup(node));
        }
        return groups;
    }

    public DuplicateGroup readGroup(JsonNode node) {
        String id = node.hasNonNull("id") ? node.get("id").asText() : null;
        JsonNode documents = node.get("documents");
        if (id == null || id.isBlank() || documents == null || !documents.isArray()) {
            throw new IllegalArgumentException(
                    "Group " + (id != null && !id.isBlank() ? id : "unknown") + " is missing required fields");
        }

        List<GroupMember> members = new ArrayList<>();
        for (JsonNode document : documents) {
            if (!document.hasNonNull("id")) {
                throw new IllegalArgumentException("Group " + id + " has a document without an id");
            }
            String lastModified = document.hasNonNull("lastModified")
                    ? document.get("lastModified").asText() : null;
            members.add(new GroupMember(document.get("id").asText(),
                    readAttributes(document.get("metadata")), lastModified));
        }

        RecommendedAction action = node.hasNonNull("recommendedAction")
                ? RecommendedAction.fromValue(node.get("recommendedAction").asText())
                : RecommendedAction.KEEP_FIRST;

        Set<String> matchingFields = new LinkedHashSet<>();
        JsonNode fields = node.get("matchingFields");
        if (fields != null && fields.isArray()) {
            fields.forEach(field -> matchingFields.add(field.asText()));
        }

        return new DuplicateGroup(id,
                node.path("similarityScore").asDouble(0.0),
                members,
                action,
                node.path("reason").asText(""),
                matchingFields);
    }

    public ArrayNode writeGroups(List<DuplicateGroup> groups) {
        ArrayNode array = objectMapper.createArrayNode();
        groups.forEach(group -> array.add(writeGroup(group)));
        return array;
    }

    public String writeGroupsAsString(List<DuplicateGroup> groups) {
        try {
            return objectMapper.writeValueAsString(writeGroups(groups));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize duplicate groups", e);
        }
    }

    public ObjectNode writeGroup(DuplicateGroup group) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", group.id());
        node.put("similarityScore", group.similarityScore());
        ArrayNode documents = node.putArray("documents");
        for (GroupMember member : group.members()) {
            ObjectNode document = documents.addObject();
            document.put("id", member.id());
            document.set("metadata", writeAttributes(member.attributes()));
            if (member.lastModified() != null) {
                document.put("lastModified", member.lastModified());
            }
        }
        node.put("recommendedAction", group.recommendedAction().value());
        node.put("reason", group.reason());
        ArrayNode fields = node.putArray("matchingFields");
        group.matchingFields().forEach(fields::add);
        return node;
    }

    public ObjectNode writeAnalysis(DuplicationAnalysis analysis) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("namespace", analysis.namespace());
        node.put("totalDocuments", analysis.totalDocuments());
        node.set("duplicateGroups", writeGroups(analysis.duplicateGroups()));
        ObjectNode savings = node.putObject("potentialSavings");
        savings.put("documentsToDelete", analysis.potentialSavings().documentsToDelete());
        savings.put("estimatedStorageSaved", analysis.potentialSavings().estimatedStorageSaved());
        node.put("processingTime", analysis.processingTimeMillis());
        ObjectNode metrics = node.putObject("analysisMetrics");
        metrics.put("exactMatches", analysis.metrics().exactMatches());
        metrics.put("fuzzyMatches", analysis.metrics().fuzzyMatches());
        metrics.put("uniqueDocuments", analysis.metrics().uniqueDocuments());
        return node;
    }

    public ObjectNode writeDeletionResult(DeletionResult result) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("success", result.success());
        node.put("deletedGroups", result.deletedGroups());
        node.put("deletedDocuments", result.deletedDocuments());
        ArrayNode errors = node.putArray("errors");
        result.errors().forEach(errors::add);
        ArrayNode trail = node.putArray("auditTrail");
        for (AuditEntry entry : result.auditTrail()) {
            ObjectNode item = trail.addObject();
            item.put("groupId", entry.groupId());
            ArrayNode deleted = item.putArray("deletedIds");
            entry.deletedIds().forEach(deleted::add);
            item.put("keptId", entry.keptId());
            item.put("reason", entry.reason());
            item.put("timestamp", entry.timestamp().toString());
        }
        return node;
    }

    private Map<String, AttributeValue> readAttributes(JsonNode metadata) {
        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        if (metadata == null || !metadata.isObject()) {
            return attributes;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = metadata.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            attributes.put(field.getKey(), AttributeValue.fromJson(field.getValue()));
        }
        return attributes;
    }

    private ObjectNode writeAttributes(Map<String, AttributeValue> attributes) {
        ObjectNode node = objectMapper.createObjectNode();
        attributes.forEach((key, value) -> node.set(key, value.toJson()));
        return node;
    }
}
