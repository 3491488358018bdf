package com.tutorflow.tutorbackend.payment;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Provider webhook envelope: {@code {id, type, created, data: {object: {...}}}}.
 * Read helpers return null for missing or blank fields.
 */
public record ProviderEvent(String id, String type, Instant created, JsonNode object) {

    public static ProviderEvent parse(JsonNode root) {
        String id = readText(root, "id");
        String type = readText(root, "type");
        if (id == null || type == null) {
            throw new IllegalArgumentException("Webhook payload must carry id and type");
        }
        JsonNode created = root.path("created");
        Instant createdAt = created.canConvertToLong() ? Instant.ofEpochSecond(created.asLong()) : null;
        return new ProviderEvent(id, type, createdAt, root.path("data").path("object"));
    }

    public String objectId() {
        return readText(object, "id");
    }

    public String text(String... path) {
        return readText(object, path);
    }

    public String metadata(String key) {
        return readText(object, "metadata", key);
    }

    public Instant epochSeconds(String... path) {
        JsonNode n = node(object, path);
        return n.canConvertToLong() && n.asLong() > 0 ? Instant.ofEpochSecond(n.asLong()) : null;
    }

    public Boolean bool(String... path) {
        JsonNode n = node(object, path);
        return n.isBoolean() ? n.asBoolean() : null;
    }

    public JsonNode path(String... path) {
        return node(object, path);
    }

    private static JsonNode node(JsonNode root, String... path) {
        JsonNode n = root;
        for (String p : path) {
            n = n.path(p);
        }
        return n;
    }

    private static String readText(JsonNode root, String... path) {
        JsonNode n = node(root, path);
        if (n.isMissingNode() || n.isNull()) return null;
        String v = n.asText();
        return v == null || v.isBlank() ? null : v;
    }
}
