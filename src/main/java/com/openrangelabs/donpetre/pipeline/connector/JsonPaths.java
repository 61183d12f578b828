package com.openrangelabs.donpetre.pipeline.connector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Dotted-path lookups into response bodies, e.g. {@code data.items} or {@code meta.pages.0.next}.
 * Numeric segments index into arrays.
 */
public final class JsonPaths {

    private JsonPaths() {
    }

    public static JsonNode resolve(JsonNode root, String path) {
        if (root == null) {
            return MissingNode.getInstance();
        }
        if (path == null || path.isBlank()) {
            return root;
        }
        JsonNode current = root;
        for (String segment : path.split("\\.")) {
            if (current.isArray() && isIndex(segment)) {
                current = current.path(Integer.parseInt(segment));
            } else {
                current = current.path(segment);
            }
            if (current.isMissingNode()) {
                return current;
            }
        }
        return current;
    }

    /**
     * Text at {@code path}, or null when absent or JSON null.
     */
    public static String text(JsonNode root, String path) {
        JsonNode node = resolve(root, path);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
