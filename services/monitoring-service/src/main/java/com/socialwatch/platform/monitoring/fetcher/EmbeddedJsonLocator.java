package com.socialwatch.platform.monitoring.fetcher;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Helpers for data that pages embed in inline scripts, e.g. {@code var $render_data = [{...}][0] || {};}.
 */
public final class EmbeddedJsonLocator {

    private EmbeddedJsonLocator() {
    }

    public static Optional<String> extractAssignedBlob(String html, String variableName) {
        if (html == null || variableName == null) {
            return Optional.empty();
        }
        int from = 0;
        while (true) {
            int at = html.indexOf(variableName, from);
            if (at < 0) {
                return Optional.empty();
            }
            int cursor = skipWhitespace(html, at + variableName.length());
            if (cursor < html.length() && html.charAt(cursor) == '=') {
                cursor = skipWhitespace(html, cursor + 1);
                if (cursor < html.length() && (html.charAt(cursor) == '[' || html.charAt(cursor) == '{')) {
                    int end = matchingBracket(html, cursor);
                    if (end > cursor) {
                        return Optional.of(html.substring(cursor, end + 1));
                    }
                }
            }
            from = at + variableName.length();
        }
    }

    public static Optional<JsonNode> findFirst(JsonNode root, String key) {
        return findFirstObject(root, node -> node.has(key)).map(node -> node.get(key));
    }

    public static Optional<JsonNode> findFirstObject(JsonNode root, Predicate<JsonNode> predicate) {
        if (root == null) {
            return Optional.empty();
        }
        if (root.isObject() && predicate.test(root)) {
            return Optional.of(root);
        }
        if (root.isContainerNode()) {
            for (JsonNode child : root) {
                Optional<JsonNode> found = findFirstObject(child, predicate);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    public static List<JsonNode> findAll(JsonNode root, String key) {
        List<JsonNode> matches = new ArrayList<>();
        collect(root, key, matches);
        return matches;
    }

    private static void collect(JsonNode node, String key, List<JsonNode> matches) {
        if (node == null) {
            return;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getKey().equals(key)) {
                    matches.add(field.getValue());
                } else {
                    collect(field.getValue(), key, matches);
                }
            }
        } else if (node.isArray()) {
            for (JsonNode child : node) {
                collect(child, key, matches);
            }
        }
    }

    private static int skipWhitespace(String text, int index) {
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }

    private static int matchingBracket(String text, int start) {
        int depth = 0;
        boolean inString = false;
        char quote = 0;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"', '\'' -> {
                    inString = true;
                    quote = c;
                }
                case '[', '{' -> depth++;
                case ']', '}' -> {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
                default -> {
                }
            }
        }
        return -1;
    }
}
