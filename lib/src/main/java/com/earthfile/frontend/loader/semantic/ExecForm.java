package com.earthfile.frontend.loader.semantic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Recognizes the JSON array form of RUN, CMD, ENTRYPOINT and VOLUME ({@code ["echo", "hi"]}). */
final class ExecForm {
    private static final ObjectMapper om =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private ExecForm() {}

    /**
     * The array elements when the words, joined by single spaces, are a JSON array of strings.
     * JSON {@code null} elements become empty strings.
     */
    static Optional<List<String>> parse(List<String> words) {
        String joined = String.join(" ", words);
        if (!joined.startsWith("[")) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = om.readTree(joined);
        } catch (JsonProcessingException notJson) {
            return Optional.empty();
        }
        if (root == null || !root.isArray()) {
            return Optional.empty();
        }
        List<String> elements = new ArrayList<>(root.size());
        for (JsonNode element : root) {
            if (element.isNull()) {
                elements.add("");
            } else if (element.isTextual()) {
                elements.add(element.textValue());
            } else {
                return Optional.empty();
            }
        }
        return Optional.of(elements);
    }
}
