package com.serge.scheduler.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

public class ImageReferenceValidator implements ConstraintValidator<ImageReference, String> {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final List<String> SIZES = List.of("thumb", "small", "medium");

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null || value.isEmpty()) return true;
        if (value.startsWith("{")) return isSizeSet(value);
        return isHttpUrl(value);
    }

    static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value);
            return ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean isSizeSet(String value) {
        try {
            JsonNode node = JSON.readTree(value);
            return node.isObject() && SIZES.stream().allMatch(k -> node.hasNonNull(k) && node.get(k).isTextual());
        } catch (JsonProcessingException e) {
            return false;
        }
    }
}
