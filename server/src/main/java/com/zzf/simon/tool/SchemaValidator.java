package com.zzf.simon.tool;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Validates tool input against the JSON Schema subset used by the registry:
 * type, required, properties, items, enum, minimum/maximum, minLength/maxLength, format date-time,
 * plus {@code requiredWhen: {discriminator: {value: [fields]}}}.
 */
@Component
public class SchemaValidator {

    /**
     * @return violations as {@code path: problem}; empty when valid
     */
    public List<String> validate(JsonNode schema, JsonNode value) {
        List<String> violations = new ArrayList<>();
        validate(schema, value, "$", violations);
        return violations;
    }

    private void validate(JsonNode schema, JsonNode value, String path, List<String> violations) {
        if (schema == null || schema.isNull()) {
            return;
        }
        if (value == null || value.isMissingNode() || value.isNull()) {
            violations.add(path + ": value is required");
            return;
        }
        String type = schema.path("type").asText("");
        if (!type.isEmpty() && !matchesType(type, value)) {
            violations.add(path + ": expected " + type + " but got " + describe(value));
            return;
        }
        JsonNode allowed = schema.get("enum");
        if (allowed != null && allowed.isArray() && !contains(allowed, value)) {
            violations.add(path + ": must be one of " + allowed);
        }
        if (value.isNumber()) {
            checkRange(schema, value, path, violations);
        }
        if (value.isTextual()) {
            checkText(schema, value.asText(), path, violations);
        }
        if (value.isObject()) {
            checkObject(schema, value, path, violations);
        }
        if (value.isArray()) {
            JsonNode items = schema.get("items");
            for (int i = 0; items != null && i < value.size(); i++) {
                validate(items, value.get(i), path + "[" + i + "]", violations);
            }
        }
    }

    private void checkObject(JsonNode schema, JsonNode value, String path, List<String> violations) {
        JsonNode required = schema.get("required");
        if (required != null && required.isArray()) {
            for (JsonNode field : required) {
                requirePresent(value, field.asText(), path, violations);
            }
        }
        JsonNode requiredWhen = schema.get("requiredWhen");
        if (requiredWhen != null && requiredWhen.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> discriminators = requiredWhen.fields();
            while (discriminators.hasNext()) {
                Map.Entry<String, JsonNode> entry = discriminators.next();
                String actual = value.path(entry.getKey()).asText(null);
                JsonNode fields = actual == null ? null : entry.getValue().get(actual);
                if (fields != null && fields.isArray()) {
                    for (JsonNode field : fields) {
                        requirePresent(value, field.asText(), path, violations);
                    }
                }
            }
        }
        JsonNode properties = schema.get("properties");
        if (properties != null && properties.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = properties.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> property = it.next();
                JsonNode child = value.get(property.getKey());
                if (child != null && !child.isNull()) {
                    validate(property.getValue(), child, path + "." + property.getKey(), violations);
                }
            }
        }
    }

    private static void requirePresent(JsonNode value, String field, String path, List<String> violations) {
        JsonNode child = value.get(field);
        if (child == null || child.isNull()) {
            violations.add(path + "." + field + ": is required");
        }
    }

    private static void checkRange(JsonNode schema, JsonNode value, String path, List<String> violations) {
        double v = value.asDouble();
        JsonNode min = schema.get("minimum");
        if (min != null && v < min.asDouble()) {
            violations.add(path + ": must be >= " + min.asText());
        }
        JsonNode max = schema.get("maximum");
        if (max != null && v > max.asDouble()) {
            violations.add(path + ": must be <= " + max.asText());
        }
    }

    private static void checkText(JsonNode schema, String text, String path, List<String> violations) {
        JsonNode minLength = schema.get("minLength");
        if (minLength != null && text.trim().length() < minLength.asInt()) {
            violations.add(path + ": must have at least " + minLength.asInt() + " characters");
        }
        JsonNode maxLength = schema.get("maxLength");
        if (maxLength != null && text.length() > maxLength.asInt()) {
            violations.add(path + ": must have at most " + maxLength.asInt() + " characters");
        }
        if ("date-time".equals(schema.path("format").asText()) && !isDateTime(text)) {
            violations.add(path + ": must be an ISO-8601 date-time with offset");
        }
    }

    private static boolean isDateTime(String text) {
        try {
            OffsetDateTime.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static boolean matchesType(String type, JsonNode value) {
        switch (type) {
            case "object":
                return value.isObject();
            case "array":
                return value.isArray();
            case "string":
                return value.isTextual();
            case "integer":
                return value.isIntegralNumber() || (value.isNumber() && value.asDouble() == Math.rint(value.asDouble()));
            case "number":
                return value.isNumber();
            case "boolean":
                return value.isBoolean();
            default:
                return true;
        }
    }

    private static boolean contains(JsonNode allowed, JsonNode value) {
        for (JsonNode candidate : allowed) {
            if (candidate.equals(value)) {
                return true;
            }
        }
        return false;
    }

    private static String describe(JsonNode value) {
        if (value.isObject()) {
            return "object";
        }
        if (value.isArray()) {
            return "array";
        }
        if (value.isTextual()) {
            return "string";
        }
        if (value.isNumber()) {
            return "number";
        }
        if (value.isBoolean()) {
            return "boolean";
        }
        return value.getNodeType().name().toLowerCase();
    }
}
