package com.bastion.service.canonicalization;

import com.bastion.model.CacheableRequest;
import com.bastion.model.OperationKind;
import com.bastion.model.RequestFingerprint;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Computes content-derived cache fingerprints.
 *
 * Steps:
 * 1. Take the request's semantically relevant fields
 * 2. Substitute defaults for absent parameters
 * 3. Drop nulls, sort JSON keys recursively
 * 4. Round floating point numbers, collapse whitespace in strings
 * 5. SHA-256 of the canonical JSON
 *
 * Same logical request → same canonical form → same digest.
 */
@Slf4j
@Service
public class RequestFingerprinter {

    private static final int FLOAT_PRECISION = 2;

    private final ObjectMapper objectMapper;

    public RequestFingerprinter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RequestFingerprint fingerprint(CacheableRequest request, OperationKind operation) {
        String canonical = canonicalize(request);
        String model = request.cacheModel() == null ? "default" : request.cacheModel();
        return new RequestFingerprint(operation, model, DigestUtils.sha256Hex(canonical));
    }

    /**
     * Canonical JSON string of the request's fingerprint fields.
     */
    public String canonicalize(CacheableRequest request) {
        ObjectNode fields = objectMapper.valueToTree(request.fingerprintFields());
        applyDefaults(fields, request.fingerprintDefaults());
        JsonNode canonical = canonicalizeNode(fields);
        StringBuilder sb = new StringBuilder();
        serializeNode(canonical, sb);
        return sb.toString();
    }

    private void applyDefaults(ObjectNode fields, Map<String, Object> defaults) {
        defaults.forEach((name, defaultValue) -> {
            JsonNode current = fields.get(name);
            if (current == null || current.isNull()) {
                fields.set(name, objectMapper.valueToTree(defaultValue));
            }
        });
    }

    private JsonNode canonicalizeNode(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }

        if (node.isObject()) {
            return canonicalizeObject((ObjectNode) node);
        } else if (node.isArray()) {
            return canonicalizeArray((ArrayNode) node);
        } else if (node.isNumber()) {
            return canonicalizeNumber(node);
        } else if (node.isTextual()) {
            return objectMapper.getNodeFactory().textNode(normalizeString(node.asText()));
        } else {
            return node;
        }
    }

    private JsonNode canonicalizeObject(ObjectNode node) {
        ObjectNode canonical = objectMapper.createObjectNode();

        List<String> fieldNames = new ArrayList<>();
        node.fieldNames().forEachRemaining(fieldNames::add);
        Collections.sort(fieldNames);

        for (String fieldName : fieldNames) {
            JsonNode value = canonicalizeNode(node.get(fieldName));
            if (value != null && !value.isNull()) {
                canonical.set(fieldName, value);
            }
        }

        return canonical;
    }

    private JsonNode canonicalizeArray(ArrayNode node) {
        ArrayNode canonical = objectMapper.createArrayNode();

        for (JsonNode element : node) {
            JsonNode canonicalElement = canonicalizeNode(element);
            if (canonicalElement != null) {
                canonical.add(canonicalElement);
            }
        }

        return canonical;
    }

    /**
     * 1, 1.0 and 1.001 all canonicalize to 1.
     */
    private JsonNode canonicalizeNumber(JsonNode node) {
        BigDecimal value = node.decimalValue();
        if (!node.isIntegralNumber()) {
            value = value.setScale(FLOAT_PRECISION, RoundingMode.HALF_UP);
        }
        return objectMapper.getNodeFactory().numberNode(value.stripTrailingZeros());
    }

    private String normalizeString(String text) {
        return text
                .trim()
                .replaceAll("\\s+", " ");
    }

    private void serializeNode(JsonNode node, StringBuilder sb) {
        if (node == null || node.isNull()) {
            sb.append("null");
        } else if (node.isObject()) {
            sb.append("{");
            List<String> fieldNames = new ArrayList<>();
            node.fieldNames().forEachRemaining(fieldNames::add);
            Collections.sort(fieldNames);

            boolean first = true;
            for (String fieldName : fieldNames) {
                if (!first) {
                    sb.append(",");
                }
                first = false;

                sb.append("\"").append(escapeJson(fieldName)).append("\":");
                serializeNode(node.get(fieldName), sb);
            }
            sb.append("}");
        } else if (node.isArray()) {
            sb.append("[");
            boolean first = true;
            for (JsonNode element : node) {
                if (!first) {
                    sb.append(",");
                }
                first = false;
                serializeNode(element, sb);
            }
            sb.append("]");
        } else if (node.isTextual()) {
            sb.append("\"").append(escapeJson(node.asText())).append("\"");
        } else if (node.isNumber()) {
            sb.append(node.decimalValue().toPlainString());
        } else if (node.isBoolean()) {
            sb.append(node.asBoolean());
        }
    }

    private String escapeJson(String text) {
        return text
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
