package com.reprise.service.canonicalization;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Serializes JSON values into the byte-stable text form that cache keys are hashed from.
 *
 * Rules:
 * 1. Separators are ", " between items and ": " between name and value
 * 2. Object keys are optionally sorted (recursively)
 * 3. Every character outside printable ASCII is escaped as a lowercase \\uXXXX sequence
 * 4. Doubles use the shortest round-trip digits, keep a trailing ".0" when integral,
 *    and switch to exponent form (1e-05, 1e+16) outside [1e-4, 1e16)
 *
 * Keys computed from this form match the keys already present in existing cache files,
 * so the layout must not change.
 */
public final class CanonicalJsonWriter {

    private CanonicalJsonWriter() {
    }

    /**
     * Serialize with object keys sorted, as used for key derivation.
     */
    public static String writeSorted(JsonNode node) {
        StringBuilder sb = new StringBuilder();
        writeNode(node, true, sb);
        return sb.toString();
    }

    /**
     * Serialize keeping object keys in their original order, as used for stored outputs.
     */
    public static String write(JsonNode node) {
        StringBuilder sb = new StringBuilder();
        writeNode(node, false, sb);
        return sb.toString();
    }

    private static void writeNode(JsonNode node, boolean sortKeys, StringBuilder sb) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            sb.append("null");
        } else if (node.isObject()) {
            writeObject(node, sortKeys, sb);
        } else if (node.isArray()) {
            sb.append('[');
            boolean first = true;
            for (JsonNode element : node) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                writeNode(element, sortKeys, sb);
            }
            sb.append(']');
        } else if (node.isTextual()) {
            writeString(node.textValue(), sb);
        } else if (node.isBoolean()) {
            sb.append(node.booleanValue() ? "true" : "false");
        } else if (node.isIntegralNumber()) {
            sb.append(node.bigIntegerValue());
        } else if (node.isNumber()) {
            writeDouble(node.doubleValue(), sb);
        } else if (node.isBinary() || node.isPojo()) {
            writeString(node.asText(), sb);
        } else {
            sb.append(node.asText());
        }
    }

    private static void writeObject(JsonNode node, boolean sortKeys, StringBuilder sb) {
        List<String> fieldNames = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            fieldNames.add(fields.next().getKey());
        }
        if (sortKeys) {
            Collections.sort(fieldNames);
        }

        sb.append('{');
        boolean first = true;
        for (String fieldName : fieldNames) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            writeString(fieldName, sb);
            sb.append(": ");
            writeNode(node.get(fieldName), sortKeys, sb);
        }
        sb.append('}');
    }

    static void writeString(String text, StringBuilder sb) {
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20 || c > 0x7e) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    static void writeDouble(double value, StringBuilder sb) {
        if (Double.isNaN(value)) {
            sb.append("NaN");
            return;
        }
        if (Double.isInfinite(value)) {
            sb.append(value > 0 ? "Infinity" : "-Infinity");
            return;
        }
        if (value == 0.0) {
            sb.append(1.0 / value < 0 ? "-0.0" : "0.0");
            return;
        }

        BigDecimal decimal = new BigDecimal(Double.toString(Math.abs(value))).stripTrailingZeros();
        String digits = decimal.unscaledValue().toString();
        int exponent = digits.length() - 1 - decimal.scale();

        if (value < 0) {
            sb.append('-');
        }
        if (exponent >= -4 && exponent < 16) {
            String plain = decimal.toPlainString();
            sb.append(plain);
            if (plain.indexOf('.') < 0) {
                sb.append(".0");
            }
            return;
        }

        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? '-' : '+');
        int magnitude = Math.abs(exponent);
        if (magnitude < 10) {
            sb.append('0');
        }
        sb.append(magnitude);
    }
}
