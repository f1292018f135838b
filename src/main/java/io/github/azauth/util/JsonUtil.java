package io.github.azauth.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal JSON parsing for token endpoint responses, JWT payloads and custom cloud
 * definitions.
 *
 * <p>Objects are returned as insertion-ordered maps, arrays as lists, numbers as
 * {@link Long} or {@link Double}.
 */
public final class JsonUtil {

    private JsonUtil() {
        // Utility class
    }

    /**
     * Parses any JSON value.
     *
     * @param json the JSON text
     * @return the parsed value ({@code Map}, {@code List}, {@code String}, {@code Number},
     *         {@code Boolean} or null)
     * @throws IllegalArgumentException if the text is not valid JSON
     */
    public static Object parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("JSON input is empty");
        }
        try {
            Parser parser = new Parser(json);
            Object value = parser.parseValue();
            parser.skipWhitespace();
            if (!parser.atEnd()) {
                throw new IllegalStateException("Unexpected trailing content at position " + parser.pos);
            }
            return value;
        } catch (IllegalStateException | IndexOutOfBoundsException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a JSON object.
     *
     * @param json the JSON text
     * @return the parsed object
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseObject(String json) {
        Object value = parse(json);
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Expected a JSON object");
        }
        return (Map<String, Object>) value;
    }

    /**
     * Parses a JSON array.
     *
     * @param json the JSON text
     * @return the parsed array
     * @throws IllegalArgumentException if the text is not a JSON array
     */
    @SuppressWarnings("unchecked")
    public static List<Object> parseArray(String json) {
        Object value = parse(json);
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("Expected a JSON array");
        }
        return (List<Object>) value;
    }

    /**
     * Reads a string member, returning null when it is absent or not a string.
     */
    public static String getString(Map<String, Object> object, String key) {
        Object value = object.get(key);
        return value instanceof String ? (String) value : null;
    }

    /**
     * Reads a numeric member. Numeric strings are accepted because some token endpoints
     * encode lifetimes as strings.
     *
     * @return the value, or null when absent or not numeric
     */
    public static Long getLong(Map<String, Object> object, String key) {
        Object value = object.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Recursive descent parser over a single JSON document.
     */
    private static final class Parser {
        private final String json;
        private int pos;

        Parser(String json) {
            this.json = json;
            this.pos = 0;
        }

        boolean atEnd() {
            return pos >= json.length();
        }

        Object parseValue() {
            skipWhitespace();
            char c = peek();
            switch (c) {
                case '{':
                    return parseObject();
                case '[':
                    return parseArray();
                case '"':
                    return parseString();
                case 't':
                    return literal("true", Boolean.TRUE);
                case 'f':
                    return literal("false", Boolean.FALSE);
                case 'n':
                    return literal("null", null);
                default:
                    if (c == '-' || Character.isDigit(c)) {
                        return parseNumber();
                    }
                    throw new IllegalStateException("Unexpected character '" + c + "' at position " + pos);
            }
        }

        Map<String, Object> parseObject() {
            expect('{');
            Map<String, Object> map = new LinkedHashMap<>();
            skipWhitespace();
            if (peek() == '}') {
                pos++;
                return map;
            }
            do {
                skipWhitespace();
                String key = parseString();
                skipWhitespace();
                expect(':');
                map.put(key, parseValue());
                skipWhitespace();
            } while (consume(','));
            expect('}');
            return map;
        }

        List<Object> parseArray() {
            expect('[');
            List<Object> list = new ArrayList<>();
            skipWhitespace();
            if (peek() == ']') {
                pos++;
                return list;
            }
            do {
                list.add(parseValue());
                skipWhitespace();
            } while (consume(','));
            expect(']');
            return list;
        }

        String parseString() {
            expect('"');
            StringBuilder sb = new StringBuilder();
            while (pos < json.length()) {
                char c = json.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                char escaped = json.charAt(pos++);
                switch (escaped) {
                    case 'b':
                        sb.append('\b');
                        break;
                    case 'f':
                        sb.append('\f');
                        break;
                    case 'n':
                        sb.append('\n');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'u':
                        sb.append((char) Integer.parseInt(json.substring(pos, pos + 4), 16));
                        pos += 4;
                        break;
                    default:
                        sb.append(escaped);
                }
            }
            throw new IllegalStateException("Unterminated string");
        }

        Number parseNumber() {
            int start = pos;
            boolean fractional = false;
            if (peek() == '-') {
                pos++;
            }
            while (pos < json.length()) {
                char c = json.charAt(pos);
                if (Character.isDigit(c)) {
                    pos++;
                } else if (c == '.' || c == 'e' || c == 'E' || c == '+' || c == '-') {
                    fractional = true;
                    pos++;
                } else {
                    break;
                }
            }
            String text = json.substring(start, pos);
            return fractional ? (Number) Double.parseDouble(text) : (Number) Long.parseLong(text);
        }

        Object literal(String word, Object value) {
            if (!json.startsWith(word, pos)) {
                throw new IllegalStateException("Expected '" + word + "' at position " + pos);
            }
            pos += word.length();
            return value;
        }

        void skipWhitespace() {
            while (pos < json.length() && Character.isWhitespace(json.charAt(pos))) {
                pos++;
            }
        }

        char peek() {
            if (pos >= json.length()) {
                throw new IllegalStateException("Unexpected end of input");
            }
            return json.charAt(pos);
        }

        void expect(char expected) {
            skipWhitespace();
            if (peek() != expected) {
                throw new IllegalStateException(
                        "Expected '" + expected + "' at position " + pos + " but found '" + peek() + "'");
            }
            pos++;
        }

        boolean consume(char c) {
            skipWhitespace();
            if (pos < json.length() && json.charAt(pos) == c) {
                pos++;
                return true;
            }
            return false;
        }
    }
}
