package com.example.smartcart.services;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one raw order cell into the list of item names it mentions.
 * Accepts JSON (also Python-style dict text) or plain delimited text and
 * never throws: anything unreadable comes back as an empty list.
 */
public class OrderParser {
    private static final JsonMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();

    private static final List<String> NAME_FIELDS = List.of("item_name", "ITEM_NAME", "itemName", "name", "item", "product_name");
    private static final List<String> QTY_FIELDS = List.of("item_quantity", "ITEM_QUANTITY", "quantity", "qty");
    private static final int MAX_REPEAT = 10;

    private static final Set<String> PLACEHOLDERS = Set.of("nan", "none", "null", "n/a", "na", "-", "--", "?", "undefined", "[]", "{}");
    private static final Pattern SPLIT = Pattern.compile("[|;,\\r\\n]+");
    private static final Pattern WS = Pattern.compile("\\s+");
    private static final Pattern NAME_VALUE = Pattern.compile(
            "[\"']?(?:item_name|ITEM_NAME|itemName|name|item|product_name)[\"']?\\s*:\\s*[\"']([^\"']*)[\"']");
    private static final Pattern PY_NONE = Pattern.compile("\\bNone\\b");
    private static final Pattern PY_TRUE = Pattern.compile("\\bTrue\\b");
    private static final Pattern PY_FALSE = Pattern.compile("\\bFalse\\b");
    private static final Pattern[] QUANTITY = {
            Pattern.compile("^\\d+\\s*[xX×]\\s+"),        // "2x Fries", "2 x Fries"
            Pattern.compile("^[xX×]\\s*\\d+\\s+"),        // "x2 Fries"
            Pattern.compile("\\s+[xX×]\\s*\\d+$"),        // "Fries x2"
            Pattern.compile("\\s*\\(\\s*\\d+\\s*\\)$"),   // "Fries (2)"
            Pattern.compile("(?i)^qty[:\\s]*\\d+\\s+"),
            Pattern.compile("(?i)\\s+qty[:\\s]*\\d+$"),
    };
    private static final String QUOTES = "\"'`";
    private static final String OPENERS = "[{(<";
    private static final String CLOSERS = "]})>";
    private static final String TRAILING_PUNCT = ".,;:!";

    public List<String> parse(String raw) {
        if (raw == null) return List.of();
        String text = raw.trim();
        if (text.isEmpty() || PLACEHOLDERS.contains(text.toLowerCase(Locale.ROOT))) return List.of();

        List<String> names = new ArrayList<>();
        if (looksStructured(text)) {
            JsonNode root = readLeniently(text);
            if (root != null) collect(root, names);
            else salvage(text, names);
            if (names.isEmpty() && text.indexOf(':') < 0) {
                names.addAll(Arrays.asList(SPLIT.split(stripOuterBrackets(text))));
            }
        } else {
            names.addAll(Arrays.asList(SPLIT.split(text)));
        }
        return cleanAll(names);
    }

    /** Cleans each name and drops the ones that end up empty. */
    public List<String> cleanAll(Collection<String> names) {
        List<String> out = new ArrayList<>(names.size());
        for (String n : names) {
            String c = clean(n);
            if (!c.isEmpty()) out.add(c);
        }
        return out;
    }

    public String clean(String name) {
        if (name == null) return "";
        String s = WS.matcher(name.replace('\u00A0', ' ')).replaceAll(" ").trim();
        String prev;
        do {
            prev = s;
            s = trimEdges(s);
            for (Pattern q : QUANTITY) s = q.matcher(s).replaceAll("");
            s = s.trim();
        } while (!s.equals(prev));
        if (PLACEHOLDERS.contains(s.toLowerCase(Locale.ROOT))) return "";
        return s;
    }

    private static String trimEdges(String s) {
        String t = s;
        boolean changed = true;
        while (changed && !t.isEmpty()) {
            changed = false;
            char first = t.charAt(0), last = t.charAt(t.length() - 1);
            if (QUOTES.indexOf(first) >= 0) { t = t.substring(1); changed = true; }
            else if (QUOTES.indexOf(last) >= 0 || TRAILING_PUNCT.indexOf(last) >= 0) { t = t.substring(0, t.length() - 1); changed = true; }
            else if (OPENERS.indexOf(first) >= 0 && unbalanced(t) > 0) { t = t.substring(1); changed = true; }
            else if (CLOSERS.indexOf(last) >= 0 && unbalanced(t) < 0) { t = t.substring(0, t.length() - 1); changed = true; }
            t = t.trim();
        }
        return t;
    }

    /** Positive when there are more opening brackets than closing ones. */
    private static int unbalanced(String s) {
        int depth = 0;
        for (int i = 0; i < s.length(); i++) {
            if (OPENERS.indexOf(s.charAt(i)) >= 0) depth++;
            else if (CLOSERS.indexOf(s.charAt(i)) >= 0) depth--;
        }
        return depth;
    }

    private static boolean looksStructured(String text) {
        char c = text.charAt(0);
        return c == '{' || c == '[';
    }

    /** Truncated or otherwise broken JSON: keep the values of recognizable name fields. */
    private static void salvage(String text, List<String> out) {
        Matcher m = NAME_VALUE.matcher(text);
        while (m.find()) out.add(m.group(1));
    }

    /** "[Wings, Fries]" -> "Wings, Fries" */
    private static String stripOuterBrackets(String text) {
        int from = 0, to = text.length();
        while (from < to && OPENERS.indexOf(text.charAt(from)) >= 0) from++;
        while (to > from && CLOSERS.indexOf(text.charAt(to - 1)) >= 0) to--;
        return text.substring(from, to);
    }

    private static JsonNode readLeniently(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (Exception first) {
            // Python repr output: None/True/False instead of JSON literals
            String py = PY_NONE.matcher(text).replaceAll("null");
            py = PY_TRUE.matcher(py).replaceAll("true");
            py = PY_FALSE.matcher(py).replaceAll("false");
            try {
                return MAPPER.readTree(py);
            } catch (Exception second) {
                return null;
            }
        }
    }

    private static void collect(JsonNode node, List<String> out) {
        if (node == null || node.isNull() || node.isMissingNode()) return;
        if (node.isTextual()) {
            out.add(node.asText());
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) collect(child, out);
            return;
        }
        if (!node.isObject()) return;

        for (String field : NAME_FIELDS) {
            JsonNode name = node.get(field);
            if (name != null && name.isTextual()) {
                int times = Math.min(MAX_REPEAT, Math.max(1, quantity(node)));
                for (int i = 0; i < times; i++) out.add(name.asText());
                return;
            }
        }
        for (JsonNode child : node) {
            if (child.isContainerNode()) collect(child, out);
        }
    }

    private static int quantity(JsonNode node) {
        for (String field : QTY_FIELDS) {
            JsonNode q = node.get(field);
            if (q == null) continue;
            if (q.canConvertToInt()) return q.asInt(1);
            if (q.isTextual()) {
                try { return Integer.parseInt(q.asText().trim()); } catch (NumberFormatException ex) { return 1; }
            }
        }
        return 1;
    }
}
