package com.connectpro.policy;

import com.connectpro.shared.model.Message;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Keyword tagging of user messages; the first matching category wins. */
public class MessageCategorizer {

    public static final String ALL = "all";
    public static final String OTHER = "other";

    private static final Map<String, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put("order", List.of("order", "buy", "purchase", "price", "cost", "payment"));
        KEYWORDS.put("support", List.of("help", "issue", "problem", "error", "broken", "fix"));
        KEYWORDS.put("query", List.of("question", "ask", "how", "what", "when", "where", "why"));
    }

    public static String categorize(String text) {
        if (text == null) return OTHER;
        var lower = text.toLowerCase(Locale.ROOT);
        for (var entry : KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) {
                return entry.getKey();
            }
        }
        return OTHER;
    }

    public static List<Message> filter(List<Message> messages, String category) {
        if (ALL.equals(category)) return messages;
        return messages.stream()
                .filter(m -> categorize(m.text()).equals(category))
                .toList();
    }
}
