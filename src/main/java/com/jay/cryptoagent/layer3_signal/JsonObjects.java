package com.jay.cryptoagent.layer3_signal;

/** Brace matching over free text, aware of JSON string literals. */
public final class JsonObjects {

    private JsonObjects() {}

    /**
     * The last balanced {...} in the text that is not nested inside another object,
     * or null when there is none.
     */
    public static String lastTopLevelObject(String text) {
        String last = null;
        int depth = 0;
        int start = -1;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) escaped = false;
                else if (c == '\\') escaped = true;
                else if (c == '"') inString = false;
                continue;
            }
            if (c == '"' && depth > 0) {
                inString = true;
            } else if (c == '{') {
                if (depth == 0) start = i;
                depth++;
            } else if (c == '}' && depth > 0) {
                depth--;
                if (depth == 0) last = text.substring(start, i + 1);
            }
        }
        return last;
    }
}
