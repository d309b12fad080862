package com.jay.cryptoagent.layer3_signal;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Cleans third-party text (search snippets, Reddit posts, news titles) before it is placed in a
 * prompt: truncates, drops lines that read like instructions to the model, and blanks out
 * fenced code blocks.
 */
public final class ExternalTextSanitizer {

    private static final Pattern INJECTION = Pattern.compile(
        "\\b(IGNORE|SYSTEM|INSTRUCTION|ADMIN|OVERRIDE|FORGET|DISREGARD|YOU\\s+ARE|PRETEND|ACT\\s+AS)\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern CODE_BLOCK = Pattern.compile("```[\\s\\S]*?```");

    public static final int TITLE_MAX = 200;
    public static final int SNIPPET_MAX = 500;
    public static final int SELFTEXT_MAX = 300;
    public static final int SOURCE_MAX = 50;

    private ExternalTextSanitizer() {}

    public static String sanitize(String text, int maxLength) {
        if (text == null || text.isEmpty()) return "";
        String cleaned = text.length() > maxLength ? text.substring(0, maxLength) : text;
        cleaned = Arrays.stream(cleaned.split("\n", -1))
            .filter(line -> !INJECTION.matcher(line).find())
            .collect(Collectors.joining("\n"));
        cleaned = CODE_BLOCK.matcher(cleaned).replaceAll("[code block removed]");
        return cleaned.trim();
    }
}
