package com.workflow.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code ${{ ... }}} expressions from markdown instructions and assigns each unique
 * expression an environment variable, so the text can reach the agent without template injection.
 * <p>
 * Not thread-safe: one extractor per markdown document.
 */
public class ExpressionExtractor {

    private static final Logger log = LoggerFactory.getLogger(ExpressionExtractor.class);

    private static final Pattern EXPRESSION = Pattern.compile("\\$\\{\\{(.*?)\\}\\}");

    private static final Pattern SIMPLE_PROPERTY_PATH =
            Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*(\\.[a-zA-Z_][a-zA-Z0-9_]*)*$");

    static final String ENV_PREFIX = "GH_AW_";
    static final String HASHED_ENV_PREFIX = ENV_PREFIX + "EXPR_";

    private final Map<String, ExpressionMapping> mappings = new LinkedHashMap<>();

    /**
     * Extract all expressions from the markdown, recording a mapping for each unique one.
     *
     * @param markdown Markdown content
     * @return Mappings found so far, sorted by original text
     */
    public List<ExpressionMapping> extract(String markdown) {
        log.debug("Extracting expressions from markdown: length={}", markdown.length());

        Matcher matcher = EXPRESSION.matcher(markdown);
        while (matcher.find()) {
            String original = matcher.group();
            if (mappings.containsKey(original)) {
                continue;
            }
            String content = matcher.group(1).trim();
            mappings.put(original, new ExpressionMapping(original, envVarName(content), content));
        }

        List<ExpressionMapping> result = new ArrayList<>(mappings.values());
        result.sort(Comparator.comparing(ExpressionMapping::original));
        log.debug("Extracted {} unique expressions", result.size());
        return result;
    }

    /**
     * Replace every extracted expression with its {@code __ENV_VAR__} placeholder.
     * Longer expressions are replaced first so none is partially replaced.
     */
    public String replaceWithPlaceholders(String markdown) {
        List<ExpressionMapping> ordered = new ArrayList<>(mappings.values());
        ordered.sort(Comparator.comparingInt((ExpressionMapping m) -> m.original().length()).reversed());

        String result = markdown;
        for (ExpressionMapping mapping : ordered) {
            result = result.replace(mapping.original(), mapping.placeholder());
        }
        return result;
    }

    /**
     * All mappings, sorted by environment variable name.
     */
    public List<ExpressionMapping> getMappings() {
        List<ExpressionMapping> result = new ArrayList<>(mappings.values());
        result.sort(Comparator.comparing(ExpressionMapping::envVar));
        return result;
    }

    /**
     * Environment variable for an expression: a readable name for plain property paths
     * ({@code github.event.issue.number} gives {@code GH_AW_GITHUB_EVENT_ISSUE_NUMBER}),
     * otherwise a name derived from the SHA-256 of the expression.
     */
    static String envVarName(String content) {
        if (SIMPLE_PROPERTY_PATH.matcher(content).matches()) {
            return ENV_PREFIX + content.replace('.', '_').toUpperCase(Locale.ROOT);
        }
        String hash = HexFormat.of().formatHex(sha256(content));
        return HASHED_ENV_PREFIX + hash.substring(0, 8).toUpperCase(Locale.ROOT);
    }

    private static byte[] sha256(String content) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(content.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
