package com.example.lence.template;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a SQL template into literal text and {@code ${inputs.<name>.value}} placeholders.
 * <p>
 * Placeholders are only recognised in plain SQL text. Single-quoted literals (including {@code E'...'} strings
 * with backslash escapes), dollar-quoted strings ({@code $$...$$} and {@code $tag$...$tag$}), double-quoted
 * identifiers, {@code --} line comments and block comments are copied through verbatim, so text that merely looks
 * like a placeholder inside them is never substituted. An unterminated region runs to the end of the template.
 */
public final class PlaceholderScanner {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{inputs\\.([A-Za-z_][A-Za-z0-9_]*)\\.value}");
    private static final Pattern DOLLAR_TAG = Pattern.compile("\\$(?:[A-Za-z_][A-Za-z0-9_]*)?\\$");

    private PlaceholderScanner() {
    }

    public sealed interface Segment permits Literal, Placeholder {
    }

    public record Literal(String text) implements Segment {
    }

    /**
     * @param parenthesized the nearest non-blank character before the token is {@code (}
     */
    public record Placeholder(String name, String token, boolean parenthesized) implements Segment {
    }

    public static List<Segment> scan(String sql) {
        List<Segment> segments = new ArrayList<>();
        if (sql == null || sql.isEmpty()) {
            return segments;
        }
        StringBuilder literal = new StringBuilder();
        Matcher matcher = PLACEHOLDER.matcher(sql);
        Matcher dollarTag = DOLLAR_TAG.matcher(sql);
        String dollarDelimiter = null;
        boolean inSingleQuote = false;
        boolean backslashEscapes = false;
        boolean inDoubleQuote = false;
        boolean inLineComment = false;
        boolean inBlockComment = false;

        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            char next = i + 1 < sql.length() ? sql.charAt(i + 1) : '\0';

            if (inLineComment) {
                literal.append(c);
                if (c == '\n') {
                    inLineComment = false;
                }
                continue;
            }

            if (inBlockComment) {
                literal.append(c);
                if (c == '*' && next == '/') {
                    literal.append(next);
                    i++;
                    inBlockComment = false;
                }
                continue;
            }

            if (dollarDelimiter != null) {
                if (sql.startsWith(dollarDelimiter, i)) {
                    literal.append(dollarDelimiter);
                    i += dollarDelimiter.length() - 1;
                    dollarDelimiter = null;
                } else {
                    literal.append(c);
                }
                continue;
            }

            if (inSingleQuote) {
                literal.append(c);
                if (backslashEscapes && c == '\\' && i + 1 < sql.length()) {
                    literal.append(next);
                    i++;
                } else if (c == '\'' && next == '\'') {
                    literal.append(next);
                    i++;
                } else if (c == '\'') {
                    inSingleQuote = false;
                }
                continue;
            }

            if (inDoubleQuote) {
                literal.append(c);
                if (c == '"' && next == '"') {
                    literal.append(next);
                    i++;
                } else if (c == '"') {
                    inDoubleQuote = false;
                }
                continue;
            }

            if (c == '-' && next == '-') {
                literal.append(c).append(next);
                i++;
                inLineComment = true;
                continue;
            }
            if (c == '/' && next == '*') {
                literal.append(c).append(next);
                i++;
                inBlockComment = true;
                continue;
            }
            if (c == '\'') {
                literal.append(c);
                inSingleQuote = true;
                backslashEscapes = i > 0 && (sql.charAt(i - 1) == 'E' || sql.charAt(i - 1) == 'e');
                continue;
            }
            if (c == '"') {
                literal.append(c);
                inDoubleQuote = true;
                continue;
            }

            if (c == '$' && next == '{') {
                matcher.region(i, sql.length());
                if (matcher.lookingAt()) {
                    boolean parenthesized = endsWithOpenParen(literal);
                    if (literal.length() > 0) {
                        segments.add(new Literal(literal.toString()));
                        literal.setLength(0);
                    }
                    segments.add(new Placeholder(matcher.group(1), matcher.group(), parenthesized));
                    i = matcher.end() - 1;
                    continue;
                }
            }
            if (c == '$') {
                dollarTag.region(i, sql.length());
                if (dollarTag.lookingAt()) {
                    dollarDelimiter = dollarTag.group();
                    literal.append(dollarDelimiter);
                    i = dollarTag.end() - 1;
                    continue;
                }
            }

            literal.append(c);
        }

        if (literal.length() > 0) {
            segments.add(new Literal(literal.toString()));
        }
        return segments;
    }

    private static boolean endsWithOpenParen(StringBuilder pending) {
        int index = pending.length() - 1;
        while (index >= 0 && Character.isWhitespace(pending.charAt(index))) {
            index--;
        }
        return index >= 0 && pending.charAt(index) == '(';
    }
}
