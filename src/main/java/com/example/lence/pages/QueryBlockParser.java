package com.example.lence.pages;

import com.example.lence.error.LenceException;
import com.example.lence.model.QueryBlock;
import org.apache.commons.text.StringEscapeUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code {% query name="..." source="..." %}SQL{% /query %}} blocks in page markdown.
 * Tags inside fenced code blocks and inline code spans are documentation, not queries, and are skipped.
 */
public class QueryBlockParser {
    private static final Pattern OPEN_TAG = Pattern.compile("\\{%-?\\s*query\\b(.*?)-?%}", Pattern.DOTALL);
    private static final Pattern CLOSE_TAG = Pattern.compile("\\{%-?\\s*/query\\s*-?%}");
    private static final Pattern ATTRIBUTE = Pattern.compile("([A-Za-z_][\\w-]*)\\s*=\\s*\"((?:\\\\.|[^\"\\\\])*)\"");
    private static final Pattern FENCE = Pattern.compile("^ {0,3}(`{3,}|~{3,})", Pattern.MULTILINE);
    private static final Pattern INLINE_CODE = Pattern.compile("(`+)(?!`)[^\\n]*?(?<!`)\\1(?!`)");

    public List<QueryBlock> parse(String page, String markdown) {
        List<QueryBlock> blocks = new ArrayList<>();
        if (markdown == null || markdown.isEmpty()) {
            return blocks;
        }
        List<int[]> ignored = findCodeRegions(markdown);
        Matcher open = OPEN_TAG.matcher(markdown);
        int searchStart = 0;
        while (open.find(searchStart)) {
            if (isIgnored(ignored, open.start())) {
                searchStart = open.end();
                continue;
            }
            int line = lineOf(markdown, open.start());
            String rawAttributes = open.group(1);
            if (rawAttributes.stripTrailing().endsWith("/")) {
                throw LenceException.configuration(
                        String.format("Query tag on page %s line %d must have a body and a closing tag", page, line));
            }
            Matcher close = CLOSE_TAG.matcher(markdown);
            if (!close.find(open.end())) {
                throw LenceException.configuration(
                        String.format("Unclosed query tag on page %s line %d", page, line));
            }
            Map<String, String> attributes = parseAttributes(rawAttributes);
            String name = attributes.get("name");
            String source = attributes.get("source");
            if (isBlank(name) || isBlank(source)) {
                throw LenceException.configuration(String.format(
                        "Query tag on page %s line %d requires non-empty 'name' and 'source' attributes", page, line));
            }
            String sql = markdown.substring(open.end(), close.start()).strip();
            blocks.add(new QueryBlock(page, name, source, sql, line));
            searchStart = close.end();
        }
        return blocks;
    }

    private Map<String, String> parseAttributes(String raw) {
        Map<String, String> attributes = new LinkedHashMap<>();
        Matcher matcher = ATTRIBUTE.matcher(raw);
        while (matcher.find()) {
            attributes.putIfAbsent(matcher.group(1), StringEscapeUtils.unescapeJava(matcher.group(2)));
        }
        return attributes;
    }

    private List<int[]> findCodeRegions(String markdown) {
        List<int[]> regions = new ArrayList<>();
        Matcher fence = FENCE.matcher(markdown);
        int searchStart = 0;
        while (fence.find(searchStart)) {
            String marker = fence.group(1);
            int start = fence.start();
            Pattern closing = Pattern.compile("^ {0,3}" + marker.charAt(0) + "{" + marker.length() + ",}[ \\t]*$",
                    Pattern.MULTILINE);
            int bodyStart = markdown.indexOf('\n', fence.end());
            if (bodyStart < 0) {
                regions.add(new int[]{start, markdown.length()});
                break;
            }
            Matcher close = closing.matcher(markdown);
            int end = close.find(bodyStart + 1) ? close.end() : markdown.length();
            regions.add(new int[]{start, end});
            searchStart = end;
        }

        Matcher inline = INLINE_CODE.matcher(markdown);
        while (inline.find()) {
            if (!isIgnored(regions, inline.start())) {
                regions.add(new int[]{inline.start(), inline.end()});
            }
        }
        return regions;
    }

    private boolean isIgnored(List<int[]> regions, int position) {
        for (int[] region : regions) {
            if (position >= region[0] && position < region[1]) {
                return true;
            }
        }
        return false;
    }

    private int lineOf(String content, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (content.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
