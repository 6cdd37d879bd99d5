package com.example.lence.registry;

import com.example.lence.error.LenceException;
import com.example.lence.model.QueryBlock;
import com.example.lence.pages.PageScanner;
import com.example.lence.pages.QueryBlockParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds a {@link QueryRegistry} from the pages on disk.
 */
public class RegistryLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(RegistryLoader.class);

    private final PageScanner scanner;
    private final QueryBlockParser parser;
    private final QueryRegistry registry;

    public RegistryLoader(PageScanner scanner, QueryBlockParser parser, QueryRegistry registry) {
        this.scanner = scanner;
        this.parser = parser;
        this.registry = registry;
    }

    public synchronized RegistrySnapshot reload() {
        Map<String, String> pages;
        try {
            pages = scanner.discover();
        } catch (IOException e) {
            throw LenceException.configuration("Failed to scan pages under " + scanner.getPagesDir() + ": " + e.getMessage(), e);
        }
        List<QueryBlock> blocks = new ArrayList<>();
        try {
            for (Map.Entry<String, String> page : pages.entrySet()) {
                blocks.addAll(parser.parse(page.getKey(), page.getValue()));
            }
            return registry.build(blocks);
        } catch (LenceException e) {
            LOGGER.warn("Registry rebuild aborted; generation {} stays live: {}",
                    registry.snapshot().generation(), e.getDetail());
            throw e;
        }
    }

    public QueryRegistry getRegistry() {
        return registry;
    }
}
