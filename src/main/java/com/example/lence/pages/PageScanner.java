package com.example.lence.pages;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers markdown pages under a directory and reads their text, keyed by canonical page path.
 */
public class PageScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(PageScanner.class);

    private final Path pagesDir;

    public PageScanner(Path pagesDir) {
        this.pagesDir = pagesDir;
    }

    public Path getPagesDir() {
        return pagesDir;
    }

    public Map<String, String> discover() throws IOException {
        Map<String, Path> files = new TreeMap<>();
        if (!Files.isDirectory(pagesDir)) {
            LOGGER.warn("Pages directory {} does not exist; no queries will be registered", pagesDir);
            return new TreeMap<>();
        }
        List<Path> markdown;
        try (Stream<Path> stream = walk()) {
            markdown = stream.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".md"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            // entries removed mid-walk, e.g. editor swap files
            throw e.getCause();
        }
        for (Path file : markdown) {
            String relative = pagesDir.relativize(file).toString().replace('\\', '/');
            String page = PagePaths.normalize(relative);
            Path existing = files.get(page);
            if (existing == null || isIndex(existing)) {
                if (existing != null) {
                    LOGGER.debug("Page {} is served by {}; ignoring {}", page, file, existing);
                }
                files.put(page, file);
            } else {
                LOGGER.debug("Page {} is served by {}; ignoring {}", page, existing, file);
            }
        }

        Map<String, String> pages = new TreeMap<>();
        for (Map.Entry<String, Path> entry : files.entrySet()) {
            pages.put(entry.getKey(), readContent(entry.getValue()));
        }
        return pages;
    }

    protected Stream<Path> walk() throws IOException {
        return Files.walk(pagesDir);
    }

    private boolean isIndex(Path file) {
        return file.getFileName().toString().equals("index.md");
    }

    static String readContent(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        CharsetDecoder decoder = StandardCharsets.UTF_8
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException ex) {
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }
}
