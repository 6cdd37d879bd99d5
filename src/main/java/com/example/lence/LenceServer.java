package com.example.lence;

import com.example.lence.catalog.JdbcSourceCatalog;
import com.example.lence.catalog.SourceCatalog;
import com.example.lence.config.LenceConfig;
import com.example.lence.config.SourcesConfigLoader;
import com.example.lence.error.LenceException;
import com.example.lence.pages.PageScanner;
import com.example.lence.pages.PageWatcher;
import com.example.lence.pages.QueryBlockParser;
import com.example.lence.registry.QueryRegistry;
import com.example.lence.registry.RegistryLoader;
import com.example.lence.service.QueryService;
import com.example.lence.tools.QueryExecuteTool;
import com.example.lence.tools.QueryListTool;
import com.example.lence.tools.RegistryReloadTool;
import com.example.lence.tools.SourceDescribeTool;
import com.example.lence.tools.SourcesListTool;
import com.example.lence.tools.Tool;
import com.example.lence.tools.ToolErrors;
import com.example.lence.tools.ToolRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * MCP server bootstrap: registers the project's data sources, builds the query registry from its pages and exposes
 * query execution and source discovery as tools over stdio.
 */
public class LenceServer {

    private static final String LOG_FILE_PATH = configureSimpleLogger();
    private static final Logger LOGGER = LoggerFactory.getLogger(LenceServer.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final McpJsonMapper mcpJsonMapper = McpJsonMapper.getDefault();
    private final ToolRegistry tools = new ToolRegistry();
    private final LenceConfig config;
    private final SourceCatalog catalog;
    private final RegistryLoader loader;
    private final PageWatcher watcher;

    public LenceServer(LenceConfig config) {
        this.config = config;
        this.catalog = JdbcSourceCatalog.open(config.jdbcUrl(), config.projectDir());
        int sources = new SourcesConfigLoader().registerAll(config.sourcesFile(), catalog);
        LOGGER.info("Registered {} source(s) from {}", sources, config.sourcesFile());

        QueryRegistry registry = new QueryRegistry();
        this.loader = new RegistryLoader(new PageScanner(config.pagesDir()), new QueryBlockParser(), registry);
        try {
            loader.reload();
        } catch (LenceException e) {
            LOGGER.error("Starting with an empty query registry: {}", e.getDetail());
        }
        this.watcher = config.watchPages() ? new PageWatcher(config.pagesDir(), loader) : null;

        QueryService service = new QueryService(registry, catalog, config.mode());
        tools.register(new QueryExecuteTool(mapper, service));
        tools.register(new QueryListTool(mapper, registry));
        tools.register(new SourcesListTool(mapper, service));
        tools.register(new SourceDescribeTool(mapper, service));
        tools.register(new RegistryReloadTool(mapper, loader));
    }

    public static void main(String[] args) {
        new LenceServer(LenceConfig.load(args)).start();
    }

    public void start() {
        List<McpServerFeatures.SyncToolSpecification> specifications = tools.list().stream()
                .map(this::toToolSpecification)
                .toList();

        if (LOG_FILE_PATH != null) {
            LOGGER.info("Logging server output to {}", LOG_FILE_PATH);
        }
        LOGGER.info("Serving project {} in {} mode", config.projectDir(), config.mode());

        if (watcher != null) {
            try {
                watcher.start();
            } catch (IOException e) {
                LOGGER.warn("Page watching disabled: {}", e.getMessage());
            }
        }

        StdioServerTransportProvider transportProvider = new StdioServerTransportProvider(mcpJsonMapper);

        McpSyncServer server = McpServer
                .sync(transportProvider)
                .serverInfo(new McpSchema.Implementation("lence-sql-mcp", "0.1.0"))
                .jsonMapper(mcpJsonMapper)
                .tools(specifications)
                .build();

        keepServerAlive(server, specifications.size());
    }

    private static String configureSimpleLogger() {
        String existing = System.getProperty("org.slf4j.simpleLogger.logFile");
        if (existing != null && !existing.isBlank()) {
            return existing;
        }
        String requested = System.getProperty("lence.logFile");
        if (requested == null || requested.isBlank()) {
            return null;
        }

        try {
            Path logFile = Path.of(requested);
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null && Files.notExists(parent)) {
                Files.createDirectories(parent);
            }
            String absolutePath = logFile.toAbsolutePath().toString();
            System.setProperty("org.slf4j.simpleLogger.logFile", absolutePath);
            return absolutePath;
        } catch (Exception ex) {
            System.err.println("Failed to configure simple logger file output: " + ex.getMessage());
            return null;
        }
    }

    private void keepServerAlive(McpSyncServer server, int toolCount) {
        CountDownLatch shutdown = new CountDownLatch(1);
        AtomicBoolean closed = new AtomicBoolean(false);

        Runnable shutdownHook = () -> {
            if (closed.compareAndSet(false, true)) {
                try {
                    LOGGER.info("Shutting down Lence server");
                    server.closeGracefully();
                } catch (Exception e) {
                    LOGGER.warn("Error while shutting down MCP server", e);
                } finally {
                    if (watcher != null) {
                        watcher.close();
                    }
                    catalog.close();
                    shutdown.countDown();
                }
            }
        };

        Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook, "lence-server-shutdown"));

        LOGGER.info("Lence server started with {} tool(s); awaiting requests...", toolCount);
        try {
            shutdown.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Lence server interrupted; shutting down");
            shutdownHook.run();
        }
    }

    private McpServerFeatures.SyncToolSpecification toToolSpecification(Tool tool) {
        McpSchema.Tool descriptor = McpSchema.Tool.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .inputSchema(mcpJsonMapper, serializeSchema(tool))
                .build();
        return McpServerFeatures.SyncToolSpecification.builder()
                .tool(descriptor)
                .callHandler((exchange, request) -> executeTool(tool, request))
                .build();
    }

    private String serializeSchema(Tool tool) {
        JsonNode schema = tool.getInputSchema();
        if (schema == null) {
            throw new IllegalStateException("Tool " + tool.getName() + " must provide an input schema");
        }
        return schema.toString();
    }

    private McpSchema.CallToolResult executeTool(Tool tool, McpSchema.CallToolRequest request) {
        JsonNode arguments = toArgumentsNode(request);
        try {
            JsonNode result = tool.call(arguments);
            McpSchema.CallToolResult.Builder builder = McpSchema.CallToolResult.builder().isError(false);
            if (result == null || result.isNull()) {
                builder.addTextContent("null");
            } else {
                builder.structuredContent(mapper.convertValue(result, Object.class));
                builder.addTextContent(renderResultText(result));
            }
            return builder.build();
        } catch (LenceException ex) {
            LOGGER.info("Tool '{}' rejected request: {}", tool.getName(), ex.getMessage());
            return errorResult(ToolErrors.toNode(mapper, ex));
        } catch (Exception ex) {
            LOGGER.error("Tool '{}' execution failed", tool.getName(), ex);
            return errorResult(ToolErrors.toNode(mapper, ex));
        }
    }

    private McpSchema.CallToolResult errorResult(ObjectNode error) {
        return McpSchema.CallToolResult.builder()
                .isError(true)
                .structuredContent(mapper.convertValue(error, Object.class))
                .addTextContent(error.path("kind").asText() + ": " + error.path("detail").asText())
                .build();
    }

    private JsonNode toArgumentsNode(McpSchema.CallToolRequest request) {
        if (request.arguments() == null) {
            return mapper.createObjectNode();
        }
        return mapper.valueToTree(request.arguments());
    }

    private String renderResultText(JsonNode result) {
        if (result.isTextual()) {
            return result.asText();
        }
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            return result.toString();
        }
    }
}
