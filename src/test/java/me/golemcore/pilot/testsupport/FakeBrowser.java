package me.golemcore.pilot.testsupport;

import me.golemcore.pilot.domain.component.ToolComponent;
import me.golemcore.pilot.domain.component.ToolRegistry;
import me.golemcore.pilot.domain.model.ToolDefinition;
import me.golemcore.pilot.domain.model.ToolResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory browser exposing {@code navigate} and {@code getPageContext}.
 * While {@link #setDown(boolean) down}, navigation throws.
 */
public class FakeBrowser {

    private volatile String currentUrl = "about:blank";
    private volatile boolean down;
    private final List<String> navigations = new CopyOnWriteArrayList<>();

    public void setDown(boolean down) {
        this.down = down;
    }

    public String getCurrentUrl() {
        return currentUrl;
    }

    public List<String> navigations() {
        return navigations;
    }

    public ToolRegistry registry() {
        return ToolRegistry.of(List.of(navigateTool(), pageContextTool()));
    }

    public ToolComponent navigateTool() {
        return new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.object("navigate", "Open a URL",
                        Map.of("url", Map.of("type", "string")), List.of("url"));
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                String url = String.valueOf(parameters.get("url"));
                navigations.add(url);
                if (down) {
                    return CompletableFuture.failedFuture(new IllegalStateException("net::ERR_CONNECTION_REFUSED"));
                }
                currentUrl = url;
                return CompletableFuture.completedFuture(
                        ToolResult.success("Navigated to " + url, Map.of("url", url)));
            }
        };
    }

    public ToolComponent pageContextTool() {
        return new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.simple("getPageContext", "Read the current page");
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                Map<String, Object> page = new LinkedHashMap<>();
                page.put("url", currentUrl);
                page.put("title", "Example Domain");
                page.put("text", "Example text");
                return CompletableFuture.completedFuture(ToolResult.success("Page: " + currentUrl, page));
            }
        };
    }
}
