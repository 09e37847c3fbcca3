package io.fullerstack.components.demo;

import io.fullerstack.components.bootstrap.GlobalRegistry;
import io.fullerstack.components.discovery.ComponentDiscovery;
import io.fullerstack.components.discovery.DiscoveryQuery;
import io.fullerstack.components.registry.ComponentFactory;
import io.fullerstack.components.registry.ComponentMetadata;
import io.fullerstack.components.registry.ComponentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plugin system walkthrough on top of the component registry.
 * <p>
 * <b>Steps:</b>
 * <ol>
 *   <li>Create a local registry</li>
 *   <li>Register plugins with metadata</li>
 *   <li>List plugins with their metadata</li>
 *   <li>Initialize every plugin</li>
 *   <li>Execute every plugin</li>
 *   <li>Existence checks</li>
 *   <li>Use the global registry (plugins contributed by {@link DemoPluginProvider})</li>
 *   <li>Discover plugins by capability</li>
 * </ol>
 */
public class PluginSystemDemo {

    private static final Logger logger = LoggerFactory.getLogger(PluginSystemDemo.class);

    static final String INPUT = "Hello, World!";
    static final String RUNTIME_ECHO = "plugin.runtime-echo";

    private final ComponentRegistry global;

    public PluginSystemDemo(ComponentRegistry global) {
        this.global = global;
    }

    public static void main(String[] args) {
        logger.info("=== Component Registry: Plugin System Example ===");
        new PluginSystemDemo(GlobalRegistry.global()).run();
        logger.info("=== Example completed successfully ===");
    }

    /**
     * Runs every step.
     *
     * @return plugin name to output of executing it on {@value #INPUT}, local registry only
     */
    public Map<String, String> run() {
        ComponentRegistry registry = createRegistry();
        registerPlugins(registry);
        listPlugins(registry);
        initializePlugins(registry);
        Map<String, String> outputs = executePlugins(registry);
        checkExistence(registry);
        useGlobalRegistry();
        discoverPlugins();
        return outputs;
    }

    ComponentRegistry createRegistry() {
        section(1, "Creating Plugin Registry");
        ComponentRegistry registry = new ComponentRegistry();
        logger.info("Registry created with {} plugins", registry.count());
        return registry;
    }

    void registerPlugins(ComponentRegistry registry) {
        section(2, "Registering Plugins");
        registry.register("echo", Plugin.MODULE_TYPE,
            ComponentFactory.of(Plugin.class, EchoPlugin::new),
            ComponentMetadata.builder()
                .implementation(EchoPlugin.class)
                .factoryName("EchoPlugin::new")
                .sourceLocation("demo/plugins/echo")
                .capabilities("text")
                .build());
        registry.register("reverse", Plugin.MODULE_TYPE,
            ComponentFactory.of(Plugin.class, ReversePlugin::new),
            ComponentMetadata.builder()
                .implementation(ReversePlugin.class)
                .factoryName("ReversePlugin::new")
                .sourceLocation("demo/plugins/reverse")
                .capabilities("text", "unicode")
                .build());
        logger.info("Registered {} plugins", registry.count());
    }

    void listPlugins(ComponentRegistry registry) {
        section(3, "Available Plugins");
        for (String name : registry.list()) {
            registry.lookup(name).ifPresent(descriptor -> {
                logger.info("  - {} ({})", descriptor.name(), descriptor.moduleType());
                logger.info("    Implementation: {}", descriptor.metadata().implementationName());
                logger.info("    Source: {}", descriptor.metadata().sourceLocation());
            });
        }
    }

    void initializePlugins(ComponentRegistry registry) {
        section(4, "Initializing Plugins");
        for (String name : registry.list()) {
            registry.create(name, Plugin.class).initialize();
        }
    }

    Map<String, String> executePlugins(ComponentRegistry registry) {
        section(5, "Executing Plugins");
        logger.info("Input: \"{}\"", INPUT);
        Map<String, String> outputs = new LinkedHashMap<>();
        for (String name : registry.list()) {
            Plugin plugin = registry.create(name, Plugin.class);
            String output = plugin.execute(INPUT);
            logger.info("  {} -> \"{}\"", plugin.name(), output);
            outputs.put(name, output);
        }
        return outputs;
    }

    void checkExistence(ComponentRegistry registry) {
        section(6, "Plugin Existence Checks");
        for (String name : List.of("echo", "reverse", "missing")) {
            logger.info("Has '{}' plugin? {}", name, registry.has(name));
        }
    }

    /**
     * @return output of the runtime-registered global plugin
     */
    String useGlobalRegistry() {
        section(7, "Using Global Registry");
        global.register(RUNTIME_ECHO, Plugin.MODULE_TYPE,
            ComponentFactory.of(Plugin.class, () -> new EchoPlugin(RUNTIME_ECHO, "1.0.0")));
        try {
            logger.info("Global registry has {} modules", global.count());
            String result = global.create(RUNTIME_ECHO, Plugin.class).execute("Global test");
            logger.info("Global plugin output: {}", result);
            return result;
        } finally {
            global.unregister(RUNTIME_ECHO);
        }
    }

    /**
     * @return global plugins declaring "text", ranked by "unicode"
     */
    List<String> discoverPlugins() {
        section(8, "Discovering Plugins");
        ComponentDiscovery discovery = new ComponentDiscovery(global);
        List<String> found = discovery.find(DiscoveryQuery.builder()
            .moduleType(Plugin.MODULE_TYPE)
            .require("text")
            .prefer("unicode")
            .build());
        for (String name : found) {
            logger.info("  {} -> \"{}\"", name, global.create(name, Plugin.class).execute(INPUT));
        }
        return found;
    }

    private static void section(int number, String title) {
        logger.info("");
        logger.info("{}. {}", number, title);
        logger.info("{}", "-".repeat(title.length() + 3));
    }
}
