package io.fullerstack.components.demo;

import io.fullerstack.components.registry.ComponentFactory;
import io.fullerstack.components.registry.ComponentMetadata;
import io.fullerstack.components.registry.Registration;
import io.fullerstack.components.spi.ComponentProvider;

import java.util.Collection;
import java.util.List;

/**
 * Contributes the demo plugins to the global registry.
 * <p>
 * Registered in {@code META-INF/services/io.fullerstack.components.spi.ComponentProvider}.
 */
public class DemoPluginProvider implements ComponentProvider {

    public static final String GLOBAL_ECHO = "plugin.global-echo";
    public static final String GLOBAL_REVERSE = "plugin.global-reverse";

    @Override
    public Collection<Registration> registrations() {
        return List.of(
            new Registration(GLOBAL_ECHO, Plugin.MODULE_TYPE,
                ComponentFactory.of(Plugin.class, () -> new EchoPlugin(GLOBAL_ECHO, "1.0.0")),
                ComponentMetadata.builder()
                    .implementation(EchoPlugin.class)
                    .factoryName("DemoPluginProvider#echo")
                    .sourceLocation(DemoPluginProvider.class.getName())
                    .capabilities("text", "stateless")
                    .build()),
            new Registration(GLOBAL_REVERSE, Plugin.MODULE_TYPE,
                ComponentFactory.of(Plugin.class, () -> new ReversePlugin(GLOBAL_REVERSE)),
                ComponentMetadata.builder()
                    .implementation(ReversePlugin.class)
                    .factoryName("DemoPluginProvider#reverse")
                    .sourceLocation(DemoPluginProvider.class.getName())
                    .capabilities("text", "stateless", "unicode")
                    .build()));
    }
}
