package io.fullerstack.components.demo;

import io.fullerstack.components.bootstrap.GlobalRegistry;
import io.fullerstack.components.registry.ComponentRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PluginSystemDemoTest {

    @Test
    void shouldEchoAndReverse() {
        assertThat(new EchoPlugin().execute("abc")).isEqualTo("[Echo] abc");
        assertThat(new ReversePlugin().execute("abc")).isEqualTo("cba");
        assertThat(new ReversePlugin().execute("a😀b")).isEqualTo("b😀a");
    }

    @Test
    void shouldReportPluginIdentity() {
        EchoPlugin echo = new EchoPlugin();

        assertThat(echo.name()).isEqualTo("echo");
        assertThat(echo.version()).isEqualTo("1.0.0");
        assertThat(echo.moduleType()).isEqualTo(Plugin.MODULE_TYPE);
        assertThat(new ReversePlugin().version()).isEqualTo("1.0.0");
    }

    @Test
    void shouldRunEveryStepAgainstLocalRegistry() {
        Map<String, String> outputs = new PluginSystemDemo(new ComponentRegistry()).run();

        assertThat(outputs).containsExactly(
            Map.entry("echo", "[Echo] Hello, World!"),
            Map.entry("reverse", "!dlroW ,olleH"));
    }

    @Test
    void shouldUseProviderPluginsFromGlobalRegistry() {
        ComponentRegistry global = GlobalRegistry.global();
        PluginSystemDemo demo = new PluginSystemDemo(global);

        assertThat(global.has(DemoPluginProvider.GLOBAL_ECHO)).isTrue();
        assertThat(demo.discoverPlugins())
            .containsExactly(DemoPluginProvider.GLOBAL_REVERSE, DemoPluginProvider.GLOBAL_ECHO);

        assertThat(demo.useGlobalRegistry()).isEqualTo("[Echo] Global test");
        assertThat(global.has(PluginSystemDemo.RUNTIME_ECHO)).isFalse();
    }
}
