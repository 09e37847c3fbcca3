package io.fullerstack.components.demo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Prefixes its input with {@code [Echo]}.
 */
public class EchoPlugin implements Plugin {

    private static final Logger logger = LoggerFactory.getLogger(EchoPlugin.class);

    private final String name;
    private final String version;

    public EchoPlugin() {
        this("echo", "1.0.0");
    }

    public EchoPlugin(String name, String version) {
        this.name = Objects.requireNonNull(name, "name");
        this.version = Objects.requireNonNull(version, "version");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void initialize() {
        logger.info("  Initializing {} v{}", name, version);
    }

    @Override
    public String execute(String input) {
        return "[Echo] " + input;
    }

    @Override
    public String version() {
        return version;
    }
}
