package io.fullerstack.components.demo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reverses its input, code point by code point.
 */
public class ReversePlugin implements Plugin {

    private static final Logger logger = LoggerFactory.getLogger(ReversePlugin.class);

    private final String name;

    public ReversePlugin() {
        this("reverse");
    }

    public ReversePlugin(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void initialize() {
        logger.info("  Initializing {}", name);
    }

    @Override
    public String execute(String input) {
        int[] codePoints = input.codePoints().toArray();
        StringBuilder reversed = new StringBuilder(input.length());
        for (int i = codePoints.length - 1; i >= 0; i--) {
            reversed.appendCodePoint(codePoints[i]);
        }
        return reversed.toString();
    }

    @Override
    public String version() {
        return "1.0.0";
    }
}
