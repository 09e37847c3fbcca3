package io.fullerstack.components.demo;

import io.fullerstack.components.Component;

/**
 * Capability served by the plugin registry.
 */
public interface Plugin extends Component {

    String MODULE_TYPE = "plugin";

    /**
     * Called once before the first {@link #execute(String)}.
     */
    void initialize();

    /**
     * @param input text to process
     * @return processed text
     */
    String execute(String input);

    String version();

    @Override
    default String moduleType() {
        return MODULE_TYPE;
    }
}
