package io.fullerstack.components;

/**
 * Base capability contract for anything served through a
 * {@link io.fullerstack.components.registry.ComponentRegistry}.
 * <p>
 * Applications define their own capability interfaces by extending this one
 * (for example {@code interface Plugin extends Component}) and register factories
 * producing implementations of it. The registry never inspects instance state;
 * these accessors exist so that call sites can identify what they were handed.
 * <p>
 * <strong>Example:</strong>
 * <pre>
 * public interface TextProcessor extends Component {
 *     String process(String input);
 * }
 *
 * registry.register("uppercase", "text_processor",
 *     ComponentFactory.of(TextProcessor.class, UpperCaseProcessor::new));
 *
 * TextProcessor processor = registry.create("uppercase", TextProcessor.class);
 * </pre>
 */
public interface Component {

    /**
     * Unique component name, normally the name it was registered under.
     *
     * @return component name
     */
    String name();

    /**
     * Coarse type tag (e.g. "plugin", "processor", "provider").
     *
     * @return module type
     */
    String moduleType();
}
