package io.fullerstack.components.registry;

import java.util.Set;

/**
 * Captures the first stack frame outside the registry and its wrappers as {@code Class:line}.
 */
final class CallerLocation {

    private static final StackWalker WALKER = StackWalker.getInstance();

    private static final Set<String> SKIPPED = Set.of(
        CallerLocation.class.getName(),
        ComponentRegistry.class.getName(),
        "io.fullerstack.components.security.SecureComponents");

    private CallerLocation() {
    }

    static String capture() {
        return WALKER.walk(frames -> frames
            .filter(frame -> !SKIPPED.contains(frame.getClassName()))
            .findFirst()
            .map(frame -> frame.getClassName() + ":" + frame.getLineNumber())
            .orElse("unknown"));
    }
}
