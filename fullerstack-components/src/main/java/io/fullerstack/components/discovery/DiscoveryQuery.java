package io.fullerstack.components.discovery;

import io.fullerstack.components.registry.ComponentDescriptor;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable query over registered components. Every filter that is set must hold
 * (logical AND); unset filters match everything.
 * <p>
 * Optional capabilities never filter. They only rank: see {@link ComponentDiscovery}.
 *
 * <pre>
 * DiscoveryQuery query = DiscoveryQuery.builder()
 *     .namePrefix("storage.")
 *     .moduleType("provider")
 *     .require("read", "write")
 *     .prefer("cache")
 *     .build();
 * </pre>
 */
public final class DiscoveryQuery {

    private final String namePrefix;
    private final String nameContains;
    private final String namePattern;
    private final Pattern compiledPattern;
    private final String moduleType;
    private final Set<String> requiredCapabilities;
    private final Set<String> optionalCapabilities;

    private DiscoveryQuery(Builder builder) {
        this.namePrefix = builder.namePrefix;
        this.nameContains = builder.nameContains;
        this.namePattern = builder.namePattern;
        this.compiledPattern = builder.namePattern != null ? globToRegex(builder.namePattern) : null;
        this.moduleType = builder.moduleType;
        this.requiredCapabilities = Set.copyOf(builder.required);
        this.optionalCapabilities = Set.copyOf(builder.optional);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Query matching every component.
     */
    public static DiscoveryQuery all() {
        return builder().build();
    }

    /**
     * Tests the filters (not the ranking) against one descriptor.
     *
     * @param descriptor candidate
     * @return true if every set filter holds
     */
    public boolean matches(ComponentDescriptor descriptor) {
        String name = descriptor.name();
        if (namePrefix != null && !name.startsWith(namePrefix)) {
            return false;
        }
        if (nameContains != null && !name.contains(nameContains)) {
            return false;
        }
        if (compiledPattern != null && !compiledPattern.matcher(name).matches()) {
            return false;
        }
        if (moduleType != null && !moduleType.equals(descriptor.moduleType())) {
            return false;
        }
        return descriptor.metadata().capabilities().containsAll(requiredCapabilities);
    }

    /**
     * Number of optional capabilities the descriptor declares.
     *
     * @param descriptor candidate
     * @return optional-tag match count
     */
    public int score(ComponentDescriptor descriptor) {
        Set<String> declared = descriptor.metadata().capabilities();
        int score = 0;
        for (String capability : optionalCapabilities) {
            if (declared.contains(capability)) {
                score++;
            }
        }
        return score;
    }

    public String namePrefix() {
        return namePrefix;
    }

    public String nameContains() {
        return nameContains;
    }

    public String namePattern() {
        return namePattern;
    }

    public String moduleType() {
        return moduleType;
    }

    public Set<String> requiredCapabilities() {
        return requiredCapabilities;
    }

    public Set<String> optionalCapabilities() {
        return optionalCapabilities;
    }

    // '*' matches any run of characters, '?' exactly one; everything else is literal
    private static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }

    @Override
    public String toString() {
        return "DiscoveryQuery[prefix=" + namePrefix + ", contains=" + nameContains + ", pattern=" + namePattern
            + ", type=" + moduleType + ", required=" + requiredCapabilities + ", optional=" + optionalCapabilities + "]";
    }

    /**
     * Builder for {@link DiscoveryQuery}.
     */
    public static final class Builder {

        private String namePrefix;
        private String nameContains;
        private String namePattern;
        private String moduleType;
        private final Set<String> required = new LinkedHashSet<>();
        private final Set<String> optional = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder namePrefix(String prefix) {
            this.namePrefix = Objects.requireNonNull(prefix, "prefix");
            return this;
        }

        public Builder nameContains(String fragment) {
            this.nameContains = Objects.requireNonNull(fragment, "fragment");
            return this;
        }

        /**
         * Glob over the whole name: {@code *} for any run of characters, {@code ?} for one.
         */
        public Builder namePattern(String glob) {
            this.namePattern = Objects.requireNonNull(glob, "glob");
            return this;
        }

        public Builder moduleType(String moduleType) {
            this.moduleType = Objects.requireNonNull(moduleType, "moduleType");
            return this;
        }

        public Builder require(String... capabilities) {
            for (String capability : capabilities) {
                required.add(Objects.requireNonNull(capability, "capability"));
            }
            return this;
        }

        public Builder require(Collection<String> capabilities) {
            capabilities.forEach(this::require);
            return this;
        }

        public Builder prefer(String... capabilities) {
            for (String capability : capabilities) {
                optional.add(Objects.requireNonNull(capability, "capability"));
            }
            return this;
        }

        public Builder prefer(Collection<String> capabilities) {
            capabilities.forEach(this::prefer);
            return this;
        }

        public DiscoveryQuery build() {
            return new DiscoveryQuery(this);
        }
    }
}
