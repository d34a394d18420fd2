package uk.gegc.coursesync.features.markup.application.placeholder;

import java.util.Map;
import java.util.Optional;

/**
 * Includes and variables of one course, loaded once per run.
 */
public class SharedContent implements IncludeResolver, VariableResolver {

    private final Map<String, String> includes;
    private final Map<String, String> variables;

    public SharedContent(Map<String, String> includes, Map<String, String> variables) {
        this.includes = Map.copyOf(includes);
        this.variables = Map.copyOf(variables);
    }

    public static SharedContent empty() {
        return new SharedContent(Map.of(), Map.of());
    }

    @Override
    public Optional<String> include(String name) {
        return Optional.ofNullable(includes.get(name));
    }

    @Override
    public Optional<String> variable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public Map<String, String> includes() {
        return includes;
    }

    public Map<String, String> variables() {
        return variables;
    }
}
