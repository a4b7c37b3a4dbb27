package it.unimib.datai.fnship.cli.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named deployment contexts and the one selected by default.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Config {
    private String currentContext;
    private Map<String, Context> contexts = new LinkedHashMap<>();

    public String getCurrentContext() {
        return currentContext;
    }

    public void setCurrentContext(String currentContext) {
        this.currentContext = currentContext;
    }

    public Map<String, Context> getContexts() {
        return contexts;
    }

    public void setContexts(Map<String, Context> contexts) {
        this.contexts = (contexts == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(contexts);
    }

    /** Returns the context stored under {@code name}, adding an empty one first if there is none. */
    public Context contextOrNew(String name) {
        return contexts.computeIfAbsent(name, k -> new Context());
    }

    /** Selects {@code name} as the current context; it must already exist. */
    public void useContext(String name) {
        if (!contexts.containsKey(name)) {
            throw new IllegalArgumentException("Unknown context: " + name);
        }
        currentContext = name;
    }
}
