package org.corvo.engine.execution;

import org.corvo.engine.error.UndefinedSectionException;
import org.corvo.engine.error.UndefinedVariableException;
import org.corvo.engine.value.Value;
import org.corvo.lang.dsl.CorvoStatement;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Variable store and section table for one program run.
 *
 * The global scope holds every variable a program assigns. Loop scopes are
 * created only by "for each" and hold nothing but the loop's item variable;
 * assignments to any other name inside a loop (or a section called from it)
 * go to the scope that already holds the name, or to the global scope.
 * The section table is shared by all scopes.
 */
public final class Environment {

    private final Environment enclosing;
    private final Map<String, Value> variables = new LinkedHashMap<>();
    private final Map<String, List<CorvoStatement>> sections;

    /**
     * Creates an empty global environment.
     */
    public Environment() {
        this.enclosing = null;
        this.sections = new HashMap<>();
    }

    private Environment(Environment enclosing) {
        this.enclosing = enclosing;
        this.sections = enclosing.sections;
    }

    /**
     * @return A child scope for a loop's item variable
     */
    public Environment newLoopScope() {
        return new Environment(this);
    }

    /**
     * Looks a variable up, innermost scope first.
     *
     * @throws UndefinedVariableException if no scope holds the name
     */
    public Value lookup(String name) {
        for (Environment scope = this; scope != null; scope = scope.enclosing) {
            Value value = scope.variables.get(name);
            if (value != null) {
                return value;
            }
        }
        throw new UndefinedVariableException("'" + name + "' has not been given a value yet");
    }

    public boolean isDefined(String name) {
        for (Environment scope = this; scope != null; scope = scope.enclosing) {
            if (scope.variables.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Binds a value to a name, overwriting it in the scope that already holds
     * it or creating it in the global scope.
     */
    public void assign(String name, Value value) {
        for (Environment scope = this; scope != null; scope = scope.enclosing) {
            if (scope.variables.containsKey(name)) {
                scope.variables.put(name, value);
                return;
            }
        }
        global().variables.put(name, value);
    }

    /**
     * Binds a value in this scope only.
     */
    public void define(String name, Value value) {
        variables.put(name, value);
    }

    /**
     * Registers a section body; a later definition replaces an earlier one.
     */
    public void defineSection(String name, List<CorvoStatement> body) {
        sections.put(name, List.copyOf(body));
    }

    /**
     * @throws UndefinedSectionException if no section has that name
     */
    public List<CorvoStatement> section(String name) {
        List<CorvoStatement> body = sections.get(name);
        if (body == null) {
            throw new UndefinedSectionException("No section named '" + name + "' has been defined");
        }
        return body;
    }

    public boolean hasSection(String name) {
        return sections.containsKey(name);
    }

    /**
     * @return Copy of all visible variables, inner scopes shadowing outer ones
     */
    public Map<String, Value> variables() {
        Map<String, Value> visible = enclosing != null ? enclosing.variables() : new LinkedHashMap<>();
        visible.putAll(variables);
        return visible;
    }

    private Environment global() {
        Environment scope = this;
        while (scope.enclosing != null) {
            scope = scope.enclosing;
        }
        return scope;
    }
}
