package org.corvo.engine.execution;

import org.corvo.engine.error.UndefinedSectionException;
import org.corvo.engine.error.UndefinedVariableException;
import org.corvo.engine.value.NumberValue;
import org.corvo.engine.value.StringValue;
import org.corvo.lang.dsl.Display;
import org.corvo.lang.dsl.Literal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentTest {

    private Environment global;

    @BeforeEach
    void setUp() {
        global = new Environment();
    }

    @Test
    void lookupOfUnassignedNameFails() {
        var e = assertThrows(UndefinedVariableException.class, () -> global.lookup("total"));
        assertTrue(e.getMessage().contains("'total'"), e.getMessage());
        assertFalse(global.isDefined("total"));
    }

    @Test
    void assignThenLookup() {
        global.assign("x", NumberValue.of(1));
        global.assign("x", StringValue.of("now text"));
        assertEquals(StringValue.of("now text"), global.lookup("x"));
    }

    @Test
    void loopScopeShadowsAndDisappears() {
        global.assign("item", NumberValue.of(0));
        Environment loop = global.newLoopScope();
        loop.define("item", NumberValue.of(5));
        assertEquals(NumberValue.of(5), loop.lookup("item"));
        assertEquals(NumberValue.of(0), global.lookup("item"));
    }

    @Test
    void assignmentInLoopScopeReachesGlobal() {
        Environment loop = global.newLoopScope();
        loop.define("n", NumberValue.of(1));
        loop.assign("total", NumberValue.of(10));
        loop.assign("n", NumberValue.of(2));
        assertEquals(NumberValue.of(10), global.lookup("total"));
        assertFalse(global.isDefined("n"));
        assertEquals(NumberValue.of(2), loop.lookup("n"));
    }

    @Test
    void assignmentUpdatesOuterVariable() {
        global.assign("count", NumberValue.of(1));
        global.newLoopScope().assign("count", NumberValue.of(2));
        assertEquals(NumberValue.of(2), global.lookup("count"));
    }

    @Test
    void sectionsAreSharedAndLastDefinitionWins() {
        Environment loop = global.newLoopScope();
        loop.defineSection("greet", List.of(new Display(Literal.string("hi"), 1)));
        assertTrue(global.hasSection("greet"));
        global.defineSection("greet", List.of());
        assertTrue(loop.section("greet").isEmpty());
    }

    @Test
    void undefinedSection() {
        var e = assertThrows(UndefinedSectionException.class, () -> global.section("report"));
        assertTrue(e.getMessage().contains("'report'"), e.getMessage());
    }

    @Test
    void variablesMergesScopes() {
        global.assign("a", NumberValue.of(1));
        Environment loop = global.newLoopScope();
        loop.define("b", NumberValue.of(2));
        assertEquals(List.of("a", "b"), List.copyOf(loop.variables().keySet()));
        assertEquals(List.of("a"), List.copyOf(global.variables().keySet()));
    }
}
