package com.arrmcp.tools;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private final ToolRegistry registry = new ToolRegistry();

    @Test
    void lookupReturnsRegisteredDefinition() {
        var def = new ToolDefinition("Echo", "Echoes input",
                Map.of("msg", ParamSpec.required(ParamType.STRING, "text to echo")));
        registry.register(def, req -> req.input().get("msg"));

        var found = registry.lookup("Echo");
        assertTrue(found.isPresent());
        assertEquals(def, found.get());
        assertTrue(registry.lookup("Missing").isEmpty());
        assertTrue(registry.lookup(null).isEmpty());
    }

    @Test
    void secondRegistrationReplacesFirst() throws Exception {
        registry.register(new ToolDefinition("Echo", "first"), req -> TextNode.valueOf("one"));
        registry.register(new ToolDefinition("Echo", "second"), req -> TextNode.valueOf("two"));

        assertEquals(1, registry.listAll().size());
        assertEquals("second", registry.lookup("Echo").orElseThrow().description());
        var handler = registry.resolve("Echo").orElseThrow().handler();
        assertEquals("two", handler.handle(new ToolRequest("Echo", null)).asText());
    }

    @Test
    void listAllIsASnapshot() {
        registry.register(new ToolDefinition("A", "a"), req -> null);
        var snapshot = registry.listAll();
        registry.register(new ToolDefinition("B", "b"), req -> null);

        assertEquals(1, snapshot.size());
        assertEquals(2, registry.listAll().size());
    }

    @Test
    void emptyRegistryListsNothing() {
        assertTrue(registry.listAll().isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    void concurrentRegistrationAndLookup() throws Exception {
        var pool = Executors.newFixedThreadPool(8);
        var start = new CountDownLatch(1);
        var futures = new ArrayList<java.util.concurrent.Future<?>>();
        for (int i = 0; i < 200; i++) {
            var name = "tool-" + (i % 50);
            futures.add(pool.submit(() -> {
                start.await();
                registry.register(new ToolDefinition(name, "d"), req -> null);
                assertTrue(registry.lookup(name).isPresent());
                registry.listAll();
                return null;
            }));
        }
        start.countDown();
        for (var f : futures) f.get(10, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(50, registry.size());
    }

    @Test
    void definitionRejectsBlankName() {
        assertThrows(IllegalArgumentException.class, () -> new ToolDefinition(" ", "x"));
    }
}
