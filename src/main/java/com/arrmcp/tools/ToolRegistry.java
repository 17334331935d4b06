package com.arrmcp.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory tool table. Registration is exclusive, lookups share the read lock.
 * A second registration under the same name replaces the first.
 */
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, RegisteredTool> tools = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public void register(ToolDefinition definition, Handler handler) {
        var entry = new RegisteredTool(definition, handler);
        RegisteredTool previous;
        lock.writeLock().lock();
        try {
            previous = tools.put(definition.name(), entry);
        } finally {
            lock.writeLock().unlock();
        }
        if (previous != null) {
            log.warn("Tool {} re-registered, previous definition replaced", definition.name());
        } else {
            log.info("Registered tool: {}", definition.name());
        }
    }

    public Optional<ToolDefinition> lookup(String name) {
        return resolve(name).map(RegisteredTool::definition);
    }

    public Optional<RegisteredTool> resolve(String name) {
        if (name == null) return Optional.empty();
        lock.readLock().lock();
        try {
            return Optional.ofNullable(tools.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ToolDefinition> listAll() {
        lock.readLock().lock();
        try {
            var defs = new ArrayList<ToolDefinition>(tools.size());
            for (var t : tools.values()) defs.add(t.definition());
            return defs;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return tools.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
