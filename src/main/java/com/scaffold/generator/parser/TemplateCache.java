package com.scaffold.generator.parser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.model.Template;

/**
 * Loaded templates keyed by canonical source path. A single lock guards
 * every read and insert; cached templates are read-only.
 */
public class TemplateCache {
    private static final Logger log = LoggerFactory.getLogger(TemplateCache.class);

    private final TemplateLoader loader;
    private final Map<Path, Template> templates = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public TemplateCache() {
        this(new TemplateLoader());
    }

    public TemplateCache(TemplateLoader loader) {
        this.loader = loader;
    }

    /**
     * Returns the cached template for the path, loading it on first use.
     * Load failures are not cached.
     */
    public Template getOrLoad(Path path) {
        Path key = canonical(path);
        lock.lock();
        try {
            Template cached = templates.get(key);
            if (cached != null) {
                log.debug("Template cache hit: {}", key);
                return cached;
            }
            Template loaded = loader.load(key);
            templates.put(key, loaded);
            log.debug("Cached template '{}' from {}", loaded.getName(), key);
            return loaded;
        } finally {
            lock.unlock();
        }
    }

    public boolean invalidate(Path path) {
        Path key = canonical(path);
        lock.lock();
        try {
            return templates.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            templates.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return templates.size();
        } finally {
            lock.unlock();
        }
    }

    public List<Path> cachedPaths() {
        lock.lock();
        try {
            return List.copyOf(templates.keySet());
        } finally {
            lock.unlock();
        }
    }

    private static Path canonical(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            // missing files still get a stable key; the loader reports them
            return path.toAbsolutePath().normalize();
        }
    }
}
