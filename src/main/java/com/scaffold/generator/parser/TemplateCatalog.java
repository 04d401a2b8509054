package com.scaffold.generator.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.exception.TemplateEngineException;
import com.scaffold.generator.model.Template;
import com.scaffold.generator.model.TemplateCategory;

import lombok.Value;

/**
 * Discovers template definitions under a set of directories.
 * Definitions that fail to load are logged and left out.
 */
public class TemplateCatalog {
    private static final Logger log = LoggerFactory.getLogger(TemplateCatalog.class);

    private final List<Path> directories;
    private final TemplateCache cache;

    public TemplateCatalog(List<Path> directories, TemplateCache cache) {
        this.directories = List.copyOf(directories);
        this.cache = cache;
    }

    /**
     * A discovered template and the file it came from.
     */
    @Value
    public static class Entry {
        Path path;
        Template template;
    }

    /**
     * All loadable templates, sorted by name.
     */
    public List<Entry> list() {
        List<Entry> entries = new ArrayList<>();
        for (Path directory : directories) {
            if (!Files.isDirectory(directory)) {
                log.warn("Template directory does not exist: {}", directory);
                continue;
            }
            try (Stream<Path> paths = Files.walk(directory)) {
                paths.filter(Files::isRegularFile)
                        .filter(TemplateLoader::isDefinitionFile)
                        .sorted()
                        .forEach(path -> load(path, entries));
            } catch (IOException e) {
                log.warn("Failed to scan template directory {}: {}", directory, e.getMessage());
            }
        }
        entries.sort(Comparator.comparing(e -> e.getTemplate().getName()));
        return entries;
    }

    public List<Entry> list(TemplateCategory category) {
        return list().stream()
                .filter(e -> e.getTemplate().getMetadata().getCategory() == category)
                .toList();
    }

    /**
     * Case-insensitive lookup by template name.
     */
    public Optional<Entry> findByName(String name) {
        return list().stream()
                .filter(e -> e.getTemplate().getName().equalsIgnoreCase(name))
                .findFirst();
    }

    public List<TemplateCategory> categories() {
        TreeSet<TemplateCategory> categories = new TreeSet<>();
        list().forEach(e -> categories.add(e.getTemplate().getMetadata().getCategory()));
        return List.copyOf(categories);
    }

    private void load(Path path, List<Entry> entries) {
        try {
            entries.add(new Entry(path, cache.getOrLoad(path)));
        } catch (TemplateEngineException e) {
            log.warn("Skipping template {}: {}", path, e.getMessage());
        }
    }
}
