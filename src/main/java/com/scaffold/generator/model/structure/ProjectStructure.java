package com.scaffold.generator.model.structure;

import java.util.ArrayList;
import java.util.List;

import com.scaffold.generator.exception.TemplateSchemaException;

import lombok.Builder;
import lombok.Value;

/**
 * The directory/file tree of a template, rooted at one directory.
 */
@Value
public class ProjectStructure {

    DirectoryItem rootDirectory;

    @Builder
    public ProjectStructure(DirectoryItem rootDirectory) {
        if (rootDirectory == null) {
            throw new TemplateSchemaException("root_directory", "is required");
        }
        this.rootDirectory = rootDirectory;
    }

    public List<FileItem> getAllFiles() {
        return rootDirectory.getAllFiles();
    }

    /**
     * The root directory followed by every descendant directory.
     */
    public List<DirectoryItem> getAllDirectories() {
        List<DirectoryItem> all = new ArrayList<>();
        all.add(rootDirectory);
        all.addAll(rootDirectory.getAllDirectories());
        return all;
    }

    public int countItems() {
        return 1 + rootDirectory.countItems();
    }
}
