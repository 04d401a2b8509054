package com.scaffold.generator.model.structure;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.scaffold.generator.model.SchemaRules;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A directory in the template tree. Children are owned by value; there are no
 * parent links.
 */
@Value
public class DirectoryItem {

    public static final String DEFAULT_PERMISSIONS = "755";

    /** May embed placeholders. */
    String name;

    String permissions;
    ConditionalExpression condition;
    List<FileItem> files;
    List<DirectoryItem> directories;

    @Builder
    public DirectoryItem(String name, String permissions, ConditionalExpression condition,
                         @Singular List<FileItem> files, @Singular List<DirectoryItem> directories) {
        this.name = SchemaRules.requireItemName("name", name, false);
        this.permissions = SchemaRules.requirePermissions("permissions",
                permissions != null ? permissions : DEFAULT_PERMISSIONS);
        this.condition = condition;
        this.files = SchemaRules.copyOrEmpty(files);
        this.directories = SchemaRules.copyOrEmpty(directories);
    }

    /**
     * Files of this directory and of every descendant, depth-first.
     */
    public List<FileItem> getAllFiles() {
        List<FileItem> all = new ArrayList<>(files);
        for (DirectoryItem child : directories) {
            all.addAll(child.getAllFiles());
        }
        return all;
    }

    /**
     * Every descendant directory, not including this one.
     */
    public List<DirectoryItem> getAllDirectories() {
        List<DirectoryItem> all = new ArrayList<>(directories);
        for (DirectoryItem child : directories) {
            all.addAll(child.getAllDirectories());
        }
        return all;
    }

    public Optional<FileItem> findFile(String fileName) {
        return getAllFiles().stream().filter(f -> f.getName().equals(fileName)).findFirst();
    }

    public Optional<DirectoryItem> findDirectory(String directoryName) {
        return getAllDirectories().stream().filter(d -> d.getName().equals(directoryName)).findFirst();
    }

    /**
     * Number of files and directories below this one.
     */
    public int countItems() {
        int total = files.size() + directories.size();
        for (DirectoryItem child : directories) {
            total += child.countItems();
        }
        return total;
    }
}
