package com.scaffold.generator.model.structure;

import java.util.List;
import java.util.Optional;

import com.scaffold.generator.model.SchemaRules;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * The external template-file collection of a template.
 */
@Value
public class TemplateFiles {

    public static final TemplateFiles EMPTY = new TemplateFiles(List.of());

    List<TemplateFile> files;

    @Builder
    public TemplateFiles(@Singular List<TemplateFile> files) {
        this.files = SchemaRules.copyOrEmpty(files);
    }

    public Optional<TemplateFile> find(String name) {
        return files.stream().filter(f -> f.getName().equals(name)).findFirst();
    }

    public List<String> getNames() {
        return files.stream().map(TemplateFile::getName).toList();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
