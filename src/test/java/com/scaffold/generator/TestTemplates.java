package com.scaffold.generator;

import java.nio.file.Path;
import java.util.List;

import com.scaffold.generator.model.Template;
import com.scaffold.generator.model.TemplateCategory;
import com.scaffold.generator.model.TemplateMetadata;
import com.scaffold.generator.model.structure.DirectoryItem;
import com.scaffold.generator.model.structure.ProjectStructure;
import com.scaffold.generator.model.variable.TemplateVariable;

/**
 * Small builders shared by the unit tests.
 */
public final class TestTemplates {

    private TestTemplates() {
    }

    public static TemplateMetadata metadata() {
        return TemplateMetadata.builder()
                .name("Test Template")
                .description("Template used by unit tests")
                .version("1.0.0")
                .category(TemplateCategory.CUSTOM)
                .author("Tester")
                .build();
    }

    public static Template template(DirectoryItem root, TemplateVariable... variables) {
        return Template.builder()
                .metadata(metadata())
                .variables(List.of(variables))
                .structure(ProjectStructure.builder().rootDirectory(root).build())
                .build();
    }

    public static Path fixture(String relativePath) {
        return Path.of("src", "test", "resources", "templates").resolve(relativePath);
    }
}
