package com.scaffold.generator.render;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

import com.scaffold.generator.exception.RenderingException;
import com.scaffold.generator.model.structure.TemplateFile;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders entries of a template's external template-file collection. The
 * resolved variables are the data model; {@code .ftl} files go through
 * FreeMarker and {@code .j2} files through the placeholder renderer.
 */
public class TemplateFileRenderer {

    private final Configuration freemarkerConfig;
    private final PlaceholderRenderer placeholderRenderer;

    public TemplateFileRenderer() {
        this(new PlaceholderRenderer());
    }

    public TemplateFileRenderer(PlaceholderRenderer placeholderRenderer) {
        this.freemarkerConfig = createFreemarkerConfig();
        this.placeholderRenderer = placeholderRenderer;
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        cfg.setBooleanFormat("c");
        cfg.setNumberFormat("computer");
        return cfg;
    }

    public String render(TemplateFile templateFile, Map<String, ?> variables) {
        if (templateFile.usesPlaceholderSyntax()) {
            try {
                return placeholderRenderer.render(templateFile.getContent(), variables);
            } catch (RenderingException e) {
                throw new RenderingException("Failed to render template file '" + templateFile.getName() + "': "
                        + e.getMessage(), e);
            }
        }
        try {
            Template template = new Template(templateFile.getName(), templateFile.getContent(), freemarkerConfig);
            StringWriter out = new StringWriter();
            template.process(variables, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new RenderingException("Failed to render template file '" + templateFile.getName() + "': "
                    + e.getMessage(), e);
        }
    }
}
