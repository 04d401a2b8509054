package com.scaffold.generator.cli;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.model.TemplateCategory;
import com.scaffold.generator.model.TemplateMetadata;
import com.scaffold.generator.parser.TemplateCache;
import com.scaffold.generator.parser.TemplateCatalog;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "list",
        mixinStandardHelpOptions = true,
        description = "Lists the template definitions found in one or more directories."
)
public class ListTemplatesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListTemplatesCommand.class);

    @Option(names = {"--dir", "-d"}, defaultValue = "templates", split = ",",
            description = "Directories to search (comma-separated, default: templates)")
    private List<Path> directories;

    @Option(names = {"--category", "-c"}, description = "Only templates of this category: ${COMPLETION-CANDIDATES}")
    private TemplateCategory category;

    @Override
    public Integer call() {
        TemplateCatalog catalog = new TemplateCatalog(directories, new TemplateCache());
        List<TemplateCatalog.Entry> entries = category == null ? catalog.list() : catalog.list(category);
        if (entries.isEmpty()) {
            log.info("No templates found in {}", directories);
            return 0;
        }
        for (TemplateCatalog.Entry entry : entries) {
            TemplateMetadata m = entry.getTemplate().getMetadata();
            log.info("{} {} [{}] - {}", m.getName(), m.getVersion(), m.getCategory().getValue(), m.getDescription());
            log.info("    {}", entry.getPath());
        }
        return 0;
    }
}
