package com.scaffold.generator.render;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.condition.ConditionEvaluator;
import com.scaffold.generator.exception.RenderingException;
import com.scaffold.generator.model.Template;
import com.scaffold.generator.model.structure.DirectoryItem;
import com.scaffold.generator.model.structure.FileItem;
import com.scaffold.generator.model.structure.TemplateFile;
import com.scaffold.generator.resolve.LicenseTextProvider;
import com.scaffold.generator.resolve.SystemVariables;
import com.scaffold.generator.util.FileWriteUtil;

/**
 * Materializes a template's directory tree onto disk.
 *
 * <p>A run checks the output path, walks the tree depth-first (parent before
 * children), then renders the standalone template files. A failure on a
 * tree file aborts the run; a failure on a standalone template file is
 * recorded in the statistics and the run continues.
 */
public class RenderingEngine {
    private static final Logger log = LoggerFactory.getLogger(RenderingEngine.class);

    private final PlaceholderRenderer placeholderRenderer;
    private final ConditionEvaluator conditionEvaluator;
    private final TemplateFileRenderer templateFileRenderer;
    private final LicenseTextProvider licenseTextProvider;
    private final Clock clock;

    public RenderingEngine() {
        this(LicenseTextProvider.NONE, Clock.systemDefaultZone());
    }

    public RenderingEngine(LicenseTextProvider licenseTextProvider, Clock clock) {
        this.placeholderRenderer = new PlaceholderRenderer();
        this.conditionEvaluator = new ConditionEvaluator(placeholderRenderer);
        this.templateFileRenderer = new TemplateFileRenderer(placeholderRenderer);
        this.licenseTextProvider = licenseTextProvider;
        this.clock = clock;
    }

    /**
     * Renders the template into {@code outputPath}.
     *
     * @param variables resolved variables; system variables are added on top
     * @throws RenderingException when the output directory is not empty and
     *         {@code overwrite} is false, or when a tree file cannot be rendered
     */
    public RenderStats render(Template template, Map<String, Object> variables, Path outputPath, boolean overwrite) {
        log.info("Rendering project '{}' to: {}", template.getName(), outputPath);
        checkOutputPath(outputPath, overwrite);

        Map<String, Object> context = SystemVariables
                .forTemplate(template.getMetadata(), licenseTextProvider, clock)
                .mergeInto(variables);
        RenderStats stats = new RenderStats();

        try {
            Files.createDirectories(outputPath);
        } catch (IOException e) {
            throw new RenderingException("Cannot create output directory " + outputPath + ": " + e.getMessage(), stats, e);
        }

        RenderRun run = new RenderRun(template, context, overwrite, stats);
        run.renderDirectory(template.getStructure().getRootDirectory(), outputPath);
        run.renderTemplateFiles(outputPath);

        log.info("Project rendering complete: {} files, {} directories created",
                stats.getFilesCreated(), stats.getDirectoriesCreated());
        return stats;
    }

    private void checkOutputPath(Path outputPath, boolean overwrite) {
        if (Files.exists(outputPath) && !Files.isDirectory(outputPath)) {
            throw new RenderingException("Output path is not a directory: " + outputPath);
        }
        if (overwrite) {
            return;
        }
        try {
            if (FileWriteUtil.isNonEmptyDirectory(outputPath)) {
                throw new RenderingException("Output directory is not empty: " + outputPath);
            }
        } catch (IOException e) {
            throw new RenderingException("Cannot inspect output directory " + outputPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * State of a single render invocation.
     */
    private final class RenderRun {
        private final Template template;
        private final Map<String, Object> variables;
        private final boolean overwrite;
        private final RenderStats stats;
        /** Files written by this run; a later item rendering to one of them is skipped. */
        private final Set<Path> written = new HashSet<>();

        RenderRun(Template template, Map<String, Object> variables, boolean overwrite, RenderStats stats) {
            this.template = template;
            this.variables = variables;
            this.overwrite = overwrite;
            this.stats = stats;
        }

        void renderDirectory(DirectoryItem directory, Path parentPath) {
            if (!conditionEvaluator.evaluate(directory.getCondition(), variables)) {
                log.debug("Directory '{}' skipped due to condition", directory.getName());
                return;
            }

            Path dirPath;
            boolean created = false;
            try {
                dirPath = resolveChild(parentPath, placeholderRenderer.render(directory.getName(), variables));
                if (!Files.exists(dirPath)) {
                    Files.createDirectories(dirPath);
                    created = true;
                    stats.directoryCreated();
                    log.debug("Created directory: {}", dirPath);
                }
            } catch (IOException | RuntimeException e) {
                throw fail("Failed to create directory '" + directory.getName() + "': " + e.getMessage(), e);
            }

            for (FileItem file : directory.getFiles()) {
                renderFile(file, dirPath);
            }
            for (DirectoryItem child : directory.getDirectories()) {
                renderDirectory(child, dirPath);
            }

            // after the children, so read-only directories can still be filled
            if (created) {
                applyPermissions(dirPath, directory.getPermissions());
            }
        }

        void renderFile(FileItem file, Path parentPath) {
            if (!conditionEvaluator.evaluate(file.getCondition(), variables)) {
                log.debug("File '{}' skipped due to condition", file.getName());
                stats.fileSkipped();
                return;
            }

            try {
                Path filePath = resolveChild(parentPath, placeholderRenderer.render(file.getName(), variables));
                if (written.contains(filePath)) {
                    log.warn("File '{}' renders to {} which this run already wrote, skipping", file.getName(), filePath);
                    stats.fileSkipped();
                    return;
                }
                boolean existed = Files.exists(filePath);
                if (existed && !overwrite) {
                    log.warn("File exists, skipping: {}", filePath);
                    stats.fileSkipped();
                    return;
                }

                writeContent(file, filePath);
                written.add(filePath);
                applyPermissions(filePath, file.getFinalPermissions());

                if (existed) {
                    stats.fileOverwritten();
                } else {
                    stats.fileCreated();
                }
                log.debug("{} file: {}", existed ? "Overwrote" : "Created", filePath);
            } catch (IOException | RuntimeException e) {
                throw fail("Failed to render file '" + file.getName() + "': " + e.getMessage(), e);
            }
        }

        private void writeContent(FileItem file, Path filePath) throws IOException {
            switch (file.getContentSource()) {
                case INLINE -> FileWriteUtil.safeWriteString(filePath,
                        placeholderRenderer.render(file.getContent(), variables), charsetOf(file));
                case TEMPLATE_FILE -> {
                    TemplateFile templateFile = template.getTemplateFiles().find(file.getTemplateFile())
                            .orElseThrow(() -> new RenderingException("Template file not found: " + file.getTemplateFile()));
                    FileWriteUtil.safeWriteString(filePath,
                            templateFileRenderer.render(templateFile, variables), charsetOf(file));
                }
                case SOURCE_FILE -> FileWriteUtil.safeWriteBytes(filePath, Files.readAllBytes(sourcePath(file)));
                case BINARY -> FileWriteUtil.safeWriteBytes(filePath, file.decodeBinaryContent());
            }
        }

        /**
         * Standalone pass over the template-file collection. Entries used by a
         * tree file are written only when they declare an explicit output path.
         */
        void renderTemplateFiles(Path outputPath) {
            Set<String> referenced = template.getStructure().getAllFiles().stream()
                    .map(FileItem::getTemplateFile)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toSet());

            for (TemplateFile templateFile : template.getTemplateFiles().getFiles()) {
                if (referenced.contains(templateFile.getName()) && templateFile.getOutputPath() == null) {
                    continue;
                }
                try {
                    Path target = resolveChild(outputPath,
                            placeholderRenderer.render(templateFile.getEffectiveOutputPath(), variables));
                    if (written.contains(target)) {
                        log.warn("Template file '{}' renders to {} which this run already wrote, skipping",
                                templateFile.getName(), target);
                        stats.fileSkipped();
                        continue;
                    }
                    boolean existed = Files.exists(target);
                    if (existed && !overwrite) {
                        log.warn("Template file exists, skipping: {}", target);
                        stats.fileSkipped();
                        continue;
                    }
                    String content = templateFileRenderer.render(templateFile, variables);
                    FileWriteUtil.safeWriteString(target, content, templateFile.getEncoding().getCharset() != null
                            ? templateFile.getEncoding().getCharset() : StandardCharsets.UTF_8);
                    written.add(target);
                    if (existed) {
                        stats.fileOverwritten();
                    } else {
                        stats.fileCreated();
                    }
                    log.debug("Rendered template file: {}", target);
                } catch (IOException | RuntimeException e) {
                    String message = "Failed to render template file '" + templateFile.getName() + "': " + e.getMessage();
                    log.error(message);
                    stats.error(message);
                }
            }
        }

        private Path sourcePath(FileItem file) {
            if (template.getSourceDirectory() == null) {
                throw new RenderingException("Cannot read source file '" + file.getSourceFile()
                        + "': template was not loaded from a directory");
            }
            return template.getSourceDirectory().resolve(file.getSourceFile());
        }

        private RenderingException fail(String message, Exception cause) {
            log.error(message);
            stats.error(message);
            return new RenderingException(message, stats, cause);
        }
    }

    private static Path resolveChild(Path parent, String renderedName) {
        Path child = parent.resolve(renderedName).normalize();
        if (renderedName.isBlank() || !child.startsWith(parent.normalize())) {
            throw new RenderingException("Rendered name '" + renderedName + "' escapes " + parent);
        }
        return child;
    }

    private static Charset charsetOf(FileItem file) {
        Charset charset = file.getEncoding().getCharset();
        return charset != null ? charset : StandardCharsets.UTF_8;
    }

    private static void applyPermissions(Path path, String permissions) {
        try {
            FileWriteUtil.setPermissions(path, permissions);
            log.debug("Set permissions {} on: {}", permissions, path);
        } catch (UnsupportedOperationException e) {
            log.debug("Filesystem does not support POSIX permissions, leaving {} as is", path);
        } catch (IOException e) {
            log.warn("Failed to set permissions on {}: {}", path, e.getMessage());
        }
    }
}
