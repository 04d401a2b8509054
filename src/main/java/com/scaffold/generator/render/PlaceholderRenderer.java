package com.scaffold.generator.render;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.scaffold.generator.condition.Expression;
import com.scaffold.generator.condition.ExpressionException;
import com.scaffold.generator.condition.ExpressionParser;
import com.scaffold.generator.condition.ValueComparator;
import com.scaffold.generator.exception.RenderingException;
import com.scaffold.generator.model.variable.StringFilter;

/**
 * Substitutes {@code {{ expression | filter | ... }}} placeholders in names,
 * inline content and conditions.
 *
 * <p>{@code {% raw %}...{% endraw %}} blocks are copied verbatim with the
 * markers removed, so content meant for another templating system can be
 * shipped untouched. {@code {% if %}}, {@code {% elif %}}, {@code {% else %}}
 * and {@code {% endif %}} select sections of the text; a block tag alone on
 * its line leaves no blank line behind, and {@code {%-}} / {@code -%}} trim
 * all surrounding whitespace.
 */
public class PlaceholderRenderer {

    private static final Pattern RAW_BLOCK = Pattern.compile(
            "\\{%-?\\s*raw\\s*-?%}(.*?)\\{%-?\\s*endraw\\s*-?%}", Pattern.DOTALL);

    /** A raw block (group 1) or an if/elif/else/endif tag (groups 2 to 5). */
    private static final Pattern BLOCK_OR_TAG = Pattern.compile(
            RAW_BLOCK.pattern() + "|\\{%(-?)\\s*(if|elif|else|endif)\\b(.*?)(-?)%}", Pattern.DOTALL);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(.*?)}}");

    /** {@code {{ identifier }}} with optional filters; the shape checked for undefined references. */
    private static final Pattern SIMPLE_REFERENCE = Pattern.compile(
            "\\{\\{\\s*([a-zA-Z_][a-zA-Z0-9_]*)\\s*(?:\\|[^{}]*)?}}");

    private static final Pattern CONDITION_TAG = Pattern.compile(
            "\\{%-?\\s*(?:if|elif)\\b(.*?)-?%}", Pattern.DOTALL);

    private static final Pattern FILTER_CALL = Pattern.compile(
            "([a-zA-Z_][a-zA-Z0-9_]*)\\s*(?:\\((.*)\\))?", Pattern.DOTALL);

    private static final String DEFAULT_FILTER = "default";

    private static final Pattern DEFAULTED = Pattern.compile("\\|\\s*default\\b");

    /**
     * Renders text, failing on any variable missing from the map.
     */
    public String render(String text, Map<String, ?> variables) {
        return render(text, variables, true);
    }

    /**
     * Renders text, substituting an empty string for missing variables.
     */
    public String renderLenient(String text, Map<String, ?> variables) {
        return render(text, variables, false);
    }

    public boolean containsPlaceholders(String text) {
        return text != null && PLACEHOLDER.matcher(text).find();
    }

    /**
     * Names referenced as {@code {{ name }}} or {@code {{ name | filter }}}
     * outside raw blocks, in order of first appearance. Placeholders with a
     * {@code default} filter tolerate a missing variable and are left out.
     */
    public Set<String> findReferences(String text) {
        Set<String> names = new LinkedHashSet<>();
        if (text == null) {
            return names;
        }
        Matcher matcher = SIMPLE_REFERENCE.matcher(stripRawBlocks(text));
        while (matcher.find()) {
            if (!DEFAULTED.matcher(matcher.group()).find()) {
                names.add(matcher.group(1));
            }
        }
        return names;
    }

    /**
     * Expressions of the {@code {% if %}} and {@code {% elif %}} tags outside
     * raw blocks, as written.
     */
    public List<String> findConditions(String text) {
        List<String> conditions = new ArrayList<>();
        if (text == null) {
            return conditions;
        }
        Matcher matcher = CONDITION_TAG.matcher(stripRawBlocks(text));
        while (matcher.find()) {
            conditions.add(matcher.group(1).trim());
        }
        return conditions;
    }

    /**
     * Evaluates the inside of a single placeholder, filters included.
     * A {@code default(...)} filter replaces a missing or null value, and
     * makes a missing variable acceptable even in strict mode.
     */
    public Object evaluate(String placeholderBody, Map<String, ?> variables, boolean strict) {
        List<String> parts = splitFilters(placeholderBody);
        List<Matcher> filters = new ArrayList<>();
        boolean hasDefault = false;
        for (String part : parts.subList(1, parts.size())) {
            Matcher call = FILTER_CALL.matcher(part.trim());
            if (!call.matches()) {
                throw new RenderingException("Malformed filter '" + part.trim() + "' in placeholder '{{" + placeholderBody + "}}'");
            }
            hasDefault |= DEFAULT_FILTER.equals(call.group(1));
            filters.add(call);
        }

        Object value = evaluateExpression(parts.get(0), placeholderBody, variables, strict && !hasDefault);
        for (Matcher call : filters) {
            String filterName = call.group(1);
            String argument = call.group(2);
            if (DEFAULT_FILTER.equals(filterName)) {
                if (value == null) {
                    value = argument == null || argument.isBlank()
                            ? ""
                            : evaluateExpression(argument, placeholderBody, variables, strict);
                }
                continue;
            }
            Optional<StringFilter> filter = StringFilter.find(filterName);
            if (filter.isEmpty()) {
                throw new RenderingException("Unknown filter '" + filterName + "' in placeholder '{{" + placeholderBody + "}}'");
            }
            if (argument != null) {
                throw new RenderingException("Filter '" + filterName + "' takes no arguments in placeholder '{{" + placeholderBody + "}}'");
            }
            value = filter.get().apply(toText(value));
        }
        return value;
    }

    /**
     * Text form of a resolved value: booleans as {@code true}/{@code false},
     * collections joined with {@code ", "}, {@code null} as empty.
     */
    public static String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(PlaceholderRenderer::toText).collect(Collectors.joining(", "));
        }
        return String.valueOf(value);
    }

    static String stripRawBlocks(String text) {
        return RAW_BLOCK.matcher(text).replaceAll("");
    }

    /**
     * Splits a placeholder body on {@code |} outside quoted strings and parentheses.
     */
    static List<String> splitFilters(String body) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        int depth = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (quote != 0) {
                current.append(c);
                if (c == '\\' && i + 1 < body.length()) {
                    current.append(body.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && depth > 0) {
                depth--;
            } else if (c == '|' && depth == 0) {
                parts.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        parts.add(current.toString());
        return parts;
    }

    private Object evaluateExpression(String source, String placeholderBody, Map<String, ?> variables, boolean strict) {
        try {
            Expression expression = ExpressionParser.parse(source.trim());
            return expression.evaluate(variables, strict);
        } catch (ExpressionException e) {
            throw new RenderingException("Cannot render placeholder '{{" + placeholderBody + "}}': " + e.getMessage(), e);
        }
    }

    private String render(String text, Map<String, ?> variables, boolean strict) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        for (Node node : parse(text)) {
            node.render(this, variables, strict, out);
        }
        return out.toString();
    }

    private List<Node> parse(String text) {
        List<Node> top = new ArrayList<>();
        Deque<IfNode> open = new ArrayDeque<>();
        Matcher matcher = BLOCK_OR_TAG.matcher(text);
        int last = 0;
        boolean trimNext = false;
        boolean skipNewline = false;
        while (matcher.find()) {
            String before = text.substring(last, matcher.start());
            if (trimNext) {
                before = before.stripLeading();
            } else if (skipNewline) {
                before = dropLeadingNewline(before);
            }
            trimNext = false;
            skipNewline = false;
            last = matcher.end();

            List<Node> target = open.isEmpty() ? top : open.peek().currentBody();
            if (matcher.group(1) != null) {
                target.add(new TextNode(before, false));
                target.add(new TextNode(matcher.group(1), true));
                continue;
            }

            boolean trimBefore = !matcher.group(2).isEmpty();
            before = trimBefore ? before.stripTrailing() : stripIndent(before, text, matcher.start());
            target.add(new TextNode(before, false));

            String keyword = matcher.group(3);
            String argument = matcher.group(4).trim();
            switch (keyword) {
                case "if" -> {
                    IfNode node = new IfNode();
                    node.addBranch(parseCondition(argument));
                    target.add(node);
                    open.push(node);
                }
                case "elif" -> requireOpen(open, keyword).addBranch(parseCondition(argument));
                case "else" -> requireOpen(open, keyword).addBranch(null);
                default -> {
                    requireOpen(open, keyword);
                    open.pop();
                }
            }
            trimNext = !matcher.group(5).isEmpty();
            skipNewline = true;
        }
        if (!open.isEmpty()) {
            throw new RenderingException("Unclosed '{% if %}' block: missing '{% endif %}'");
        }
        String tail = text.substring(last);
        if (trimNext) {
            tail = tail.stripLeading();
        } else if (skipNewline) {
            tail = dropLeadingNewline(tail);
        }
        top.add(new TextNode(tail, false));
        return top;
    }

    private static IfNode requireOpen(Deque<IfNode> open, String keyword) {
        if (open.isEmpty()) {
            throw new RenderingException("'{% " + keyword + " %}' without a matching '{% if %}'");
        }
        return open.peek();
    }

    private static Expression parseCondition(String source) {
        try {
            return ExpressionParser.parse(source);
        } catch (ExpressionException e) {
            throw new RenderingException("Invalid condition '{% if " + source + " %}': " + e.getMessage(), e);
        }
    }

    private static String dropLeadingNewline(String text) {
        if (text.startsWith("\r\n")) {
            return text.substring(2);
        }
        return text.startsWith("\n") ? text.substring(1) : text;
    }

    /** Removes the spaces and tabs before a block tag that starts its line. */
    private static String stripIndent(String before, String text, int tagStart) {
        int i = tagStart;
        while (i > 0 && (text.charAt(i - 1) == ' ' || text.charAt(i - 1) == '\t')) {
            i--;
        }
        if (i > 0 && text.charAt(i - 1) != '\n') {
            return before;
        }
        return before.substring(0, Math.max(0, before.length() - (tagStart - i)));
    }

    private interface Node {
        void render(PlaceholderRenderer renderer, Map<String, ?> variables, boolean strict, StringBuilder out);
    }

    private static final class TextNode implements Node {
        private final String text;
        private final boolean verbatim;

        TextNode(String text, boolean verbatim) {
            this.text = text;
            this.verbatim = verbatim;
        }

        @Override
        public void render(PlaceholderRenderer renderer, Map<String, ?> variables, boolean strict, StringBuilder out) {
            if (verbatim) {
                out.append(text);
            } else if (!text.isEmpty()) {
                out.append(renderer.substitute(text, variables, strict));
            }
        }
    }

    private static final class IfNode implements Node {
        /** Branch conditions in order; {@code null} marks the else branch. */
        private final List<Expression> conditions = new ArrayList<>();
        private final List<List<Node>> bodies = new ArrayList<>();

        void addBranch(Expression condition) {
            if (!conditions.isEmpty() && conditions.get(conditions.size() - 1) == null) {
                throw new RenderingException("'{% elif %}' or '{% else %}' after '{% else %}'");
            }
            conditions.add(condition);
            bodies.add(new ArrayList<>());
        }

        List<Node> currentBody() {
            return bodies.get(bodies.size() - 1);
        }

        @Override
        public void render(PlaceholderRenderer renderer, Map<String, ?> variables, boolean strict, StringBuilder out) {
            for (int i = 0; i < conditions.size(); i++) {
                Expression condition = conditions.get(i);
                if (condition == null || holds(condition, variables, strict)) {
                    for (Node node : bodies.get(i)) {
                        node.render(renderer, variables, strict, out);
                    }
                    return;
                }
            }
        }

        private static boolean holds(Expression condition, Map<String, ?> variables, boolean strict) {
            try {
                return ValueComparator.isTruthy(condition.evaluate(variables, strict));
            } catch (ExpressionException e) {
                throw new RenderingException("Cannot evaluate '{% if " + condition + " %}': " + e.getMessage(), e);
            }
        }
    }

    private String substitute(String segment, Map<String, ?> variables, boolean strict) {
        Matcher matcher = PLACEHOLDER.matcher(segment);
        StringBuilder out = new StringBuilder(segment.length());
        while (matcher.find()) {
            Object value = evaluate(matcher.group(1), variables, strict);
            matcher.appendReplacement(out, Matcher.quoteReplacement(toText(value)));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
