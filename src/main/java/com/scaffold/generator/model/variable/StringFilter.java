package com.scaffold.generator.model.variable;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import com.scaffold.generator.exception.TemplateSchemaException;
import com.scaffold.generator.util.NamingUtil;

/**
 * Name-transform operations usable as variable filters and in
 * {@code {{ name | filter }}} placeholders.
 */
public enum StringFilter {
    SNAKE_CASE("snake_case", NamingUtil::toSnakeCase),
    KEBAB_CASE("kebab_case", NamingUtil::toKebabCase),
    CAMEL_CASE("camel_case", NamingUtil::toCamelCase),
    PASCAL_CASE("pascal_case", NamingUtil::toPascalCase),
    UPPER("upper", s -> s.toUpperCase(Locale.ROOT)),
    LOWER("lower", s -> s.toLowerCase(Locale.ROOT)),
    TITLE("title", NamingUtil::toTitleCase),
    CAPITALIZE("capitalize", NamingUtil::capitalize),
    STRIP("strip", String::strip),
    SLUGIFY("slugify", NamingUtil::slugify),
    SANITIZE("sanitize", NamingUtil::sanitize),
    REPLACE_SPACES("replace_spaces", s -> s.replace(' ', '_')),
    NORMALIZE_PATH("normalize_path", NamingUtil::normalizePath);

    private final String value;
    private final UnaryOperator<String> transform;

    StringFilter(String value, UnaryOperator<String> transform) {
        this.value = value;
        this.transform = transform;
    }

    public String getValue() {
        return value;
    }

    public String apply(String input) {
        return input == null ? null : transform.apply(input);
    }

    public static Optional<StringFilter> find(String value) {
        return Arrays.stream(values()).filter(f -> f.value.equals(value)).findFirst();
    }

    public static StringFilter fromValue(String value) {
        return find(value).orElseThrow(() -> new TemplateSchemaException("filters",
                "unsupported filter '" + value + "', supported: "
                        + Arrays.stream(values()).map(StringFilter::getValue).collect(Collectors.joining(", "))));
    }
}
