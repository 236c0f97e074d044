package com.raditha.rlint.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.raditha.rlint.model.RVersion;
import com.raditha.rlint.model.Rule;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Settings read from an {@code rlint.toml} file.
 * <p>
 * All keys live in a {@code [lint]} table:
 * <pre>
 * [lint]
 * select = ["CORR", "any_is_na"]
 * ignore = ["assignment"]
 * assignment = "&lt;-"
 * exclude = ["scratch/**"]
 * </pre>
 * Command-line options override these values, see {@link #toSelection}.
 */
public class LinterSettings {

    private static final Logger logger = LoggerFactory.getLogger(LinterSettings.class);

    public static final String FILE_NAME = "rlint.toml";
    private static final String TABLE = "lint";

    private final @Nullable Path source;
    private final @Nullable List<String> select;
    private final List<String> extendSelect;
    private final List<String> ignore;
    private final @Nullable List<String> fixable;
    private final List<String> unfixable;
    private final List<String> exclude;
    private final boolean defaultExclude;
    private final @Nullable String assignment;
    private final List<String> globals;
    private final List<String> exports;

    private LinterSettings(@Nullable Path source, Map<String, Object> lint) {
        this.source = source;
        this.select = lint.containsKey("select") ? getListString(lint, "select") : null;
        this.extendSelect = getListString(lint, "extend-select");
        this.ignore = getListString(lint, "ignore");
        this.fixable = lint.containsKey("fixable") ? getListString(lint, "fixable") : null;
        this.unfixable = getListString(lint, "unfixable");
        this.exclude = getListString(lint, "exclude");
        this.defaultExclude = getBoolean(lint, "default-exclude", true);
        this.assignment = getString(lint, "assignment", null);
        this.globals = getListString(lint, "globals");
        this.exports = getListString(lint, "exports");
    }

    /**
     * Settings used when no configuration file exists.
     */
    public static LinterSettings empty() {
        return new LinterSettings(null, Map.of());
    }

    /**
     * Load settings from a TOML file.
     *
     * @throws IOException if the file cannot be read or is not valid TOML
     */
    public static LinterSettings load(Path file) throws IOException {
        TomlMapper mapper = new TomlMapper();
        Map<String, Object> document = mapper.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {
        });
        Object table = document.get(TABLE);
        if (table == null) {
            logger.warn("{} has no [{}] table, using defaults", file, TABLE);
            return new LinterSettings(file, Map.of());
        }
        if (!(table instanceof Map)) {
            throw new IllegalArgumentException("[" + TABLE + "] in " + file + " must be a table");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> lint = (Map<String, Object>) table;
        logger.info("Loaded settings from {}", file);
        return new LinterSettings(file, lint);
    }

    /**
     * Find the nearest {@value #FILE_NAME} in {@code start} or one of its ancestors.
     */
    public static Optional<Path> find(Path start) {
        Path current = start.toAbsolutePath().normalize();
        if (Files.isRegularFile(current)) {
            current = current.getParent();
        }
        while (current != null) {
            Path candidate = current.resolve(FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    /**
     * Load the nearest settings file above {@code start}, or empty settings when none exists.
     */
    public static LinterSettings discover(Path start) throws IOException {
        Optional<Path> file = find(start);
        return file.isPresent() ? load(file.get()) : empty();
    }

    /**
     * Combine these settings with command-line selections. CLI {@code select}
     * replaces the file's, ignore lists from both places are unioned.
     */
    public RuleSelection toSelection(@Nullable List<String> cliSelect, List<String> cliExtendSelect,
            List<String> cliIgnore, @Nullable String minRVersion, Path projectPath, boolean fix, boolean fixOnly,
            boolean unsafeFixes) throws IOException {
        List<String> extend = concat(extendSelect, cliExtendSelect);
        List<String> ignored = concat(ignore, cliIgnore);
        RVersion version = minRVersion != null
                ? RVersion.parse(minRVersion)
                : DescriptionFile.minimumRVersion(projectPath).orElse(null);
        return new RuleSelection(cliSelect, select, extend, ignored, version, fix, fixOnly, unsafeFixes);
    }

    /**
     * Build the run configuration.
     *
     * @param enabledRules   the resolved rule set
     * @param cliAssignment  {@code --assignment} value, null when not given
     * @param unsafeFixes    whether unsafe fixes are allowed
     */
    public LinterConfig toConfig(Set<Rule> enabledRules,
            @Nullable String cliAssignment, boolean unsafeFixes) {
        String operator = cliAssignment != null ? cliAssignment : assignment;
        AssignmentOperator preferred = operator == null
                ? AssignmentOperator.LEFT_ARROW
                : AssignmentOperator.fromString(operator);
        return new LinterConfig(
                enabledRules,
                preferred,
                unsafeFixes,
                fixable == null ? null : RuleSelection.expand(fixable),
                RuleSelection.expand(unfixable),
                Set.copyOf(globals),
                Set.copyOf(exports));
    }

    public Optional<Path> source() {
        return Optional.ofNullable(source);
    }

    public List<String> exclude() {
        return exclude;
    }

    public boolean defaultExclude() {
        return defaultExclude;
    }

    public Optional<String> assignment() {
        return Optional.ofNullable(assignment);
    }

    public List<String> ignore() {
        return ignore;
    }

    public Optional<List<String>> select() {
        return Optional.ofNullable(select);
    }

    private static List<String> concat(List<String> first, List<String> second) {
        if (second == null || second.isEmpty()) {
            return first;
        }
        List<String> result = new ArrayList<>(first);
        result.addAll(second);
        return result;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        if (value != null) {
            throw new IllegalArgumentException("'" + key + "' must be an array of strings, got: " + value);
        }
        return List.of();
    }
}
