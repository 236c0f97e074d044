package com.raditha.rlint.semantic;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Names that are always in scope: the attached base packages plus any names
 * configured by the user.
 */
public final class Globals {

    private static final String RESOURCE = "/r-globals.txt";
    private static Globals base;

    private final Set<String> names;

    private Globals(Set<String> names) {
        this.names = Set.copyOf(names);
    }

    /**
     * The bundled list of base R names.
     */
    public static synchronized Globals base() {
        if (base == null) {
            base = new Globals(load());
        }
        return base;
    }

    public static Globals of(Collection<String> names) {
        return new Globals(new HashSet<>(names));
    }

    public Globals with(Collection<String> additional) {
        if (additional.isEmpty()) {
            return this;
        }
        Set<String> merged = new HashSet<>(names);
        merged.addAll(additional);
        return new Globals(merged);
    }

    public boolean contains(String name) {
        return names.contains(name) || name.equals("...") || name.matches("\\.\\.[0-9]+");
    }

    public int size() {
        return names.size();
    }

    private static Set<String> load() {
        Set<String> loaded = new HashSet<>();
        try (InputStream in = Globals.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + RESOURCE);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                String name = line.trim();
                if (!name.isEmpty() && !name.startsWith("#")) {
                    loaded.add(name);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return loaded;
    }
}
