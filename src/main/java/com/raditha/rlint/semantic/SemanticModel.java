package com.raditha.rlint.semantic;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The resolved scopes, bindings and references of one file.
 * <p>
 * All three are kept in arenas indexed by their id; links between them are ids,
 * never object references. Scope 0 is the file scope.
 */
public class SemanticModel {

    private final List<Scope> scopes;
    private final List<Binding> bindings;
    private final List<Reference> references;

    public SemanticModel(List<Scope> scopes, List<Binding> bindings, List<Reference> references) {
        if (scopes.isEmpty()) {
            throw new IllegalArgumentException("A semantic model needs at least the file scope");
        }
        this.scopes = List.copyOf(scopes);
        this.bindings = List.copyOf(bindings);
        this.references = List.copyOf(references);
    }

    public List<Scope> scopes() {
        return scopes;
    }

    public List<Binding> bindings() {
        return bindings;
    }

    public List<Reference> references() {
        return references;
    }

    public Scope rootScope() {
        return scopes.get(0);
    }

    public Scope scope(int id) {
        return scopes.get(id);
    }

    public Binding binding(int id) {
        return bindings.get(id);
    }

    public Reference reference(int id) {
        return references.get(id);
    }

    public Optional<Binding> resolvedBinding(Reference reference) {
        return reference.bindingId() == null ? Optional.empty() : Optional.of(bindings.get(reference.bindingId()));
    }

    public List<Binding> bindingsNamed(String name) {
        return bindings.stream().filter(b -> b.name().equals(name)).toList();
    }

    public long readCount(Binding binding) {
        return binding.referenceIds().stream().map(references::get).filter(Reference::isRead).count();
    }

    /**
     * The innermost scope whose range contains {@code offset}.
     */
    public Scope scopeAt(int offset) {
        Scope innermost = rootScope();
        for (Scope scope : scopes) {
            if (scope.range().start() <= offset && offset <= scope.range().end()
                    && scope.range().length() <= innermost.range().length()) {
                innermost = scope;
            }
        }
        return innermost;
    }

    /**
     * Bindings never read, in source order. Writes such as {@code x[1] <- 2} do
     * not count as uses.
     *
     * @param exports names visible outside the file, which are never reported
     */
    public List<Binding> unusedBindings(Set<String> exports) {
        List<Binding> unused = new ArrayList<>();
        for (Binding binding : bindings) {
            if (!exports.contains(binding.name()) && readCount(binding) == 0) {
                unused.add(binding);
            }
        }
        unused.sort(Comparator.comparingInt(b -> b.range().start()));
        return unused;
    }

    /**
     * Reads that matched neither a binding nor a global, in source order.
     */
    public List<Reference> unresolvedReferences() {
        List<Reference> unresolved = new ArrayList<>();
        for (Reference reference : references) {
            if (reference.isRead() && reference.resolution() == Resolution.UNRESOLVED) {
                unresolved.add(reference);
            }
        }
        unresolved.sort(Comparator.comparingInt(r -> r.range().start()));
        return unresolved;
    }
}
