package com.raditha.rlint.semantic;

import com.raditha.rlint.syntax.SyntaxTree;
import com.raditha.rlint.syntax.TextRange;
import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles a {@link SemanticModel} from the ordered events of
 * {@link SemanticEventExtractor}.
 * <p>
 * The events are consumed in order to build the scope arena and bindings.
 * References are resolved once every scope has been closed, against the full
 * binding set of each scope on the chain, so that a function body can refer to
 * a name bound later in an enclosing scope. Within a scope the binding in
 * effect is the latest one declared before the reference in event order, or
 * the first binding when all of them come later. A super-assignment to a
 * name that no enclosing scope binds declares it in the file scope.
 */
public class SemanticModelBuilder {

    private static final class ScopeData {
        final int id;
        final Integer parentId;
        TextRange range;
        final Map<String, List<Integer>> bindingsByName = new LinkedHashMap<>();

        ScopeData(int id, Integer parentId, TextRange range) {
            this.id = id;
            this.parentId = parentId;
            this.range = range;
        }
    }

    private record BindingData(int scopeId, String name, TextRange range, BindingKind kind, int sequence) {
    }

    private record PendingReference(SemanticEvent.Reference event, int scopeId, int sequence) {
    }

    private final Globals globals;

    public SemanticModelBuilder(Globals globals) {
        this.globals = globals;
    }

    public static SemanticModel build(SyntaxTree tree, Globals globals) {
        return new SemanticModelBuilder(globals).build(SemanticEventExtractor.extract(tree));
    }

    public SemanticModel build(List<SemanticEvent> events) {
        List<ScopeData> scopes = new ArrayList<>();
        List<BindingData> bindings = new ArrayList<>();
        List<PendingReference> pending = new ArrayList<>();
        Deque<ScopeData> stack = new ArrayDeque<>();

        for (int sequence = 0; sequence < events.size(); sequence++) {
            SemanticEvent event = events.get(sequence);
            if (event instanceof SemanticEvent.OpenScope open) {
                Integer parentId = stack.isEmpty() ? null : stack.peek().id;
                if (parentId == null && !scopes.isEmpty()) {
                    throw new IllegalStateException("Second root scope opened at " + open.range());
                }
                ScopeData scope = new ScopeData(scopes.size(), parentId, open.range());
                scopes.add(scope);
                stack.push(scope);
            } else if (event instanceof SemanticEvent.CloseScope close) {
                if (stack.isEmpty()) {
                    throw new IllegalStateException("Scope closed at " + close.range() + " was never opened");
                }
                stack.pop().range = close.range();
            } else if (event instanceof SemanticEvent.DeclareBinding declare) {
                ScopeData scope = requireOpen(stack, declare.range());
                scope.bindingsByName.computeIfAbsent(declare.name(), k -> new ArrayList<>()).add(bindings.size());
                bindings.add(new BindingData(scope.id, declare.name(), declare.range(), declare.kind(), sequence));
            } else if (event instanceof SemanticEvent.Reference reference) {
                pending.add(new PendingReference(reference, requireOpen(stack, reference.range()).id, sequence));
            }
        }
        if (!stack.isEmpty()) {
            throw new IllegalStateException(stack.size() + " scope(s) left open");
        }
        declareGlobalSuperAssignments(pending, scopes, bindings);

        List<List<Integer>> referencesPerBinding = new ArrayList<>();
        bindings.forEach(b -> referencesPerBinding.add(new ArrayList<>()));
        List<Reference> references = new ArrayList<>();
        for (PendingReference reference : pending) {
            int id = references.size();
            Integer bindingId = resolve(reference, scopes, bindings);
            Resolution resolution;
            if (bindingId != null) {
                resolution = Resolution.BOUND;
                referencesPerBinding.get(bindingId).add(id);
            } else if (globals.contains(reference.event().name())) {
                resolution = Resolution.GLOBAL;
            } else {
                resolution = Resolution.UNRESOLVED;
            }
            SemanticEvent.Reference event = reference.event();
            references.add(new Reference(id, reference.scopeId(), event.name(), event.range(), event.kind(),
                    event.callee(), resolution, bindingId));
        }

        return new SemanticModel(freezeScopes(scopes), freezeBindings(bindings, referencesPerBinding), references);
    }

    /**
     * A {@code <<-} whose name no enclosing scope binds creates the variable in
     * the global environment, so it becomes a binding of the file scope.
     */
    private static void declareGlobalSuperAssignments(List<PendingReference> pending, List<ScopeData> scopes,
            List<BindingData> bindings) {
        if (scopes.isEmpty()) {
            return;
        }
        ScopeData root = scopes.get(0);
        for (PendingReference reference : pending) {
            SemanticEvent.Reference event = reference.event();
            if (!event.superAssignment() || resolve(reference, scopes, bindings) != null) {
                continue;
            }
            root.bindingsByName.computeIfAbsent(event.name(), k -> new ArrayList<>()).add(bindings.size());
            bindings.add(new BindingData(root.id, event.name(), event.range(), BindingKind.SUPER_ASSIGNMENT,
                    reference.sequence()));
        }
    }

    private static ScopeData requireOpen(Deque<ScopeData> stack, TextRange at) {
        if (stack.isEmpty()) {
            throw new IllegalStateException("Event at " + at + " outside of any scope");
        }
        return stack.peek();
    }

    private static @Nullable Integer resolve(PendingReference reference, List<ScopeData> scopes,
            List<BindingData> bindings) {
        ScopeData scope = scopes.get(reference.scopeId());
        if (reference.event().superAssignment() && scope.parentId != null) {
            scope = scopes.get(scope.parentId);
        }
        while (scope != null) {
            List<Integer> candidates = scope.bindingsByName.get(reference.event().name());
            if (candidates != null && !candidates.isEmpty()) {
                Integer chosen = candidates.get(0);
                for (Integer candidate : candidates) {
                    if (bindings.get(candidate).sequence() < reference.sequence()) {
                        chosen = candidate;
                    }
                }
                return chosen;
            }
            scope = scope.parentId == null ? null : scopes.get(scope.parentId);
        }
        return null;
    }

    private static List<Scope> freezeScopes(List<ScopeData> scopes) {
        List<Scope> result = new ArrayList<>();
        for (ScopeData data : scopes) {
            Map<String, List<Integer>> bindingsByName = new LinkedHashMap<>();
            data.bindingsByName.forEach((name, ids) -> bindingsByName.put(name, List.copyOf(ids)));
            result.add(new Scope(data.id, data.parentId, data.range, Collections.unmodifiableMap(bindingsByName)));
        }
        return result;
    }

    private static List<Binding> freezeBindings(List<BindingData> bindings, List<List<Integer>> references) {
        List<Binding> result = new ArrayList<>();
        for (int i = 0; i < bindings.size(); i++) {
            BindingData data = bindings.get(i);
            result.add(new Binding(i, data.scopeId(), data.name(), data.range(), data.kind(),
                    List.copyOf(references.get(i))));
        }
        return result;
    }
}
