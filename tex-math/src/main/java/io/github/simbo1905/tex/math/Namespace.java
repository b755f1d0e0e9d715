package io.github.simbo1905.tex.math;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/// A scoped space of names (macros, or any other named value).
///
/// Local assignments are undone when the group they were made in ends. Each
/// open group keeps one undo frame recording the value a name had before its
/// first local assignment in that group; a `null` entry means "was undefined".
/// Global assignments drop the name from every frame and then pin the new
/// value into the innermost frame, so closing groups cannot undo them.
final class Namespace<V> {

    private final Map<String, V> current;
    private final Map<String, V> builtins;
    private final Deque<Map<String, V>> undoStack = new ArrayDeque<>();

    Namespace(Map<String, V> builtins, Map<String, V> globals) {
        this.builtins = Objects.requireNonNull(builtins, "builtins must not be null");
        this.current = new HashMap<>(Objects.requireNonNull(globals, "globals must not be null"));
    }

    Namespace(Map<String, V> builtins) {
        this(builtins, Map.of());
    }

    void beginGroup() {
        undoStack.push(new HashMap<>());
    }

    /// Restores every name assigned locally since the matching [#beginGroup()].
    void endGroup() {
        if (undoStack.isEmpty()) {
            throw new TexParseException(
                "Unbalanced namespace destruction: attempt to pop global namespace");
        }
        final Map<String, V> undo = undoStack.pop();
        for (final var entry : undo.entrySet()) {
            if (entry.getValue() == null) {
                current.remove(entry.getKey());
            } else {
                current.put(entry.getKey(), entry.getValue());
            }
        }
    }

    /// Closes all open groups; used when unwinding after an error.
    void endGroups() {
        while (!undoStack.isEmpty()) {
            endGroup();
        }
    }

    int depth() {
        return undoStack.size();
    }

    boolean has(String name) {
        return current.containsKey(name) || builtins.containsKey(name);
    }

    V get(String name) {
        final V value = current.get(name);
        return value != null ? value : builtins.get(name);
    }

    /// Assigns `value` (null undefines) locally, or in every group when `global`.
    void set(String name, V value, boolean global) {
        if (global) {
            for (final Map<String, V> undo : undoStack) {
                undo.remove(name);
            }
            if (!undoStack.isEmpty()) {
                undoStack.peek().put(name, value);
            }
        } else {
            final Map<String, V> top = undoStack.peek();
            if (top != null && !top.containsKey(name)) {
                top.put(name, current.get(name));
            }
        }
        if (value == null) {
            current.remove(name);
        } else {
            current.put(name, value);
        }
    }

    void set(String name, V value) {
        set(name, value, false);
    }

    /// Names assigned at the outermost level, for carrying definitions between renders.
    Map<String, V> currentDefinitions() {
        return Map.copyOf(current);
    }
}
