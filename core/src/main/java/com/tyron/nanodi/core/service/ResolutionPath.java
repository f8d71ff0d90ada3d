package com.tyron.nanodi.core.service;

import java.util.ArrayList;
import java.util.List;

/**
 * Names of the services currently under construction in a scope, oldest first.
 */
final class ResolutionPath {

    private final List<String> names = new ArrayList<>();

    void push(String name) {
        names.add(name);
    }

    void pop() {
        names.remove(names.size() - 1);
    }

    int lastIndexOf(String name) {
        return names.lastIndexOf(name);
    }

    String get(int index) {
        return names.get(index);
    }

    int size() {
        return names.size();
    }

    boolean isEmpty() {
        return names.isEmpty();
    }

    /**
     * @return a copy of the path followed by {@code requested}.
     */
    List<String> extendedWith(String requested) {
        List<String> copy = new ArrayList<>(names.size() + 1);
        copy.addAll(names);
        copy.add(requested);
        return copy;
    }

    /**
     * Formats {@code /scope/ problem: a -> [b] -> c -> [requested]}, marking the entry at {@code markedIndex}.
     */
    String describe(String scopeName, String problem, int markedIndex, String requested) {
        StringBuilder out = new StringBuilder(64);
        out.append('/').append(scopeName == null ? "(unnamed)" : scopeName).append("/ ");
        out.append(problem).append(": ");
        for (int i = 0; i < names.size(); i++) {
            if (i == markedIndex) {
                out.append('[').append(names.get(i)).append(']');
            } else {
                out.append(names.get(i));
            }
            out.append(" -> ");
        }
        out.append('[').append(requested).append(']');
        return out.toString();
    }

    @Override
    public String toString() {
        return String.join(" -> ", names);
    }
}
