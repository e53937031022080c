package com.pyast.ast;

import com.pyast.InternalConsistencyError;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Identifier pool owned by a {@link Program} or {@link Expression}; every name field of the tree
 * is drawn from it.
 */
public final class InternedStringPool {

    private final ConcurrentMap<String, InternedString> strings = new ConcurrentHashMap<>();

    public InternedString get(String s) {
        if (s == null) {
            throw new InternalConsistencyError("Cannot intern a null identifier");
        }
        return strings.computeIfAbsent(s, InternedString::new);
    }

    public int size() {
        return strings.size();
    }

    @Override
    public String toString() {
        return "InternedStringPool[" + strings.size() + " strings]";
    }
}
