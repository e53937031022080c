package com.pyast.ast;

/**
 * An identifier canonicalized by an {@link InternedStringPool}. Within one pool, equal texts are
 * the same instance, so identity comparison is enough.
 */
public final class InternedString implements Comparable<InternedString> {

    private final String s;

    InternedString(String s) {
        this.s = s;
    }

    public String s() {
        return s;
    }

    public boolean isEmpty() {
        return s.isEmpty();
    }

    @Override
    public int compareTo(InternedString other) {
        return s.compareTo(other.s);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof InternedString other && s.equals(other.s);
    }

    @Override
    public int hashCode() {
        return s.hashCode();
    }

    @Override
    public String toString() {
        return s;
    }
}
