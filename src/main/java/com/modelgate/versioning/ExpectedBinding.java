package com.modelgate.versioning;

import com.modelgate.runtime.ConfigException;

/**
 * Compare-and-swap precondition on an alias: any binding, no binding, or bound to one version.
 */
public record ExpectedBinding(Kind kind, Integer version) {

    public static ExpectedBinding any() {
        return new ExpectedBinding(Kind.ANY, null);
    }

    public static ExpectedBinding unbound() {
        return new ExpectedBinding(Kind.UNBOUND, null);
    }

    public static ExpectedBinding version(int version) {
        return new ExpectedBinding(Kind.VERSION, version);
    }

    /** {@code null} means any, {@code none} means unbound, a number means that version. */
    public static ExpectedBinding parse(String text) {
        if (text == null || text.isBlank()) {
            return any();
        }
        if ("none".equalsIgnoreCase(text.trim())) {
            return unbound();
        }
        try {
            return version(Integer.parseInt(text.trim()));
        } catch (NumberFormatException e) {
            throw new ConfigException("Expected version must be a number or 'none', got '" + text + "'", e);
        }
    }

    public boolean matches(AliasBinding current) {
        return switch (kind) {
            case ANY -> true;
            case UNBOUND -> current == null;
            case VERSION -> current != null && current.version() == version;
        };
    }

    public String describe() {
        return switch (kind) {
            case ANY -> "any binding";
            case UNBOUND -> "unbound";
            case VERSION -> "version " + version;
        };
    }

    public enum Kind {
        ANY,
        UNBOUND,
        VERSION
    }
}
