package com.pyast.json;

import java.util.ServiceLoader;

/**
 * A pluggable JSON backend for dumping syntax trees.
 *
 * <p>Backends register themselves in {@code META-INF/services/com.pyast.json.AstJsonProvider};
 * putting a backend jar such as pyast-jackson on the classpath is enough.</p>
 *
 * <pre>{@code
 * String json = AstJsonProvider.getProvider().getSerializer().serializePretty(program);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    /**
     * Short backend name used by {@link #getProvider(String)}, e.g. "Jackson".
     */
    String getName();

    /**
     * The first registered backend.
     *
     * @throws IllegalStateException when no backend is registered
     */
    static AstJsonProvider getProvider() {
        return ServiceLoader.load(AstJsonProvider.class)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No JSON backend registered for syntax trees; add pyast-jackson to the classpath"));
    }

    /**
     * The registered backend whose {@link #getName()} equals {@code name}, ignoring case.
     *
     * @throws IllegalStateException when no backend has that name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No JSON backend named '" + name + "' is registered");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst().isPresent();
    }
}
