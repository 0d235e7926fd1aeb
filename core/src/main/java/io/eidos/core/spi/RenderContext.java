package io.eidos.core.spi;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Auxiliary state scoped to one top-level render call. The renderer creates a fresh context for
 * every call and hands it to the backend's {@link RenderHook}; nothing in it survives the call, so
 * repeated or batched renders never see each other's declarations.
 *
 * <p>
 * Not thread-safe. A context is only ever touched by the thread doing the render.
 */
public final class RenderContext {

    private final Set<String> declaredNames = new LinkedHashSet<>();

    /**
     * Records {@code name} as declared.
     *
     * @return {@code true} if this is the first declaration of {@code name} in this render
     */
    public boolean declare(String name) {
        return declaredNames.add(name);
    }

    public boolean isDeclared(String name) {
        return declaredNames.contains(name);
    }

    /** Names declared so far, in declaration order. */
    public Set<String> declaredNames() {
        return Collections.unmodifiableSet(declaredNames);
    }
}
