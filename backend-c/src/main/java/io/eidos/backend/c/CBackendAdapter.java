package io.eidos.backend.c;

import io.eidos.core.spi.BackendAdapter;
import io.eidos.core.spi.RenderHook;

/**
 * C backend. Places the rendered statements inside {@code int main()} after a {@code stdio.h}
 * include and hoists variable declarations in front of first assignments.
 */
public final class CBackendAdapter implements BackendAdapter {

    public static final String ID = "c";

    private static final String HEADER = "#include <stdio.h>\n\nint main() {\n";
    private static final String FOOTER = "    return 0;\n}\n";

    private final RenderHook hook;

    /** Used by {@link java.util.ServiceLoader}; hoists {@code int} declarations for {@code assignment}. */
    public CBackendAdapter() {
        this(new DeclarationHoistingHook());
    }

    public CBackendAdapter(DeclarationHoistingHook hook) {
        this.hook = hook;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String displayName() {
        return "C";
    }

    @Override
    public String fileExtension() {
        return "c";
    }

    @Override
    public RenderHook renderHook() {
        return hook;
    }

    @Override
    public String wrap(String body) {
        return HEADER + body + FOOTER;
    }
}
