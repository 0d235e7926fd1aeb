package io.eidos.core.spi;

/**
 * Target-language backend SPI. Supplies the program skeleton that wraps the rendered body and,
 * optionally, a {@link RenderHook} for per-target side effects.
 *
 * <p>
 * Implementations are discovered with {@link java.util.ServiceLoader} (see
 * {@code BackendRegistry#installed()}) and must have a public no-arg constructor for that. They
 * must be stateless: the same instance is used for every source document of a run.
 */
public interface BackendAdapter {

    /** Backend identifier used on the command line, e.g. {@code "c"}. */
    String id();

    /** Human-readable target name, e.g. {@code "C"}. */
    String displayName();

    /** Extension of generated files, without the dot. */
    String fileExtension();

    /**
     * Indentation depth at which top-level statements are rendered, i.e. how deep the skeleton
     * nests the body. Defaults to {@code 1} (inside an entry-point function).
     */
    default int bodyDepth() {
        return 1;
    }

    /** Render hook for this target. Defaults to {@link RenderHook#NONE}. */
    default RenderHook renderHook() {
        return RenderHook.NONE;
    }

    /**
     * Wraps the rendered body in the target's program skeleton.
     *
     * @param body rendered statements, already indented at {@link #bodyDepth()}
     * @return the complete program text
     */
    String wrap(String body);
}
