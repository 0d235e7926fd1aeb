package io.eidos.core.spi;

import io.eidos.core.model.StatementNode;
import java.util.List;

/**
 * Backend-specific side effect applied while rendering statements, e.g. hoisting a variable
 * declaration in front of its first assignment. Implementations keep their state in the supplied
 * {@link RenderContext}, never in fields, so one hook instance can serve any number of renders.
 */
@FunctionalInterface
public interface RenderHook {

    /** Hook that adds nothing. */
    RenderHook NONE = (node, context) -> List.of();

    /**
     * Returns extra target lines to emit before {@code node}, without indentation or line
     * terminators. The renderer indents them at the statement's depth.
     *
     * @param node    the statement about to be rendered
     * @param context per-render auxiliary state
     * @return lines to emit first, possibly empty, never null
     */
    List<String> beforeStatement(StatementNode node, RenderContext context);
}
