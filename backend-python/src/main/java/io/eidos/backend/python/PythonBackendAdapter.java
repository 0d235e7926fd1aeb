package io.eidos.backend.python;

import io.eidos.core.spi.BackendAdapter;

/**
 * Python backend. Places the rendered statements inside {@code def main():} followed by the usual
 * {@code __main__} guard. An empty body becomes {@code pass} so the module still compiles.
 */
public final class PythonBackendAdapter implements BackendAdapter {

    public static final String ID = "python";

    private static final String HEADER = "def main():\n";
    private static final String EMPTY_BODY = "    pass\n";
    private static final String FOOTER = "\nif __name__ == \"__main__\":\n    main()\n";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String displayName() {
        return "Python";
    }

    @Override
    public String fileExtension() {
        return "py";
    }

    @Override
    public String wrap(String body) {
        return HEADER + (body.isBlank() ? EMPTY_BODY : body) + FOOTER;
    }
}
