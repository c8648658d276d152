package org.calista.qualia.diagnostics;

import java.util.Objects;

/**
 * One structured warning raised while loading configuration or running a pass.
 *
 * @param severity how bad it is
 * @param code     stable machine-readable code (e.g. {@code framebook.unknown-frame})
 * @param source   component that raised it
 * @param message  human-readable text
 */
public record Diagnostic(Severity severity, String code, String source, String message) {

    public enum Severity { INFO, WARN, ERROR }

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        code = code == null ? "" : code;
        source = source == null ? "" : source;
        message = message == null ? "" : message;
    }

    @Override
    public String toString() {
        return severity + " [" + code + "] " + source + ": " + message;
    }
}
