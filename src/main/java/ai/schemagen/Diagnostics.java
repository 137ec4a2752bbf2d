package ai.schemagen;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collects non-fatal warnings of a run and echoes them as {@code WARN:} lines.
 */
public final class Diagnostics {

    private final PrintStream out;
    private final List<String> warnings = new ArrayList<>();

    public Diagnostics() {
        this(System.err);
    }

    public Diagnostics(PrintStream out) {
        this.out = out;
    }

    /**
     * Diagnostics that only collect, used where stderr output is unwanted (tests).
     */
    public static Diagnostics silent() {
        return new Diagnostics(null);
    }

    public void warn(String message) {
        Objects.requireNonNull(message, "message");
        warnings.add(message);
        if (out != null) {
            out.println("WARN: " + message);
        }
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    public int warningCount() {
        return warnings.size();
    }
}
