package nl.uu.medical.diagnosis.fusion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Append-only, human-readable record of the decisions taken while fusing one prediction.
 */
public final class ReasoningTrace {

    private final List<String> steps = new ArrayList<>();

    public void record(String message) {
        steps.add(message);
    }

    public void record(String format, Object... args) {
        steps.add(String.format(Locale.ROOT, format, args));
    }

    public List<String> steps() {
        return Collections.unmodifiableList(steps);
    }

    public int size() {
        return steps.size();
    }
}
