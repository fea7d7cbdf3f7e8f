package vn.com.fecredit.flowable.layout.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Outcome of a BPMN check: errors make the document invalid, warnings do not. */
public class ValidationResult {
    public final boolean valid;
    public final List<String> errors;
    public final List<String> warnings;

    public ValidationResult(List<String> errors, List<String> warnings) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.valid = this.errors.isEmpty();
    }

    /** Flat, printable list in the order a console user reads it. */
    public List<String> messages() {
        List<String> messages = new ArrayList<>();
        if (!errors.isEmpty()) {
            messages.add("Structural errors:");
            messages.addAll(errors);
        }
        if (!warnings.isEmpty()) {
            messages.add("(warning) non-fatal issues:");
            messages.addAll(warnings);
        }
        return valid && messages.isEmpty() ? List.of("OK") : messages;
    }
}
