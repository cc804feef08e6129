package com.catalog.reconciliation.rules;

import com.catalog.reconciliation.core.marc.DataField;
import com.catalog.reconciliation.core.marc.MarcRecord;
import com.catalog.reconciliation.core.marc.Subfield;
import com.catalog.reconciliation.core.model.FieldEdit;

import java.util.List;
import java.util.Optional;

/**
 * Maintains the load command directive ({@code 949  $a*...;}) of selection records:
 * {@code b2=} carries the material format and {@code bn=} the default location.
 */
public class CommandTagRule {

    public static final String TAG = "949";

    /**
     * Returns the edit that synthesizes or completes the command directive, if one is needed.
     * A directive that already names a location is never touched.
     */
    public Optional<FieldEdit> apply(MarcRecord marc, String format, String defaultLocation) {
        boolean hasFormat = format != null && !format.isEmpty();
        boolean hasLocation = defaultLocation != null && !defaultLocation.isEmpty();
        if (!hasFormat && !hasLocation) {
            return Optional.empty();
        }
        Optional<DataField> directive = findDirective(marc);
        if (directive.isEmpty()) {
            StringBuilder command = new StringBuilder("*");
            if (hasFormat) {
                command.append("b2=").append(format).append(';');
            }
            if (hasLocation) {
                command.append("bn=").append(defaultLocation).append(';');
            }
            return Optional.of(FieldEdit.add(TAG, ' ', ' ', List.of(new Subfield("a", command.toString()))));
        }
        DataField existing = directive.get();
        String command = existing.getFirst("a").strip();
        if (!hasLocation || command.contains("bn=")) {
            return Optional.empty();
        }
        String updated = command.endsWith(";")
                ? command + "bn=" + defaultLocation + ";"
                : command + ";bn=" + defaultLocation + ";";
        return Optional.of(FieldEdit.replace(existing, List.of(new Subfield("a", updated))));
    }

    static Optional<DataField> findDirective(MarcRecord marc) {
        if (marc == null) {
            return Optional.empty();
        }
        return marc.getFields(TAG).stream()
                .filter(f -> f.hasIndicators(' ', ' '))
                .filter(f -> {
                    String a = f.getFirst("a");
                    return a != null && a.startsWith("*");
                })
                .findFirst();
    }
}
