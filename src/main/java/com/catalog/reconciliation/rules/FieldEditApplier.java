package com.catalog.reconciliation.rules;

import com.catalog.reconciliation.core.marc.ControlField;
import com.catalog.reconciliation.core.marc.MarcRecord;
import com.catalog.reconciliation.core.model.FieldEdit;
import com.catalog.reconciliation.core.model.LibrarySystem;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Applies {@link FieldEdit}s to a copy of a MARC record, marks the leader as
 * Unicode and, for NYPL, strips OCLC prefixes from the control number.
 */
public class FieldEditApplier {

    private static final int LEADER_CODING_SCHEME = 9;
    private static final Pattern OCLC_PREFIX = Pattern.compile("^[ocmn]+");

    public MarcRecord apply(MarcRecord source, List<FieldEdit> edits, LibrarySystem library) {
        MarcRecord marc = source != null ? source.copy() : new MarcRecord();
        for (FieldEdit edit : edits) {
            if (edit.delete()) {
                marc.removeFields(edit.tag());
            }
            edit.original().ifPresent(marc::removeField);
            if (!edit.removeOnly()) {
                marc.addOrderedField(edit.toField());
            }
        }
        marc.setLeader(withCodingScheme(marc.getLeader()));
        if (library == LibrarySystem.NYPL) {
            stripControlNumberPrefix(marc);
        }
        return marc;
    }

    private static String withCodingScheme(String leader) {
        if (leader == null || leader.length() <= LEADER_CODING_SCHEME) {
            throw new IllegalArgumentException("Leader too short to set coding scheme: '" + leader + "'");
        }
        return leader.substring(0, LEADER_CODING_SCHEME) + 'a' + leader.substring(LEADER_CODING_SCHEME + 1);
    }

    private static void stripControlNumberPrefix(MarcRecord marc) {
        Optional<ControlField> controlNumber = marc.getControlField("001");
        controlNumber.ifPresent(field -> {
            String stripped = OCLC_PREFIX.matcher(field.data()).replaceFirst("");
            if (!stripped.equals(field.data())) {
                marc.setControlField(new ControlField("001", stripped));
            }
        });
    }
}
