package com.catalog.reconciliation.rules;

import com.catalog.reconciliation.core.marc.DataField;
import com.catalog.reconciliation.core.marc.MarcRecord;
import com.catalog.reconciliation.core.marc.Subfield;
import com.catalog.reconciliation.core.model.BibIds;
import com.catalog.reconciliation.core.model.BibRecord;
import com.catalog.reconciliation.core.model.Collection;
import com.catalog.reconciliation.core.model.FieldEdit;
import com.catalog.reconciliation.core.model.LibrarySystem;
import com.catalog.reconciliation.core.model.MatchDecision;
import com.catalog.reconciliation.core.model.OrderAttribute;
import com.catalog.reconciliation.core.model.OrderLine;
import com.catalog.reconciliation.core.model.VendorField;
import com.catalog.reconciliation.core.model.VendorInfo;
import com.catalog.reconciliation.core.model.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes the field edits a record needs before it is written back out.
 * Nothing is mutated here; {@link FieldEditApplier} performs the edits.
 *
 * <p>Rules run in this order:</p>
 * <ol>
 *   <li>cataloging records get the vendor's fields verbatim</li>
 *   <li>order-level records get their order lines, overlaid with the template, as order fields</li>
 *   <li>selection records get a load command directive</li>
 *   <li>a decided target id replaces the bib id field</li>
 *   <li>NYPL records lose any incoming collection field, get their BL/RL code when they have one,
 *       and a split call number for series vendors</li>
 * </ol>
 */
public class FieldUpdateRuleEngine {
    private static final Logger log = LoggerFactory.getLogger(FieldUpdateRuleEngine.class);

    static final String COLLECTION_TAG = "910";

    private final OrderFieldMapper orderFieldMapper;
    private final CommandTagRule commandTagRule;
    private final CallNumberReconstructor callNumberReconstructor;

    public FieldUpdateRuleEngine() {
        this(new OrderFieldMapper(), new CommandTagRule(), new CallNumberReconstructor());
    }

    public FieldUpdateRuleEngine(OrderFieldMapper orderFieldMapper, CommandTagRule commandTagRule,
                                 CallNumberReconstructor callNumberReconstructor) {
        this.orderFieldMapper = orderFieldMapper;
        this.commandTagRule = commandTagRule;
        this.callNumberReconstructor = callNumberReconstructor;
    }

    /**
     * @param vendorInfo   vendor configuration of a cataloging record, may be null otherwise
     * @param templateData order template values for order-level records, may be null
     * @throws com.catalog.reconciliation.core.error.DataIntegrityException if a call number
     *         cannot be split without changing it
     */
    public List<FieldEdit> computeEdits(BibRecord record, MatchDecision decision, VendorInfo vendorInfo,
                                        Map<String, ?> templateData, UpdateContext context) {
        List<FieldEdit> edits = new ArrayList<>();
        Workflow workflow = record.getWorkflow();

        if (workflow == Workflow.CATALOGING) {
            if (vendorInfo != null) {
                for (VendorField field : vendorInfo.fields()) {
                    edits.add(FieldEdit.add(field.tag(), field.ind1().charAt(0), field.ind2().charAt(0),
                            List.of(new Subfield(field.subfieldCode(), field.value()))));
                }
            }
        } else {
            List<OrderLine> orders = overlayTemplate(record.getOrders(), templateData);
            edits.addAll(orderFieldMapper.toEdits(orders, context.orderMappings()));
        }

        if (workflow == Workflow.SELECTION) {
            commandTagRule.apply(record.getMarcRecord(), templateFormat(templateData), context.defaultLocation())
                    .ifPresent(edits::add);
        }

        if (decision != null && decision.targetId() != null) {
            edits.add(FieldEdit.replaceAll(context.bibIdTag(),
                    List.of(new Subfield("a", BibIds.normalize(decision.targetId())))));
        }

        if (record.getLibrary() == LibrarySystem.NYPL) {
            Collection collection = record.getCollection();
            if (collection == Collection.BRANCH || collection == Collection.RESEARCH) {
                edits.add(FieldEdit.replaceAll(COLLECTION_TAG, List.of(new Subfield("a", collection.getCode()))));
            } else {
                edits.add(FieldEdit.deleteAll(COLLECTION_TAG));
            }
            if (collection == Collection.BRANCH && workflow == Workflow.CATALOGING
                    && context.callNumberRebuildVendors().contains(record.getVendor())) {
                callNumberEdit(record.getMarcRecord()).ifPresent(edits::add);
            }
        }

        log.debug("edits.computed resourceId={} count={}", record.getResourceId(), edits.size());
        return edits;
    }

    /**
     * Applies the template to copies of the order lines; the record's own lines are untouched.
     */
    static List<OrderLine> overlayTemplate(List<OrderLine> orders, Map<String, ?> templateData) {
        List<OrderLine> overlaid = new ArrayList<>(orders.size());
        for (OrderLine order : orders) {
            OrderLine copy = order.copy();
            copy.applyTemplate(templateData);
            overlaid.add(copy);
        }
        return overlaid;
    }

    private static String templateFormat(Map<String, ?> templateData) {
        if (templateData == null) {
            return null;
        }
        Object format = templateData.get(OrderAttribute.FORMAT.getKey());
        return OrderLine.isTruthy(format) ? String.valueOf(format) : null;
    }

    private Optional<FieldEdit> callNumberEdit(MarcRecord marc) {
        if (marc == null) {
            return Optional.empty();
        }
        List<DataField> fields = marc.getFields(CallNumberReconstructor.TAG);
        if (fields.isEmpty()) {
            return Optional.empty();
        }
        List<Subfield> subfields = callNumberReconstructor.reconstruct(fields.get(0).value());
        return Optional.of(FieldEdit.replaceAll(CallNumberReconstructor.TAG, subfields));
    }
}
