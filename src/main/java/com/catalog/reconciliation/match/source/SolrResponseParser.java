package com.catalog.reconciliation.match.source;

import com.catalog.reconciliation.core.error.CandidateLookupException;
import com.catalog.reconciliation.core.marc.MarcDates;
import com.catalog.reconciliation.core.model.Candidate;
import com.catalog.reconciliation.core.model.CatalogSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses the BPL Solr search response: {@code {"response": {"docs": [...]}}}.
 * Variable fields arrive flattened as {@code "020 || {{a}} 978... || {{q}} pbk"}
 * strings in {@code sm_bib_varfields}; items as JSON strings in {@code sm_item_data}.
 * Solr does not report collections, so every candidate's collection is null.
 */
public class SolrResponseParser implements CandidateResponseParser {

    private static final String SEPARATOR = " || ";

    private final ObjectMapper objectMapper;

    public SolrResponseParser() {
        this(new ObjectMapper());
    }

    public SolrResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Candidate> parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CandidateLookupException("Malformed Solr response: " + e.getOriginalMessage(), e);
        }
        List<Candidate> candidates = new ArrayList<>();
        for (JsonNode doc : root.path("response").path("docs")) {
            candidates.add(toCandidate(doc));
        }
        return candidates;
    }

    Candidate toCandidate(JsonNode doc) {
        List<VarField> varFields = varFields(doc);
        String tag001 = text(doc, "ss_marc_tag_001");
        String tag003 = text(doc, "ss_marc_tag_003");
        boolean inHouse = tag001 != null && tag001.startsWith("o") && "OCoLC".equals(tag003);

        Set<String> branch = new LinkedHashSet<>();
        varFields.stream().filter(f -> "099".equals(f.tag())).map(VarField::joined).forEach(v -> addIfPresent(branch, v));
        addIfPresent(branch, text(doc, "call_number"));

        Set<String> isbns = new LinkedHashSet<>(subfieldValues(varFields, "020"));
        doc.path("isbn").forEach(n -> addIfPresent(isbns, n.asText(null)));

        Set<String> oclcNumbers = new LinkedHashSet<>(subfieldValues(varFields, "035"));
        addIfPresent(oclcNumbers, tag001);

        String id = text(doc, "id");
        if (id == null || id.isBlank()) {
            throw new CandidateLookupException("Solr response entry has no id");
        }
        return Candidate.builder(id)
                .title(text(doc, "title"))
                .collection(null)
                .branchCallNumber(branch.isEmpty() ? null : branch.iterator().next())
                .researchCallNumbers(List.of())
                .catalogSource(inHouse ? CatalogSource.IN_HOUSE : CatalogSource.VENDOR)
                .updateTime(updateTime(text(doc, "ss_marc_tag_005")))
                .controlNumber(tag001)
                .isbns(new ArrayList<>(isbns))
                .oclcNumbers(new ArrayList<>(oclcNumbers))
                .upcs(new ArrayList<>(new LinkedHashSet<>(subfieldValues(varFields, "024", "028"))))
                .barcodes(barcodes(doc))
                .build();
    }

    private List<String> barcodes(JsonNode doc) {
        List<String> barcodes = new ArrayList<>();
        for (JsonNode item : doc.path("sm_item_data")) {
            String json = item.asText("");
            if (json.isEmpty()) {
                continue;
            }
            try {
                String barcode = text(objectMapper.readTree(json), "barcode");
                if (barcode != null && !barcode.isEmpty()) {
                    barcodes.add(barcode);
                }
            } catch (JsonProcessingException e) {
                throw new CandidateLookupException("Malformed item data in Solr response: " + json, e);
            }
        }
        return barcodes;
    }

    private static LocalDateTime updateTime(String tag005) {
        try {
            return MarcDates.parse(tag005);
        } catch (IllegalArgumentException e) {
            throw new CandidateLookupException("Invalid ss_marc_tag_005 in Solr response: " + tag005, e);
        }
    }

    static List<VarField> varFields(JsonNode doc) {
        List<VarField> fields = new ArrayList<>();
        for (JsonNode node : doc.path("sm_bib_varfields")) {
            String raw = node.asText("");
            int split = raw.indexOf(SEPARATOR);
            if (split < 0) {
                continue;
            }
            String tag = raw.substring(0, split);
            String data = raw.substring(split + SEPARATOR.length());
            if (!data.contains("{{")) {
                continue;
            }
            List<VarField.Sub> subs = new ArrayList<>();
            for (String part : data.split(" \\|\\| ")) {
                int close = part.indexOf("}}");
                if (close < 0) {
                    continue;
                }
                String code = part.substring(0, close).replace("{", "");
                subs.add(new VarField.Sub(code, part.substring(close + 2).trim()));
            }
            fields.add(new VarField(tag, " ", subs));
        }
        return fields;
    }

    private static List<String> subfieldValues(List<VarField> fields, String... tags) {
        Set<String> wanted = Set.of(tags);
        List<String> values = new ArrayList<>();
        for (VarField field : fields) {
            if (wanted.contains(field.tag())) {
                field.values("a").stream().filter(v -> !v.isEmpty()).forEach(values::add);
            }
        }
        return values;
    }

    private static String text(JsonNode node, String name) {
        JsonNode value = node.get(name);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static void addIfPresent(Set<String> values, String value) {
        if (value != null && !value.isEmpty()) {
            values.add(value);
        }
    }
}
