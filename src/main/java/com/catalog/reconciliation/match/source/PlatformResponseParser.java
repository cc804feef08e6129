package com.catalog.reconciliation.match.source;

import com.catalog.reconciliation.core.error.CandidateLookupException;
import com.catalog.reconciliation.core.model.Candidate;
import com.catalog.reconciliation.core.model.CatalogSource;
import com.catalog.reconciliation.core.model.Collection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses the NYPL Platform bib search response: {@code {"data": [...]}} where each
 * bib carries {@code varFields} with {@code marcTag}, {@code ind1} and
 * {@code subfields[{tag, content}]}.
 */
public class PlatformResponseParser implements CandidateResponseParser {

    private static final DateTimeFormatter UPDATED_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final ObjectMapper objectMapper;

    public PlatformResponseParser() {
        this(new ObjectMapper());
    }

    public PlatformResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Candidate> parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new CandidateLookupException("Malformed Platform response: " + e.getOriginalMessage(), e);
        }
        List<Candidate> candidates = new ArrayList<>();
        for (JsonNode bib : root.path("data")) {
            candidates.add(toCandidate(bib));
        }
        return candidates;
    }

    Candidate toCandidate(JsonNode bib) {
        List<VarField> varFields = varFields(bib);
        List<String> branch = joinedValues(varFields, "091", null);
        List<String> research = joinedValues(varFields, "852", "8");

        Set<String> isbns = new LinkedHashSet<>(subfieldValues(varFields, "a", "020"));
        bib.path("standardNumbers").forEach(n -> addIfPresent(isbns, n.asText(null)));

        Set<String> oclcNumbers = new LinkedHashSet<>(subfieldValues(varFields, "a", "035"));
        addIfPresent(oclcNumbers, text(bib, "controlNumber"));

        boolean inHouse = subfieldValues(varFields, "b", "901").stream().anyMatch(v -> v.contains("CAT"));

        String id = text(bib, "id");
        if (id == null || id.isBlank()) {
            throw new CandidateLookupException("Platform response entry has no id");
        }
        return Candidate.builder(id)
                .title(text(bib, "title"))
                .collection(collection(varFields, branch, research))
                .branchCallNumber(branch.isEmpty() ? null : branch.get(0))
                .researchCallNumbers(research)
                .catalogSource(inHouse ? CatalogSource.IN_HOUSE : CatalogSource.VENDOR)
                .updateTime(updateTime(text(bib, "updatedDate")))
                .controlNumber(text(bib, "controlNumber"))
                .isbns(new ArrayList<>(isbns))
                .oclcNumbers(new ArrayList<>(oclcNumbers))
                .upcs(new ArrayList<>(new LinkedHashSet<>(subfieldValues(varFields, "a", "024", "028"))))
                .build();
    }

    private static Collection collection(List<VarField> varFields, List<String> branch, List<String> research) {
        List<String> codes = subfieldValues(varFields, "a", "910");
        if (codes.size() > 1) {
            return Collection.MIXED;
        }
        if (codes.size() == 1) {
            return Collection.fromCode(codes.get(0));
        }
        if (!branch.isEmpty() && !research.isEmpty()) {
            return Collection.MIXED;
        }
        if (!branch.isEmpty()) {
            return Collection.BRANCH;
        }
        if (!research.isEmpty()) {
            return Collection.RESEARCH;
        }
        return null;
    }

    private static LocalDateTime updateTime(String updatedDate) {
        if (updatedDate == null || updatedDate.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(updatedDate, UPDATED_DATE);
        } catch (DateTimeParseException e) {
            throw new CandidateLookupException("Invalid updatedDate in Platform response: " + updatedDate, e);
        }
    }

    private static List<VarField> varFields(JsonNode bib) {
        List<VarField> fields = new ArrayList<>();
        for (JsonNode field : bib.path("varFields")) {
            List<VarField.Sub> subs = new ArrayList<>();
            for (JsonNode sub : field.path("subfields")) {
                subs.add(new VarField.Sub(sub.path("tag").asText(""), sub.path("content").asText("")));
            }
            fields.add(new VarField(field.path("marcTag").asText(""), field.path("ind1").asText(" "), subs));
        }
        return fields;
    }

    private static List<String> joinedValues(List<VarField> fields, String tag, String ind1) {
        return fields.stream()
                .filter(f -> tag.equals(f.tag()))
                .filter(f -> ind1 == null || ind1.equals(f.ind1()))
                .map(VarField::joined)
                .toList();
    }

    private static List<String> subfieldValues(List<VarField> fields, String code, String... tags) {
        Set<String> wanted = Set.of(tags);
        List<String> values = new ArrayList<>();
        for (VarField field : fields) {
            if (wanted.contains(field.tag())) {
                field.values(code).stream().filter(v -> !v.isEmpty()).forEach(values::add);
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
