package com.catalog.reconciliation.match.source;

import com.catalog.reconciliation.core.error.CandidateLookupException;
import com.catalog.reconciliation.core.model.Candidate;
import com.catalog.reconciliation.core.model.CatalogSource;
import com.catalog.reconciliation.core.model.Collection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PlatformResponseParser Tests")
class PlatformResponseParserTest {

    private final PlatformResponseParser parser = new PlatformResponseParser();

    private static final String BRANCH_BIB = """
            {"data": [{
              "id": "21790265",
              "title": "Example title",
              "controlNumber": "1089804986",
              "updatedDate": "2019-05-23T09:15:01",
              "standardNumbers": ["9780062822789"],
              "varFields": [
                {"marcTag": "091", "ind1": " ", "subfields": [
                  {"tag": "p", "content": "J"}, {"tag": "a", "content": "FIC"}, {"tag": "c", "content": "SMITH"}]},
                {"marcTag": "901", "ind1": " ", "subfields": [{"tag": "b", "content": "CATBL"}]},
                {"marcTag": "910", "ind1": " ", "subfields": [{"tag": "a", "content": "BL"}]}
              ]
            }]}
            """;

    @Test
    @DisplayName("Should map a branch bib into a candidate")
    void parsesBranchBib() {
        List<Candidate> candidates = parser.parse(BRANCH_BIB);

        assertEquals(1, candidates.size());
        Candidate candidate = candidates.get(0);
        assertEquals("21790265", candidate.bibId());
        assertEquals("Example title", candidate.title());
        assertEquals(Collection.BRANCH, candidate.collection());
        assertEquals("J FIC SMITH", candidate.branchCallNumber());
        assertTrue(candidate.researchCallNumbers().isEmpty());
        assertEquals(CatalogSource.IN_HOUSE, candidate.catalogSource());
        assertEquals(LocalDateTime.of(2019, 5, 23, 9, 15, 1), candidate.updateTime());
        assertEquals(List.of("9780062822789"), candidate.isbns());
        assertEquals(List.of("1089804986"), candidate.oclcNumbers());
    }

    @Test
    @DisplayName("Should derive the collection from call numbers when 910 is absent")
    void derivesCollectionFromCallNumbers() {
        String body = """
                {"data": [
                  {"id": "1", "varFields": [
                    {"marcTag": "852", "ind1": "8", "subfields": [{"tag": "h", "content": "ReCAP 19-1234"}]}]},
                  {"id": "2", "varFields": [
                    {"marcTag": "091", "ind1": " ", "subfields": [{"tag": "a", "content": "FIC"}]},
                    {"marcTag": "852", "ind1": "8", "subfields": [{"tag": "h", "content": "JFE 19-1"}]}]},
                  {"id": "3", "varFields": []}
                ]}
                """;

        List<Candidate> candidates = parser.parse(body);

        assertEquals(Collection.RESEARCH, candidates.get(0).collection());
        assertEquals(List.of("ReCAP 19-1234"), candidates.get(0).researchCallNumbers());
        assertEquals(Collection.MIXED, candidates.get(1).collection());
        assertNull(candidates.get(2).collection());
        assertEquals(CatalogSource.VENDOR, candidates.get(2).catalogSource());
        assertNull(candidates.get(2).updateTime());
    }

    @Test
    @DisplayName("Several 910 codes should mark the bib as mixed")
    void multiple910sAreMixed() {
        String body = """
                {"data": [{"id": "1", "varFields": [
                  {"marcTag": "910", "ind1": " ", "subfields": [{"tag": "a", "content": "BL"}]},
                  {"marcTag": "910", "ind1": " ", "subfields": [{"tag": "a", "content": "RL"}]}]}]}
                """;

        assertEquals(Collection.MIXED, parser.parse(body).get(0).collection());
    }

    @Test
    @DisplayName("Empty responses should yield no candidates")
    void emptyResponse() {
        assertTrue(parser.parse("{\"data\": []}").isEmpty());
        assertTrue(parser.parse("{}").isEmpty());
    }

    @Test
    @DisplayName("Malformed bodies and entries without ids should be lookup failures")
    void malformedBodies() {
        assertThrows(CandidateLookupException.class, () -> parser.parse("{not json"));
        assertThrows(CandidateLookupException.class, () -> parser.parse("{\"data\": [{\"title\": \"x\"}]}"));
        assertThrows(CandidateLookupException.class,
                () -> parser.parse("{\"data\": [{\"id\": \"1\", \"updatedDate\": \"yesterday\"}]}"));
    }
}
