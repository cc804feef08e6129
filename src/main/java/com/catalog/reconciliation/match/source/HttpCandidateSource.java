package com.catalog.reconciliation.match.source;

import com.catalog.reconciliation.core.error.CandidateLookupException;
import com.catalog.reconciliation.core.model.BibIds;
import com.catalog.reconciliation.core.model.Candidate;
import com.catalog.reconciliation.core.model.IdentifierKind;
import com.catalog.reconciliation.match.CandidateSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link CandidateSource} that issues one GET per identifier against a catalog search
 * backend and hands the body to a {@link CandidateResponseParser}.
 *
 * <pre>
 * CandidateSource source = HttpCandidateSource.builder()
 *     .baseUrl("https://platform.example.org/api/v0.1")
 *     .queryPaths(HttpCandidateSource.PLATFORM_PATHS)
 *     .parser(new PlatformResponseParser())
 *     .authorization(tokenProvider::bearerHeader)
 *     .build();
 * </pre>
 *
 * A 404 means no hits. Any other non-2xx status, a transport error or an
 * interrupted request raises {@link CandidateLookupException}.
 */
public class HttpCandidateSource implements CandidateSource {
    private static final Logger log = LoggerFactory.getLogger(HttpCandidateSource.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final String VALUE_PLACEHOLDER = "{value}";

    public static final Map<IdentifierKind, String> PLATFORM_PATHS = Map.of(
            IdentifierKind.BIB_ID, "/bibs?id={value}&limit=20",
            IdentifierKind.ISBN, "/bibs?standardNumber={value}&limit=20",
            IdentifierKind.OCLC_NUMBER, "/bibs?controlNumber={value}&limit=20",
            IdentifierKind.UPC, "/bibs?standardNumber={value}&limit=20");

    public static final Map<IdentifierKind, String> SOLR_PATHS = Map.of(
            IdentifierKind.BIB_ID, "/select?q=id:{value}",
            IdentifierKind.ISBN, "/select?q=isbn:{value}",
            IdentifierKind.OCLC_NUMBER, "/select?q=ss_marc_tag_001:{value}",
            IdentifierKind.UPC, "/select?q=sm_marc_tag_024_a:{value}");

    private final String baseUrl;
    private final Map<IdentifierKind, String> queryPaths;
    private final CandidateResponseParser parser;
    private final Supplier<String> authorization;
    private final Duration timeout;
    private final HttpClient httpClient;

    private HttpCandidateSource(Builder builder) {
        this.baseUrl = Objects.requireNonNull(builder.baseUrl, "baseUrl is required");
        this.parser = Objects.requireNonNull(builder.parser, "parser is required");
        if (builder.queryPaths == null || builder.queryPaths.isEmpty()) {
            throw new IllegalArgumentException("queryPaths are required");
        }
        this.queryPaths = new EnumMap<>(builder.queryPaths);
        this.authorization = builder.authorization;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public List<Candidate> getCandidates(IdentifierKind kind, String value) {
        String path = queryPaths.get(kind);
        if (path == null) {
            throw new IllegalArgumentException("Invalid matchpoint: '" + kind.getKey()
                    + "'. Available matchpoints are: " + Arrays.toString(queryPaths.keySet().stream()
                    .map(IdentifierKind::getKey).toArray()));
        }
        String queryValue = kind == IdentifierKind.BIB_ID ? BibIds.digits(value) : value;
        URI uri = URI.create(baseUrl + path.replace(VALUE_PLACEHOLDER,
                URLEncoder.encode(queryValue, StandardCharsets.UTF_8)));

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        if (authorization != null) {
            request.header("Authorization", authorization.get());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CandidateLookupException("Candidate lookup failed: kind=" + kind.getKey()
                    + ", value=" + value + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CandidateLookupException("Candidate lookup interrupted: kind=" + kind.getKey()
                    + ", value=" + value, e);
        }

        int status = response.statusCode();
        if (status == 404) {
            log.debug("lookup.empty kind={} value={}", kind, value);
            return List.of();
        }
        if (status < 200 || status >= 300) {
            throw new CandidateLookupException("Candidate lookup returned status " + status
                    + ": kind=" + kind.getKey() + ", value=" + value);
        }
        List<Candidate> candidates = parser.parse(response.body());
        log.debug("lookup.completed kind={} value={} count={}", kind, value, candidates.size());
        return candidates;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private Map<IdentifierKind, String> queryPaths;
        private CandidateResponseParser parser;
        private Supplier<String> authorization;
        private Duration timeout;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder queryPaths(Map<IdentifierKind, String> queryPaths) {
            this.queryPaths = queryPaths;
            return this;
        }

        public Builder parser(CandidateResponseParser parser) {
            this.parser = parser;
            return this;
        }

        /**
         * Supplies the {@code Authorization} header value per request, so expiring
         * tokens can be refreshed by the caller.
         */
        public Builder authorization(Supplier<String> authorization) {
            this.authorization = authorization;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public HttpCandidateSource build() {
            return new HttpCandidateSource(this);
        }
    }
}
