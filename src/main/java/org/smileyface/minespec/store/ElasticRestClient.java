package org.smileyface.minespec.store;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOptions;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.GetResponse;
import co.elastic.clients.elasticsearch.core.IndexResponse;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.ExistsRequest;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.http.HttpHost;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.elasticsearch.client.RestClient;

import java.io.Closeable;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Thin wrapper around the Elasticsearch Java API client exposing the few index and document
 * operations the spec store needs. Writes wait for a refresh so that they are visible to the next read.
 */
public class ElasticRestClient implements Closeable {

    private static final Logger log = LogManager.getLogger();

    static final int PAGE_SIZE = 1_000;

    private final RestClient lowLevel;
    private final ElasticsearchClient client;
    private final int pageSize;

    /**
     * Constructs the client using the provided ElasticContext by internally creating the underlying
     * Elasticsearch Java API client. Documents are mapped with the given Jackson mapper.
     */
    public ElasticRestClient(ElasticContext context, ObjectMapper mapper) {
        this(context, mapper, PAGE_SIZE);
    }

    ElasticRestClient(ElasticContext context, ObjectMapper mapper, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1: " + pageSize);
        }
        if (context == null) {
            log.error("ElasticContext must not be null");
            throw new IllegalArgumentException("ElasticContext must not be null");
        }
        log.info("ElasticRestClient initializing on {}:{}", context.getAddress(), context.getPort());
        this.lowLevel = RestClient.builder(new HttpHost(context.getAddress(), context.getPort(), "http")).build();
        ElasticsearchTransport transport = new RestClientTransport(lowLevel,
                mapper == null ? new JacksonJsonpMapper() : new JacksonJsonpMapper(mapper.copy()));
        this.client = new ElasticsearchClient(transport);
        this.pageSize = pageSize;
    }

    // ---------------- Indices ----------------

    /**
     * Creates an index with the provided JSON body (settings/mappings) if it does not exist.
     * @return true if created, false if already exists
     */
    public boolean createIndex(String indexName, String jsonBody) throws IOException {
        try {
            boolean exists = client.indices().exists(ExistsRequest.of(b -> b.index(indexName))).value();
            if (exists) return false;
            if (jsonBody == null || jsonBody.isBlank()) {
                client.indices().create(CreateIndexRequest.of(b -> b.index(indexName)));
            } else {
                client.indices().create(b -> b.index(indexName).withJson(new StringReader(jsonBody)));
            }
            log.debug("Index {} created", indexName);
            return true;
        } catch (ElasticsearchException e) {
            log.error("Failed to create index {}", indexName, e);
            throw e;
        }
    }

    // ---------------- Documents ----------------

    /**
     * Indexes (creates or replaces) the document under the given id.
     *
     * @return the document id
     */
    public <T> String indexDocument(String indexName, String id, T document) throws IOException {
        requireName(indexName, "indexName");
        requireName(id, "id");
        if (document == null) {
            throw new IllegalArgumentException("document must not be null");
        }
        try {
            IndexResponse resp = client.index(b -> b.index(indexName).id(id).document(document).refresh(Refresh.WaitFor));
            log.debug("Indexed {} into {} ({})", resp.id(), indexName, resp.result());
            return resp.id();
        } catch (ElasticsearchException e) {
            log.error("Failed to index document {} into index {}", id, indexName, e);
            throw e;
        }
    }

    /**
     * Fetches a document by id; empty when the document or the index does not exist.
     */
    public <T> Optional<T> getDocument(String indexName, String id, Class<T> type) throws IOException {
        requireName(indexName, "indexName");
        requireName(id, "id");
        try {
            GetResponse<T> resp = client.get(b -> b.index(indexName).id(id), type);
            if (resp == null || !resp.found() || resp.source() == null) {
                log.debug("Document with id: {} not found in {}", id, indexName);
                return Optional.empty();
            }
            return Optional.of(resp.source());
        } catch (ElasticsearchException e) {
            if (e.status() == 404) return Optional.empty();
            log.error("Failed to get document with id {} from index {}", id, indexName, e);
            throw e;
        }
    }

    /**
     * Returns the sources of every document matching {@code query}, reading page by page with
     * {@code search_after}. The sort fields must identify a document uniquely.
     */
    public <T> List<T> searchAll(String indexName, Query query, List<String> sortFields, Class<T> type)
            throws IOException {
        requireName(indexName, "indexName");
        if (sortFields == null || sortFields.isEmpty()) {
            throw new IllegalArgumentException("sortFields must not be empty");
        }
        List<SortOptions> sort = new ArrayList<>();
        for (String field : sortFields) {
            sort.add(SortOptions.of(so -> so.field(f -> f.field(field).order(SortOrder.Asc))));
        }
        try {
            List<T> out = new ArrayList<>();
            List<FieldValue> after = null;
            while (true) {
                final List<FieldValue> cursor = after;
                SearchResponse<T> resp = client.search(s -> {
                    s.index(indexName).query(query).sort(sort).size(pageSize);
                    if (cursor != null) s.searchAfter(cursor);
                    return s;
                }, type);
                List<Hit<T>> hits = resp.hits().hits();
                for (Hit<T> h : hits) {
                    if (h.source() != null) out.add(h.source());
                }
                if (hits.size() < pageSize) {
                    return out;
                }
                after = hits.get(hits.size() - 1).sort();
                log.debug("Read {} hits from {} so far", out.size(), indexName);
            }
        } catch (ElasticsearchException e) {
            if (e.status() == 404) return List.of();
            log.error("Failed to search index {}", indexName, e);
            throw e;
        }
    }

    @Override
    public void close() throws IOException {
        lowLevel.close();
    }

    private static void requireName(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null/blank");
        }
    }
}
