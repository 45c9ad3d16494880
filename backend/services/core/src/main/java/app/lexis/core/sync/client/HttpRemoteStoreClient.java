package app.lexis.core.sync.client;

import app.lexis.core.sync.config.RemoteStoreProps;
import app.lexis.core.sync.domain.RemoteEntityKind;
import app.lexis.core.sync.domain.SyncIdentity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * REST document store client. Layout:
 * <pre>
 *   GET    /users/{key}/{collection}.json        -> {id: document, ...} or null
 *   PUT    /users/{key}/{collection}/{id}.json   -> overwrite one document
 *   DELETE /users/{key}/{collection}/{id}.json
 * </pre>
 */
@Component
public class HttpRemoteStoreClient implements RemoteStoreClient {

    private static final Logger log = LoggerFactory.getLogger(HttpRemoteStoreClient.class);

    private final RestClient restClient;
    private final RemoteStoreProps props;
    private final ObjectMapper objectMapper;

    public HttpRemoteStoreClient(RestClient.Builder restClientBuilder,
                                 RemoteStoreProps props,
                                 ObjectMapper objectMapper) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.restClient = props.configured()
                ? restClientBuilder.baseUrl(props.baseUrl()).build()
                : null;
        if (restClient == null) {
            log.info("Remote store base URL is not configured, running local-only");
        }
    }

    @Override
    public <T> List<T> fetchAll(RemoteEntityKind kind, SyncIdentity identity, Class<T> type) {
        if (identity == null || restClient == null) {
            return List.of();
        }

        JsonNode body = restClient.get()
                .uri(b -> collectionUri(b, identity, kind))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JsonNode.class);

        if (body == null || body.isNull() || body.isMissingNode()) {
            return List.of();
        }

        // object keyed by id; the store may answer with an array for numeric ids
        List<T> out = new ArrayList<>();
        for (JsonNode item : body) {
            if (item == null || item.isNull() || !item.isObject()) {
                continue;
            }
            try {
                out.add(objectMapper.treeToValue(item, type));
            } catch (JsonProcessingException | IllegalArgumentException ex) {
                log.warn("Skipping malformed remote {} document: {}", kind.collection(), ex.getMessage());
            }
        }
        return out;
    }

    @Override
    public void upsert(RemoteEntityKind kind, SyncIdentity identity, String id, Object document) {
        if (identity == null || restClient == null) {
            return;
        }
        restClient.put()
                .uri(b -> documentUri(b, identity, kind, id))
                .contentType(MediaType.APPLICATION_JSON)
                .body(document)
                .retrieve()
                .toBodilessEntity();
    }

    @Override
    public void delete(RemoteEntityKind kind, SyncIdentity identity, String id) {
        if (identity == null || restClient == null) {
            return;
        }
        restClient.delete()
                .uri(b -> documentUri(b, identity, kind, id))
                .retrieve()
                .toBodilessEntity();
    }

    private URI collectionUri(UriBuilder b, SyncIdentity identity, RemoteEntityKind kind) {
        b.path("/users/{key}/{collection}.json");
        withAuth(b);
        return b.build(identity.key(), kind.collection());
    }

    private URI documentUri(UriBuilder b, SyncIdentity identity, RemoteEntityKind kind, String id) {
        b.path("/users/{key}/{collection}/{id}.json");
        withAuth(b);
        return b.build(identity.key(), kind.collection(), id);
    }

    private void withAuth(UriBuilder b) {
        if (props.authToken() != null && !props.authToken().isBlank()) {
            b.queryParam("auth", props.authToken());
        }
    }
}
