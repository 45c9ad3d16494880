package app.lexis.core.sync.client;

import app.lexis.core.sync.domain.RemoteEntityKind;
import app.lexis.core.sync.domain.SyncIdentity;

import java.util.List;

/**
 * Keyed document store holding each learner's replica. Every operation is a
 * no-op when {@code identity} is {@code null}. Transport failures surface as
 * unchecked exceptions; callers decide whether they are fatal.
 */
public interface RemoteStoreClient {

    <T> List<T> fetchAll(RemoteEntityKind kind, SyncIdentity identity, Class<T> type);

    void upsert(RemoteEntityKind kind, SyncIdentity identity, String id, Object document);

    void delete(RemoteEntityKind kind, SyncIdentity identity, String id);
}
