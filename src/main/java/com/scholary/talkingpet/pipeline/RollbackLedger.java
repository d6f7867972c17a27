package com.scholary.talkingpet.pipeline;

import com.scholary.talkingpet.error.Failures;
import com.scholary.talkingpet.logging.StructuredLogger;
import com.scholary.talkingpet.storage.ArtifactStore;
import com.scholary.talkingpet.storage.StoredArtifact;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Undo list for one request's uploads.
 *
 * <p>Storage and the relational store share no transaction, so instead every successful upload is
 * registered here and, if the workflow fails later, deleted again in reverse order. Each path is
 * deleted at most once however often {@link #rollback()} is called. A failed delete is logged and
 * skipped; the returned future always completes normally so the original error stays the one the
 * caller sees.
 */
public class RollbackLedger {

  private final ArtifactStore artifactStore;
  private final StructuredLogger structuredLogger;
  private final String correlationId;
  private final Map<String, StoredArtifact> uploads = new LinkedHashMap<>();

  public RollbackLedger(
      ArtifactStore artifactStore, StructuredLogger structuredLogger, String correlationId) {
    this.artifactStore = artifactStore;
    this.structuredLogger = structuredLogger;
    this.correlationId = correlationId;
  }

  public synchronized void register(StoredArtifact artifact) {
    uploads.putIfAbsent(artifact.storagePath(), artifact);
  }

  public synchronized int size() {
    return uploads.size();
  }

  /** Delete everything registered so far, newest first, then forget it. */
  public CompletableFuture<Void> rollback() {
    List<StoredArtifact> pending;
    synchronized (this) {
      pending = new ArrayList<>(uploads.values());
      uploads.clear();
    }
    Collections.reverse(pending);

    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
    for (StoredArtifact artifact : pending) {
      chain = chain.thenCompose(ignored -> deleteLogged(artifact));
    }
    return chain;
  }

  private CompletableFuture<Void> deleteLogged(StoredArtifact artifact) {
    CompletableFuture<Void> delete;
    try {
      delete = artifactStore.delete(artifact.storagePath());
    } catch (RuntimeException e) {
      delete = CompletableFuture.failedFuture(e);
    }

    return delete.handle(
        (ignored, error) -> {
          if (error == null) {
            structuredLogger.logRollbackDelete(correlationId, artifact.storagePath(), true, null);
          } else {
            structuredLogger.logRollbackDelete(
                correlationId,
                artifact.storagePath(),
                false,
                Failures.unwrap(error).getMessage());
          }
          return null;
        });
  }
}
