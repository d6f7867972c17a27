package com.scholary.talkingpet.record;

import java.util.concurrent.CompletableFuture;

/**
 * Writes the completion record for a workflow.
 *
 * <p>This is the commit point: a workflow is only successful once this write succeeds. Failures
 * complete the future with {@link com.scholary.talkingpet.error.PersistenceFailedException}.
 */
public interface MetadataRecorder {

  CompletableFuture<Void> record(PersistedRecord record);
}
