package com.scholary.talkingpet.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import com.scholary.talkingpet.error.StorageUnavailableException;
import com.scholary.talkingpet.logging.StructuredLogger;
import com.scholary.talkingpet.storage.ArtifactStore;
import com.scholary.talkingpet.storage.StoredArtifact;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

@ExtendWith(MockitoExtension.class)
class RollbackLedgerTest {

  private static final StoredArtifact AUDIO =
      new StoredArtifact("https://s/a.mp3", "anonymous/audio/a.mp3", "audio/mpeg");
  private static final StoredArtifact FINAL =
      new StoredArtifact("https://s/f.mp4", "anonymous/videos/f.mp4", "video/mp4");

  @Mock private ArtifactStore artifactStore;

  private RollbackLedger ledger;

  @BeforeEach
  void setUp() {
    ledger =
        new RollbackLedger(
            artifactStore,
            new StructuredLogger(LoggerFactory.getLogger(RollbackLedgerTest.class)),
            "cid-1");
  }

  @Test
  void rollback_shouldDeleteNewestFirst() {
    when(artifactStore.delete(anyString())).thenReturn(CompletableFuture.completedFuture(null));
    ledger.register(AUDIO);
    ledger.register(FINAL);

    ledger.rollback().join();

    InOrder order = inOrder(artifactStore);
    order.verify(artifactStore).delete(FINAL.storagePath());
    order.verify(artifactStore).delete(AUDIO.storagePath());
  }

  @Test
  void rollback_shouldDeleteEachPathOnceEvenWhenCalledTwice() {
    when(artifactStore.delete(anyString())).thenReturn(CompletableFuture.completedFuture(null));
    ledger.register(AUDIO);
    ledger.register(AUDIO);

    ledger.rollback().join();
    ledger.rollback().join();

    verify(artifactStore, times(1)).delete(AUDIO.storagePath());
    verifyNoMoreInteractions(artifactStore);
    assertThat(ledger.size()).isZero();
  }

  @Test
  void rollback_shouldContinuePastFailedDelete() {
    when(artifactStore.delete(FINAL.storagePath()))
        .thenReturn(
            CompletableFuture.failedFuture(
                new StorageUnavailableException("storage down", null)));
    when(artifactStore.delete(AUDIO.storagePath()))
        .thenThrow(new IllegalStateException("client closed"));
    ledger.register(AUDIO);
    ledger.register(FINAL);

    CompletableFuture<Void> rollback = ledger.rollback();

    assertThat(rollback.join()).isNull();
    verify(artifactStore).delete(FINAL.storagePath());
    verify(artifactStore).delete(AUDIO.storagePath());
  }

  @Test
  void rollback_shouldCompleteImmediatelyWhenEmpty() {
    assertThat(ledger.rollback()).isCompleted();
    verifyNoMoreInteractions(artifactStore);
  }
}
