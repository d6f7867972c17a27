package com.scholary.talkingpet.record;

import com.scholary.talkingpet.error.PersistenceFailedException;
import java.sql.Timestamp;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Records completed generations in {@code pet_videos} through {@link JdbcTemplate}.
 *
 * <p>JDBC blocks, so the insert runs on the bounded generation executor instead of whichever
 * thread completed the previous step.
 */
@Repository
public class JdbcMetadataRecorder implements MetadataRecorder {

  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcMetadataRecorder.class);

  static final String INSERT_SQL =
      "insert into pet_videos (id, user_id, model_id, audio_url, video_url, final_url,"
          + " storage_key, image_url, script, prompt, voice_id, resolution, duration, created_at)"
          + " values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

  private final JdbcTemplate jdbcTemplate;
  private final Executor executor;

  public JdbcMetadataRecorder(
      JdbcTemplate jdbcTemplate, @Qualifier("generationExecutor") Executor executor) {
    this.jdbcTemplate = jdbcTemplate;
    this.executor = executor;
  }

  @Override
  public CompletableFuture<Void> record(PersistedRecord record) {
    try {
      return CompletableFuture.runAsync(() -> insert(record), executor);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(
          new PersistenceFailedException("Could not schedule record insert", e));
    }
  }

  void insert(PersistedRecord record) {
    UUID id = UUID.randomUUID();
    UUID userId;
    try {
      userId = record.userId() == null ? null : UUID.fromString(record.userId());
    } catch (IllegalArgumentException e) {
      throw new PersistenceFailedException("Invalid user id on record: " + record.userId(), e);
    }
    try {
      int inserted =
          jdbcTemplate.update(
              INSERT_SQL,
              id,
              userId,
              record.modelId(),
              record.audioUrl(),
              record.videoUrl(),
              record.finalUrl(),
              record.storageKey(),
              record.imageUrl(),
              record.script(),
              record.prompt(),
              record.voiceId(),
              record.resolution(),
              record.duration(),
              Timestamp.from(record.createdAt()));

      if (inserted != 1) {
        throw new PersistenceFailedException(
            "Expected to insert 1 pet_videos row, inserted " + inserted, null);
      }
      LOGGER.info("Recorded generation: id={}, model={}", id, record.modelId());

    } catch (DataAccessException e) {
      LOGGER.error("Failed to record generation: model={}", record.modelId(), e);
      throw new PersistenceFailedException("Failed to record generation: " + e.getMessage(), e);
    }
  }
}
