package com.scholary.talkingpet.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Workflow steps complete on whatever thread finished the previous future, so the thread's own
 * MDC can't be trusted. Every method takes the correlation id explicitly and sets it, together
 * with the event fields, only for the duration of the log call.
 */
public class StructuredLogger {

  public static final String CORRELATION_ID = "correlationId";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log workflow started event. */
  public void logWorkflowStarted(
      String correlationId, String workflow, String modelId, String resolution) {
    try {
      putContext(correlationId, "workflow_started");
      MDC.put("workflow", workflow);
      MDC.put("modelId", modelId);
      MDC.put("resolution", resolution);

      logger.info(
          "Workflow started: workflow={}, model={}, resolution={}", workflow, modelId, resolution);
    } finally {
      clearEventFields();
    }
  }

  /** Log step finished event. */
  public void logStepFinished(String correlationId, String step, long elapsedMs) {
    try {
      putContext(correlationId, "step_finished");
      MDC.put("step", step);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Step finished: step={}, elapsed={}ms", step, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log workflow completed event. */
  public void logWorkflowCompleted(
      String correlationId, String workflow, String finalUrl, boolean muxed, long elapsedMs) {
    try {
      putContext(correlationId, "workflow_completed");
      MDC.put("workflow", workflow);
      MDC.put("muxed", String.valueOf(muxed));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Workflow completed: workflow={}, muxed={}, finalUrl={}, elapsed={}ms",
          workflow,
          muxed,
          finalUrl,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log workflow failure event. */
  public void logWorkflowFailed(
      String correlationId, String workflow, String errorCode, String message, int uploads) {
    try {
      putContext(correlationId, "workflow_failed");
      MDC.put("workflow", workflow);
      MDC.put("errorCode", errorCode);
      MDC.put("uploads", String.valueOf(uploads));

      logger.error(
          "Workflow failed: workflow={}, error={}, uploadsToRollBack={}, message={}",
          workflow,
          errorCode,
          uploads,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log compensating delete event. */
  public void logRollbackDelete(
      String correlationId, String storagePath, boolean deleted, String message) {
    try {
      putContext(correlationId, "rollback_delete");
      MDC.put("storagePath", storagePath);
      MDC.put("deleted", String.valueOf(deleted));

      if (deleted) {
        logger.info("Rollback deleted artifact: path={}", storagePath);
      } else {
        logger.warn("Rollback could not delete artifact: path={}, error={}", storagePath, message);
      }
    } finally {
      clearEventFields();
    }
  }

  private static void putContext(String correlationId, String eventType) {
    if (correlationId != null) {
      MDC.put(CORRELATION_ID, correlationId);
    }
    MDC.put("event_type", eventType);
  }

  /** Clear event-specific fields from MDC. */
  private static void clearEventFields() {
    MDC.remove(CORRELATION_ID);
    MDC.remove("event_type");
    MDC.remove("workflow");
    MDC.remove("modelId");
    MDC.remove("resolution");
    MDC.remove("step");
    MDC.remove("elapsedMs");
    MDC.remove("muxed");
    MDC.remove("errorCode");
    MDC.remove("uploads");
    MDC.remove("storagePath");
    MDC.remove("deleted");
  }
}
