package org.crmbridge.account.service;

/**
 * States of one {@link AccountCreationPipeline} execution.
 *
 * <p>{@code RECEIVED -> VALIDATED -> RECORD_CREATED | RECORD_FAILED -> EVENT_BUILT -> PUBLISHED |
 * PUBLISH_FAILED -> RESPONDED}. Validation failures go straight from RECEIVED to RESPONDED.
 */
public enum PipelineStage {
  RECEIVED,
  VALIDATED,
  RECORD_CREATED,
  RECORD_FAILED,
  EVENT_BUILT,
  PUBLISHED,
  PUBLISH_FAILED,
  RESPONDED,
}
