/*-
 * -\-\-
 * ECS Run Task Runner
 * --
 * Copyright (C) 2026 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.ecsrun.logs;

import com.amazonaws.AbortedException;
import com.amazonaws.AmazonClientException;
import com.amazonaws.services.logs.model.GetLogEventsResult;
import com.amazonaws.services.logs.model.OutputLogEvent;
import com.amazonaws.services.logs.model.ResourceNotFoundException;
import com.spotify.ecsrun.aws.LogsClient;
import com.spotify.ecsrun.util.Time;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Follows a single CloudWatch Logs stream from its head, handing every event to a predicate until
 * the predicate asks to stop.
 *
 * <p>The stream may not exist when tailing starts; it is polled until it appears. Once the
 * {@code finished} future passed to {@link #tail} completes, the tailer keeps reading until the
 * stream has been idle for the configured drain timeout before giving up on seeing its end.
 *
 * <p>Interrupting the tailing thread stops it without another fetch. A fetch aborted by the
 * interrupt also counts as cancellation.
 */
public class LogTailer {

  private static final Logger LOG = LoggerFactory.getLogger(LogTailer.class);

  public enum Outcome {
    /** The predicate returned false. */
    FINISHED,
    /** The source finished and no terminating event was seen within the drain timeout. */
    DRAIN_TIMEOUT,
    /** Reading the stream failed. */
    FAILED,
    /** The tailing thread was interrupted. */
    CANCELLED,
  }

  private final LogsClient logs;
  private final Duration pollInterval;
  private final Duration drainTimeout;
  private final Time time;

  public LogTailer(LogsClient logs, Duration pollInterval, Duration drainTimeout, Time time) {
    this.logs = Objects.requireNonNull(logs);
    this.pollInterval = Objects.requireNonNull(pollInterval);
    this.drainTimeout = Objects.requireNonNull(drainTimeout);
    this.time = Objects.requireNonNull(time);
  }

  public Outcome tail(LogStreamRef stream, Predicate<OutputLogEvent> shouldContinue,
                      CompletableFuture<?> finished) {
    LOG.debug("Tailing {}", stream);
    Optional<String> token = Optional.empty();
    Instant drainDeadline = null;

    while (!Thread.currentThread().isInterrupted()) {
      final Optional<GetLogEventsResult> page;
      try {
        page = fetch(stream, token);
      } catch (AbortedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (AmazonClientException e) {
        LOG.warn("Failed to read {}, no longer tailing it", stream, e);
        return Outcome.FAILED;
      }

      boolean progressed = false;
      if (page.isPresent()) {
        for (OutputLogEvent event : page.get().getEvents()) {
          if (!shouldContinue.test(event)) {
            LOG.debug("Done tailing {}", stream);
            return Outcome.FINISHED;
          }
          progressed = true;
        }
        final String next = page.get().getNextForwardToken();
        if (next != null) {
          token = Optional.of(next);
        }
      }

      if (finished.isDone()) {
        final Instant now = time.get();
        if (drainDeadline == null || progressed) {
          drainDeadline = now.plus(drainTimeout);
        } else if (!now.isBefore(drainDeadline)) {
          LOG.warn("Gave up on {}, no end of stream seen within {} after it finished",
              stream, drainTimeout);
          return Outcome.DRAIN_TIMEOUT;
        }
      }

      if (!progressed) {
        try {
          Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
    }

    LOG.debug("Tailing of {} cancelled", stream);
    return Outcome.CANCELLED;
  }

  private Optional<GetLogEventsResult> fetch(LogStreamRef stream, Optional<String> token) {
    try {
      return Optional.of(logs.getLogEvents(stream.logGroup(), stream.logStream(), token));
    } catch (ResourceNotFoundException e) {
      LOG.debug("{} does not exist yet", stream);
      return Optional.empty();
    }
  }
}
