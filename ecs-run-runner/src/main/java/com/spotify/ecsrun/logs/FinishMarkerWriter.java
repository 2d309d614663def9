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

import static com.google.common.base.Preconditions.checkState;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.ecs.model.Container;
import com.amazonaws.services.ecs.model.Task;
import com.amazonaws.services.logs.model.InputLogEvent;
import com.amazonaws.services.logs.model.PutLogEventsResult;
import com.spotify.ecsrun.aws.EcsClient;
import com.spotify.ecsrun.aws.LogsClient;
import com.spotify.ecsrun.runner.FinalizationException;
import com.spotify.ecsrun.util.Time;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends the {@link FinishMarker} of a stopped container to its log stream, so that anyone
 * tailing the stream knows that no more output will follow.
 */
public class FinishMarkerWriter {

  private static final Logger LOG = LoggerFactory.getLogger(FinishMarkerWriter.class);

  private final LogsClient logs;
  private final Time time;

  public FinishMarkerWriter(LogsClient logs, Time time) {
    this.logs = Objects.requireNonNull(logs);
    this.time = Objects.requireNonNull(time);
  }

  /**
   * Writes the finish marker of a container.
   *
   * @throws IllegalStateException if the container has not stopped
   * @throws FinalizationException if the container has no exit code, or the marker could not be
   *     written
   */
  public void write(LogStreamRef stream, Task task, Container container)
      throws FinalizationException {
    checkState(EcsClient.STOPPED.equals(container.getLastStatus()),
        "expected container %s to be STOPPED, got %s",
        container.getName(), container.getLastStatus());

    if (container.getExitCode() == null) {
      throw new FinalizationException(stopReason(task, container));
    }

    final String message = FinishMarker.message(container.getContainerArn(),
        container.getExitCode());
    LOG.debug("Writing \"{}\" to {}", message, stream);

    final PutLogEventsResult result;
    try {
      logs.createLogStream(stream.logGroup(), stream.logStream());
      result = logs.putLogEvents(stream.logGroup(), stream.logStream(), List.of(
          new InputLogEvent().withMessage(message).withTimestamp(time.millis())));
    } catch (AmazonClientException e) {
      throw new FinalizationException("Failed to write finish marker to " + stream, e);
    }
    if (result.getRejectedLogEventsInfo() != null) {
      throw new FinalizationException("Finish marker rejected by " + stream + ": "
                                      + result.getRejectedLogEventsInfo());
    }
  }

  private static String stopReason(Task task, Container container) {
    if (container.getReason() != null) {
      return container.getReason();
    }
    if (task.getStoppedReason() != null) {
      return task.getStoppedReason();
    }
    return "Container " + container.getName() + " stopped without an exit code";
  }
}
