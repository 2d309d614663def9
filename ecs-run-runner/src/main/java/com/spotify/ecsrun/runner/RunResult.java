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

package com.spotify.ecsrun.runner;

import com.amazonaws.services.ecs.model.Container;
import com.amazonaws.services.ecs.model.Task;
import com.google.auto.value.AutoValue;
import java.util.List;
import java.util.Optional;

/**
 * The outcome of a run: the first non-zero container exit code, tasks and containers taken in the
 * order the backend reports them, or 0 if every container succeeded.
 */
@AutoValue
public abstract class RunResult {

  public abstract int exitCode();

  /** The container that determined a non-zero exit code. */
  public abstract Optional<String> failedContainer();

  public boolean isSuccess() {
    return exitCode() == 0;
  }

  public static RunResult success() {
    return new AutoValue_RunResult(0, Optional.empty());
  }

  public static RunResult failure(int exitCode, String container) {
    if (exitCode == 0) {
      throw new IllegalArgumentException("exit code of a failure must not be 0");
    }
    return new AutoValue_RunResult(exitCode, Optional.of(container));
  }

  /**
   * Aggregates the exit codes of stopped tasks.
   *
   * @throws FinalizationException if a container has no exit code
   */
  public static RunResult of(List<Task> tasks) throws FinalizationException {
    for (Task task : tasks) {
      for (Container container : task.getContainers()) {
        final Integer exitCode = container.getExitCode();
        if (exitCode == null) {
          throw new FinalizationException("Container " + container.getName()
                                          + " has no exit code: " + container.getReason());
        }
        if (exitCode != 0) {
          return failure(exitCode, container.getName());
        }
      }
    }
    return success();
  }
}
