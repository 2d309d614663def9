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

import com.amazonaws.services.ecs.model.Container;
import com.amazonaws.services.ecs.model.Task;
import com.google.auto.value.AutoValue;
import com.spotify.ecsrun.aws.Arns;

/**
 * Identifies the CloudWatch Logs stream a container of a task writes to when it is configured with
 * the awslogs driver.
 */
@AutoValue
public abstract class LogStreamRef {

  public abstract String logGroup();

  public abstract String logStream();

  public static LogStreamRef create(String logGroup, String logStream) {
    return new AutoValue_LogStreamRef(logGroup, logStream);
  }

  /**
   * The awslogs driver names streams {@code prefix/container-name/task-id}.
   */
  public static LogStreamRef of(String logGroup, String streamPrefix, Container container,
                                Task task) {
    return create(logGroup, String.join("/",
        streamPrefix, container.getName(), Arns.resourceId(task.getTaskArn())));
  }

  @Override
  public String toString() {
    return logGroup() + ":" + logStream();
  }
}
