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

import com.google.auto.value.AutoValue;
import com.typesafe.config.Config;
import java.time.Duration;

/**
 * Tunables of the {@link RunOrchestrator}, read from the {@code ecs-run} section of the
 * configuration.
 */
@AutoValue
public abstract class RunnerConfig {

  static final String LOG_POLL_INTERVAL = "ecs-run.log-poll-interval";
  static final String TASK_POLL_INTERVAL = "ecs-run.task-poll-interval";
  static final String TAIL_DRAIN_TIMEOUT = "ecs-run.tail-drain-timeout";
  static final String ASSIGN_PUBLIC_IP = "ecs-run.assign-public-ip";

  public abstract Duration logPollInterval();

  public abstract Duration taskPollInterval();

  public abstract Duration tailDrainTimeout();

  /** {@code ENABLED} or {@code DISABLED}. */
  public abstract String assignPublicIp();

  public static RunnerConfig create(Duration logPollInterval, Duration taskPollInterval,
                                    Duration tailDrainTimeout, String assignPublicIp) {
    return new AutoValue_RunnerConfig(logPollInterval, taskPollInterval, tailDrainTimeout,
        assignPublicIp);
  }

  public static RunnerConfig fromConfig(Config config) {
    return create(
        config.getDuration(LOG_POLL_INTERVAL),
        config.getDuration(TASK_POLL_INTERVAL),
        config.getDuration(TAIL_DRAIN_TIMEOUT),
        config.getString(ASSIGN_PUBLIC_IP));
  }
}
