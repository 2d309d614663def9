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

import com.spotify.ecsrun.aws.EcsClient;
import com.spotify.ecsrun.aws.LogsClient;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Runs a task definition to completion.
 */
public interface TaskRunner {

  /**
   * Submits a run, forwards the output of its containers and blocks until all of them have
   * stopped.
   *
   * @throws InterruptedException if the calling thread is interrupted, which cancels the run
   */
  RunResult run(RunSpec spec) throws RunException, InterruptedException;

  /**
   * Create a {@link TaskRunner} that runs tasks on ECS.
   *
   * @param env    environment that bare override variables are looked up in
   * @param output receives every line the containers log
   */
  static TaskRunner ecs(EcsClient ecs, LogsClient logs, RunnerConfig config,
                        Map<String, String> env, Consumer<String> output) {
    return new RunOrchestrator(ecs, logs, config, env, output);
  }
}
