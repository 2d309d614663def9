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

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.ecs.model.Container;
import com.amazonaws.services.ecs.model.DescribeTasksResult;
import com.amazonaws.services.ecs.model.Task;
import com.spotify.ecsrun.aws.EcsClient;
import com.spotify.ecsrun.aws.Failures;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls ECS until a set of tasks has stopped. There is no timeout; interrupt the waiting thread
 * to give up.
 */
public class TaskWaiter {

  private static final Logger LOG = LoggerFactory.getLogger(TaskWaiter.class);

  private final EcsClient ecs;
  private final Duration pollInterval;

  public TaskWaiter(EcsClient ecs, Duration pollInterval) {
    this.ecs = Objects.requireNonNull(ecs);
    this.pollInterval = Objects.requireNonNull(pollInterval);
  }

  /**
   * Blocks until every task and each of its containers is STOPPED.
   *
   * @return the stopped tasks as last described
   * @throws TaskPollingException if describing the tasks fails or a task is missing
   */
  public List<Task> awaitStopped(String cluster, List<String> taskArns)
      throws TaskPollingException, InterruptedException {
    final Map<String, String> lastStatus = new HashMap<>();
    while (true) {
      final List<Task> tasks = describe(cluster, taskArns);
      for (Task task : tasks) {
        final String status = task.getLastStatus();
        if (!Objects.equals(lastStatus.put(task.getTaskArn(), status), status)) {
          LOG.info("Task {} is {}", task.getTaskArn(), status);
        }
      }
      if (tasks.size() == taskArns.size() && tasks.stream().allMatch(TaskWaiter::isStopped)) {
        return tasks;
      }
      Thread.sleep(pollInterval.toMillis());
    }
  }

  /**
   * Describes tasks once.
   *
   * @throws TaskPollingException if describing the tasks fails or a task is missing
   */
  public List<Task> describe(String cluster, List<String> taskArns) throws TaskPollingException {
    final DescribeTasksResult result;
    try {
      result = ecs.describeTasks(cluster, taskArns);
    } catch (AmazonClientException e) {
      throw new TaskPollingException("Failed to describe tasks: " + e.getMessage(), e);
    }
    if (!result.getFailures().isEmpty()) {
      throw new TaskPollingException("Failed to describe tasks: "
                                     + Failures.describe(result.getFailures()));
    }
    return result.getTasks();
  }

  static boolean isStopped(Task task) {
    return EcsClient.STOPPED.equals(task.getLastStatus())
           && task.getContainers().stream().map(Container::getLastStatus)
               .allMatch(EcsClient.STOPPED::equals);
  }
}
