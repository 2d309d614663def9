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

package com.spotify.ecsrun.aws;

import com.amazonaws.services.ecs.AmazonECS;
import com.amazonaws.services.ecs.model.DescribeTasksRequest;
import com.amazonaws.services.ecs.model.DescribeTasksResult;
import com.amazonaws.services.ecs.model.RegisterTaskDefinitionRequest;
import com.amazonaws.services.ecs.model.RunTaskRequest;
import com.amazonaws.services.ecs.model.RunTaskResult;
import com.amazonaws.services.ecs.model.TaskDefinition;
import java.util.List;
import java.util.Objects;

/**
 * A thin wrapper around the {@link AmazonECS} client that exposes the handful of calls needed to
 * run a task, behind an interface that is easy to mock.
 */
public interface EcsClient {

  String STOPPED = "STOPPED";

  TaskDefinition registerTaskDefinition(RegisterTaskDefinitionRequest request);

  RunTaskResult runTask(RunTaskRequest request);

  DescribeTasksResult describeTasks(String cluster, List<String> taskArns);

  static EcsClient of(AmazonECS ecs) {
    return new Impl(ecs);
  }

  class Impl implements EcsClient {

    private final AmazonECS ecs;

    public Impl(AmazonECS ecs) {
      this.ecs = Objects.requireNonNull(ecs);
    }

    @Override
    public TaskDefinition registerTaskDefinition(RegisterTaskDefinitionRequest request) {
      return ecs.registerTaskDefinition(request).getTaskDefinition();
    }

    @Override
    public RunTaskResult runTask(RunTaskRequest request) {
      return ecs.runTask(request);
    }

    @Override
    public DescribeTasksResult describeTasks(String cluster, List<String> taskArns) {
      return ecs.describeTasks(new DescribeTasksRequest()
          .withCluster(cluster)
          .withTasks(taskArns));
    }
  }
}
