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

import static java.util.stream.Collectors.toList;

import com.amazonaws.AmazonClientException;
import com.amazonaws.services.ecs.model.AwsVpcConfiguration;
import com.amazonaws.services.ecs.model.Container;
import com.amazonaws.services.ecs.model.ContainerOverride;
import com.amazonaws.services.ecs.model.LaunchType;
import com.amazonaws.services.ecs.model.LogConfiguration;
import com.amazonaws.services.ecs.model.NetworkConfiguration;
import com.amazonaws.services.ecs.model.RegisterTaskDefinitionRequest;
import com.amazonaws.services.ecs.model.RunTaskRequest;
import com.amazonaws.services.ecs.model.RunTaskResult;
import com.amazonaws.services.ecs.model.Task;
import com.amazonaws.services.ecs.model.TaskDefinition;
import com.amazonaws.services.ecs.model.TaskOverride;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.spotify.ecsrun.aws.EcsClient;
import com.spotify.ecsrun.aws.Failures;
import com.spotify.ecsrun.aws.LogsClient;
import com.spotify.ecsrun.logs.ContainerLogPrinter;
import com.spotify.ecsrun.logs.FinishMarkerWriter;
import com.spotify.ecsrun.logs.LogStreamRef;
import com.spotify.ecsrun.logs.LogTailer;
import com.spotify.ecsrun.taskdef.TaskDefinitions;
import com.spotify.ecsrun.util.Time;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link TaskRunner} that registers a task definition on ECS, runs it and tails the CloudWatch
 * Logs stream of every container while waiting for the tasks to stop.
 *
 * <p>Once the tasks have stopped a finish marker is appended to each container's stream and the
 * tailer of that container is told the container is done. The run returns after every tailer has
 * seen its marker or given up.
 */
class RunOrchestrator implements TaskRunner {

  private static final Logger LOG = LoggerFactory.getLogger(RunOrchestrator.class);

  private static final ThreadFactory TAILER_THREAD_FACTORY = new ThreadFactoryBuilder()
      .setDaemon(true)
      .setNameFormat("log-tailer-%d")
      .build();

  private static final int MAX_STARTED_BY_LENGTH = 128;

  private final EcsClient ecs;
  private final LogsClient logs;
  private final RunnerConfig config;
  private final Consumer<String> output;
  private final Time time;
  private final OverrideResolver overrideResolver;
  private final LogTailer tailer;
  private final FinishMarkerWriter markerWriter;
  private final TaskWaiter waiter;

  RunOrchestrator(EcsClient ecs, LogsClient logs, RunnerConfig config, Map<String, String> env,
                  Consumer<String> output) {
    this(ecs, logs, config, env, output, Time.SYSTEM);
  }

  @VisibleForTesting
  RunOrchestrator(EcsClient ecs, LogsClient logs, RunnerConfig config, Map<String, String> env,
                  Consumer<String> output, Time time) {
    this.ecs = Objects.requireNonNull(ecs);
    this.logs = Objects.requireNonNull(logs);
    this.config = Objects.requireNonNull(config);
    this.output = Objects.requireNonNull(output);
    this.time = Objects.requireNonNull(time);
    this.overrideResolver = new OverrideResolver(env);
    this.tailer = new LogTailer(logs, config.logPollInterval(), config.tailDrainTimeout(), time);
    this.markerWriter = new FinishMarkerWriter(logs, time);
    this.waiter = new TaskWaiter(ecs, config.taskPollInterval());
  }

  @Override
  public RunResult run(RunSpec spec) throws RunException, InterruptedException {
    final String streamPrefix = streamPrefix(spec);
    final List<Task> tasks = submit(spec, streamPrefix);

    final ExecutorService executor = Executors.newCachedThreadPool(TAILER_THREAD_FACTORY);
    try {
      return follow(spec, streamPrefix, tasks, executor);
    } finally {
      executor.shutdownNow();
    }
  }

  private List<Task> submit(RunSpec spec, String streamPrefix)
      throws RunException, InterruptedException {
    final List<ContainerOverride> overrides = overrideResolver.resolve(
        spec.overrides(), spec.environment(), spec.taskDefinition().containerNames());

    checkCancelled();
    try {
      logs.createLogGroup(spec.logGroup());
    } catch (AmazonClientException e) {
      throw new SubmissionException("Failed to create log group " + spec.logGroup() + ": "
                                    + e.getMessage(), e);
    }

    checkCancelled();
    final String taskDefinition = register(spec, streamPrefix);

    checkCancelled();
    final RunTaskRequest request = new RunTaskRequest()
        .withCluster(spec.cluster())
        .withTaskDefinition(taskDefinition)
        .withCount(spec.count())
        .withStartedBy(startedBy(streamPrefix))
        .withOverrides(new TaskOverride().withContainerOverrides(overrides));
    if (spec.fargate()) {
      request.withLaunchType(LaunchType.FARGATE);
    }
    if (spec.awsvpc()) {
      request.setNetworkConfiguration(new NetworkConfiguration()
          .withAwsvpcConfiguration(new AwsVpcConfiguration()
              .withSubnets(spec.subnets())
              .withSecurityGroups(spec.securityGroups())
              .withAssignPublicIp(config.assignPublicIp())));
    }

    LOG.info("Running {} task(s) of {} on cluster {}", spec.count(), taskDefinition,
        spec.cluster());
    final RunTaskResult result;
    try {
      result = ecs.runTask(request);
    } catch (AmazonClientException e) {
      throw new SubmissionException("Unable to run task: " + e.getMessage(), e);
    }
    if (!result.getFailures().isEmpty()) {
      throw new SubmissionException("Unable to run task: "
                                    + Failures.describe(result.getFailures()));
    }
    if (result.getTasks().isEmpty()) {
      throw new SubmissionException("Unable to run task: no tasks were started");
    }
    return result.getTasks();
  }

  private String register(RunSpec spec, String streamPrefix) throws SubmissionException {
    final RegisterTaskDefinitionRequest request =
        TaskDefinitions.registerRequest(spec.taskDefinition());

    LOG.info("Setting tasks to use log group {}", spec.logGroup());
    final Map<String, String> options = Map.of(
        "awslogs-group", spec.logGroup(),
        "awslogs-region", spec.region(),
        "awslogs-stream-prefix", streamPrefix);
    request.getContainerDefinitions().forEach(definition -> definition.setLogConfiguration(
        new LogConfiguration().withLogDriver("awslogs").withOptions(options)));

    LOG.info("Registering a task for {}", request.getFamily());
    final TaskDefinition registered;
    try {
      registered = ecs.registerTaskDefinition(request);
    } catch (AmazonClientException e) {
      throw new SubmissionException("Failed to register task definition "
                                    + request.getFamily() + ": " + e.getMessage(), e);
    }
    final String taskDefinition = registered.getFamily() + ":" + registered.getRevision();
    LOG.info("Registered task definition {}", taskDefinition);
    return taskDefinition;
  }

  private RunResult follow(RunSpec spec, String streamPrefix, List<Task> tasks,
                           ExecutorService executor)
      throws RunException, InterruptedException {
    final Map<String, CompletableFuture<Integer>> stopped = new HashMap<>();
    final List<CompletableFuture<Void>> tailers = new ArrayList<>();
    for (Task task : tasks) {
      for (Container container : task.getContainers()) {
        final LogStreamRef stream = LogStreamRef.of(spec.logGroup(), streamPrefix, container, task);
        final CompletableFuture<Integer> containerStopped = new CompletableFuture<>();
        stopped.put(container.getContainerArn(), containerStopped);
        final ContainerLogPrinter printer =
            new ContainerLogPrinter(container.getContainerArn(), output);
        tailers.add(CompletableFuture.runAsync(
            () -> tail(stream, printer, containerStopped), executor));
      }
    }

    final List<String> taskArns = tasks.stream().map(Task::getTaskArn).collect(toList());
    taskArns.forEach(arn -> LOG.info("Waiting until task {} has stopped", arn));
    waiter.awaitStopped(spec.cluster(), taskArns);
    LOG.info("All tasks have stopped");

    final List<Task> finalTasks = waiter.describe(spec.cluster(), taskArns);
    for (Task task : finalTasks) {
      for (Container container : task.getContainers()) {
        markerWriter.write(LogStreamRef.of(spec.logGroup(), streamPrefix, container, task),
            task, container);
        final CompletableFuture<Integer> containerStopped =
            stopped.get(container.getContainerArn());
        if (containerStopped != null) {
          containerStopped.complete(container.getExitCode());
        }
      }
    }

    LOG.info("Waiting for logs to finish");
    try {
      CompletableFuture.allOf(tailers.toArray(new CompletableFuture[0])).get();
    } catch (ExecutionException e) {
      throw new IllegalStateException("Log tailer failed", e.getCause());
    }

    final RunResult result = RunResult.of(finalTasks);
    if (result.isSuccess()) {
      LOG.info("All containers exited with 0");
    } else {
      LOG.info("Container {} exited with {}", result.failedContainer().orElse(""),
          result.exitCode());
    }
    return result;
  }

  private void tail(LogStreamRef stream, ContainerLogPrinter printer,
                    CompletableFuture<Integer> containerStopped) {
    try {
      tailer.tail(stream, printer, containerStopped);
    } catch (RuntimeException e) {
      LOG.warn("Tailing {} failed", stream, e);
    }
  }

  private String streamPrefix(RunSpec spec) {
    return spec.name().orElseGet(() -> {
      final Instant now = time.get();
      return "run_task_" + (now.getEpochSecond() * 1_000_000_000L + now.getNano());
    });
  }

  @VisibleForTesting
  static String startedBy(String streamPrefix) {
    final String sanitized = streamPrefix.replaceAll("[^A-Za-z0-9_-]", "_");
    return sanitized.length() > MAX_STARTED_BY_LENGTH
           ? sanitized.substring(0, MAX_STARTED_BY_LENGTH)
           : sanitized;
  }

  private static void checkCancelled() throws InterruptedException {
    if (Thread.interrupted()) {
      throw new InterruptedException("Run cancelled");
    }
  }
}
