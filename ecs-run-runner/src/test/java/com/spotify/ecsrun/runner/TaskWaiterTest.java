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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.amazonaws.services.ecs.model.AmazonECSException;
import com.amazonaws.services.ecs.model.Container;
import com.amazonaws.services.ecs.model.DescribeTasksResult;
import com.amazonaws.services.ecs.model.Failure;
import com.amazonaws.services.ecs.model.Task;
import com.spotify.ecsrun.aws.EcsClient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class TaskWaiterTest {

  private static final String TASK_1 = "arn:aws:ecs:eu-west-1:123456789012:task/default/t1";
  private static final String TASK_2 = "arn:aws:ecs:eu-west-1:123456789012:task/default/t2";

  @Mock EcsClient ecs;

  @Test
  public void shouldPollUntilAllTasksHaveStopped() throws Exception {
    when(ecs.describeTasks("default", List.of(TASK_1, TASK_2)))
        .thenReturn(describe(task(TASK_1, "PENDING"), task(TASK_2, "PENDING")))
        .thenReturn(describe(task(TASK_1, "STOPPED"), task(TASK_2, "RUNNING")))
        .thenReturn(describe(task(TASK_1, "STOPPED"), task(TASK_2, "STOPPED")));

    var tasks = waiter().awaitStopped("default", List.of(TASK_1, TASK_2));

    assertThat(tasks.stream().map(Task::getTaskArn).toArray(), is(new Object[] {TASK_1, TASK_2}));
    verify(ecs, times(3)).describeTasks("default", List.of(TASK_1, TASK_2));
  }

  @Test
  public void shouldWaitForContainersOfStoppedTask() throws Exception {
    when(ecs.describeTasks("default", List.of(TASK_1)))
        .thenReturn(describe(task(TASK_1, "STOPPED", "RUNNING")))
        .thenReturn(describe(task(TASK_1, "STOPPED", "STOPPED")));

    var tasks = waiter().awaitStopped("default", List.of(TASK_1));

    assertThat(tasks, contains(task(TASK_1, "STOPPED", "STOPPED")));
    verify(ecs, times(2)).describeTasks("default", List.of(TASK_1));
  }

  @Test
  public void shouldFailOnMissingTask() {
    when(ecs.describeTasks("default", List.of(TASK_1))).thenReturn(new DescribeTasksResult()
        .withFailures(new Failure().withArn(TASK_1).withReason("MISSING")));

    var e = assertThrows(TaskPollingException.class,
        () -> waiter().awaitStopped("default", List.of(TASK_1)));

    assertThat(e.getMessage(), is("Failed to describe tasks: MISSING (" + TASK_1 + ")"));
  }

  @Test
  public void shouldWrapBackendFailure() {
    var cause = new AmazonECSException("Throttling");
    when(ecs.describeTasks("default", List.of(TASK_1))).thenThrow(cause);

    var e = assertThrows(TaskPollingException.class,
        () -> waiter().awaitStopped("default", List.of(TASK_1)));

    assertThat(e.getCause(), is(cause));
  }

  @Test(timeout = 10_000)
  public void shouldAbortWhenInterrupted() throws Exception {
    when(ecs.describeTasks("default", List.of(TASK_1)))
        .thenReturn(describe(task(TASK_1, "RUNNING", "RUNNING")));
    var waiter = new TaskWaiter(ecs, Duration.ofHours(1));
    var error = new AtomicReference<Throwable>();
    var thread = new Thread(() -> {
      try {
        waiter.awaitStopped("default", List.of(TASK_1));
      } catch (Throwable t) {
        error.set(t);
      }
    });

    thread.start();
    thread.interrupt();
    thread.join();

    assertThat(error.get() instanceof InterruptedException, is(true));
  }

  private TaskWaiter waiter() {
    return new TaskWaiter(ecs, Duration.ofMillis(1));
  }

  private static DescribeTasksResult describe(Task... tasks) {
    return new DescribeTasksResult().withTasks(tasks);
  }

  private static Task task(String arn, String lastStatus) {
    return task(arn, lastStatus, lastStatus);
  }

  private static Task task(String arn, String lastStatus, String containerStatus) {
    return new Task()
        .withTaskArn(arn)
        .withLastStatus(lastStatus)
        .withContainers(new Container().withName("app").withLastStatus(containerStatus));
  }
}
