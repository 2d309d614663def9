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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.amazonaws.AbortedException;
import com.amazonaws.services.logs.model.AWSLogsException;
import com.amazonaws.services.logs.model.GetLogEventsResult;
import com.amazonaws.services.logs.model.OutputLogEvent;
import com.amazonaws.services.logs.model.ResourceNotFoundException;
import com.spotify.ecsrun.aws.FakeLogsClient;
import com.spotify.ecsrun.aws.LogsClient;
import com.spotify.ecsrun.logs.LogTailer.Outcome;
import com.spotify.ecsrun.util.Time;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class LogTailerTest {

  private static final String CONTAINER_ARN =
      "arn:aws:ecs:eu-west-1:123456789012:container/default/abc/5fd1c9ab";
  private static final String MARKER = FinishMarker.message(CONTAINER_ARN, 0);
  private static final LogStreamRef STREAM = LogStreamRef.create("group", "prefix/app/abc");

  private static final Duration POLL = Duration.ofMillis(1);
  private static final Duration DRAIN = Duration.ofSeconds(30);

  private final FakeLogsClient logs = new FakeLogsClient(2);
  private final List<String> output = new CopyOnWriteArrayList<>();
  private final ContainerLogPrinter printer = new ContainerLogPrinter(CONTAINER_ARN, output::add);
  private final CompletableFuture<Integer> running = new CompletableFuture<>();

  @Test
  @Parameters({"1", "2", "3", "4", "6"})
  public void shouldEmitEntriesBeforeMarkerAndStopAtIt(int position) {
    var entries = IntStream.rangeClosed(1, 6)
        .mapToObj(i -> i == position ? MARKER : "line " + i)
        .toArray(String[]::new);
    logs.append("group", "prefix/app/abc", entries);

    var outcome = tailer(logs, Time.SYSTEM).tail(STREAM, printer, running);

    var expected = IntStream.range(1, position)
        .mapToObj(i -> "line " + i)
        .collect(Collectors.toList());
    assertThat(outcome, is(Outcome.FINISHED));
    assertThat(output, is(expected));
  }

  @Test
  public void shouldIgnoreMarkersOfOtherContainers() {
    logs.append("group", "prefix/app/abc",
        "Container 00000000 exited with 1", "hello", MARKER, "after");

    var outcome = tailer(logs, Time.SYSTEM).tail(STREAM, printer, running);

    assertThat(outcome, is(Outcome.FINISHED));
    assertThat(output, contains("Container 00000000 exited with 1", "hello"));
  }

  @Test
  public void shouldWaitForStreamToBeCreated() {
    var client = mock(LogsClient.class);
    when(client.getLogEvents("group", "prefix/app/abc", Optional.empty()))
        .thenThrow(new ResourceNotFoundException("The specified log stream does not exist."))
        .thenThrow(new ResourceNotFoundException("The specified log stream does not exist."))
        .thenReturn(page("t1", "hello", MARKER));

    var outcome = tailer(client, Time.SYSTEM).tail(STREAM, printer, running);

    assertThat(outcome, is(Outcome.FINISHED));
    assertThat(output, contains("hello"));
  }

  @Test
  public void shouldFollowForwardToken() {
    var client = mock(LogsClient.class);
    when(client.getLogEvents("group", "prefix/app/abc", Optional.empty()))
        .thenReturn(page("t1", "one"));
    when(client.getLogEvents("group", "prefix/app/abc", Optional.of("t1")))
        .thenReturn(page("t1"))
        .thenReturn(page("t2", "two", MARKER));

    var outcome = tailer(client, Time.SYSTEM).tail(STREAM, printer, running);

    assertThat(outcome, is(Outcome.FINISHED));
    assertThat(output, contains("one", "two"));
    verify(client).getLogEvents("group", "prefix/app/abc", Optional.empty());
  }

  @Test
  public void shouldStopOnFetchFailure() {
    var client = mock(LogsClient.class);
    when(client.getLogEvents(eq("group"), eq("prefix/app/abc"), any()))
        .thenReturn(page("t1", "hello"))
        .thenThrow(new AWSLogsException("Rate exceeded"));

    var outcome = tailer(client, Time.SYSTEM).tail(STREAM, printer, running);

    assertThat(outcome, is(Outcome.FAILED));
    assertThat(output, contains("hello"));
  }

  @Test
  public void shouldGiveUpAfterDrainTimeoutWhenFinished() {
    logs.append("group", "prefix/app/abc", "hello", "world");
    var now = new AtomicReference<>(Instant.parse("2026-01-01T00:00:00Z"));
    Time ticking = () -> now.getAndUpdate(t -> t.plusSeconds(10));
    running.complete(0);

    var outcome = tailer(logs, ticking).tail(STREAM, printer, running);

    assertThat(outcome, is(Outcome.DRAIN_TIMEOUT));
    assertThat(output, contains("hello", "world"));
  }

  @Test
  public void shouldKeepDrainingWhileBacklogIsBeingRead() {
    var lines = IntStream.rangeClosed(1, 20)
        .mapToObj(i -> "line " + i)
        .collect(Collectors.toList());
    logs.append("group", "prefix/app/abc", lines.toArray(new String[0]));
    logs.append("group", "prefix/app/abc", MARKER);
    var now = new AtomicReference<>(Instant.parse("2026-01-01T00:00:00Z"));
    Time ticking = () -> now.getAndUpdate(t -> t.plusSeconds(10));
    running.complete(0);

    var outcome = tailer(logs, ticking).tail(STREAM, printer, running);

    assertThat(outcome, is(Outcome.FINISHED));
    assertThat(output, is(lines));
  }

  @Test
  public void shouldPreferMarkerOverDrainTimeout() {
    logs.append("group", "prefix/app/abc", "hello", MARKER);
    running.complete(0);

    var outcome = tailer(logs, Time.SYSTEM).tail(STREAM, printer, running);

    assertThat(outcome, is(Outcome.FINISHED));
    assertThat(output, contains("hello"));
  }

  @Test
  public void shouldNotFetchWhenAlreadyInterrupted() {
    var client = mock(LogsClient.class);

    Thread.currentThread().interrupt();
    final Outcome outcome;
    try {
      outcome = tailer(client, Time.SYSTEM).tail(STREAM, printer, running);
    } finally {
      Thread.interrupted();
    }

    assertThat(outcome, is(Outcome.CANCELLED));
    verifyNoInteractions(client);
  }

  @Test
  public void shouldTreatAbortedFetchAsCancelled() {
    var client = mock(LogsClient.class);
    when(client.getLogEvents(eq("group"), eq("prefix/app/abc"), any()))
        .thenReturn(page("t1", "hello"))
        .thenThrow(new AbortedException());

    final Outcome outcome;
    final boolean interrupted;
    try {
      outcome = tailer(client, Time.SYSTEM).tail(STREAM, printer, running);
    } finally {
      interrupted = Thread.interrupted();
    }

    assertThat(outcome, is(Outcome.CANCELLED));
    assertThat(interrupted, is(true));
    assertThat(output, contains("hello"));
  }

  @Test(timeout = 10_000)
  public void shouldStopWaitingBetweenPollsWhenInterrupted() throws Exception {
    var tailer = new LogTailer(logs, Duration.ofHours(1), DRAIN, Time.SYSTEM);
    var outcome = new AtomicReference<Outcome>();
    var thread = new Thread(() -> outcome.set(tailer.tail(STREAM, printer, running)));

    thread.start();
    while (logs.fetches() == 0) {
      Thread.sleep(1);
    }
    thread.interrupt();
    thread.join();

    assertThat(outcome.get(), is(Outcome.CANCELLED));
    assertThat(logs.fetches(), is(1));
    assertThat(output, is(empty()));
  }

  private static LogTailer tailer(LogsClient client, Time time) {
    return new LogTailer(client, POLL, DRAIN, time);
  }

  private static GetLogEventsResult page(String nextToken, String... messages) {
    var events = new ArrayList<OutputLogEvent>();
    for (String message : messages) {
      events.add(new OutputLogEvent().withMessage(message).withTimestamp(0L));
    }
    return new GetLogEventsResult().withEvents(events).withNextForwardToken(nextToken);
  }
}
