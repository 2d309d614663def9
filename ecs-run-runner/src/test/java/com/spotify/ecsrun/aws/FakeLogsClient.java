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

import com.amazonaws.services.logs.model.GetLogEventsResult;
import com.amazonaws.services.logs.model.InputLogEvent;
import com.amazonaws.services.logs.model.OutputLogEvent;
import com.amazonaws.services.logs.model.PutLogEventsResult;
import com.amazonaws.services.logs.model.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An in-memory {@link LogsClient} serving pages of at most {@code pageSize} events.
 */
public class FakeLogsClient implements LogsClient {

  private final int pageSize;
  private final Set<String> groups = new HashSet<>();
  private final Map<String, List<OutputLogEvent>> streams = new LinkedHashMap<>();
  private final AtomicInteger fetches = new AtomicInteger();

  public FakeLogsClient() {
    this(2);
  }

  public FakeLogsClient(int pageSize) {
    this.pageSize = pageSize;
  }

  @Override
  public synchronized boolean createLogGroup(String logGroupName) {
    return groups.add(logGroupName);
  }

  @Override
  public synchronized boolean createLogStream(String logGroupName, String logStreamName) {
    if (!groups.contains(logGroupName)) {
      throw new ResourceNotFoundException("The specified log group does not exist.");
    }
    return streams.putIfAbsent(key(logGroupName, logStreamName), new ArrayList<>()) == null;
  }

  @Override
  public synchronized GetLogEventsResult getLogEvents(String logGroupName, String logStreamName,
                                                      Optional<String> nextToken) {
    fetches.incrementAndGet();
    final List<OutputLogEvent> events = stream(logGroupName, logStreamName);
    final int from = nextToken.map(token -> Integer.parseInt(token.substring(2))).orElse(0);
    final int to = Math.min(events.size(), from + pageSize);
    return new GetLogEventsResult()
        .withEvents(new ArrayList<>(events.subList(from, to)))
        .withNextForwardToken("f/" + to);
  }

  @Override
  public synchronized PutLogEventsResult putLogEvents(String logGroupName, String logStreamName,
                                                      List<InputLogEvent> events) {
    final List<OutputLogEvent> stream = stream(logGroupName, logStreamName);
    for (InputLogEvent event : events) {
      stream.add(new OutputLogEvent()
          .withMessage(event.getMessage())
          .withTimestamp(event.getTimestamp()));
    }
    return new PutLogEventsResult();
  }

  public synchronized void append(String logGroupName, String logStreamName, String... messages) {
    groups.add(logGroupName);
    final List<OutputLogEvent> stream =
        streams.computeIfAbsent(key(logGroupName, logStreamName), k -> new ArrayList<>());
    for (String message : messages) {
      stream.add(new OutputLogEvent().withMessage(message).withTimestamp(0L));
    }
  }

  public synchronized List<String> messages(String logGroupName, String logStreamName) {
    final List<String> messages = new ArrayList<>();
    for (OutputLogEvent event : stream(logGroupName, logStreamName)) {
      messages.add(event.getMessage());
    }
    return messages;
  }

  public synchronized boolean hasGroup(String logGroupName) {
    return groups.contains(logGroupName);
  }

  public synchronized boolean hasStream(String logGroupName, String logStreamName) {
    return streams.containsKey(key(logGroupName, logStreamName));
  }

  public int fetches() {
    return fetches.get();
  }

  private List<OutputLogEvent> stream(String logGroupName, String logStreamName) {
    final List<OutputLogEvent> stream = streams.get(key(logGroupName, logStreamName));
    if (stream == null) {
      throw new ResourceNotFoundException("The specified log stream does not exist.");
    }
    return stream;
  }

  private static String key(String logGroupName, String logStreamName) {
    return logGroupName + ":" + logStreamName;
  }
}
