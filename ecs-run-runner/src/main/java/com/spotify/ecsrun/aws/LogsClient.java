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

import com.amazonaws.services.logs.AWSLogs;
import com.amazonaws.services.logs.model.CreateLogGroupRequest;
import com.amazonaws.services.logs.model.CreateLogStreamRequest;
import com.amazonaws.services.logs.model.GetLogEventsRequest;
import com.amazonaws.services.logs.model.GetLogEventsResult;
import com.amazonaws.services.logs.model.InputLogEvent;
import com.amazonaws.services.logs.model.PutLogEventsRequest;
import com.amazonaws.services.logs.model.PutLogEventsResult;
import com.amazonaws.services.logs.model.ResourceAlreadyExistsException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thin wrapper around the CloudWatch Logs {@link AWSLogs} client that exposes a smaller
 * interface that is easier to mock and fake.
 */
public interface LogsClient {

  /**
   * Creates a log group unless it already exists.
   *
   * @return true if the group was created by this call
   */
  boolean createLogGroup(String logGroupName);

  /**
   * Creates a log stream unless it already exists.
   *
   * @return true if the stream was created by this call
   */
  boolean createLogStream(String logGroupName, String logStreamName);

  /**
   * Reads events from the head of a stream, or from the position identified by a token returned
   * by an earlier call.
   *
   * @throws com.amazonaws.services.logs.model.ResourceNotFoundException if the stream does not
   *     exist (yet)
   */
  GetLogEventsResult getLogEvents(String logGroupName, String logStreamName,
                                  Optional<String> nextToken);

  PutLogEventsResult putLogEvents(String logGroupName, String logStreamName,
                                  List<InputLogEvent> events);

  static LogsClient of(AWSLogs logs) {
    return new Impl(logs);
  }

  class Impl implements LogsClient {

    private static final Logger log = LoggerFactory.getLogger(LogsClient.class);

    private final AWSLogs logs;

    public Impl(AWSLogs logs) {
      this.logs = Objects.requireNonNull(logs);
    }

    @Override
    public boolean createLogGroup(String logGroupName) {
      try {
        logs.createLogGroup(new CreateLogGroupRequest(logGroupName));
        log.info("Created log group {}", logGroupName);
        return true;
      } catch (ResourceAlreadyExistsException e) {
        log.debug("Log group {} already exists", logGroupName);
        return false;
      }
    }

    @Override
    public boolean createLogStream(String logGroupName, String logStreamName) {
      try {
        logs.createLogStream(new CreateLogStreamRequest(logGroupName, logStreamName));
        return true;
      } catch (ResourceAlreadyExistsException e) {
        return false;
      }
    }

    @Override
    public GetLogEventsResult getLogEvents(String logGroupName, String logStreamName,
                                           Optional<String> nextToken) {
      final GetLogEventsRequest request = new GetLogEventsRequest()
          .withLogGroupName(logGroupName)
          .withLogStreamName(logStreamName)
          .withStartFromHead(true);
      nextToken.ifPresent(request::setNextToken);
      return logs.getLogEvents(request);
    }

    @Override
    public PutLogEventsResult putLogEvents(String logGroupName, String logStreamName,
                                           List<InputLogEvent> events) {
      return logs.putLogEvents(new PutLogEventsRequest()
          .withLogGroupName(logGroupName)
          .withLogStreamName(logStreamName)
          .withLogEvents(events));
    }
  }
}
