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

import com.amazonaws.services.logs.model.OutputLogEvent;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards the messages of a container's log stream to an output until the finish marker of that
 * container is seen. The marker itself is not forwarded.
 */
public class ContainerLogPrinter implements Predicate<OutputLogEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ContainerLogPrinter.class);

  private final String containerArn;
  private final Consumer<String> output;

  public ContainerLogPrinter(String containerArn, Consumer<String> output) {
    this.containerArn = Objects.requireNonNull(containerArn);
    this.output = Objects.requireNonNull(output);
  }

  @Override
  public boolean test(OutputLogEvent event) {
    if (FinishMarker.matches(containerArn, event.getMessage())) {
      LOG.debug("Sentinel found: {}", event.getMessage());
      return false;
    }
    output.accept(event.getMessage());
    return true;
  }
}
