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

import static java.util.stream.Collectors.joining;

import com.amazonaws.services.ecs.model.Failure;
import java.util.List;

public final class Failures {

  private Failures() {
    throw new UnsupportedOperationException();
  }

  public static String describe(List<Failure> failures) {
    return failures.stream()
        .map(Failures::describe)
        .collect(joining(", "));
  }

  private static String describe(Failure failure) {
    final StringBuilder sb = new StringBuilder(String.valueOf(failure.getReason()));
    if (failure.getDetail() != null) {
      sb.append(": ").append(failure.getDetail());
    }
    if (failure.getArn() != null) {
      sb.append(" (").append(failure.getArn()).append(')');
    }
    return sb.toString();
  }
}
