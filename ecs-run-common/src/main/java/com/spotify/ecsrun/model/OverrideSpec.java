/*-
 * -\-\-
 * ECS Run Task Common
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

package com.spotify.ecsrun.model;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

/**
 * A declared, not yet resolved, override of a container's command and environment.
 *
 * <p>The target container is optional; it can only be left out when the task definition has a
 * single container. Environment entries are either {@code KEY=VALUE} or a bare {@code KEY} that is
 * looked up in the host environment when the override is resolved.
 */
@AutoValue
public abstract class OverrideSpec {

  private static final Splitter COMMAND_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  public abstract Optional<String> container();

  public abstract List<String> command();

  public abstract List<String> environment();

  public static OverrideSpec create(Optional<String> container, List<String> command,
                                    List<String> environment) {
    return new AutoValue_OverrideSpec(
        container.filter(name -> !name.isEmpty()),
        ImmutableList.copyOf(command),
        ImmutableList.copyOf(environment));
  }

  public static OverrideSpec of(String container, String... command) {
    return create(Optional.ofNullable(container), List.of(command), List.of());
  }

  /**
   * Parse an override written as {@code SERVICE:COMMAND}, e.g. {@code worker:./migrate --all}.
   * The service may be empty ({@code :./migrate}) to target the only container. The command is
   * split on whitespace.
   *
   * @throws IllegalArgumentException if there is no separator or the command is empty
   */
  public static OverrideSpec parse(String spec) {
    final int separator = spec.indexOf(':');
    if (separator < 0) {
      throw new IllegalArgumentException(
          "Malformed override \"" + spec + "\", expected SERVICE:COMMAND");
    }
    final String container = spec.substring(0, separator).trim();
    final List<String> command = COMMAND_SPLITTER.splitToList(spec.substring(separator + 1));
    if (command.isEmpty()) {
      throw new IllegalArgumentException("Malformed override \"" + spec + "\", command is empty");
    }
    return create(Optional.of(container), command, List.of());
  }
}
