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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import java.util.List;
import java.util.Optional;

/**
 * The container definition fields that can be declared in a task definition file.
 */
@AutoValue
public abstract class ContainerDefinitionSpec {

  @JsonProperty
  public abstract String name();

  @JsonProperty
  public abstract String image();

  @JsonProperty
  public abstract List<String> command();

  @JsonProperty
  public abstract List<String> entryPoint();

  @JsonProperty
  public abstract List<EnvVar> environment();

  @JsonProperty
  public abstract Optional<Integer> cpu();

  @JsonProperty
  public abstract Optional<Integer> memory();

  @JsonProperty
  public abstract Optional<Integer> memoryReservation();

  @JsonProperty
  public abstract Optional<Boolean> essential();

  @JsonProperty
  public abstract Optional<String> workingDirectory();

  @JsonCreator
  public static ContainerDefinitionSpec create(
      @JsonProperty("name") String name,
      @JsonProperty("image") String image,
      @JsonProperty("command") List<String> command,
      @JsonProperty("entryPoint") List<String> entryPoint,
      @JsonProperty("environment") List<EnvVar> environment,
      @JsonProperty("cpu") Optional<Integer> cpu,
      @JsonProperty("memory") Optional<Integer> memory,
      @JsonProperty("memoryReservation") Optional<Integer> memoryReservation,
      @JsonProperty("essential") Optional<Boolean> essential,
      @JsonProperty("workingDirectory") Optional<String> workingDirectory) {
    return new AutoValue_ContainerDefinitionSpec(
        name, image,
        Lists.orEmpty(command),
        Lists.orEmpty(entryPoint),
        Lists.orEmpty(environment),
        Optionals.orEmpty(cpu),
        Optionals.orEmpty(memory),
        Optionals.orEmpty(memoryReservation),
        Optionals.orEmpty(essential),
        Optionals.orEmpty(workingDirectory));
  }

  public static ContainerDefinitionSpec of(String name, String image) {
    return create(name, image, null, null, null, null, null, null, null, null);
  }
}
