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

import static java.util.stream.Collectors.toList;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import java.util.List;
import java.util.Optional;

/**
 * A task definition as declared in a task definition file, in the shape of the ECS
 * RegisterTaskDefinition API.
 */
@AutoValue
public abstract class TaskDefinitionSpec {

  @JsonProperty
  public abstract String family();

  @JsonProperty
  public abstract Optional<String> taskRoleArn();

  @JsonProperty
  public abstract Optional<String> executionRoleArn();

  @JsonProperty
  public abstract Optional<String> networkMode();

  @JsonProperty
  public abstract List<String> requiresCompatibilities();

  @JsonProperty
  public abstract Optional<String> cpu();

  @JsonProperty
  public abstract Optional<String> memory();

  @JsonProperty
  public abstract List<ContainerDefinitionSpec> containerDefinitions();

  public List<String> containerNames() {
    return containerDefinitions().stream()
        .map(ContainerDefinitionSpec::name)
        .collect(toList());
  }

  @JsonCreator
  public static TaskDefinitionSpec create(
      @JsonProperty("family") String family,
      @JsonProperty("taskRoleArn") Optional<String> taskRoleArn,
      @JsonProperty("executionRoleArn") Optional<String> executionRoleArn,
      @JsonProperty("networkMode") Optional<String> networkMode,
      @JsonProperty("requiresCompatibilities") List<String> requiresCompatibilities,
      @JsonProperty("cpu") Optional<String> cpu,
      @JsonProperty("memory") Optional<String> memory,
      @JsonProperty("containerDefinitions") List<ContainerDefinitionSpec> containerDefinitions) {
    return new AutoValue_TaskDefinitionSpec(
        family,
        Optionals.orEmpty(taskRoleArn),
        Optionals.orEmpty(executionRoleArn),
        Optionals.orEmpty(networkMode),
        Lists.orEmpty(requiresCompatibilities),
        Optionals.orEmpty(cpu),
        Optionals.orEmpty(memory),
        Lists.orEmpty(containerDefinitions));
  }

  public static TaskDefinitionSpec of(String family, ContainerDefinitionSpec... containers) {
    return create(family, null, null, null, null, null, null, List.of(containers));
  }
}
