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

import com.google.auto.value.AutoValue;
import com.spotify.ecsrun.model.OverrideSpec;
import com.spotify.ecsrun.model.TaskDefinitionSpec;
import java.util.List;
import java.util.Optional;

/**
 * Everything needed to submit one run of a task definition.
 */
@AutoValue
public abstract class RunSpec {

  /** Prefix of the log streams of the run, generated when absent. */
  public abstract Optional<String> name();

  public abstract TaskDefinitionSpec taskDefinition();

  public abstract String cluster();

  public abstract String logGroup();

  public abstract String region();

  public abstract boolean fargate();

  public abstract List<String> subnets();

  public abstract List<String> securityGroups();

  public abstract int count();

  public abstract List<OverrideSpec> overrides();

  /** {@code KEY=VALUE} or {@code KEY} entries added to every override. */
  public abstract List<String> environment();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_RunSpec.Builder()
        .fargate(false)
        .subnets(List.of())
        .securityGroups(List.of())
        .count(1)
        .overrides(List.of())
        .environment(List.of());
  }

  public boolean awsvpc() {
    return !subnets().isEmpty() || !securityGroups().isEmpty();
  }

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder name(String name);
    public abstract Builder name(Optional<String> name);
    public abstract Builder taskDefinition(TaskDefinitionSpec taskDefinition);
    public abstract Builder cluster(String cluster);
    public abstract Builder logGroup(String logGroup);
    public abstract Builder region(String region);
    public abstract Builder fargate(boolean fargate);
    public abstract Builder subnets(List<String> subnets);
    public abstract Builder securityGroups(List<String> securityGroups);
    public abstract Builder count(int count);
    public abstract Builder overrides(List<OverrideSpec> overrides);
    public abstract Builder environment(List<String> environment);

    abstract RunSpec autoBuild();

    public RunSpec build() {
      final RunSpec spec = autoBuild();
      if (spec.count() < 1) {
        throw new IllegalArgumentException("count must be at least 1, got " + spec.count());
      }
      return spec;
    }
  }
}
