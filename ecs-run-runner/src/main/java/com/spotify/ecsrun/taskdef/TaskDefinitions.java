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

package com.spotify.ecsrun.taskdef;

import static java.util.stream.Collectors.toList;

import com.amazonaws.services.ecs.model.ContainerDefinition;
import com.amazonaws.services.ecs.model.KeyValuePair;
import com.amazonaws.services.ecs.model.RegisterTaskDefinitionRequest;
import com.spotify.ecsrun.model.ContainerDefinitionSpec;
import com.spotify.ecsrun.model.EnvVar;
import com.spotify.ecsrun.model.TaskDefinitionSpec;

/**
 * Conversion of parsed task definitions into ECS requests.
 */
public final class TaskDefinitions {

  private TaskDefinitions() {
    throw new UnsupportedOperationException();
  }

  public static RegisterTaskDefinitionRequest registerRequest(TaskDefinitionSpec spec) {
    final RegisterTaskDefinitionRequest request = new RegisterTaskDefinitionRequest()
        .withFamily(spec.family())
        .withContainerDefinitions(spec.containerDefinitions().stream()
            .map(TaskDefinitions::containerDefinition)
            .collect(toList()));
    spec.taskRoleArn().ifPresent(request::setTaskRoleArn);
    spec.executionRoleArn().ifPresent(request::setExecutionRoleArn);
    spec.networkMode().ifPresent(request::setNetworkMode);
    spec.cpu().ifPresent(request::setCpu);
    spec.memory().ifPresent(request::setMemory);
    if (!spec.requiresCompatibilities().isEmpty()) {
      request.setRequiresCompatibilities(spec.requiresCompatibilities());
    }
    return request;
  }

  static ContainerDefinition containerDefinition(ContainerDefinitionSpec spec) {
    final ContainerDefinition definition = new ContainerDefinition()
        .withName(spec.name())
        .withImage(spec.image());
    if (!spec.command().isEmpty()) {
      definition.setCommand(spec.command());
    }
    if (!spec.entryPoint().isEmpty()) {
      definition.setEntryPoint(spec.entryPoint());
    }
    if (!spec.environment().isEmpty()) {
      definition.setEnvironment(spec.environment().stream()
          .map(TaskDefinitions::keyValuePair)
          .collect(toList()));
    }
    spec.cpu().ifPresent(definition::setCpu);
    spec.memory().ifPresent(definition::setMemory);
    spec.memoryReservation().ifPresent(definition::setMemoryReservation);
    spec.essential().ifPresent(definition::setEssential);
    spec.workingDirectory().ifPresent(definition::setWorkingDirectory);
    return definition;
  }

  private static KeyValuePair keyValuePair(EnvVar var) {
    return new KeyValuePair().withName(var.name()).withValue(var.value());
  }
}
