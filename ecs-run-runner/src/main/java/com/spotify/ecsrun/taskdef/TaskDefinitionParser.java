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

import static com.spotify.ecsrun.serialization.Json.OBJECT_MAPPER;
import static com.spotify.ecsrun.serialization.Yaml.YAML_MAPPER;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.spotify.ecsrun.model.ContainerDefinitionSpec;
import com.spotify.ecsrun.model.TaskDefinitionSpec;
import com.spotify.ecsrun.runner.ConfigurationException;
import com.spotify.ecsrun.util.EnvInterpolation;
import com.spotify.ecsrun.util.EnvInterpolation.MissingVariableException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a task definition file in the shape of an ECS {@code RegisterTaskDefinition} request.
 * Files ending in {@code .yaml} or {@code .yml} are read as YAML, anything else as JSON.
 * Environment variable references in the file are substituted before it is parsed.
 */
public class TaskDefinitionParser {

  private static final Logger LOG = LoggerFactory.getLogger(TaskDefinitionParser.class);

  private final Map<String, String> env;

  public TaskDefinitionParser(Map<String, String> env) {
    this.env = Objects.requireNonNull(env);
  }

  public TaskDefinitionSpec parse(Path file) throws ConfigurationException {
    LOG.debug("Reading task definition {}", file);
    final String content;
    try {
      content = Files.readString(file, StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      throw new ConfigurationException("Task definition " + file + " does not exist", e);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read task definition " + file, e);
    }
    return parse(content, mapperFor(file), file.toString());
  }

  TaskDefinitionSpec parse(String content, ObjectMapper mapper, String source)
      throws ConfigurationException {
    final String interpolated;
    try {
      interpolated = EnvInterpolation.interpolate(content, env);
    } catch (MissingVariableException e) {
      throw new ConfigurationException(e.getMessage() + " in " + source, e);
    }

    final TaskDefinitionSpec spec;
    try {
      spec = mapper.readValue(interpolated, TaskDefinitionSpec.class);
    } catch (IOException e) {
      throw new ConfigurationException("Invalid task definition " + source + ": "
                                       + e.getMessage(), e);
    }
    validate(spec, source);
    return spec;
  }

  private static void validate(TaskDefinitionSpec spec, String source)
      throws ConfigurationException {
    if (spec.family().isEmpty()) {
      throw new ConfigurationException("Task definition " + source + " has no family");
    }
    if (spec.containerDefinitions().isEmpty()) {
      throw new ConfigurationException("Task definition " + source
                                       + " has no container definitions");
    }
    final Set<String> names = new HashSet<>();
    for (ContainerDefinitionSpec container : spec.containerDefinitions()) {
      if (!names.add(container.name())) {
        throw new ConfigurationException("Task definition " + source
                                         + " has more than one container named "
                                         + container.name());
      }
    }
  }

  static ObjectMapper mapperFor(Path file) {
    final String name = file.getFileName().toString();
    return name.endsWith(".yaml") || name.endsWith(".yml") ? YAML_MAPPER : OBJECT_MAPPER;
  }
}
