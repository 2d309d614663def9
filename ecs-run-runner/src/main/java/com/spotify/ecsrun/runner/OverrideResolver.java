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

import com.amazonaws.services.ecs.model.ContainerOverride;
import com.amazonaws.services.ecs.model.KeyValuePair;
import com.google.common.collect.ImmutableList;
import com.spotify.ecsrun.model.EnvVar;
import com.spotify.ecsrun.model.OverrideSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns declared {@link OverrideSpec}s into ECS container overrides: picks the target container
 * and resolves environment entries against the host environment.
 */
public class OverrideResolver {

  private static final Logger LOG = LoggerFactory.getLogger(OverrideResolver.class);

  private final Map<String, String> env;

  public OverrideResolver(Map<String, String> env) {
    this.env = Objects.requireNonNull(env);
  }

  /**
   * Resolves all overrides with a non-empty command.
   *
   * @param overrides      declared overrides
   * @param environment    entries added to every override after its own
   * @param containerNames names of the container definitions of the task definition
   */
  public List<ContainerOverride> resolve(List<OverrideSpec> overrides, List<String> environment,
                                         List<String> containerNames)
      throws ConfigurationException {
    final List<ContainerOverride> resolved = new ArrayList<>();
    for (OverrideSpec override : overrides) {
      if (override.command().isEmpty()) {
        continue;
      }
      final List<EnvVar> vars = ImmutableList.<EnvVar>builder()
          .addAll(resolveEnvironment(override.environment()))
          .addAll(resolveEnvironment(environment))
          .build();
      resolved.add(new ContainerOverride()
          .withName(resolveTarget(override, containerNames))
          .withCommand(override.command())
          .withEnvironment(toKeyValuePairs(vars)));
    }
    return resolved;
  }

  /**
   * The container an override applies to.
   *
   * @throws ConfigurationException if the override names no container and there is more than one
   */
  public String resolveTarget(OverrideSpec override, List<String> containerNames)
      throws ConfigurationException {
    if (override.container().isPresent()) {
      return override.container().get();
    }
    if (containerNames.size() != 1) {
      throw new ConfigurationException("No service provided for override and can't determine "
                                       + "default service with " + containerNames.size()
                                       + " container definitions");
    }
    final String container = containerNames.get(0);
    LOG.info("Assuming override applies to '{}'", container);
    return container;
  }

  /**
   * Resolves {@code KEY=VALUE} and bare {@code KEY} entries, in order.
   *
   * @throws ConfigurationException if a bare key is not set in the environment
   */
  public List<EnvVar> resolveEnvironment(List<String> entries) throws ConfigurationException {
    final List<EnvVar> vars = new ArrayList<>(entries.size());
    for (String entry : entries) {
      final int separator = entry.indexOf('=');
      if (separator >= 0) {
        vars.add(EnvVar.create(entry.substring(0, separator), entry.substring(separator + 1)));
        continue;
      }
      final String value = env.get(entry);
      if (value == null) {
        throw new ConfigurationException("missing environment variable \"" + entry + "\"");
      }
      vars.add(EnvVar.create(entry, value));
    }
    return vars;
  }

  private static List<KeyValuePair> toKeyValuePairs(List<EnvVar> vars) {
    final List<KeyValuePair> pairs = new ArrayList<>(vars.size());
    for (EnvVar var : vars) {
      pairs.add(new KeyValuePair().withName(var.name()).withValue(var.value()));
    }
    return pairs;
  }
}
