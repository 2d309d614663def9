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

/**
 * A single environment variable as handed to a container.
 */
@AutoValue
public abstract class EnvVar {

  @JsonProperty
  public abstract String name();

  @JsonProperty
  public abstract String value();

  @JsonCreator
  public static EnvVar create(
      @JsonProperty("name") String name,
      @JsonProperty("value") String value) {
    return new AutoValue_EnvVar(name, value == null ? "" : value);
  }

  @Override
  public String toString() {
    return name() + "=" + value();
  }
}
