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

package com.spotify.ecsrun.util;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shell style variable interpolation: {@code $VAR}, {@code ${VAR}} and {@code ${VAR:-default}}.
 * {@code $$} produces a literal {@code $}.
 */
public final class EnvInterpolation {

  private static final Pattern VARIABLE = Pattern.compile(
      "\\$(?:\\$|\\{([A-Za-z_][A-Za-z0-9_]*)(?::-([^}]*))?}|([A-Za-z_][A-Za-z0-9_]*))");

  private EnvInterpolation() {
    throw new UnsupportedOperationException();
  }

  /**
   * @throws MissingVariableException if a variable without a default is not set
   */
  public static String interpolate(String text, Map<String, String> env) {
    final Matcher matcher = VARIABLE.matcher(text);
    final StringBuilder sb = new StringBuilder();
    while (matcher.find()) {
      final String braced = matcher.group(1);
      final String name = braced != null ? braced : matcher.group(3);
      final String replacement;
      if (name == null) {
        replacement = "$";
      } else {
        replacement = lookup(name, matcher.group(2), env);
      }
      matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  private static String lookup(String name, String defaultValue, Map<String, String> env) {
    final String value = env.get(name);
    if (defaultValue != null && (value == null || value.isEmpty())) {
      return defaultValue;
    }
    if (value == null) {
      throw new MissingVariableException(name);
    }
    return value;
  }

  public static class MissingVariableException extends IllegalArgumentException {

    private final String variable;

    MissingVariableException(String variable) {
      super(String.format("missing environment variable \"%s\"", variable));
      this.variable = variable;
    }

    public String variable() {
      return variable;
    }
  }
}
