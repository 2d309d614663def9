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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import com.spotify.ecsrun.util.EnvInterpolation.MissingVariableException;
import java.util.Map;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class EnvInterpolationTest {

  private static final Map<String, String> ENV = Map.of(
      "IMAGE", "alpine",
      "TAG", "3.18",
      "EMPTY", "");

  @Test
  @Parameters({
      "image: $IMAGE | image: alpine",
      "image: ${IMAGE}:${TAG} | image: alpine:3.18",
      "tag: ${MISSING:-latest} | tag: latest",
      "tag: ${EMPTY:-latest} | tag: latest",
      "tag: ${TAG:-latest} | tag: 3.18",
      "cost: $$5 | cost: $5",
      "plain text | plain text",
      "trailing $ | trailing $",
  })
  public void shouldInterpolate(String text, String expected) {
    assertThat(EnvInterpolation.interpolate(text, ENV), is(expected));
  }

  @Test
  public void shouldKeepEmptyValueWithoutDefault() {
    assertThat(EnvInterpolation.interpolate("x${EMPTY}x", ENV), is("xx"));
  }

  @Test
  public void shouldFailOnMissingVariable() {
    var e = assertThrows(MissingVariableException.class,
        () -> EnvInterpolation.interpolate("image: ${NOPE}", ENV));
    assertThat(e.variable(), is("NOPE"));
    assertThat(e.getMessage(), is("missing environment variable \"NOPE\""));
  }
}
