/*
 * Copyright 2024 The building-blocks Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.rbbl.buildingblocks.guard;

import java.io.Serial;

/**
 * A specific {@link IllegalArgumentException} to be thrown when a {@link Guard} rule is violated.
 *
 * <p>Guard violations denote programming errors - callers are not expected to recover from them.
 * Expected business failures must be modelled with {@link
 * io.github.rbbl.buildingblocks.result.Result} instead.
 */
public class InvalidArgumentException extends IllegalArgumentException {
  @Serial private static final long serialVersionUID = 4217905361518412235L;

  private final String parameterName;

  /**
   * Constructs a new exception with the parameter name prepended to the detail message.
   *
   * @param parameterName the name of the parameter which failed validation
   * @param message the violated rule description
   */
  public InvalidArgumentException(String parameterName, String message) {
    super("%s: %s".formatted(parameterName, message));
    this.parameterName = parameterName;
  }

  /**
   * @return the name of the parameter which failed validation
   */
  public final String getParameterName() {
    return parameterName;
  }
}
