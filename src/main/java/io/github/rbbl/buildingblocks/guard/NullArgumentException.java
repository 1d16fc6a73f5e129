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

/** Thrown when a {@code null} was passed where a value is required. */
public class NullArgumentException extends InvalidArgumentException {
  @Serial private static final long serialVersionUID = -6371183094451870252L;

  /**
   * @param parameterName the name of the parameter which was {@code null}
   */
  public NullArgumentException(String parameterName) {
    super(parameterName, "Value cannot be null");
  }
}
