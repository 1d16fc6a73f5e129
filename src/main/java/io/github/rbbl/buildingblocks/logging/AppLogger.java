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

package io.github.rbbl.buildingblocks.logging;

/**
 * Leveled logging facade, independent of the logging backend.
 *
 * <p>Messages are templates with positional {@code {}} placeholders, e.g. {@code
 * logger.info("Order {} shipped to {}", orderId, address)}.
 *
 * @param <T> is the category type, typically the class which logs
 */
public interface AppLogger<T> {
  /**
   * @param category class to name the logger after
   * @param <T> is the category type
   * @return SLF4J-backed logger
   */
  static <T> AppLogger<T> forClass(final Class<T> category) {
    return new Slf4jAppLogger<>(category);
  }

  /**
   * @param <T> is the category type
   * @return an instance of logger which does not perform any operations
   */
  @SuppressWarnings("unchecked")
  static <T> AppLogger<T> noOp() {
    return (AppLogger<T>) NoOp.INSTANCE;
  }

  void trace(String template, Object... args);

  void info(String template, Object... args);

  void warn(String template, Object... args);

  void error(Throwable cause, String template, Object... args);

  /** Default implementation of the silent logger */
  final class NoOp implements AppLogger<Object> {
    private static final AppLogger<Object> INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void trace(String template, Object... args) {
      // Do nothing
    }

    @Override
    public void info(String template, Object... args) {
      // Do nothing
    }

    @Override
    public void warn(String template, Object... args) {
      // Do nothing
    }

    @Override
    public void error(Throwable cause, String template, Object... args) {
      // Do nothing
    }
  }
}
