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

import io.github.rbbl.buildingblocks.guard.Guard;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AppLogger} delegating to SLF4J, the actual backend is whatever binding is present on the
 * classpath.
 *
 * @param <T> is the category type
 */
public final class Slf4jAppLogger<T> implements AppLogger<T> {
  private static final Object[] NO_ARGS = new Object[0];

  private final Logger logger;

  /**
   * @param category class to name the logger after
   */
  public Slf4jAppLogger(final Class<T> category) {
    this(LoggerFactory.getLogger(Guard.notNull(category, "category")));
  }

  Slf4jAppLogger(final Logger logger) {
    this.logger = Guard.notNull(logger, "logger");
  }

  @Override
  public void trace(String template, Object... args) {
    logger.trace(template, orEmpty(args));
  }

  @Override
  public void info(String template, Object... args) {
    logger.info(template, orEmpty(args));
  }

  @Override
  public void warn(String template, Object... args) {
    logger.warn(template, orEmpty(args));
  }

  /**
   * SLF4J treats the trailing {@link Throwable} argument as the cause, rendering its stack trace.
   */
  @Override
  public void error(Throwable cause, String template, Object... args) {
    final Object[] nonNullArgs = orEmpty(args);
    final Object[] argsWithCause = Arrays.copyOf(nonNullArgs, nonNullArgs.length + 1);
    argsWithCause[nonNullArgs.length] = cause;
    logger.error(template, argsWithCause);
  }

  private static Object[] orEmpty(Object[] args) {
    return args == null ? NO_ARGS : args;
  }
}
