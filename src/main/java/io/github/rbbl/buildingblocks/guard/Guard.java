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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;

/**
 * Defines utility for verifying method and constructor inputs.
 *
 * <p>Unfortunately, annotations are not a saving grace when it comes to {@code null}s or malformed
 * values - methods of this class are intended to be used at the boundaries of public methods and
 * constructors to block invalid inputs as early as possible.
 *
 * <p>Every method returns the value it was given when the check passes, which allows to validate
 * and assign in one go:
 *
 * <pre>{@code
 * this.name = Guard.notNullOrWhiteSpace(name, "name");
 * }</pre>
 *
 * <p>Guard clauses are not a business rule validation pipeline - a failing guard denotes a bug in
 * the calling code. Expected failures must be returned as {@link
 * io.github.rbbl.buildingblocks.result.Result}.
 */
public final class Guard {
  static final UUID NIL_UUID = new UUID(0L, 0L);

  private Guard() {
    // Cannot be instantiated
  }

  /**
   * @param value which must not be {@code null}
   * @param parameterName is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws NullArgumentException when the value is {@code null}
   */
  public static <T> T notNull(T value, String parameterName) throws NullArgumentException {
    if (value == null) {
      throw new NullArgumentException(parameterName);
    }

    return value;
  }

  /**
   * @param value which must contain at least one non-whitespace character
   * @param parameterName is the parameter name
   * @return value if it passed the check
   * @throws InvalidArgumentException when the value is {@code null}, empty or blank
   */
  public static String notNullOrWhiteSpace(String value, String parameterName)
      throws InvalidArgumentException {
    if (value == null || value.isBlank()) {
      throw new InvalidArgumentException(
          parameterName, "Value cannot be null, empty, or whitespace");
    }

    return value;
  }

  /**
   * @param value which must not be {@code null} or a nil {@link UUID}
   * @param parameterName is the parameter name
   * @return value if it passed the check
   * @throws NullArgumentException when the value is {@code null}
   * @throws EmptyIdentifierException when the value is a nil {@link UUID}
   */
  public static UUID notEmpty(UUID value, String parameterName)
      throws NullArgumentException, EmptyIdentifierException {
    if (NIL_UUID.equals(notNull(value, parameterName))) {
      throw new EmptyIdentifierException(parameterName);
    }

    return value;
  }

  /**
   * Rejects values equal to the zero value of their type.
   *
   * <p>Zero values are {@code false}, {@code '\0'}, any numeric zero and the nil {@link UUID}.
   * Values of other types only have to be non-{@code null}.
   *
   * @param value to check
   * @param parameterName is the parameter name
   * @param <T> is the type of the value
   * @return value if it passed the check
   * @throws NullArgumentException when the value is {@code null}
   * @throws InvalidArgumentException when the value is the zero value of its type
   */
  public static <T> T notDefault(T value, String parameterName)
      throws NullArgumentException, InvalidArgumentException {
    if (isZeroValue(notNull(value, parameterName))) {
      throw new InvalidArgumentException(
          parameterName, "Value cannot be the default for its type");
    }

    return value;
  }

  /**
   * @param value to check
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @param parameterName is the parameter name
   * @param <T> is the type of the value
   * @return value if it is within {@code [min, max]}
   * @throws NullArgumentException when any of the values is {@code null}
   * @throws ArgumentOutOfRangeException when the value lies outside of the range
   */
  public static <T extends Comparable<? super T>> T inRange(
      T value, T min, T max, String parameterName)
      throws NullArgumentException, ArgumentOutOfRangeException {
    notNull(value, parameterName);
    notNull(min, "min");
    notNull(max, "max");

    if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
      throw new ArgumentOutOfRangeException(
          parameterName, "Value must be between %s and %s".formatted(min, max));
    }

    return value;
  }

  /**
   * @param value to check
   * @param parameterName is the parameter name
   * @return value if it is not negative
   * @throws ArgumentOutOfRangeException when the value is negative
   */
  public static int nonNegative(int value, String parameterName)
      throws ArgumentOutOfRangeException {
    if (value < 0) {
      throw negative(parameterName);
    }

    return value;
  }

  /**
   * @param value to check
   * @param parameterName is the parameter name
   * @return value if it is not negative
   * @throws ArgumentOutOfRangeException when the value is negative
   */
  public static long nonNegative(long value, String parameterName)
      throws ArgumentOutOfRangeException {
    if (value < 0L) {
      throw negative(parameterName);
    }

    return value;
  }

  /**
   * @param value to check
   * @param parameterName is the parameter name
   * @return value if it is not negative
   * @throws NullArgumentException when the value is {@code null}
   * @throws ArgumentOutOfRangeException when the value is negative
   */
  public static BigDecimal nonNegative(BigDecimal value, String parameterName)
      throws NullArgumentException, ArgumentOutOfRangeException {
    if (notNull(value, parameterName).signum() < 0) {
      throw negative(parameterName);
    }

    return value;
  }

  /**
   * {@code null} values pass this check - combine with {@link #notNull(Object, String)} when the
   * value is required.
   *
   * @param value to check
   * @param maxLength maximum allowed amount of characters
   * @param parameterName is the parameter name
   * @return value if its length does not exceed {@code maxLength}
   * @throws InvalidArgumentException when the value is too long
   */
  public static String maxLength(String value, int maxLength, String parameterName)
      throws InvalidArgumentException {
    if (value != null && value.length() > maxLength) {
      throw new InvalidArgumentException(
          parameterName, "Maximum length is %d".formatted(maxLength));
    }

    return value;
  }

  /**
   * Generic check for rules not covered by other methods.
   *
   * @param condition which must hold
   * @param message describing the rule
   * @param parameterName is the parameter name
   * @throws InvalidArgumentException when the condition is {@code false}
   */
  public static void that(boolean condition, String message, String parameterName)
      throws InvalidArgumentException {
    if (!condition) {
      throw new InvalidArgumentException(parameterName, message);
    }
  }

  private static ArgumentOutOfRangeException negative(String parameterName) {
    return new ArgumentOutOfRangeException(parameterName, "Value cannot be negative");
  }

  private static boolean isZeroValue(Object value) {
    if (value instanceof Boolean bool) {
      return !bool;
    } else if (value instanceof Character character) {
      return character == '\u0000';
    } else if (value instanceof BigDecimal decimal) {
      return decimal.signum() == 0;
    } else if (value instanceof BigInteger integer) {
      return integer.signum() == 0;
    } else if (value instanceof Double || value instanceof Float) {
      return ((Number) value).doubleValue() == 0.0d;
    } else if (value instanceof Number number) {
      return number.longValue() == 0L;
    } else if (value instanceof UUID uuid) {
      return NIL_UUID.equals(uuid);
    }

    return false;
  }
}
