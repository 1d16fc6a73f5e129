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

package io.github.rbbl.buildingblocks.result;

import io.github.rbbl.buildingblocks.guard.Guard;
import io.github.suppierk.java.Try;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Represents the outcome of an operation which may fail for expected, business-related reasons.
 *
 * <p>Exceptions remain reserved for programming errors, whereas this class carries a
 * human-readable failure message back to the caller without unwinding the stack.
 *
 * <p>Two variants are available:
 *
 * <ul>
 *   <li>Value-less {@code Result<Void>} created via {@link #success()} or {@link
 *       #failure(String)}.
 *   <li>Value-bearing {@code Result<T>} created via {@link #success(Object)} or {@link
 *       #failure(String)}.
 * </ul>
 *
 * <p>A successful result never has an error, a failed result never has a value.
 *
 * @param <T> is the type of the payload carried by a successful result
 */
public final class Result<T> {
  private static final Result<Void> SUCCESS = new Result<>(true, null, null);

  private final boolean success;
  private final String error;
  private final T value;

  private Result(final boolean success, final String error, final T value) {
    this.success = success;
    this.error = error;
    this.value = value;
  }

  /**
   * @return a value-less successful result
   */
  public static Result<Void> success() {
    return SUCCESS;
  }

  /**
   * @param value produced by the operation
   * @param <T> is the type of the value
   * @return a successful result carrying the value
   */
  public static <T> Result<T> success(final T value) {
    return new Result<>(true, null, value);
  }

  /**
   * @param error human-readable description of the failure
   * @param <T> is the type of the value the operation would have produced
   * @return a failed result carrying the message
   * @throws io.github.rbbl.buildingblocks.guard.InvalidArgumentException if the message is {@code
   *     null} or blank
   */
  public static <T> Result<T> failure(final String error) {
    return new Result<>(false, Guard.notNullOrWhiteSpace(error, "error"), null);
  }

  /**
   * Runs the given code and captures its outcome.
   *
   * <p>Any exception thrown by the code is turned into a failure using the exception message, or
   * the exception class name when the message is absent. An {@link InterruptedException} also
   * restores the interrupt status of the current thread.
   *
   * @param callable to run
   * @param <T> is the type of the value
   * @return a successful result with the returned value or a failed result
   */
  public static <T> Result<T> of(final Callable<T> callable) {
    final Callable<T> nonNullCallable = Guard.notNull(callable, "callable");
    final Try<T> attempt = Try.of(nonNullCallable::call);
    final AtomicReference<Result<T>> outcome = new AtomicReference<>();

    attempt.ifSuccess(result -> outcome.set(success(result)));
    attempt.ifFailure(
        cause -> {
          if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
          }

          outcome.set(failure(describe(cause)));
        });

    return outcome.get();
  }

  /**
   * @return {@code true} if the operation succeeded
   */
  public boolean isSuccess() {
    return success;
  }

  /**
   * @return {@code true} if the operation failed
   */
  public boolean isFailure() {
    return !success;
  }

  /**
   * @return failure message, empty for successful results
   */
  public Optional<String> error() {
    return Optional.ofNullable(error);
  }

  /**
   * @return the payload, empty for failed and value-less results
   */
  public Optional<T> value() {
    return Optional.ofNullable(value);
  }

  /**
   * @param mapper to transform the payload of a successful result with
   * @param <R> is the type of the new payload
   * @return a new successful result with transformed payload, or the same failure
   */
  @SuppressWarnings("unchecked")
  public <R> Result<R> map(final Function<? super T, ? extends R> mapper) {
    final Function<? super T, ? extends R> nonNullMapper = Guard.notNull(mapper, "mapper");
    return success ? success(nonNullMapper.apply(value)) : (Result<R>) this;
  }

  /**
   * @param action to perform with the payload if the result is successful
   * @return this instance for chaining
   */
  public Result<T> ifSuccess(final Consumer<? super T> action) {
    final Consumer<? super T> nonNullAction = Guard.notNull(action, "action");
    if (success) {
      nonNullAction.accept(value);
    }

    return this;
  }

  /**
   * @param action to perform with the error message if the result is a failure
   * @return this instance for chaining
   */
  public Result<T> ifFailure(final Consumer<String> action) {
    final Consumer<String> nonNullAction = Guard.notNull(action, "action");
    if (!success) {
      nonNullAction.accept(error);
    }

    return this;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Result<?> that = (Result<?>) o;
    return success == that.success
        && Objects.equals(error, that.error)
        && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(success, error, value);
  }

  @Override
  public String toString() {
    final StringJoiner joiner = new StringJoiner(", ", Result.class.getSimpleName() + "[", "]");
    return success
        ? joiner.add("success").add("value=" + value).toString()
        : joiner.add("failure").add("error='" + error + "'").toString();
  }

  private static String describe(final Throwable cause) {
    final String message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getName() : message;
  }
}
