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

package io.github.rbbl.buildingblocks.authorization;

import java.util.Optional;

/**
 * Read-only access to the identity of the user interacting with the system.
 *
 * <p>This interface does not enforce any particular authentication mechanism - implementations
 * typically read the identity from a security context, a request header or a token, depending on
 * the environment.
 */
public interface CurrentUser {
  /** Actor name recorded in audit fields when no user identifier is available. */
  String ANONYMOUS_USER_ID = "anonymous";

  /**
   * @return a default instance for unauthenticated interactions
   */
  static CurrentUser anonymous() {
    return AnonymousCurrentUser.getInstance();
  }

  /**
   * @return identifier of the current user, if known
   */
  Optional<String> userId();

  /**
   * @return {@code true} if the current user has been authenticated
   */
  boolean isAuthenticated();

  /**
   * @return identifier of the authenticated user
   * @throws UnauthorizedException if the user is not authenticated or has no identifier
   */
  default String requireUserId() throws UnauthorizedException {
    if (!isAuthenticated()) {
      throw new UnauthorizedException("User is not authenticated");
    }

    return userId()
        .orElseThrow(() -> new UnauthorizedException("Authenticated user has no identifier"));
  }
}
