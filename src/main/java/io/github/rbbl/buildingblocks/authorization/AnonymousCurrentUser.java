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

/** Default stub option to use as a {@link CurrentUser}: not authenticated, no identifier. */
public final class AnonymousCurrentUser implements CurrentUser {
  private AnonymousCurrentUser() {
    // Cannot be instantiated
  }

  /**
   * @return a default instance of the user
   */
  public static AnonymousCurrentUser getInstance() {
    return Holder.INSTANCE;
  }

  /** {@inheritDoc} */
  @Override
  public Optional<String> userId() {
    return Optional.empty();
  }

  /** {@inheritDoc} */
  @Override
  public boolean isAuthenticated() {
    return false;
  }

  /**
   * @see <a
   *     href="https://en.wikipedia.org/wiki/Initialization-on-demand_holder_idiom">Initialization-on-demand
   *     holder idiom</a>
   */
  private static class Holder {
    private static final AnonymousCurrentUser INSTANCE = new AnonymousCurrentUser();
  }
}
