package io.github.rbbl.test;

import io.github.rbbl.buildingblocks.authorization.CurrentUser;
import java.util.Optional;

/**
 * A sample {@link CurrentUser} with predefined identity.
 *
 * @param userId to fulfill {@link CurrentUser#userId()} contract
 * @param isAuthenticated to fulfill {@link CurrentUser#isAuthenticated()} contract
 */
public record FixedCurrentUser(Optional<String> userId, boolean isAuthenticated)
    implements CurrentUser {
  public static FixedCurrentUser authenticated(String userId) {
    return new FixedCurrentUser(Optional.of(userId), true);
  }
}
