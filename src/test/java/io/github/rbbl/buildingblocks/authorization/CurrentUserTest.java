package io.github.rbbl.buildingblocks.authorization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.rbbl.test.FixedCurrentUser;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CurrentUserTest {
  @Test
  void when_user_is_authenticated_required_user_id_is_returned() {
    assertEquals("alice", FixedCurrentUser.authenticated("alice").requireUserId());
  }

  @Test
  void when_authenticated_user_has_no_identifier_unauthorized_exception_is_thrown() {
    final var user = new FixedCurrentUser(Optional.empty(), true);

    final var exception = assertThrows(UnauthorizedException.class, user::requireUserId);
    assertEquals("Authenticated user has no identifier", exception.getMessage());
  }

  @Test
  void when_user_has_identifier_but_is_not_authenticated_unauthorized_exception_is_thrown() {
    final var user = new FixedCurrentUser(Optional.of("alice"), false);

    final var exception = assertThrows(UnauthorizedException.class, user::requireUserId);
    assertEquals("User is not authenticated", exception.getMessage());
  }
}
