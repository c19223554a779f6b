package com.codeheadsystems.jwtdown.springboot.security;

import com.codeheadsystems.jwtdown.server.store.UserRecord;
import java.security.Principal;

public record JwtdownPrincipal(UserRecord user) implements Principal {

  @Override
  public String getName() {
    return user.username();
  }
}
