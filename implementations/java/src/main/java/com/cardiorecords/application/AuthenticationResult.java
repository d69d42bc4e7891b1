package com.cardiorecords.application;

import com.cardiorecords.domain.model.Principal;
import com.cardiorecords.infrastructure.security.IssuedToken;
import lombok.Value;

/**
 * Principal together with the token issued to it.
 */
@Value
public class AuthenticationResult {
    Principal principal;
    IssuedToken token;
}
