package com.salonhub.authservice.services.userlogin;

import com.salonhub.authservice.models.UserAccount;
import com.salonhub.authservice.services.ClientContext;
import com.salonhub.authservice.services.TokenIssuer;
import com.salonhub.authservice.services.TokenPair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserLogin {

    private final AuthenticationGate authenticationGate;
    private final TokenIssuer tokenIssuer;

    // Login: check credentials, then issue a fresh pair. No tenant context is involved.
    public TokenPair login(String email, String password, String tenantHint, ClientContext client) {
        UserAccount user = authenticationGate.validateCredentials(email, password, tenantHint, client);
        return tokenIssuer.issue(user, client);
    }
}
