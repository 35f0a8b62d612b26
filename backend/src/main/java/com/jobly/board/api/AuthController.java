package com.jobly.board.api;

import com.jobly.board.auth.IdentityClaim;
import com.jobly.board.auth.TokenCodec;
import com.jobly.board.model.Credentials;
import com.jobly.board.model.User;
import com.jobly.board.model.UserRegistration;
import com.jobly.board.service.UserService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/** Token issuing. Both routes are public. */
@RestController
@RequestMapping("/auth")
public class AuthController {
    private final UserService userService;
    private final TokenCodec tokenCodec;
    private final RequestValidator validator;

    public AuthController(UserService userService, TokenCodec tokenCodec, RequestValidator validator) {
        this.userService = userService;
        this.tokenCodec = tokenCodec;
        this.validator = validator;
    }

    @PostMapping("/token")
    public Map<String, String> token(@RequestBody Credentials credentials) {
        User user = userService.authenticate(validator.validate(credentials));
        return Map.of("token", tokenFor(user));
    }

    @PostMapping("/register")
    public ResponseEntity<Map<String, String>> register(@RequestBody UserRegistration registration) {
        User user = userService.register(validator.validate(registration).asNewUser());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("token", tokenFor(user)));
    }

    private String tokenFor(User user) {
        return tokenCodec.encode(new IdentityClaim(user.username(), user.isAdmin()));
    }
}
