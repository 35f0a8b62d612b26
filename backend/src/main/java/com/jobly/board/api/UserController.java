package com.jobly.board.api;

import com.jobly.board.auth.Capability;
import com.jobly.board.auth.IdentityClaim;
import com.jobly.board.auth.RequiresCapability;
import com.jobly.board.auth.TokenCodec;
import com.jobly.board.model.NewUser;
import com.jobly.board.model.User;
import com.jobly.board.model.UserDetail;
import com.jobly.board.model.UserUpdate;
import com.jobly.board.service.UserService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/users")
public class UserController {
    private final UserService userService;
    private final TokenCodec tokenCodec;
    private final RequestValidator validator;

    public UserController(UserService userService, TokenCodec tokenCodec, RequestValidator validator) {
        this.userService = userService;
        this.tokenCodec = tokenCodec;
        this.validator = validator;
    }

    /** Admin-only user creation, unlike {@code /auth/register} the new user may be an admin. */
    @PostMapping
    @RequiresCapability(Capability.ADMIN)
    public ResponseEntity<Map<String, Object>> create(@RequestBody NewUser user) {
        User created = userService.register(validator.validate(user));
        String token = tokenCodec.encode(new IdentityClaim(created.username(), created.isAdmin()));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("user", created, "token", token));
    }

    @GetMapping
    @RequiresCapability(Capability.ADMIN)
    public Map<String, List<User>> findAll() {
        return Map.of("users", userService.findAll());
    }

    @GetMapping("/{username}")
    @RequiresCapability(Capability.ADMIN_OR_SELF)
    public Map<String, UserDetail> get(@PathVariable("username") String username) {
        return Map.of("user", userService.get(username));
    }

    @PatchMapping("/{username}")
    @RequiresCapability(Capability.ADMIN_OR_SELF)
    public Map<String, User> update(@PathVariable("username") String username, @RequestBody UserUpdate update) {
        return Map.of("user", userService.update(username, validator.validate(update)));
    }

    @DeleteMapping("/{username}")
    @RequiresCapability(Capability.ADMIN_OR_SELF)
    public Map<String, String> delete(@PathVariable("username") String username) {
        userService.remove(username);
        return Map.of("deleted", username);
    }

    @PostMapping("/{username}/jobs/{id}")
    @RequiresCapability(Capability.ADMIN_OR_SELF)
    public Map<String, Long> apply(@PathVariable("username") String username, @PathVariable("id") long jobId) {
        userService.applyToJob(username, jobId);
        return Map.of("applied", jobId);
    }
}
