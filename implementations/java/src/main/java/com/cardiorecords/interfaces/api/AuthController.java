package com.cardiorecords.interfaces.api;

import com.cardiorecords.application.AccountService;
import com.cardiorecords.application.Authenticator;
import com.cardiorecords.application.SecurityContextProvider;
import com.cardiorecords.domain.model.AuditAction;
import com.cardiorecords.domain.model.ResourceKind;
import com.cardiorecords.infrastructure.audit.Audited;
import com.cardiorecords.infrastructure.security.SecurityContext;
import com.cardiorecords.interfaces.api.dto.AuthResponse;
import com.cardiorecords.interfaces.api.dto.ChangePasswordRequest;
import com.cardiorecords.interfaces.api.dto.ErrorResponse;
import com.cardiorecords.interfaces.api.dto.LoginRequest;
import com.cardiorecords.interfaces.api.dto.MessageResponse;
import com.cardiorecords.interfaces.api.dto.PrincipalResponse;
import com.cardiorecords.interfaces.api.dto.RegisterRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for authentication and the caller's own account.
 *
 * Security:
 * - register and login are public; everything else needs a bearer token
 * - Login failures answer with one uniform message
 * - Every call is audited, including failed logins
 */
@RestController
@RequestMapping(value = "/api/auth", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Authentication", description = "Registration, login and session management")
public class AuthController {

    private final Authenticator authenticator;
    private final AccountService accountService;
    private final SecurityContextProvider contextProvider;

    @PostMapping(value = "/register", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    @Audited(resource = ResourceKind.USER, action = AuditAction.CREATE)
    @Operation(summary = "Register a new account")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Account created",
            content = @Content(schema = @Schema(implementation = AuthResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request parameters",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "409", description = "Email already registered",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        AuthResponse response = AuthResponse.from(
            accountService.register(request.getEmail(), request.getPassword(), request.getName()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Audited(resource = ResourceKind.USER)
    @Operation(summary = "Login and obtain a bearer token")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Login successful",
            content = @Content(schema = @Schema(implementation = AuthResponse.class))),
        @ApiResponse(responseCode = "401", description = "Invalid credentials or account deactivated",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(responseCode = "423", description = "Account temporarily locked",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(AuthResponse.from(authenticator.login(request.getEmail(), request.getPassword())));
    }

    @GetMapping("/me")
    @Audited(resource = ResourceKind.USER, action = AuditAction.READ)
    @Operation(summary = "Current principal profile")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<PrincipalResponse> me() {
        SecurityContext context = contextProvider.getCurrentContext();
        return ResponseEntity.ok(PrincipalResponse.from(accountService.currentPrincipal(context)));
    }

    @PostMapping("/logout")
    @Audited(resource = ResourceKind.USER)
    @Operation(summary = "Revoke the current token")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<MessageResponse> logout() {
        authenticator.logout(contextProvider.getCurrentContext());
        return ResponseEntity.ok(new MessageResponse("Logged out successfully."));
    }

    @PutMapping(value = "/password", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Audited(resource = ResourceKind.USER, action = AuditAction.UPDATE)
    @Operation(summary = "Change password", description = "Returns a fresh token; older tokens stop working")
    @SecurityRequirement(name = "bearerAuth")
    public ResponseEntity<AuthResponse> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        SecurityContext context = contextProvider.getCurrentContext();
        return ResponseEntity.ok(AuthResponse.from(
            accountService.changePassword(context, request.getCurrentPassword(), request.getNewPassword())));
    }
}
