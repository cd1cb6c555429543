package com.taskboard.servicebackend.web;

import com.taskboard.servicebackend.security.AuthenticatedUser;
import com.taskboard.servicebackend.security.JwtService;
import com.taskboard.servicebackend.user.AppUser;
import com.taskboard.servicebackend.user.UserService;
import com.taskboard.servicebackend.web.dto.ApiResponse;
import com.taskboard.servicebackend.web.dto.auth.AuthResponse;
import com.taskboard.servicebackend.web.dto.auth.ChangePasswordRequest;
import com.taskboard.servicebackend.web.dto.auth.SignInRequest;
import com.taskboard.servicebackend.web.dto.auth.SignUpRequest;
import com.taskboard.servicebackend.web.dto.auth.UpdateProfileRequest;
import com.taskboard.servicebackend.web.dto.auth.UserProfileDto;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/auth")
public class AuthController {
    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final UserService userService;
    private final JwtService jwtService;

    public AuthController(UserService userService, JwtService jwtService) {
        this.userService = userService;
        this.jwtService = jwtService;
    }

    @PostMapping("/register")
    public ResponseEntity<ApiResponse<AuthResponse>> register(@Valid @RequestBody SignUpRequest request) {
        AppUser user = userService.registerUser(request.name(), request.email(), request.password());
        String token = jwtService.issue(user);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok("User registered successfully", AuthResponse.issued(token, user)));
    }

    @PostMapping("/login")
    public ResponseEntity<ApiResponse<AuthResponse>> login(@Valid @RequestBody SignInRequest request) {
        AppUser user = userService.authenticate(request.email(), request.password());
        String token = jwtService.issue(user);
        return ResponseEntity.ok(ApiResponse.ok("Login successful", AuthResponse.issued(token, user)));
    }

    @GetMapping("/profile")
    public ResponseEntity<ApiResponse<Map<String, UserProfileDto>>> profile(
            @AuthenticationPrincipal AuthenticatedUser principal) {
        AppUser user = userService.getProfile(principal.id());
        return ResponseEntity.ok(ApiResponse.ok("Profile retrieved successfully",
                Map.of("user", UserProfileDto.from(user))));
    }

    @PutMapping("/profile")
    public ResponseEntity<ApiResponse<Map<String, UserProfileDto>>> updateProfile(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @Valid @RequestBody UpdateProfileRequest request) {
        AppUser user = userService.updateProfile(principal.id(), request.name(), request.email());
        return ResponseEntity.ok(ApiResponse.ok("Profile updated successfully",
                Map.of("user", UserProfileDto.from(user))));
    }

    @PutMapping("/change-password")
    public ResponseEntity<ApiResponse<Void>> changePassword(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @Valid @RequestBody ChangePasswordRequest request) {
        userService.changePassword(principal.id(), request.currentPassword(), request.newPassword());
        return ResponseEntity.ok(ApiResponse.ok("Password changed successfully"));
    }

    @PostMapping("/validate-token")
    public ResponseEntity<ApiResponse<Map<String, Object>>> validateToken(
            @AuthenticationPrincipal AuthenticatedUser principal) {
        AppUser user = userService.getProfile(principal.id());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user", UserProfileDto.from(user));
        data.put("valid", true);
        return ResponseEntity.ok(ApiResponse.ok("Token is valid", data));
    }

    /**
     * Tokens are not tracked server side; the client drops its copy.
     */
    @PostMapping("/logout")
    public ResponseEntity<ApiResponse<Void>> logout(@AuthenticationPrincipal AuthenticatedUser principal) {
        log.info("User {} logged out", principal.id());
        return ResponseEntity.ok(ApiResponse.ok("Logout successful"));
    }
}
