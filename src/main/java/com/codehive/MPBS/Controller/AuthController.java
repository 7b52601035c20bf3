package com.codehive.MPBS.Controller;

import com.codehive.MPBS.DTO.JwtResponse;
import com.codehive.MPBS.DTO.LoginRequestDTO;
import com.codehive.MPBS.DTO.MessageResponse;
import com.codehive.MPBS.Entities.Users;
import com.codehive.MPBS.Services.AdminBootstrapService;
import com.codehive.MPBS.Services.AuthService;
import com.codehive.MPBS.security.AuthTokenFilter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class AuthController {

    @Autowired
    private AuthService authService;

    @Autowired
    private AdminBootstrapService adminBootstrapService;

    @PostMapping("/public/login")
    public ResponseEntity<JwtResponse> authenticateUser(@Valid @RequestBody LoginRequestDTO loginRequest) {
        return ResponseEntity.ok(authService.login(loginRequest.getUsername(), loginRequest.getPassword()));
    }

    // First-run only: creates the primary admin while none exists
    @PostMapping("/public/setup")
    public ResponseEntity<Users> setup(@Valid @RequestBody LoginRequestDTO setupRequest) {
        Users admin = adminBootstrapService.completeSetup(setupRequest.getUsername(), setupRequest.getPassword());
        return new ResponseEntity<>(admin, HttpStatus.CREATED);
    }

    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logoutUser(HttpServletRequest request) {
        String jwt = AuthTokenFilter.parseJwt(request);
        if (jwt != null) {
            authService.logout(jwt);
        }
        SecurityContextHolder.clearContext();
        return ResponseEntity.ok(new MessageResponse("Logged out successfully!"));
    }
}
