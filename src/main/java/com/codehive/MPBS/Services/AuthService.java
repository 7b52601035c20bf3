package com.codehive.MPBS.Services;

import com.codehive.MPBS.DTO.JwtResponse;
import com.codehive.MPBS.Entities.Users;
import com.codehive.MPBS.Exceptions.InvalidCredentialsException;
import com.codehive.MPBS.Repositories.UserRepository;
import com.codehive.MPBS.security.JwtUtils;
import com.codehive.MPBS.security.TokenDenylistService;
import io.jsonwebtoken.JwtException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class AuthService {

    @Autowired
    private AuthenticationManager authenticationManager;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private JwtUtils jwtUtils;

    @Autowired
    private TokenDenylistService tokenDenylistService;

    // Unknown user and wrong password fail alike
    public Authentication authenticate(String username, String password) {
        try {
            return authenticationManager.authenticate(new UsernamePasswordAuthenticationToken(username, password));
        } catch (AuthenticationException e) {
            log.info("Failed login for '{}'", username);
            throw new InvalidCredentialsException();
        }
    }

    public JwtResponse login(String username, String password) {
        Authentication authentication = authenticate(username, password);

        Users user = userRepository.findByUsername(authentication.getName())
                .orElseThrow(InvalidCredentialsException::new);
        String jwt = jwtUtils.generateJwtToken(authentication);

        log.info("User '{}' logged in", user.getUsername());
        return new JwtResponse(jwt, user.getId(), user.getUsername(), user.getRole().name());
    }

    public void logout(String token) {
        try {
            tokenDenylistService.revoke(token, jwtUtils.getExpirationFromJwtToken(token));
        } catch (JwtException | IllegalArgumentException e) {
            // The filter already authenticated this token, so this only happens if it expired meanwhile
            log.debug("Logout with unparseable token: {}", e.getMessage());
        }
    }
}
