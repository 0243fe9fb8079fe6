package com.example.identity.web.rest.controller;

import static com.example.identity.web.rest.ApiConstants.ApiPath.*;

import com.example.identity.web.rest.dto.SessionExchangeRequest;
import com.example.identity.web.rest.dto.SessionExchangeResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Tag(
    name = "Authentication",
    description = "Session creation from an identity provider access token, logout and session lookup"
)
@RequestMapping(
    value = AUTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface AuthAPI {

  @Operation(
      summary = "Create a session",
      description = "Validates an identity provider access token and issues a session as both a "
          + "self-contained token and a store reference"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session created, cookies set"),
      @ApiResponse(responseCode = "400", description = "No access token supplied"),
      @ApiResponse(responseCode = "401", description = "Access token rejected by the identity provider"),
      @ApiResponse(responseCode = "500", description = "Internal server error")
  })
  @PostMapping(value = SESSION)
  ResponseEntity<SessionExchangeResponse> createSession(
      @Parameter(description = "Bearer access token; takes precedence over the body")
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @RequestBody(required = false) SessionExchangeRequest body,
      HttpServletResponse response
                                                       );

  @Operation(
      summary = "Logout user",
      description = "Deletes store-backed sessions carried by the request and clears session cookies"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Successfully logged out")
  })
  @PostMapping(value = LOGOUT)
  ResponseEntity<Map<String, Object>> logout(HttpServletRequest request, HttpServletResponse response);

  @Operation(
      summary = "Get current user",
      description = "Resolves the request's session and returns the verified identity"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Identity returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated")
  })
  @GetMapping(value = ME)
  ResponseEntity<Map<String, Object>> me(HttpServletRequest request);

  @Operation(
      summary = "Check authentication status",
      description = "Returns whether the request carries a valid session; never 401"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Authentication status returned")
  })
  @GetMapping(value = STATUS)
  ResponseEntity<Map<String, Object>> status(HttpServletRequest request);
}
