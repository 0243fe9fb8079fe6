package com.example.identity.web.rest.controller;

import static com.example.identity.web.rest.ApiConstants.ApiPath.*;

import com.example.identity.domain.entity.ResolvedIdentity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Session information for authenticated API callers.
 */
@Tag(
    name = "Session",
    description = "Identity of the authenticated caller"
)
@RequestMapping(
    value = API_BASE + SESSION,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface SessionAPI {

  @Operation(
      summary = "Get current identity",
      description = "Returns the identity resolved by the session filter, including tags and elevated access"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Identity returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated")
  })
  @GetMapping(value = ME)
  ResponseEntity<ResolvedIdentity> currentIdentity(
      @Parameter(hidden = true) @AuthenticationPrincipal ResolvedIdentity identity);
}
