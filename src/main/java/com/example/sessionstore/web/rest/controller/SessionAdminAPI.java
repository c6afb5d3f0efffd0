package com.example.sessionstore.web.rest.controller;

import static com.example.sessionstore.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Session maintenance API.
 * Exposes the bulk operations of the session store to operators.
 */
@Tag(
    name = "Session Maintenance",
    description = "Enumerate and invalidate stored sessions"
)
@RequestMapping(
    value = API_BASE + ADMIN,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface SessionAdminAPI {

  @Operation(
      summary = "List all sessions",
      description = "Returns every stored session with its id"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Sessions returned"),
      @ApiResponse(responseCode = "503", description = "Session store unavailable")
  })
  @GetMapping(value = SESSIONS)
  ResponseEntity<Map<String, Object>> listSessions();

  @Operation(summary = "List session ids")
  @GetMapping(value = SESSIONS + IDS)
  ResponseEntity<Map<String, Object>> listSessionIds();

  @Operation(summary = "Count sessions", description = "Counts primary session keys only")
  @GetMapping(value = SESSIONS + COUNT)
  ResponseEntity<Map<String, Object>> countSessions();

  @Operation(summary = "Get one session")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session returned"),
      @ApiResponse(responseCode = "404", description = "No such session")
  })
  @GetMapping(value = SESSIONS + SESSION_ID)
  ResponseEntity<Map<String, Object>> getSession(@PathVariable("sessionId") String sessionId);

  @Operation(summary = "Destroy one session", description = "Removes the session and its user index entry")
  @DeleteMapping(value = SESSIONS + SESSION_ID)
  ResponseEntity<Void> destroySession(@PathVariable("sessionId") String sessionId);

  @Operation(summary = "Clear all sessions", description = "Removes every key of the session namespace")
  @DeleteMapping(value = SESSIONS)
  ResponseEntity<Map<String, Object>> clearSessions();

  @Operation(summary = "List a user's session ids")
  @GetMapping(value = USER_SESSIONS)
  ResponseEntity<Map<String, Object>> listUserSessionIds(@PathVariable("userId") String userId);

  @Operation(summary = "Clear a user's sessions", description = "Invalidates every session of one user")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Sessions removed"),
      @ApiResponse(responseCode = "400", description = "Invalid user id")
  })
  @DeleteMapping(value = USER_SESSIONS)
  ResponseEntity<Map<String, Object>> clearUserSessions(@PathVariable("userId") String userId);
}
