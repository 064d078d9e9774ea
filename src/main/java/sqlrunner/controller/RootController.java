package sqlrunner.controller;

import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Produces;
import io.micronaut.security.annotation.Secured;
import io.micronaut.security.authentication.Authentication;
import io.micronaut.security.rules.SecurityRule;

import java.util.LinkedHashMap;
import java.util.Map;

@Controller
public class RootController {

    @Get
    @Secured(SecurityRule.IS_ANONYMOUS)
    @Produces(MediaType.APPLICATION_JSON)
    public Map<String, Object> info() {
        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("auth", Map.of("me", "GET /auth/me"));
        endpoints.put("query", Map.of(
                "execute", "POST /query/execute",
                "history", "GET /query/history",
                "clear_history", "DELETE /query/history"));
        endpoints.put("tables", Map.of(
                "list", "GET /tables",
                "info", "GET /tables/{name}"));
        endpoints.put("health", "GET /health");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "SQL Runner API");
        body.put("version", "1.0.0");
        body.put("description", "Execute SQL queries with authentication");
        body.put("endpoints", endpoints);
        return body;
    }

    @Get("/auth/me")
    @Secured(SecurityRule.IS_AUTHENTICATED)
    @Produces(MediaType.APPLICATION_JSON)
    public Map<String, Object> me(Authentication authentication) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("username", authentication.getName());
        body.put("roles", authentication.getRoles());
        return body;
    }
}
