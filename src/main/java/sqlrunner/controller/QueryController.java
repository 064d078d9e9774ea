package sqlrunner.controller;

import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Delete;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import io.micronaut.security.annotation.Secured;
import io.micronaut.security.authentication.Authentication;
import io.micronaut.security.rules.SecurityRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sqlrunner.model.HistoryRecord;
import sqlrunner.model.QueryRequest;
import sqlrunner.model.QueryResponse;
import sqlrunner.service.QueryRunnerService;

import java.util.List;
import java.util.Map;

/**
 * Statement execution and per-user history.
 *
 * <p>Execution always answers 200; a failed statement is reported with
 * {@code success=false} in the body.
 */
@Controller("/query")
@Secured(SecurityRule.IS_AUTHENTICATED)
@ExecuteOn(TaskExecutors.BLOCKING)
public class QueryController {

    private static final Logger LOG = LoggerFactory.getLogger(QueryController.class);

    private final QueryRunnerService queryRunnerService;

    public QueryController(QueryRunnerService queryRunnerService) {
        this.queryRunnerService = queryRunnerService;
    }

    @Post("/execute")
    @Produces(MediaType.APPLICATION_JSON)
    public HttpResponse<Map<String, Object>> execute(@Body QueryRequest request, Authentication authentication) {
        String user = authentication.getName();
        LOG.debug("Execute request from {}", user);
        QueryResponse response = queryRunnerService.executeStatement(user, request.query());
        return HttpResponse.ok(response.toMap());
    }

    @Get("/history")
    @Produces(MediaType.APPLICATION_JSON)
    public List<Map<String, Object>> history(Authentication authentication) {
        return queryRunnerService.getHistory(authentication.getName()).stream()
                .map(HistoryRecord::toMap)
                .toList();
    }

    @Delete("/history")
    @Produces(MediaType.APPLICATION_JSON)
    public Map<String, Object> clearHistory(Authentication authentication) {
        queryRunnerService.clearHistory(authentication.getName());
        return Map.of("message", "Query history cleared successfully");
    }
}
