package sqlrunner.controller;

import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Produces;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import io.micronaut.security.annotation.Secured;
import io.micronaut.security.rules.SecurityRule;
import sqlrunner.service.QueryRunnerService;

import java.util.Map;

/**
 * Schema browsing. Unknown tables surface as 404 through the global exception handler.
 */
@Controller("/tables")
@Secured(SecurityRule.IS_AUTHENTICATED)
@ExecuteOn(TaskExecutors.BLOCKING)
public class TableController {

    private final QueryRunnerService queryRunnerService;

    public TableController(QueryRunnerService queryRunnerService) {
        this.queryRunnerService = queryRunnerService;
    }

    @Get
    @Produces(MediaType.APPLICATION_JSON)
    public Map<String, Object> listTables() {
        return Map.of("tables", queryRunnerService.listTables());
    }

    @Get("/{name}")
    @Produces(MediaType.APPLICATION_JSON)
    public Map<String, Object> describeTable(@PathVariable String name) {
        return queryRunnerService.describeTable(name).toMap();
    }
}
