package com.edgewatch.controller.rest;

import com.edgewatch.service.core.query.SeriesQueryService;
import com.edgewatch.service.core.support.DurationParser;
import com.edgewatch.telemetry.model.LogRecord;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/query", produces = MediaType.APPLICATION_JSON_VALUE)
public class QueryController {

    private final SeriesQueryService queryService;
    private final Clock clock;

    public QueryController(SeriesQueryService queryService, Clock clock) {
        this.queryService = queryService;
        this.clock = clock;
    }

    @GetMapping("/series")
    public SeriesQueryResponse series(
            @RequestParam("cluster_id") String clusterId,
            @RequestParam("series_key") String seriesKey,
            @RequestParam(name = "from", required = false) String from,
            @RequestParam(name = "to", required = false) String to,
            @RequestParam(name = "step", required = false) String step,
            @RequestParam(name = "limit", required = false) Integer limit) {
        QueryRangeResolver.ResolvedRange range = QueryRangeResolver.resolve(from, to, clock);
        Duration stepDuration = step == null || step.isBlank() ? null : DurationParser.parse(step);
        return SeriesQueryResponse.from(
                queryService.querySeries(clusterId, seriesKey, range.from(), range.to(), stepDuration, limit));
    }

    @GetMapping("/series/keys")
    public Map<String, Object> seriesKeys(
            @RequestParam("cluster_id") String clusterId,
            @RequestParam(name = "limit", required = false) Integer limit) {
        List<String> keys = queryService.listSeries(clusterId, limit);
        return Map.of("clusterId", clusterId, "count", keys.size(), "seriesKeys", keys);
    }

    @GetMapping("/logs")
    public Map<String, Object> logs(
            @RequestParam("cluster_id") String clusterId,
            @RequestParam(name = "from", required = false) String from,
            @RequestParam(name = "to", required = false) String to,
            @RequestParam(name = "limit", required = false) Integer limit) {
        QueryRangeResolver.ResolvedRange range = QueryRangeResolver.resolve(from, to, clock);
        List<LogRecord> logs = queryService.queryLogs(clusterId, range.from(), range.to(), limit);
        return Map.of("clusterId", clusterId, "count", logs.size(), "logs", logs);
    }
}
