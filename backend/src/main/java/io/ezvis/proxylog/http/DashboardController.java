package io.ezvis.proxylog.http;

import io.ezvis.proxylog.service.AccessLogQueryService;
import io.ezvis.proxylog.service.QueryKind;
import io.ezvis.proxylog.service.TimeRange;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class DashboardController {

    private final AccessLogQueryService queryService;

    @GetMapping("/queries")
    public List<String> queries() {
        return Arrays.stream(QueryKind.values())
                .map(QueryKind::externalName)
                .toList();
    }

    @GetMapping("/{query}")
    public QueryResponse query(@PathVariable("query") String query,
                               @RequestParam(value = "start", required = false) String start,
                               @RequestParam(value = "end", required = false) String end) {
        QueryKind kind = QueryKind.fromName(query)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown query: " + query));
        TimeRange range = TimeRange.parse(start, end);
        return new QueryResponse(kind.externalName(), queryService.run(kind, range));
    }

    public record QueryResponse(String query, List<?> rows) {
    }
}
