package com.vigil.agent.api;

import com.vigil.agent.domain.ClusterAgent;
import com.vigil.database.EventQuery;
import com.vigil.database.TimelineStore;
import com.vigil.eventmodel.TimelineEvent;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * The cluster timeline.
 * <p>
 * {@code GET} returns stored events, oldest first, and accepts the filters {@code type},
 * {@code node} and {@code probe}; any other parameter is rejected. {@code POST} stores an event
 * reported by a peer; posting the same event twice stores it once.
 */
@RestController
@RequestMapping("/api/v1/timeline")
@ConditionalOnProperty(prefix = "vigil.timeline", name = "enabled", havingValue = "true")
public class TimelineController {

    private final TimelineStore store;
    private final ClusterAgent agent;

    public TimelineController(TimelineStore store, ClusterAgent agent) {
        this.store = store;
        this.agent = agent;
    }

    @GetMapping
    public List<TimelineEvent> events(@RequestParam Map<String, String> filters) {
        return store.events(EventQuery.fromFilters(filters));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void update(@Valid @RequestBody TimelineUpdate update) {
        agent.recordEvent(update.name(), update.event());
    }

    /**
     * @param name  the member reporting the event
     * @param event the event, in its stored JSON form
     */
    public record TimelineUpdate(@NotBlank String name, @NotNull TimelineEvent event) {
    }
}
