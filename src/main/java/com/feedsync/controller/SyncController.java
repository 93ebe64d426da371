package com.feedsync.controller;

import com.feedsync.dto.SyncSummary;
import com.feedsync.exception.NoActiveSyncRunException;
import com.feedsync.model.SyncMode;
import com.feedsync.model.SyncRun;
import com.feedsync.model.SyncTrigger;
import com.feedsync.service.sync.SyncOrchestrator;
import com.feedsync.service.sync.SyncRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {
    private final SyncOrchestrator syncOrchestrator;
    private final SyncRunService syncRunService;

    @PostMapping("/{feedId}")
    public Mono<SyncRun> syncAccount(@PathVariable String feedId,
                                     @RequestParam(required = false) String mode) {
        SyncMode syncMode = SyncMode.fromValue(mode);
        log.info("Manual {} sync requested for {}", syncMode, feedId);
        return syncOrchestrator.syncAccount(feedId, syncMode, SyncTrigger.API);
    }

    @PostMapping
    public Mono<SyncSummary> syncAll(@RequestParam(required = false) String mode) {
        return syncOrchestrator.syncAll(SyncMode.fromValue(mode));
    }

    @PostMapping("/{feedId}/cancel")
    public Mono<Map<String, Object>> cancel(@PathVariable String feedId) {
        if (!syncOrchestrator.cancel(feedId)) {
            return Mono.error(new NoActiveSyncRunException(feedId));
        }
        return Mono.just(Map.of(
                "feedId", feedId,
                "cancelled", true,
                "message", "Cancellation requested"
        ));
    }

    @GetMapping("/runs")
    public Flux<SyncRun> runs(@RequestParam(required = false) String feedId,
                              @RequestParam(defaultValue = "20") int limit) {
        return syncRunService.recentRuns(feedId, Math.max(1, Math.min(limit, 200)));
    }
}
