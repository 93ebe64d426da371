package com.feedsync.controller;

import com.feedsync.dto.RegisterAccountRequest;
import com.feedsync.model.Account;
import com.feedsync.service.account.AccountService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {
    private final AccountService accountService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Account> register(@Valid @RequestBody RegisterAccountRequest request) {
        return accountService.register(request.getFeedId().trim(), request.getName(), request.isInitialSyncRequested());
    }

    @GetMapping
    public Flux<Account> list() {
        return accountService.listAccounts();
    }

    @GetMapping("/{feedId}")
    public Mono<Account> get(@PathVariable String feedId) {
        return accountService.findByFeedId(feedId);
    }

    @PostMapping("/{feedId}/refresh")
    public Mono<Account> refresh(@PathVariable String feedId) {
        return accountService.refreshMetadata(feedId);
    }

    @PostMapping("/{feedId}/deactivate")
    public Mono<Account> deactivate(@PathVariable String feedId) {
        return accountService.deactivate(feedId);
    }

    @PostMapping("/{feedId}/activate")
    public Mono<Account> activate(@PathVariable String feedId) {
        return accountService.activate(feedId);
    }
}
