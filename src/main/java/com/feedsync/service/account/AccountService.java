package com.feedsync.service.account;

import com.feedsync.exception.AccountNotFoundException;
import com.feedsync.exception.DuplicateAccountException;
import com.feedsync.model.Account;
import com.feedsync.model.SyncMode;
import com.feedsync.model.SyncTrigger;
import com.feedsync.repository.AccountRepository;
import com.feedsync.service.feed.FeedClient;
import com.feedsync.service.feed.FeedMetadata;
import com.feedsync.service.sync.SyncOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Tracked accounts. Accounts are deactivated, never deleted; only a metadata refresh changes
 * their display fields.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private final AccountRepository accountRepository;
    private final FeedClient feedClient;
    private final SyncOrchestrator syncOrchestrator;

    public Mono<Account> register(String feedId, String name, boolean initialSync) {
        log.info("Registering account for feed {}", feedId);
        return accountRepository.findByFeedId(feedId)
                .flatMap(existing -> Mono.<FeedMetadata>error(new DuplicateAccountException(feedId)))
                .switchIfEmpty(Mono.defer(() -> feedClient.fetchMetadata(feedId)))
                .map(metadata -> newAccount(feedId, name, metadata))
                .flatMap(account -> accountRepository.save(account)
                        .onErrorMap(DataIntegrityViolationException.class, e -> new DuplicateAccountException(feedId)))
                .flatMap(saved -> initialSync ? runInitialSync(saved) : Mono.just(saved))
                .doOnSuccess(saved -> log.info("Account {} registered as '{}'", feedId, saved.getName()));
    }

    public Mono<Account> refreshMetadata(String feedId) {
        return findByFeedId(feedId)
                .flatMap(account -> feedClient.refreshMetadata(feedId)
                        .map(metadata -> {
                            if (metadata.getTitle() != null && !metadata.getTitle().isBlank()) {
                                account.setName(metadata.getTitle().trim());
                            }
                            account.setDescription(metadata.getDescription());
                            account.setAvatarUrl(metadata.getIconUrl());
                            account.setUpdatedAt(LocalDateTime.now());
                            return account;
                        }))
                .flatMap(accountRepository::save)
                .doOnSuccess(account -> log.info("Refreshed metadata for {}", feedId));
    }

    public Mono<Account> deactivate(String feedId) {
        return setActive(feedId, false);
    }

    public Mono<Account> activate(String feedId) {
        return setActive(feedId, true);
    }

    public Flux<Account> listAccounts() {
        return accountRepository.findAllOrdered();
    }

    public Mono<Account> findByFeedId(String feedId) {
        return accountRepository.findByFeedId(feedId)
                .switchIfEmpty(Mono.error(() -> new AccountNotFoundException(feedId)));
    }

    private Mono<Account> setActive(String feedId, boolean active) {
        return findByFeedId(feedId)
                .flatMap(account -> {
                    if (Boolean.valueOf(active).equals(account.getActive())) {
                        return Mono.just(account);
                    }
                    account.setActive(active);
                    account.setUpdatedAt(LocalDateTime.now());
                    return accountRepository.save(account)
                            .doOnSuccess(saved -> log.info("Account {} {}", feedId, active ? "activated" : "deactivated"));
                });
    }

    private Mono<Account> runInitialSync(Account account) {
        return syncOrchestrator.run(account, SyncMode.FULL, SyncTrigger.REGISTRATION)
                .doOnNext(run -> log.info("Initial sync for {} ended {}", account.getFeedId(), run.getStatus()))
                .onErrorResume(error -> {
                    log.warn("Initial sync for {} could not run: {}", account.getFeedId(), error.getMessage());
                    return Mono.empty();
                })
                .thenReturn(account);
    }

    private Account newAccount(String feedId, String name, FeedMetadata metadata) {
        LocalDateTime now = LocalDateTime.now();
        String displayName = firstNonBlank(name, metadata.getTitle(), feedId);
        return Account.builder()
                .feedId(feedId)
                .name(displayName)
                .description(metadata.getDescription())
                .avatarUrl(metadata.getIconUrl())
                .feedUrl(feedClient.feedUrl(feedId))
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
