package com.feedsync.repository;

import com.feedsync.model.Account;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface AccountRepository extends R2dbcRepository<Account, Long> {

    Mono<Account> findByFeedId(String feedId);

    @Query("SELECT * FROM accounts WHERE is_active = true ORDER BY id")
    Flux<Account> findAllActive();

    @Query("SELECT * FROM accounts ORDER BY id")
    Flux<Account> findAllOrdered();
}
