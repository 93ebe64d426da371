package com.feedsync.service.sync;

import com.feedsync.config.SyncProperties;
import com.feedsync.dto.AccountSyncResult;
import com.feedsync.exception.AccountNotFoundException;
import com.feedsync.exception.FetchException;
import com.feedsync.exception.SyncAlreadyRunningException;
import com.feedsync.model.Account;
import com.feedsync.model.SyncMode;
import com.feedsync.model.SyncRun;
import com.feedsync.model.SyncStatus;
import com.feedsync.model.SyncTrigger;
import com.feedsync.repository.AccountRepository;
import com.feedsync.repository.ArticleRepository;
import com.feedsync.repository.SyncRunRepository;
import com.feedsync.service.content.ContentNormalizer;
import com.feedsync.service.feed.FeedClient;
import com.feedsync.service.feed.FeedCursor;
import com.feedsync.service.feed.FeedItem;
import com.feedsync.service.feed.FeedPage;
import com.feedsync.service.merge.ArticleMergeService;
import com.feedsync.service.merge.InMemoryArticleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SyncOrchestratorTest {

    private static final LocalDateTime PUBLISHED = LocalDateTime.of(2024, 5, 1, 10, 0);

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private ArticleRepository articleRepository;

    @Mock
    private SyncRunRepository syncRunRepository;

    @Mock
    private FeedClient feedClient;

    @Mock
    private TransactionalOperator transactionalOperator;

    private final List<SyncRun> savedRuns = new CopyOnWriteArrayList<>();
    private final AtomicLong runIds = new AtomicLong();

    private SyncProperties properties;
    private ActiveRunRegistry activeRuns;
    private InMemoryArticleStore store;
    private SyncOrchestrator orchestrator;
    private Account account;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new SyncProperties();
        activeRuns = new ActiveRunRegistry();
        store = new InMemoryArticleStore().bind(articleRepository);
        lenient().when(transactionalOperator.transactional(any(Mono.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(syncRunRepository.save(any(SyncRun.class))).thenAnswer(invocation -> {
            SyncRun run = invocation.getArgument(0);
            if (run.getId() == null) {
                run.setId(runIds.incrementAndGet());
            }
            savedRuns.add(run);
            return Mono.just(run);
        });

        orchestrator = new SyncOrchestrator(
                accountRepository,
                feedClient,
                new ContentNormalizer(properties),
                new ArticleMergeService(articleRepository, transactionalOperator),
                new SyncRunService(syncRunRepository, accountRepository),
                activeRuns,
                properties);
        account = account(1L, "feed-a");
    }

    @Test
    void repeatedIncrementalSync_shouldReportKnownItemsAsUnchanged() {
        stubPage(account, 1, false, "g1", "g2", "g3");

        StepVerifier.create(orchestrator.run(account, SyncMode.INCREMENTAL, SyncTrigger.API))
                .assertNext(run -> {
                    assertEquals(SyncStatus.SUCCESS, run.getStatus());
                    assertEquals(3, run.getArticlesNew());
                    assertEquals(0, run.getArticlesUnchanged());
                })
                .verifyComplete();

        StepVerifier.create(orchestrator.run(account, SyncMode.INCREMENTAL, SyncTrigger.API))
                .assertNext(run -> {
                    assertEquals(SyncStatus.SUCCESS, run.getStatus());
                    assertEquals(0, run.getArticlesNew());
                    assertEquals(0, run.getArticlesUpdated());
                    assertEquals(3, run.getArticlesUnchanged());
                    assertEquals(1, run.getPagesFetched());
                })
                .verifyComplete();

        verify(feedClient, times(2)).fetchPage(eq(account), eq(new FeedCursor(1)), any(SyncCancellation.class));
        verify(feedClient, never()).fetchPage(eq(account), eq(new FeedCursor(2)), any(SyncCancellation.class));
        assertEquals(3, store.size());
    }

    @Test
    void incrementalSync_shouldStopAtFirstFullyKnownPage() {
        stubPage(account, 1, true, "k1", "k2");
        stubPage(account, 2, false, "k3", "k4");
        StepVerifier.create(orchestrator.run(account, SyncMode.FULL, SyncTrigger.API))
                .expectNextCount(1)
                .verifyComplete();

        stubPage(account, 1, true, "n1", "n2");
        stubPage(account, 2, true, "k1", "k2");
        stubPage(account, 3, false, "k3", "k4");

        StepVerifier.create(orchestrator.run(account, SyncMode.INCREMENTAL, SyncTrigger.API))
                .assertNext(run -> {
                    assertEquals(SyncStatus.SUCCESS, run.getStatus());
                    assertEquals(2, run.getPagesFetched());
                    assertEquals(2, run.getArticlesNew());
                    assertEquals(2, run.getArticlesUnchanged());
                })
                .verifyComplete();

        verify(feedClient, never()).fetchPage(eq(account), eq(new FeedCursor(3)), any(SyncCancellation.class));
    }

    @Test
    void fullSync_shouldPageThroughKnownItems() {
        stubPage(account, 1, true, "g1", "g2");
        stubPage(account, 2, true, "g3", "g4");
        stubPage(account, 3, false, "g5");

        StepVerifier.create(orchestrator.run(account, SyncMode.FULL, SyncTrigger.API))
                .expectNextCount(1)
                .verifyComplete();
        StepVerifier.create(orchestrator.run(account, SyncMode.FULL, SyncTrigger.API))
                .assertNext(run -> {
                    assertEquals(SyncStatus.SUCCESS, run.getStatus());
                    assertEquals(3, run.getPagesFetched());
                    assertEquals(5, run.getArticlesFetched());
                    assertEquals(5, run.getArticlesUnchanged());
                })
                .verifyComplete();
    }

    @Test
    void fetchFailureOnSecondPage_shouldEndPartialWithFirstPageCounts() {
        stubPage(account, 1, true, "g1", "g2");
        when(feedClient.fetchPage(eq(account), eq(new FeedCursor(2)), any(SyncCancellation.class)))
                .thenReturn(Mono.error(new FetchException("feed-a", new FeedCursor(2), "upstream status 502", 502, null)));

        StepVerifier.create(orchestrator.run(account, SyncMode.FULL, SyncTrigger.API))
                .assertNext(run -> {
                    assertEquals(SyncStatus.PARTIAL, run.getStatus());
                    assertEquals(1, run.getPagesFetched());
                    assertEquals(2, run.getArticlesNew());
                    assertNotNull(run.getErrorMessage());
                    assertNotNull(run.getCompletedAt());
                })
                .verifyComplete();

        verify(feedClient, never()).fetchPage(eq(account), eq(new FeedCursor(3)), any(SyncCancellation.class));
        assertEquals(2, store.size());
    }

    @Test
    void fetchFailureOnFirstPage_shouldEndFailed() {
        when(accountRepository.findByFeedId("feed-a")).thenReturn(Mono.just(account));
        when(feedClient.fetchPage(eq(account), eq(new FeedCursor(1)), any(SyncCancellation.class)))
                .thenReturn(Mono.error(new FetchException("feed-a", new FeedCursor(1), "timed out")));

        StepVerifier.create(orchestrator.syncAccount("feed-a", SyncMode.INCREMENTAL, SyncTrigger.API))
                .assertNext(run -> {
                    assertEquals(SyncStatus.FAILED, run.getStatus());
                    assertEquals(0, run.getPagesFetched());
                    assertEquals(0, run.getArticlesNew());
                    assertTrue(run.getErrorMessage().contains("timed out"));
                })
                .verifyComplete();
    }

    @Test
    void pageCap_shouldEndRunSuccessfully() {
        properties.setMaxPages(2);
        stubPage(account, 1, true, "g1", "g2");
        stubPage(account, 2, true, "g3", "g4");

        StepVerifier.create(orchestrator.run(account, SyncMode.FULL, SyncTrigger.API))
                .assertNext(run -> {
                    assertEquals(SyncStatus.SUCCESS, run.getStatus());
                    assertEquals(2, run.getPagesFetched());
                    assertEquals(4, run.getArticlesNew());
                })
                .verifyComplete();

        verify(feedClient, never()).fetchPage(eq(account), eq(new FeedCursor(3)), any(SyncCancellation.class));
    }

    @Test
    void concurrentRun_shouldBeRejectedImmediately() {
        activeRuns.register("feed-a");

        StepVerifier.create(orchestrator.run(account, SyncMode.FULL, SyncTrigger.API))
                .expectError(SyncAlreadyRunningException.class)
                .verify();

        verifyNoInteractions(feedClient);
        assertTrue(savedRuns.isEmpty());
    }

    @Test
    void finishedRun_shouldReleaseTheAccount() {
        stubPage(account, 1, false, "g1");

        StepVerifier.create(orchestrator.run(account, SyncMode.FULL, SyncTrigger.API))
                .expectNextCount(1)
                .verifyComplete();

        assertFalse(activeRuns.isActive("feed-a"));
    }

    @Test
    void cancellation_shouldStopBeforeNextPageAndEndPartial() {
        FeedPage firstPage = page(1, true, "g1", "g2");
        when(feedClient.fetchPage(eq(account), eq(new FeedCursor(1)), any(SyncCancellation.class)))
                .thenAnswer(invocation -> {
                    assertTrue(orchestrator.cancel("feed-a"));
                    return Mono.just(firstPage);
                });

        StepVerifier.create(orchestrator.run(account, SyncMode.FULL, SyncTrigger.API))
                .assertNext(run -> {
                    assertEquals(SyncStatus.PARTIAL, run.getStatus());
                    assertEquals(1, run.getPagesFetched());
                    assertEquals(2, run.getArticlesNew());
                    assertTrue(run.getErrorMessage().startsWith("cancelled"));
                })
                .verifyComplete();

        verify(feedClient, never()).fetchPage(eq(account), eq(new FeedCursor(2)), any(SyncCancellation.class));
        assertFalse(orchestrator.cancel("feed-a"));
    }

    @Test
    void abandonedRun_shouldStillBeClosed() {
        when(feedClient.fetchPage(eq(account), eq(new FeedCursor(1)), any(SyncCancellation.class)))
                .thenReturn(Mono.never());

        Disposable subscription = orchestrator.run(account, SyncMode.FULL, SyncTrigger.API).subscribe();
        subscription.dispose();

        SyncRun last = savedRuns.get(savedRuns.size() - 1);
        assertEquals(SyncStatus.PARTIAL, last.getStatus());
        assertNotNull(last.getCompletedAt());
        assertFalse(activeRuns.isActive("feed-a"));
    }

    @Test
    void subscriberLeavingDuringFinalSave_shouldNotCancelTheSave() {
        stubPage(account, 1, false, "g1");
        Sinks.One<SyncRun> terminalSave = Sinks.one();
        AtomicBoolean saveCancelled = new AtomicBoolean();
        AtomicReference<SyncRun> finishing = new AtomicReference<>();
        doAnswer(invocation -> {
            SyncRun run = invocation.getArgument(0);
            if (run.getId() == null) {
                run.setId(runIds.incrementAndGet());
                return Mono.just(run);
            }
            finishing.set(run);
            return terminalSave.asMono().doOnCancel(() -> saveCancelled.set(true));
        }).when(syncRunRepository).save(any(SyncRun.class));

        Disposable subscription = orchestrator.run(account, SyncMode.FULL, SyncTrigger.API).subscribe();
        assertNotNull(finishing.get(), "terminal save should be in flight");
        subscription.dispose();
        terminalSave.tryEmitValue(finishing.get());

        assertFalse(saveCancelled.get());
        assertEquals(SyncStatus.SUCCESS, finishing.get().getStatus());
        assertNotNull(finishing.get().getCompletedAt());
        verify(syncRunRepository, times(2)).save(any(SyncRun.class));
    }

    @Test
    void syncAccount_shouldFailForUnknownFeed() {
        when(accountRepository.findByFeedId("missing")).thenReturn(Mono.empty());

        StepVerifier.create(orchestrator.syncAccount("missing", SyncMode.INCREMENTAL, SyncTrigger.API))
                .expectError(AccountNotFoundException.class)
                .verify();
    }

    @Test
    void syncAll_shouldIsolateAccountFailures() {
        Account broken = account(2L, "feed-b");
        Account busy = account(3L, "feed-c");
        stubPage(account, 1, false, "g1", "g2");
        when(feedClient.fetchPage(eq(broken), eq(new FeedCursor(1)), any(SyncCancellation.class)))
                .thenReturn(Mono.error(new FetchException("feed-b", new FeedCursor(1), "upstream status 500", 500, null)));
        when(accountRepository.findAllActive()).thenReturn(Flux.just(account, broken, busy));
        activeRuns.register("feed-c");

        StepVerifier.create(orchestrator.syncAll(SyncMode.INCREMENTAL))
                .assertNext(summary -> {
                    assertEquals(3, summary.getTotalAccounts());
                    assertEquals(1, summary.getSucceeded());
                    assertEquals(1, summary.getFailed());
                    assertEquals(1, summary.getNotStarted());
                    assertEquals(2, summary.getTotalNew());

                    Map<String, AccountSyncResult> byFeed = summary.getResults().stream()
                            .collect(Collectors.toMap(AccountSyncResult::getFeedId, Function.identity()));
                    assertEquals(SyncStatus.SUCCESS, byFeed.get("feed-a").getStatus());
                    assertEquals(SyncStatus.FAILED, byFeed.get("feed-b").getStatus());
                    assertNull(byFeed.get("feed-c").getStatus());
                    assertNotNull(byFeed.get("feed-c").getError());
                })
                .verifyComplete();
    }

    private void stubPage(Account owner, int page, boolean hasMore, String... guids) {
        FeedPage feedPage = page(page, hasMore, guids);
        when(feedClient.fetchPage(eq(owner), eq(new FeedCursor(page)), any(SyncCancellation.class)))
                .thenReturn(Mono.just(feedPage));
    }

    private static FeedPage page(int page, boolean hasMore, String... guids) {
        List<FeedItem> items = new ArrayList<>();
        for (String guid : guids) {
            items.add(FeedItem.builder()
                    .guid(guid)
                    .title("Post " + guid)
                    .author("Alice")
                    .link("https://example.com/" + guid)
                    .htmlBody("<p>Body of " + guid + "</p>")
                    .publishedAt(PUBLISHED)
                    .build());
        }
        return new FeedPage(items, hasMore ? new FeedCursor(page + 1) : null, hasMore);
    }

    private static Account account(Long id, String feedId) {
        return Account.builder().id(id).feedId(feedId).name("Account " + feedId).active(true).build();
    }
}
