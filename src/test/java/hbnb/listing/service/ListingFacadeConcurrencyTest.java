package hbnb.listing.service;

import hbnb.listing.domain.Place;
import hbnb.listing.domain.User;
import hbnb.listing.exception.ConflictException;
import hbnb.listing.service.command.ReviewCommand;
import hbnb.listing.testutil.PlaceTestBuilder;
import hbnb.listing.testutil.UserTestBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Concurrency tests for the listing facade.
 * Checks that the uniqueness rules hold when many callers race.
 */
class ListingFacadeConcurrencyTest {

    private static final int THREAD_COUNT = 16;

    private ListingFacade facade;

    @BeforeEach
    void setUp() {
        facade = new ListingFacade();
    }

    @Test
    @DisplayName("Concurrent sign-ups with the same email produce exactly one user")
    void testConcurrentDuplicateEmail() throws Exception {
        // GIVEN: many callers registering the same email at once
        ExecutorService executor = Executors.newFixedThreadPool(THREAD_COUNT);
        CountDownLatch startLatch = new CountDownLatch(1);
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<Boolean>> futures = new ArrayList<>();

        for (int i = 0; i < THREAD_COUNT; i++) {
            final int caller = i;
            futures.add(executor.submit(() -> {
                startLatch.await();
                try {
                    facade.createUser(UserTestBuilder.guest()
                            .firstName("Caller" + caller)
                            .email("race@example.com")
                            .build());
                    return true;
                } catch (ConflictException e) {
                    conflicts.incrementAndGet();
                    return false;
                }
            }));
        }

        // WHEN: all start together
        startLatch.countDown();
        int successes = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(10, TimeUnit.SECONDS)) {
                successes++;
            }
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // THEN: one winner, everyone else saw a conflict
        assertThat(successes).isEqualTo(1);
        assertThat(conflicts.get()).isEqualTo(THREAD_COUNT - 1);
        assertThat(facade.listUsers()).hasSize(1);
    }

    @Test
    @DisplayName("Concurrent guest reviews of one place by one user store a single review")
    void testConcurrentGuestReviews() throws Exception {
        // GIVEN: a host's place and a guest
        User host = facade.createUser(UserTestBuilder.host().build());
        User guest = facade.createUser(UserTestBuilder.guest().build());
        Place place = facade.createPlace(PlaceTestBuilder.ownedBy(host.getId()).build());

        ExecutorService executor = Executors.newFixedThreadPool(THREAD_COUNT);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch completionLatch = new CountDownLatch(THREAD_COUNT);
        AtomicInteger conflicts = new AtomicInteger();

        for (int i = 0; i < THREAD_COUNT; i++) {
            final int rating = i % 5 + 1;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    facade.submitGuestReview(ReviewCommand.builder()
                            .text("Review with rating " + rating)
                            .rating(rating)
                            .userId(guest.getId())
                            .placeId(place.getId())
                            .build());
                } catch (ConflictException e) {
                    conflicts.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    completionLatch.countDown();
                }
            });
        }

        // WHEN
        startLatch.countDown();
        assertThat(completionLatch.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        // THEN
        assertThat(facade.listReviewsByPlace(place.getId())).hasSize(1);
        assertThat(conflicts.get()).isEqualTo(THREAD_COUNT - 1);
    }
}
