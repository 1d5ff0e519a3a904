package com.storewatch.tracker.crawl.scan;

import com.storewatch.tracker.crawl.http.FetchPacingContext;
import com.storewatch.tracker.crawl.model.CrawlState;
import com.storewatch.tracker.crawl.model.SeenEntry;
import com.storewatch.tracker.crawl.store.ListingUnavailableException;
import com.storewatch.tracker.crawl.store.StoreListingClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RollingScannerTest {

    @Mock
    private StoreListingClient listingClient;

    private final FetchPacingContext pacing =
        new FetchPacingContext(0, 0, Duration.ZERO, Clock.systemUTC(), millis -> { });

    @Test
    void windowWrapsAndCursorAdvancesModuloOrdering() {
        RollingScanner scanner = new RollingScanner(listingClient, new Random(1));
        CrawlState state = stateWithOrdering(10);
        state.setCursor(8);

        List<Long> window = scanner.nextWindow(state, 5);
        scanner.advance(state, window.size());

        assertThat(window).containsExactly(8L, 9L, 0L, 1L, 2L);
        assertThat(state.getCursor()).isEqualTo(3);
    }

    @Test
    void windowNeverRepeatsAnIdentifier() {
        List<Long> window = RollingScanner.window(List.of(1L, 2L, 3L), 2, 10);

        assertThat(window).containsExactly(3L, 1L, 2L);
    }

    @Test
    void advanceOnEmptyOrderingResetsCursor() {
        RollingScanner scanner = new RollingScanner(listingClient, new Random(1));
        CrawlState state = CrawlState.empty();
        state.setCursor(4);

        scanner.advance(state, 3);

        assertThat(state.getCursor()).isZero();
        assertThat(scanner.nextWindow(state, 5)).isEmpty();
    }

    @Test
    void freshListingReplacesOrderingAndClampsCursor() {
        when(listingClient.listAllIdentifiers(any())).thenReturn(List.of(5L, 6L, 7L));
        RollingScanner scanner = new RollingScanner(listingClient, new Random(1));
        CrawlState state = stateWithOrdering(10);
        state.setCursor(9);

        boolean refreshed = scanner.refreshOrdering(state, pacing);

        assertThat(refreshed).isTrue();
        assertThat(state.getLastIdentifierOrdering()).containsExactly(5L, 6L, 7L);
        assertThat(state.getCursor()).isZero();
    }

    @Test
    void unavailableListingKeepsCachedOrdering() {
        when(listingClient.listAllIdentifiers(any())).thenThrow(new ListingUnavailableException("listing down"));
        RollingScanner scanner = new RollingScanner(listingClient, new Random(1));
        CrawlState state = stateWithOrdering(4);
        state.setCursor(2);

        boolean refreshed = scanner.refreshOrdering(state, pacing);

        assertThat(refreshed).isFalse();
        assertThat(state.getLastIdentifierOrdering()).containsExactly(0L, 1L, 2L, 3L);
        assertThat(state.getCursor()).isEqualTo(2);
    }

    @Test
    void newArrivalsAreUnseenIdsSampledToCap() {
        RollingScanner scanner = new RollingScanner(listingClient, new Random(99));
        CrawlState state = stateWithOrdering(20);
        for (long id = 0; id < 10; id++) {
            state.getSeenEntries().put(id, SeenEntry.unresolved());
        }

        List<Long> all = scanner.selectNewArrivals(state, 50);
        List<Long> sampled = scanner.selectNewArrivals(state, 4);

        assertThat(all).containsExactlyElementsOf(LongStream.range(10, 20).boxed().collect(Collectors.toList()));
        assertThat(sampled).hasSize(4).doesNotHaveDuplicates().allMatch(id -> id >= 10 && id < 20);
        assertThat(scanner.selectNewArrivals(state, 0)).isEmpty();
    }

    @Test
    void sameSeedSelectsSameSample() {
        CrawlState state = stateWithOrdering(30);

        List<Long> first = new RollingScanner(listingClient, new Random(5)).selectNewArrivals(state, 6);
        List<Long> second = new RollingScanner(listingClient, new Random(5)).selectNewArrivals(state, 6);

        assertThat(first).isEqualTo(second);
    }

    private static CrawlState stateWithOrdering(int size) {
        CrawlState state = CrawlState.empty();
        state.setLastIdentifierOrdering(LongStream.range(0, size).boxed().collect(Collectors.toList()));
        return state;
    }
}
