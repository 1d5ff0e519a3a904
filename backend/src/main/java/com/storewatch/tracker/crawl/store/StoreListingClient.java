package com.storewatch.tracker.crawl.store;

import com.storewatch.tracker.crawl.http.FetchPacingContext;

import java.util.List;

public interface StoreListingClient {
    /**
     * Full identifier ordering as published by the store.
     *
     * @throws ListingUnavailableException when the listing cannot be fetched or is empty
     */
    List<Long> listAllIdentifiers(FetchPacingContext pacing);
}
