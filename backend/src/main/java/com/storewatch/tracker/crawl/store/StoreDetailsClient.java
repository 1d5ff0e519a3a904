package com.storewatch.tracker.crawl.store;

import com.storewatch.tracker.crawl.http.FetchPacingContext;
import com.storewatch.tracker.crawl.model.DetailsResponse;
import com.storewatch.tracker.crawl.model.StoreLocale;

public interface StoreDetailsClient {
    DetailsResponse fetchDetails(long appId, StoreLocale locale, FetchPacingContext pacing);
}
