package com.socialwatch.platform.monitoring.fetcher;

import java.util.function.Function;

/**
 * One technique for pulling data out of a platform: an API endpoint, a page scrape, an
 * alternate network path. Implementations throw {@link TransientUpstreamException} or
 * {@link PermanentUpstreamException}; any other runtime exception counts as permanent.
 */
public interface FetchStrategy<T> {

    String name();

    T fetch(FetchRequest request);

    static <T> FetchStrategy<T> of(String name, Function<FetchRequest, T> body) {
        return new FetchStrategy<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public T fetch(FetchRequest request) {
                return body.apply(request);
            }
        };
    }
}
