package com.flighttracker.tracker.domain.quote;

/**
 * Port to the external flight-search provider. Implementations bound each call with a
 * timeout and report failures as {@link com.flighttracker.tracker.domain.exceptions.ProviderException}.
 */
public interface FlightQuoteProvider {

    FlightSearchResult search(FlightQuery query);
}
