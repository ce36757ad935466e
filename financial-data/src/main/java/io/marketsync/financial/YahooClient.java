package io.marketsync.financial;

import io.marketsync.error.FetchException;

/**
 * Raw access to the Yahoo Finance v8 chart endpoint. Returns the JSON body.
 */
public interface YahooClient {
    String fetchChart(String ticker, long period1, long period2, String interval) throws FetchException;
}
