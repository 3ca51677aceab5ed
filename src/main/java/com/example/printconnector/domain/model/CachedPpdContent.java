package com.example.printconnector.domain.model;

/**
 * PPD text read from the cache together with the snapshot it belongs to.
 *
 * @param ppd  snapshot the text was read from
 * @param text full PPD document
 */
public record CachedPpdContent(CachedPpd ppd, String text) {
}
