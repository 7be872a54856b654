package com.fleetwarden.autoscaler.redis;

import java.util.List;

/**
 * One page of a cursor-based key scan.
 *
 * @param cursor cursor to pass to the next call; {@link #INITIAL_CURSOR} once the scan is complete
 * @param keys   keys matched on this page, possibly empty even when the scan is not finished
 */
public record ScanPage(String cursor, List<String> keys) {

    public static final String INITIAL_CURSOR = "0";

    public boolean isFinished() {
        return INITIAL_CURSOR.equals(cursor);
    }
}
