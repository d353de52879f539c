package io.tickersched.core;

import java.util.List;

/**
 * The known entity universe per interval.
 */
public interface TickerUniverse {
    List<String> entities(String interval);
}
