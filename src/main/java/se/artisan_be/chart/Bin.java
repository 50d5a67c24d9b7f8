package se.artisan_be.chart;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Histogram bucket; a null upper bound marks the open-ended last bucket.
 */
@Getter
@AllArgsConstructor
public class Bin {
    private final String label;
    private final Integer upperInclusive;
}
