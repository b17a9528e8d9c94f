package com.eyelevel.codeconverter.pipeline;

import com.eyelevel.codeconverter.model.ConversionStats;
import com.eyelevel.codeconverter.model.ItemFailure;

/**
 * Observes a conversion run. Callbacks of one run are delivered one at a time, in the order the
 * changes happened, from whichever thread settled the item.
 */
public interface ConversionListener {

    ConversionListener NONE = new ConversionListener() {
    };

    /**
     * @param percent Settled share of the accepted items, from 0 to 100. Never decreases within a run.
     */
    default void onProgress(double percent) {
    }

    default void onStatsChange(ConversionStats stats) {
    }

    default void onItemFailed(ItemFailure failure) {
    }
}
