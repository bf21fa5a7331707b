package com.querysentinel.job;

import com.querysentinel.core.model.AnomalyFinding;

import java.io.IOException;
import java.util.List;

/**
 * Destination of the findings of a detection run.
 */
public interface FindingSink {

    /**
     * Deliver the findings in the given order.
     *
     * @param findings ordered findings
     * @throws IOException if delivery fails
     */
    void deliver(List<AnomalyFinding> findings) throws IOException;
}
