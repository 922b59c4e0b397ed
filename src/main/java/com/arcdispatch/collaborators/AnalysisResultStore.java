package com.arcdispatch.collaborators;

import com.arcdispatch.models.AnalysisResult;

import java.io.IOException;

/**
 * Durable storage for finished results. Called from a background executor, never on the
 * streaming path.
 */
public interface AnalysisResultStore {

    /**
     * @return the record id under which the result was stored
     */
    String save(AnalysisResult result) throws IOException;
}
