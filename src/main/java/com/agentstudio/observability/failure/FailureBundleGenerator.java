package com.agentstudio.observability.failure;

import java.io.IOException;

/**
 * Collects the evidence around a detected failure into a self-contained bundle.
 *
 * @author Agent Studio 2025-2026
 */
public interface FailureBundleGenerator {

    /**
     * Generates a bundle.
     *
     * @param request what failed and where its logs live
     * @return the bundle id and location
     * @throws IOException if the bundle cannot be written
     */
    FailureBundleResult generate(FailureBundleRequest request) throws IOException;
}
