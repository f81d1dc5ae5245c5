package com.agentstudio.observability.failure;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A written failure bundle.
 *
 * @param bundleId   unique bundle id
 * @param bundlePath absolute path of the bundle file
 */
public record FailureBundleResult(
        @JsonProperty("bundle_id") String bundleId,
        @JsonProperty("bundle_path") String bundlePath) {
}
