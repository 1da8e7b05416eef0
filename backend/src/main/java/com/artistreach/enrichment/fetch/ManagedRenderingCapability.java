package com.artistreach.enrichment.fetch;

import java.util.List;

/**
 * Remote rendering jobs used when a direct fetch is blocked or too thin. A job is started, polled
 * until it finishes and then read back; the whole cycle is bounded by a hard ceiling.
 */
public interface ManagedRenderingCapability {
    boolean isAvailable();

    /**
     * @throws RenderingException when the job cannot be started, fails, or exceeds the ceiling
     */
    List<RenderedPage> render(RenderRequest request);
}
