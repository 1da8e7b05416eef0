package com.artistreach.enrichment.step;

final class StepPacing {
    private StepPacing() {}

    static void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted between page fetches", e);
        }
    }
}
