package com.lucidreview.api;

public record CancelRunResponse(
        String status,
        String message
) {
    public static CancelRunResponse success() {
        return new CancelRunResponse("success", "Run cancellation requested.");
    }

    public static CancelRunResponse notCancellable() {
        return new CancelRunResponse("not-cancellable", "Run not found or already finished.");
    }
}
