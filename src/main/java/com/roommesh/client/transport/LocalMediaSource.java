package com.roommesh.client.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Camera and microphone capture. A failed acquisition completes the future with a
 * {@link MediaAcquisitionException}.
 */
public interface LocalMediaSource {

    CompletableFuture<MediaStream> acquire();
}
