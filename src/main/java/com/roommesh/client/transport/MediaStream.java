package com.roommesh.client.transport;

import java.util.List;

/**
 * Opaque handle on captured or received media.
 */
public interface MediaStream {

    String getId();

    List<String> getTrackIds();
}
