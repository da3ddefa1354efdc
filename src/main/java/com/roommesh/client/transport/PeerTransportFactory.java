package com.roommesh.client.transport;

public interface PeerTransportFactory {

    PeerTransport create(String remoteId, PeerTransport.Observer observer);
}
