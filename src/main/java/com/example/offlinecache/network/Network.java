package com.example.offlinecache.network;

import com.example.offlinecache.core.NetRequest;
import com.example.offlinecache.core.NetResponse;
import com.example.offlinecache.core.NetworkException;

/**
 * The real network, seen as opaque request/response I/O.
 * Any HTTP status is a response; only failing to get one is a {@link NetworkException}.
 */
public interface Network {

    NetResponse fetch(NetRequest request) throws NetworkException;
}
