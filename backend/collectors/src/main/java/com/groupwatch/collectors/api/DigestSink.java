package com.groupwatch.collectors.api;

import com.groupwatch.core.digest.Digest;

@FunctionalInterface
public interface DigestSink {
    void publish(Digest digest);
}
