package com.fvr.recommendation.ratelimit;

public interface RateLimiter {
    boolean allow(String key);
}
