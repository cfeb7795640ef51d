package com.asl.search.policy;

public interface UrlBlocklist {
    boolean isBlocked(String url, TeamFlags flags);
}
