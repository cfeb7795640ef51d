package com.asl.search.service;

public class ZeroDataRetentionUnsupportedException extends RuntimeException {
    public ZeroDataRetentionUnsupportedException(String teamId) {
        super("Search is not supported for zero data retention teams (team_id=" + teamId + ")");
    }
}
