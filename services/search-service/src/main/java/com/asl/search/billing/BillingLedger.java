package com.asl.search.billing;

public interface BillingLedger {
    void billTeam(String teamId, Long apiKeyId, int credits);
}
