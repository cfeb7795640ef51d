package com.asl.search.policy;

import java.util.List;

public class TeamFlags {
    private boolean forceZdr;
    private List<String> unblockedDomains = List.of();

    public static TeamFlags none() {
        return new TeamFlags();
    }

    public boolean isForceZdr() {
        return forceZdr;
    }

    public void setForceZdr(boolean forceZdr) {
        this.forceZdr = forceZdr;
    }

    public List<String> getUnblockedDomains() {
        return unblockedDomains;
    }

    public void setUnblockedDomains(List<String> unblockedDomains) {
        this.unblockedDomains = unblockedDomains == null ? List.of() : unblockedDomains;
    }
}
