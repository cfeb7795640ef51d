package com.asl.search.policy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.policy")
public class BlocklistProperties {
    private List<String> blockedDomains = new ArrayList<>();
    private Map<String, TeamFlags> teams = new LinkedHashMap<>();

    public List<String> getBlockedDomains() {
        return blockedDomains;
    }

    public void setBlockedDomains(List<String> blockedDomains) {
        this.blockedDomains = blockedDomains;
    }

    public Map<String, TeamFlags> getTeams() {
        return teams;
    }

    public void setTeams(Map<String, TeamFlags> teams) {
        this.teams = teams;
    }
}
