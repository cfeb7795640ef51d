package com.asl.search.merge;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.fusion")
public class FusionProperties {
    private int k = RankFusion.DEFAULT_K;
    private double beta = RankFusion.DEFAULT_BETA;

    public int getK() {
        return k;
    }

    public void setK(int k) {
        this.k = k;
    }

    public double getBeta() {
        return beta;
    }

    public void setBeta(double beta) {
        this.beta = beta;
    }
}
