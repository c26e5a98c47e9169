package com.aramcoach.core.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * BM25 tuning. Defaults are the usual Okapi values.
 */
@Component
@ConfigurationProperties(prefix = "aramcoach.ranker")
public class RankerProperties {

    /** Term-frequency saturation. */
    private double k1 = 1.2;

    /** Length normalization strength, 0 disables it. */
    private double b = 0.75;

    /** Number of snippets kept per run. */
    private int topK = 5;

    public double getK1() {
        return k1;
    }

    public void setK1(double k1) {
        this.k1 = k1;
    }

    public double getB() {
        return b;
    }

    public void setB(double b) {
        this.b = b;
    }

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }
}
