package com.procurement.config;

import com.procurement.stats.DeviationMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.math.BigDecimal;

/**
 * Strongly-typed binding for all {@code procurement.*} properties.
 *
 * <pre>
 * procurement:
 *   gate:
 *     reject-reason: FAILED DATA QUALITY RULES
 *     detailed-reject-reasons: false
 *   normalization:
 *     preserve-manual-overrides: true
 *   statistics:
 *     deviation: POPULATION
 *   fact:
 *     outlier-deviations: 2
 *     contract-min-vendor-score: 75
 *     ...
 *   pipeline:
 *     parallel-stages: true
 * </pre>
 *
 * Defaults reproduce the legacy warehouse rules, so a missing block is safe.
 */
@ConfigurationProperties(prefix = "procurement")
public class ProcurementProperties {

    @NestedConfigurationProperty
    private Gate gate = new Gate();

    @NestedConfigurationProperty
    private Normalization normalization = new Normalization();

    @NestedConfigurationProperty
    private Statistics statistics = new Statistics();

    @NestedConfigurationProperty
    private Fact fact = new Fact();

    @NestedConfigurationProperty
    private Pipeline pipeline = new Pipeline();

    public Gate getGate() {
        return gate;
    }

    public void setGate(Gate gate) {
        this.gate = gate;
    }

    public Normalization getNormalization() {
        return normalization;
    }

    public void setNormalization(Normalization normalization) {
        this.normalization = normalization;
    }

    public Statistics getStatistics() {
        return statistics;
    }

    public void setStatistics(Statistics statistics) {
        this.statistics = statistics;
    }

    public Fact getFact() {
        return fact;
    }

    public void setFact(Fact fact) {
        this.fact = fact;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    // ------------------------------------------------------------------ //

    public static class Gate {

        private String rejectReason = "FAILED DATA QUALITY RULES";

        /** Append the names of the failed rules to the reject reason. */
        private boolean detailedRejectReasons = false;

        public String getRejectReason() {
            return rejectReason;
        }

        public void setRejectReason(String rejectReason) {
            this.rejectReason = rejectReason;
        }

        public boolean isDetailedRejectReasons() {
            return detailedRejectReasons;
        }

        public void setDetailedRejectReasons(boolean detailedRejectReasons) {
            this.detailedRejectReasons = detailedRejectReasons;
        }
    }

    public static class Normalization {

        /** When false the map is truncated and rebuilt on every run, curated overrides included. */
        private boolean preserveManualOverrides = true;

        public boolean isPreserveManualOverrides() {
            return preserveManualOverrides;
        }

        public void setPreserveManualOverrides(boolean preserveManualOverrides) {
            this.preserveManualOverrides = preserveManualOverrides;
        }
    }

    public static class Statistics {

        private DeviationMode deviation = DeviationMode.POPULATION;

        public DeviationMode getDeviation() {
            return deviation;
        }

        public void setDeviation(DeviationMode deviation) {
            this.deviation = deviation;
        }
    }

    public static class Fact {

        private BigDecimal outlierDeviations = BigDecimal.valueOf(2);
        private int contractMinVendorScore = 75;
        private int contractMinQualityScore = 7;
        private int highRiskVendorScoreBelow = 50;
        private int highRiskQualityScoreBelow = 5;
        private int mediumRiskVendorScoreMin = 50;
        private int mediumRiskVendorScoreMax = 70;

        public BigDecimal getOutlierDeviations() {
            return outlierDeviations;
        }

        public void setOutlierDeviations(BigDecimal outlierDeviations) {
            this.outlierDeviations = outlierDeviations;
        }

        public int getContractMinVendorScore() {
            return contractMinVendorScore;
        }

        public void setContractMinVendorScore(int contractMinVendorScore) {
            this.contractMinVendorScore = contractMinVendorScore;
        }

        public int getContractMinQualityScore() {
            return contractMinQualityScore;
        }

        public void setContractMinQualityScore(int contractMinQualityScore) {
            this.contractMinQualityScore = contractMinQualityScore;
        }

        public int getHighRiskVendorScoreBelow() {
            return highRiskVendorScoreBelow;
        }

        public void setHighRiskVendorScoreBelow(int highRiskVendorScoreBelow) {
            this.highRiskVendorScoreBelow = highRiskVendorScoreBelow;
        }

        public int getHighRiskQualityScoreBelow() {
            return highRiskQualityScoreBelow;
        }

        public void setHighRiskQualityScoreBelow(int highRiskQualityScoreBelow) {
            this.highRiskQualityScoreBelow = highRiskQualityScoreBelow;
        }

        public int getMediumRiskVendorScoreMin() {
            return mediumRiskVendorScoreMin;
        }

        public void setMediumRiskVendorScoreMin(int mediumRiskVendorScoreMin) {
            this.mediumRiskVendorScoreMin = mediumRiskVendorScoreMin;
        }

        public int getMediumRiskVendorScoreMax() {
            return mediumRiskVendorScoreMax;
        }

        public void setMediumRiskVendorScoreMax(int mediumRiskVendorScoreMax) {
            this.mediumRiskVendorScoreMax = mediumRiskVendorScoreMax;
        }
    }

    public static class Pipeline {

        /** Run vendor normalization and the quality gate concurrently. */
        private boolean parallelStages = true;

        public boolean isParallelStages() {
            return parallelStages;
        }

        public void setParallelStages(boolean parallelStages) {
            this.parallelStages = parallelStages;
        }
    }
}
