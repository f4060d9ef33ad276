package de.mirkosertic.docmerge.cleaning;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Settings of a cleaning pass. Every step can be switched off individually.
 */
public class CleaningConfig {

    // Duplicate handling
    private boolean removeDuplicates = true;
    private @Nullable List<String> duplicateSubset;
    private KeepPolicy keepDuplicate = KeepPolicy.FIRST;

    // Null handling
    private boolean handleNulls = true;
    private double nullThreshold = 0.5;
    private FillStrategy fillStrategy = FillStrategy.MEAN;

    // Type inference
    private boolean inferTypes = true;
    private boolean parseDates = true;

    private boolean normalizeNames = true;

    // Outlier detection
    private boolean detectOutliers = false;
    private OutlierMethod outlierMethod = OutlierMethod.IQR;
    private double zScoreThreshold = 3.0;

    public CleaningConfig() {
    }

    public CleaningConfig(final CleaningConfig other) {
        this.removeDuplicates = other.removeDuplicates;
        this.duplicateSubset = other.duplicateSubset;
        this.keepDuplicate = other.keepDuplicate;
        this.handleNulls = other.handleNulls;
        this.nullThreshold = other.nullThreshold;
        this.fillStrategy = other.fillStrategy;
        this.inferTypes = other.inferTypes;
        this.parseDates = other.parseDates;
        this.normalizeNames = other.normalizeNames;
        this.detectOutliers = other.detectOutliers;
        this.outlierMethod = other.outlierMethod;
        this.zScoreThreshold = other.zScoreThreshold;
    }

    public boolean isRemoveDuplicates() {
        return removeDuplicates;
    }

    public void setRemoveDuplicates(final boolean removeDuplicates) {
        this.removeDuplicates = removeDuplicates;
    }

    /**
     * Columns compared when looking for duplicates, or null to compare whole rows.
     */
    public @Nullable List<String> getDuplicateSubset() {
        return duplicateSubset;
    }

    public void setDuplicateSubset(final @Nullable List<String> duplicateSubset) {
        this.duplicateSubset = duplicateSubset == null ? null : List.copyOf(duplicateSubset);
    }

    public KeepPolicy getKeepDuplicate() {
        return keepDuplicate;
    }

    public void setKeepDuplicate(final KeepPolicy keepDuplicate) {
        this.keepDuplicate = keepDuplicate;
    }

    public boolean isHandleNulls() {
        return handleNulls;
    }

    public void setHandleNulls(final boolean handleNulls) {
        this.handleNulls = handleNulls;
    }

    /**
     * Columns with a larger fraction of missing values are dropped.
     */
    public double getNullThreshold() {
        return nullThreshold;
    }

    public void setNullThreshold(final double nullThreshold) {
        if (nullThreshold < 0.0 || nullThreshold > 1.0) {
            throw new IllegalArgumentException("Null threshold must be between 0 and 1, got " + nullThreshold);
        }
        this.nullThreshold = nullThreshold;
    }

    public FillStrategy getFillStrategy() {
        return fillStrategy;
    }

    public void setFillStrategy(final FillStrategy fillStrategy) {
        this.fillStrategy = fillStrategy;
    }

    public boolean isInferTypes() {
        return inferTypes;
    }

    public void setInferTypes(final boolean inferTypes) {
        this.inferTypes = inferTypes;
    }

    public boolean isParseDates() {
        return parseDates;
    }

    public void setParseDates(final boolean parseDates) {
        this.parseDates = parseDates;
    }

    public boolean isNormalizeNames() {
        return normalizeNames;
    }

    public void setNormalizeNames(final boolean normalizeNames) {
        this.normalizeNames = normalizeNames;
    }

    public boolean isDetectOutliers() {
        return detectOutliers;
    }

    public void setDetectOutliers(final boolean detectOutliers) {
        this.detectOutliers = detectOutliers;
    }

    public OutlierMethod getOutlierMethod() {
        return outlierMethod;
    }

    public void setOutlierMethod(final OutlierMethod outlierMethod) {
        this.outlierMethod = outlierMethod;
    }

    public double getZScoreThreshold() {
        return zScoreThreshold;
    }

    public void setZScoreThreshold(final double zScoreThreshold) {
        this.zScoreThreshold = zScoreThreshold;
    }

    @Override
    public String toString() {
        return "CleaningConfig{removeDuplicates=" + removeDuplicates
                + ", duplicateSubset=" + duplicateSubset
                + ", keepDuplicate=" + keepDuplicate
                + ", handleNulls=" + handleNulls
                + ", nullThreshold=" + nullThreshold
                + ", fillStrategy=" + fillStrategy
                + ", inferTypes=" + inferTypes
                + ", parseDates=" + parseDates
                + ", normalizeNames=" + normalizeNames
                + ", detectOutliers=" + detectOutliers
                + ", outlierMethod=" + outlierMethod
                + ", zScoreThreshold=" + zScoreThreshold
                + "}";
    }
}
