package com.perfwatch.core.config;

import com.perfwatch.core.model.Severity;

import java.io.Serializable;
import java.util.List;

/**
 * Deviation ratios at which each alert severity is raised.
 *
 * @since 1.0.0
 */
public class AlertThresholds implements Serializable {

    private static final long serialVersionUID = 1L;

    private double info = 0.05;
    private double warning = 0.10;
    private double critical = 0.15;

    public AlertThresholds() {
    }

    public AlertThresholds(double info, double warning, double critical) {
        this.info = info;
        this.warning = warning;
        this.critical = critical;
    }

    /**
     * @param severity alert severity
     * @return the minimum deviation ratio for that severity
     */
    public double thresholdFor(Severity severity) {
        return switch (severity) {
            case INFO -> info;
            case WARNING -> warning;
            case CRITICAL -> critical;
        };
    }

    void validate(List<String> errors) {
        if (!(info > 0)) {
            errors.add("alertThresholds.info must be > 0, got: " + info);
        }
        if (warning < info) {
            errors.add("alertThresholds.warning must be >= info, got: " + warning);
        }
        if (critical < warning) {
            errors.add("alertThresholds.critical must be >= warning, got: " + critical);
        }
    }

    public double getInfo() {
        return info;
    }

    public void setInfo(double info) {
        this.info = info;
    }

    public double getWarning() {
        return warning;
    }

    public void setWarning(double warning) {
        this.warning = warning;
    }

    public double getCritical() {
        return critical;
    }

    public void setCritical(double critical) {
        this.critical = critical;
    }

    @Override
    public String toString() {
        return "AlertThresholds{info=" + info + ", warning=" + warning + ", critical=" + critical + '}';
    }
}
