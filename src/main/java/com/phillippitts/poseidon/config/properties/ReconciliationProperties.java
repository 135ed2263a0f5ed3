package com.phillippitts.poseidon.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Scoring weights and backend selection for forecast reconciliation.
 *
 * <p>Example application.properties:
 * <pre>
 * poseidon.reconciliation.field-weight=20
 * poseidon.reconciliation.tide-weight=20
 * poseidon.reconciliation.typical-bonus=10
 * poseidon.reconciliation.typical-max-wave-height=5.0
 * poseidon.reconciliation.typical-max-wave-period=20.0
 * poseidon.reconciliation.ocr-mode=FALLBACK
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "poseidon.reconciliation")
public class ReconciliationProperties {

    /**
     * When the optical text backend takes part in a reconciliation.
     */
    public enum OcrMode {
        /** Only when the vision model backend is unavailable. */
        FALLBACK,
        /** Always, alongside every other backend. */
        ALWAYS
    }

    /** Points per populated, valid wave height / wave period / wind speed field. */
    @Min(0)
    private final int fieldWeight;

    /** Points when tide extremes contain at least one high and one low. */
    @Min(0)
    private final int tideWeight;

    /** Points per field whose maximum lies in the typical sub-range. */
    @Min(0)
    private final int typicalBonus;

    private final double typicalMaxWaveHeight;

    private final double typicalMaxWavePeriod;

    @NotNull
    private final OcrMode ocrMode;

    @ConstructorBinding
    public ReconciliationProperties(Integer fieldWeight, Integer tideWeight, Integer typicalBonus,
                                    Double typicalMaxWaveHeight, Double typicalMaxWavePeriod,
                                    OcrMode ocrMode) {
        this.fieldWeight = fieldWeight == null ? 20 : fieldWeight;
        this.tideWeight = tideWeight == null ? 20 : tideWeight;
        this.typicalBonus = typicalBonus == null ? 10 : typicalBonus;
        this.typicalMaxWaveHeight = typicalMaxWaveHeight == null ? 5.0 : typicalMaxWaveHeight;
        this.typicalMaxWavePeriod = typicalMaxWavePeriod == null ? 20.0 : typicalMaxWavePeriod;
        this.ocrMode = ocrMode == null ? OcrMode.FALLBACK : ocrMode;
        if (this.fieldWeight < 0 || this.tideWeight < 0 || this.typicalBonus < 0) {
            throw new IllegalArgumentException("poseidon.reconciliation weights must not be negative");
        }
    }

    // Defaults for tests and manual instantiation
    public static ReconciliationProperties defaults() {
        return new ReconciliationProperties(null, null, null, null, null, null);
    }

    public static ReconciliationProperties withOcrMode(OcrMode ocrMode) {
        return new ReconciliationProperties(null, null, null, null, null, ocrMode);
    }

    public int getFieldWeight() {
        return fieldWeight;
    }

    public int getTideWeight() {
        return tideWeight;
    }

    public int getTypicalBonus() {
        return typicalBonus;
    }

    public double getTypicalMaxWaveHeight() {
        return typicalMaxWaveHeight;
    }

    public double getTypicalMaxWavePeriod() {
        return typicalMaxWavePeriod;
    }

    public OcrMode getOcrMode() {
        return ocrMode;
    }
}
