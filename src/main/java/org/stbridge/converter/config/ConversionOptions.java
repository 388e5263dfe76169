package org.stbridge.converter.config;

import lombok.Builder;

/**
 * Per-call switches for a conversion.
 *
 * @param skipValidation   skip the source version check
 * @param preserveOriginal convert a deep copy and leave the input untouched
 * @param warnDataLoss     tally what a downgrade drops before converting
 */
@Builder
public record ConversionOptions(Boolean skipValidation, Boolean preserveOriginal, Boolean warnDataLoss) {

    public ConversionOptions {
        if (skipValidation == null) {
            skipValidation = false;
        }
        if (preserveOriginal == null) {
            preserveOriginal = true;
        }
        if (warnDataLoss == null) {
            warnDataLoss = true;
        }
    }

    public static ConversionOptions defaults() {
        return ConversionOptions.builder().build();
    }
}
