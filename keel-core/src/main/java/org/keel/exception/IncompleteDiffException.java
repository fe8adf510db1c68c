package org.keel.exception;

import lombok.Getter;

import java.util.List;

/**
 * One or more differs failed, so the change set misses part of the difference.
 */
@Getter
public class IncompleteDiffException extends KeelException {

    private final List<String> failedDiffers;

    public IncompleteDiffException(List<String> failedDiffers, List<String> warnings) {
        super("Refusing to act on an incomplete diff; failed differ(s) " + failedDiffers
                + (warnings.isEmpty() ? "" : ":\n  " + String.join("\n  ", warnings)));
        this.failedDiffers = List.copyOf(failedDiffers);
    }
}
