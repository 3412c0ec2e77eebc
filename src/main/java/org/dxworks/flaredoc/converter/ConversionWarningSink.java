package org.dxworks.flaredoc.converter;

/**
 * Receives recoverable conversion problems. A warning never changes control flow:
 * the converter reports it and carries on with the next node.
 */
public interface ConversionWarningSink {

    void warn(String documentLabel, String message);
}
