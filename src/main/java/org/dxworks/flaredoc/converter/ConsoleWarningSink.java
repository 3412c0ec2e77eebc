package org.dxworks.flaredoc.converter;

public class ConsoleWarningSink implements ConversionWarningSink {

    @Override
    public void warn(String documentLabel, String message) {
        synchronized (System.err) {
            System.err.println("  Warning [" + documentLabel + "]: " + message);
        }
    }
}
