package com.safety.aralia.util;

import com.safety.aralia.api.ConversionListener;
import com.safety.aralia.api.ConversionWarning;

import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Default {@link ConversionListener}: reports warnings at WARN and phase
 * progress at DEBUG through Log4j 2.
 */
@Log4j2
public class LoggingConversionListener implements ConversionListener {

    @Override
    public void onDeclarationsRead(String treeName, int lineCount) {
        log.debug("Read fault tree {} from {} lines", treeName, lineCount);
    }

    @Override
    public void onWarning(ConversionWarning warning) {
        log.warn(warning.message());
    }

    @Override
    public void onTopGatesDetected(List<String> topGates) {
        log.debug("Top gates: {}", topGates);
    }

    @Override
    public void onConversionEnd(String treeName, int gateCount) {
        log.info("Converted fault tree {} ({} gates)", treeName, gateCount);
    }
}
