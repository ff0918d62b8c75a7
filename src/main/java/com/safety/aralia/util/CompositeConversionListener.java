package com.safety.aralia.util;

import com.safety.aralia.api.ConversionListener;
import com.safety.aralia.api.ConversionWarning;

import java.util.Arrays;
import java.util.List;

/**
 * Aggregates multiple {@link ConversionListener} instances.
 */
public class CompositeConversionListener implements ConversionListener {
    private ConversionListener[] listeners = new ConversionListener[0];

    public CompositeConversionListener(ConversionListener... listeners) {
        for (ConversionListener l : listeners)
            addForComposite(l);
    }

    public void addForComposite(ConversionListener listener) {
        ConversionListener[] old = listeners;
        ConversionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    @Override
    public void onDeclarationsRead(String treeName, int lineCount) {
        for (ConversionListener l : listeners)
            l.onDeclarationsRead(treeName, lineCount);
    }

    @Override
    public void onWarning(ConversionWarning warning) {
        for (ConversionListener l : listeners)
            l.onWarning(warning);
    }

    @Override
    public void onTopGatesDetected(List<String> topGates) {
        for (ConversionListener l : listeners)
            l.onTopGatesDetected(topGates);
    }

    @Override
    public void onConversionEnd(String treeName, int gateCount) {
        for (ConversionListener l : listeners)
            l.onConversionEnd(treeName, gateCount);
    }
}
