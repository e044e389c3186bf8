/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.enhance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.spatialenhance.data.FeatureMatrix;

/**
 *
 * Which features to predict: all of them if none are requested,
 * otherwise the requested ones that exist, in the matrix's own row order.
 * Requested names that don't exist are skipped (and counted), not an error.
 *
 */
public class FeatureSelector {

    private static final Logger logger = LogManager.getLogger(FeatureSelector.class);

    public static class FeatureSelection {
        final List<String> selected;
        final int numSkipped;
        final int numAvailable;

        FeatureSelection(List<String> selected, int numSkipped, int numAvailable) {
            this.selected = Collections.unmodifiableList(selected);
            this.numSkipped = numSkipped;
            this.numAvailable = numAvailable;
        }

        public List<String> getSelected() {
            return selected;
        }

        public int getNumSkipped() {
            return numSkipped;
        }

        public int getNumAvailable() {
            return numAvailable;
        }

        public boolean isPartial(){
            return selected.size() < numAvailable;
        }
    }


    /**
     * @param requested feature names to predict; null or empty for all
     */
    public static FeatureSelection select(List<String> requested, FeatureMatrix features){
        List<String> available = features.getRowNames();

        if(requested==null || requested.isEmpty())
            return new FeatureSelection(new ArrayList<>(available), 0, available.size());

        LinkedHashSet<String> requestSet = new LinkedHashSet<>(requested);
        ArrayList<String> selected = new ArrayList<>();
        for(String name : available){
            if(requestSet.contains(name))
                selected.add(name);
        }

        int numSkipped = requestSet.size() - selected.size();
        if(numSkipped>0)
            logger.info("Skipping {} features not in reference data", numSkipped);
        if(selected.isEmpty())
            logger.warn("None of the {} requested features are in the reference data", requestSet.size());

        return new FeatureSelection(selected, numSkipped, available.size());
    }
}
