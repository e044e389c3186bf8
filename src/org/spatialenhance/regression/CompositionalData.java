/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.regression;

import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.spatialenhance.data.FeatureMatrix;

/**
 *
 * Turns features x samples values into samples x components compositions for Dirichlet regression
 * Each sample is normalized to sum to 1.  If any component is exactly 0 or 1
 * (where the Dirichlet density is degenerate), all compositions are shrunk toward the center:
 * y' = (y*(n-1) + 1/C) / n   (n samples, C components)
 *
 */
public class CompositionalData {

    private static final Logger logger = LogManager.getLogger(CompositionalData.class);


    public static double[][] prepare(FeatureMatrix features, List<String> componentNames){
        int numComp = componentNames.size();
        int numSamp = features.numSamples();
        if(numComp<2)
            throw new IllegalArgumentException("ERROR: compositions need at least 2 components, got "+numComp);
        if(numSamp<1)
            throw new IllegalArgumentException("ERROR: no samples to build compositions from");

        double comps[][] = new double[numSamp][numComp];
        for(int c=0; c<numComp; c++){
            double row[] = features.getRow(componentNames.get(c));
            for(int s=0; s<numSamp; s++){
                if(row[s]<0 || Double.isNaN(row[s]) || Double.isInfinite(row[s])){
                    throw new IllegalArgumentException("ERROR: compositional feature "+componentNames.get(c)
                            +" has invalid value "+row[s]+" (need finite, nonnegative values)");
                }
                comps[s][c] = row[s];
            }
        }

        boolean normalized = false;
        boolean onBoundary = false;
        for(int s=0; s<numSamp; s++){
            double sum = 0;
            for(int c=0; c<numComp; c++)
                sum += comps[s][c];
            if(sum<=0)
                throw new IllegalArgumentException("ERROR: sample "+s+" has all-zero composition");
            if(Math.abs(sum-1)>1e-10)
                normalized = true;
            for(int c=0; c<numComp; c++){
                comps[s][c] /= sum;
                if(comps[s][c]==0 || comps[s][c]==1)
                    onBoundary = true;
            }
        }

        if(normalized)
            logger.info("Normalized {} compositional features to sum to 1 in each sample", numComp);

        if(onBoundary){
            logger.info("Compositions contain 0 or 1; shrinking all compositions away from the boundary");
            for(int s=0; s<numSamp; s++){
                for(int c=0; c<numComp; c++)
                    comps[s][c] = (comps[s][c]*(numSamp-1) + 1./numComp) / numSamp;
            }
        }

        return comps;
    }
}
