/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.enhance;

import cern.colt.matrix.DoubleFactory2D;
import cern.colt.matrix.DoubleMatrix2D;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.spatialenhance.data.FeatureMatrix;

/**
 *
 * Runs an independent fit/predict for each feature and assembles the results
 *
 * Each feature's fit only produces its own row and its own diagnostic,
 * so the features can be fit on several threads without any shared state.
 * The calling thread's interrupt flag is checked between features.
 *
 */
public class PerFeatureFitter {

    private static final Logger logger = LogManager.getLogger(PerFeatureFitter.class);

    public static class FeatureFit {
        final String featureName;
        final double[] prediction;//over the enhanced samples
        final double diagnostic;

        public FeatureFit(String featureName, double[] prediction, double diagnostic) {
            this.featureName = featureName;
            this.prediction = prediction;
            this.diagnostic = diagnostic;
        }
    }

    public interface SingleFeatureFit {
        FeatureFit fit(String featureName);
    }


    private final int numThreads;

    public PerFeatureFitter(int numThreads){
        if(numThreads<1)
            throw new IllegalArgumentException("ERROR: need at least one thread, got "+numThreads);
        this.numThreads = numThreads;
    }


    /**
     * Fit every feature, then assemble a featureNames x enhSampleIds prediction matrix
     * with one diagnostic of the given kind per feature
     */
    public EnhancedFeatures fitAll(List<String> featureNames, List<String> enhSampleIds,
            FitDiagnostics.Kind diagKind, SingleFeatureFit fitter){

        long startTime = System.currentTimeMillis();
        List<FeatureFit> fits;
        if(numThreads==1 || featureNames.size()<2)
            fits = fitSerial(featureNames, fitter);
        else
            fits = fitParallel(featureNames, fitter);

        DoubleMatrix2D pred = DoubleFactory2D.dense.make(featureNames.size(), enhSampleIds.size());
        LinkedHashMap<String,Double> diagnostics = new LinkedHashMap<>();
        for(int f=0; f<fits.size(); f++){
            FeatureFit fit = fits.get(f);
            if(fit.prediction.length!=enhSampleIds.size()){
                throw new IllegalStateException("ERROR: got "+fit.prediction.length+" predictions for "
                        +fit.featureName+", expected "+enhSampleIds.size());
            }
            for(int s=0; s<fit.prediction.length; s++)
                pred.setQuick(f, s, fit.prediction[s]);
            diagnostics.put(fit.featureName, fit.diagnostic);
            logger.debug("{} {}: {}", fit.featureName, diagKind, fit.diagnostic);
        }

        logger.info("Fit {} features in {} ms", featureNames.size(), System.currentTimeMillis()-startTime);
        return new EnhancedFeatures(new FeatureMatrix(pred, featureNames, enhSampleIds),
                new FitDiagnostics(diagKind, diagnostics));
    }


    private static List<FeatureFit> fitSerial(List<String> featureNames, SingleFeatureFit fitter){
        ArrayList<FeatureFit> ans = new ArrayList<>();
        for(String feature : featureNames){
            checkInterrupted();
            ans.add(fitter.fit(feature));
        }
        return ans;
    }


    private List<FeatureFit> fitParallel(List<String> featureNames, SingleFeatureFit fitter){
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(numThreads, featureNames.size()));
        try {
            ArrayList<Future<FeatureFit>> futures = new ArrayList<>();
            for(String feature : featureNames){
                futures.add(executor.submit(() -> {
                    checkInterrupted();
                    return fitter.fit(feature);
                }));
            }

            ArrayList<FeatureFit> ans = new ArrayList<>();
            for(Future<FeatureFit> future : futures)
                ans.add(future.get());
            return ans;
        }
        catch(InterruptedException e){
            Thread.currentThread().interrupt();
            throw new CancellationException("Feature fitting interrupted");
        }
        catch(ExecutionException e){
            Throwable cause = e.getCause();
            if(cause instanceof RuntimeException)
                throw (RuntimeException)cause;
            if(cause instanceof Error)
                throw (Error)cause;
            throw new RuntimeException("ERROR: feature fit failed", cause);
        }
        finally {
            executor.shutdownNow();
        }
    }


    private static void checkInterrupted(){
        if(Thread.currentThread().isInterrupted())
            throw new CancellationException("Feature fitting interrupted");
    }
}
