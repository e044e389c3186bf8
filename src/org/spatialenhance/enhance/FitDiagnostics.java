/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.enhance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 *
 * One quality number per predicted feature.  What the number means depends on the model.
 * Not used for control flow, just reported alongside the predictions.
 *
 */
public class FitDiagnostics {

    public enum Kind {
        R_SQUARED,//coefficient of determination of a linear fit (not clamped to [0,1])
        TRAIN_RMSE,//training root-mean-square error after the last boosting round
        NONE//model doesn't report per-feature diagnostics
    }

    private final Kind kind;
    private final LinkedHashMap<String,Double> values;


    public FitDiagnostics(Kind kind, Map<String,Double> values){
        this.kind = kind;
        this.values = new LinkedHashMap<>(values);
        if(kind==Kind.NONE && !values.isEmpty())
            throw new IllegalArgumentException("ERROR: diagnostics of kind NONE can't have values");
    }

    public static FitDiagnostics none(){
        return new FitDiagnostics(Kind.NONE, Collections.emptyMap());
    }


    public Kind getKind(){
        return kind;
    }

    public boolean isEmpty(){
        return values.isEmpty();
    }

    public int size(){
        return values.size();
    }

    public Double get(String featureName){
        return values.get(featureName);
    }

    public Map<String,Double> asMap(){
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString(){
        return "FitDiagnostics["+kind+", "+values.size()+" features]";
    }
}
