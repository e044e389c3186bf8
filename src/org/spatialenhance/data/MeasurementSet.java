/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 *
 * A set of named measurements (feature matrices) over one common set of samples,
 * e.g. counts and logcounts of the same spots.  Immutable; with* methods return copies.
 *
 */
public class MeasurementSet {

    private final LinkedHashMap<String,FeatureMatrix> measurements;


    public MeasurementSet(){
        measurements = new LinkedHashMap<>();
    }

    public MeasurementSet(String name, FeatureMatrix matrix){
        this();
        measurements.put(name, matrix);
    }

    private MeasurementSet(LinkedHashMap<String,FeatureMatrix> measurements){
        this.measurements = measurements;
    }


    public FeatureMatrix getMeasurement(String name){
        FeatureMatrix ans = measurements.get(name);
        if(ans==null)
            throw new IllegalArgumentException("ERROR: no measurement named "+name+" (have "+measurements.keySet()+")");
        return ans;
    }

    /**
     * Number of samples shared by the measurements, or -1 if there are none yet
     */
    public int numSamples(){
        if(measurements.isEmpty())
            return -1;
        return measurements.values().iterator().next().numSamples();
    }

    public MeasurementSet withMeasurement(String name, FeatureMatrix matrix){
        for(Map.Entry<String,FeatureMatrix> other : measurements.entrySet()){
            if( (!other.getKey().equals(name)) && other.getValue().numSamples()!=matrix.numSamples() ){
                throw new IllegalArgumentException("ERROR: measurement "+name+" has "+matrix.numSamples()
                        +" samples but "+other.getKey()+" has "+other.getValue().numSamples());
            }
        }
        LinkedHashMap<String,FeatureMatrix> copy = new LinkedHashMap<>(measurements);
        copy.put(name, matrix);
        return new MeasurementSet(copy);
    }
}
