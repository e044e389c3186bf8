/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.enhance;

import java.util.Arrays;

/**
 *
 * Models available for predicting enhanced features
 *
 */
public enum EnhancementModel {

    XGBOOST("xgboost"),//gradient-boosted trees, one ensemble per feature
    DIRICHLET("dirichlet"),//one joint Dirichlet regression of the features as compositions
    LM("lm");//ordinary linear regression, one per feature

    private final String modelName;

    EnhancementModel(String modelName){
        this.modelName = modelName;
    }

    public String getModelName(){
        return modelName;
    }

    public static EnhancementModel fromName(String name){
        for(EnhancementModel model : values()){
            if(model.modelName.equalsIgnoreCase(name))
                return model;
        }
        throw new IllegalArgumentException("ERROR: unknown enhancement model "+name
                +" (options: "+Arrays.toString(values())+")");
    }

    @Override
    public String toString(){
        return modelName;
    }
}
