/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.regression;

import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.spatialenhance.data.EmbeddingTable;

/**
 *
 * Ordinary least squares fit of one response on the terms of a formula, with intercept
 *
 */
public class LinearFit {

    private final ModelFormula formula;
    private final double[] coeffs;//intercept, then one per term
    private final double rSquared;
    private final double[] fittedVals;


    private LinearFit(ModelFormula formula, double[] coeffs, double rSquared, double[] fittedVals){
        this.formula = formula;
        this.coeffs = coeffs;
        this.rSquared = rSquared;
        this.fittedVals = fittedVals;
    }


    public static LinearFit fit(ModelFormula formula, EmbeddingTable data, double[] response){
        if(response.length!=data.numRows())
            throw new IllegalArgumentException("ERROR: "+response.length+" response values for "+data.numRows()+" samples");

        double x[][] = formula.designMatrix(data);
        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.newSampleData(response, x);

        try {
            double coeffs[] = ols.estimateRegressionParameters();
            double rSquared = ols.calculateRSquared();//may be NaN (constant response) or negative: reported as is

            double resid[] = ols.estimateResiduals();
            double fitted[] = new double[response.length];
            for(int s=0; s<fitted.length; s++)
                fitted[s] = response[s] - resid[s];

            return new LinearFit(formula, coeffs, rSquared, fitted);
        }
        catch(SingularMatrixException e){
            throw new IllegalArgumentException("ERROR: design matrix for "+formula+" is rank-deficient", e);
        }
    }


    public double[] predict(EmbeddingTable newData){
        double x[][] = formula.designMatrix(newData);
        double ans[] = new double[x.length];
        for(int s=0; s<x.length; s++){
            double val = coeffs[0];
            for(int t=0; t<x[s].length; t++)
                val += coeffs[t+1]*x[s][t];
            ans[s] = val;
        }
        return ans;
    }

    public double getRSquared(){
        return rSquared;
    }

    public double[] getCoeffs(){
        return coeffs.clone();
    }

    public double[] getFittedValues(){
        return fittedVals.clone();
    }

    public ModelFormula getFormula(){
        return formula;
    }
}
