/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.regression;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunctionGradient;
import org.apache.commons.math3.optim.nonlinear.scalar.gradient.NonLinearConjugateGradientOptimizer;
import org.apache.commons.math3.special.Gamma;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 *
 * Dirichlet regression, common parametrization:
 * composition y_i ~ Dirichlet(alpha_i1...alpha_iC), log(alpha_ij) = beta_j0 + sum_k beta_jk x_ik
 * Fit by maximum likelihood (nonlinear conjugate gradient on the log-likelihood).
 * Predictions are expected compositions alpha_ij / sum_j alpha_ij, so they always lie on the simplex.
 *
 * Predictors are standardized internally; with an intercept per component this
 * reparametrizes the model without changing its fitted values.
 *
 */
public class DirichletRegression {

    private static final Logger logger = LogManager.getLogger(DirichletRegression.class);

    static final double ETA_LIMIT = 30;//linear predictors are clamped to +/- this before exponentiating
    static final int DEFAULT_MAX_ITER = 2000;

    private final int numComp;
    private final double[] predMeans, predScales;
    private final double[][] beta;//[component][0 = intercept, then one per predictor], in standardized units
    private final double logLikelihood;
    private final int numIter;


    private DirichletRegression(double[] predMeans, double[] predScales, double[][] beta, double logLikelihood, int numIter){
        this.predMeans = predMeans;
        this.predScales = predScales;
        this.beta = beta;
        this.logLikelihood = logLikelihood;
        this.numIter = numIter;
        numComp = beta.length;
    }


    public static DirichletRegression fit(double[][] x, double[][] y){
        return fit(x, y, DEFAULT_MAX_ITER);
    }

    /**
     * @param x samples x predictors
     * @param y samples x components, each row strictly inside the simplex
     */
    public static DirichletRegression fit(double[][] x, double[][] y, int maxIter){
        int numSamp = x.length;
        if(y.length!=numSamp)
            throw new IllegalArgumentException("ERROR: "+y.length+" compositions for "+numSamp+" samples");
        if(numSamp==0)
            throw new IllegalArgumentException("ERROR: no samples for Dirichlet regression");

        int numPred = x[0].length;
        int numComp = y[0].length;

        double means[] = new double[numPred];
        double scales[] = new double[numPred];
        for(int k=0; k<numPred; k++){
            for(int s=0; s<numSamp; s++)
                means[k] += x[s][k];
            means[k] /= numSamp;
            double ss = 0;
            for(int s=0; s<numSamp; s++)
                ss += (x[s][k]-means[k]) * (x[s][k]-means[k]);
            double sd = Math.sqrt(ss/numSamp);
            scales[k] = (sd>0) ? sd : 1;//constant predictor: just center it
        }

        double z[][] = standardize(x, means, scales);
        double logY[][] = new double[numSamp][numComp];
        for(int s=0; s<numSamp; s++){
            for(int j=0; j<numComp; j++){
                if( !(y[s][j]>0 && y[s][j]<1) )
                    throw new IllegalArgumentException("ERROR: composition value "+y[s][j]+" not strictly between 0 and 1");
                logY[s][j] = Math.log(y[s][j]);
            }
        }

        LogLikelihood ll = new LogLikelihood(z, logY, numComp);

        long startTime = System.currentTimeMillis();
        NonLinearConjugateGradientOptimizer optimizer = new NonLinearConjugateGradientOptimizer(
                NonLinearConjugateGradientOptimizer.Formula.POLAK_RIBIERE,
                new SimpleValueChecker(1e-10, 1e-10, maxIter));//counts as converged once maxIter is reached

        PointValuePair opt = optimizer.optimize(
                new MaxEval(Integer.MAX_VALUE),
                new MaxIter(maxIter+1),
                new ObjectiveFunction(ll),
                new ObjectiveFunctionGradient(ll.gradient()),
                GoalType.MAXIMIZE,
                new InitialGuess(new double[numComp*(numPred+1)]));//all alpha = 1

        double params[] = opt.getPoint();
        double beta[][] = new double[numComp][numPred+1];
        for(int j=0; j<numComp; j++)
            System.arraycopy(params, j*(numPred+1), beta[j], 0, numPred+1);

        logger.info("Dirichlet regression: {} components, {} predictors, log-likelihood {} after {} iterations ({} ms)",
                numComp, numPred, opt.getValue(), optimizer.getIterations(), System.currentTimeMillis()-startTime);

        return new DirichletRegression(means, scales, beta, opt.getValue(), optimizer.getIterations());
    }


    /**
     * Expected compositions, samples x components
     */
    public double[][] predict(double[][] x){
        double z[][] = standardize(x, predMeans, predScales);
        double ans[][] = new double[z.length][numComp];
        for(int s=0; s<z.length; s++){
            double eta[] = new double[numComp];
            double maxEta = Double.NEGATIVE_INFINITY;
            for(int j=0; j<numComp; j++){
                eta[j] = linearPredictor(beta[j], z[s]);
                maxEta = Math.max(maxEta, eta[j]);
            }
            double sum = 0;
            for(int j=0; j<numComp; j++){
                ans[s][j] = Math.exp(eta[j]-maxEta);
                sum += ans[s][j];
            }
            for(int j=0; j<numComp; j++)
                ans[s][j] /= sum;
        }
        return ans;
    }

    public double getLogLikelihood(){
        return logLikelihood;
    }

    public int getNumIterations(){
        return numIter;
    }

    public int getNumComponents(){
        return numComp;
    }


    private static double[][] standardize(double[][] x, double[] means, double[] scales){
        double z[][] = new double[x.length][means.length];
        for(int s=0; s<x.length; s++){
            if(x[s].length!=means.length)
                throw new IllegalArgumentException("ERROR: expected "+means.length+" predictors, got "+x[s].length);
            for(int k=0; k<means.length; k++)
                z[s][k] = (x[s][k]-means[k]) / scales[k];
        }
        return z;
    }

    static double linearPredictor(double[] coeffs, double[] z){
        double eta = coeffs[0];
        for(int k=0; k<z.length; k++)
            eta += coeffs[k+1]*z[k];
        return Math.max(-ETA_LIMIT, Math.min(ETA_LIMIT, eta));
    }


    private static class LogLikelihood implements MultivariateFunction {
        //parameters are flattened beta: component j's coefficients at j*(numPred+1)...

        final double[][] z;
        final double[][] logY;
        final int numComp, numPred;

        LogLikelihood(double[][] z, double[][] logY, int numComp){
            this.z = z;
            this.logY = logY;
            this.numComp = numComp;
            numPred = z[0].length;
        }

        private double[][] alphas(double[] params, double[][] rawEta){
            double ans[][] = new double[z.length][numComp];
            double coeffs[] = new double[numPred+1];
            for(int j=0; j<numComp; j++){
                System.arraycopy(params, j*(numPred+1), coeffs, 0, numPred+1);
                for(int s=0; s<z.length; s++){
                    double eta = coeffs[0];
                    for(int k=0; k<numPred; k++)
                        eta += coeffs[k+1]*z[s][k];
                    if(rawEta!=null)
                        rawEta[s][j] = eta;
                    ans[s][j] = Math.exp( Math.max(-ETA_LIMIT, Math.min(ETA_LIMIT, eta)) );
                }
            }
            return ans;
        }

        @Override
        public double value(double[] params) {
            double alpha[][] = alphas(params, null);
            double ans = 0;
            for(int s=0; s<z.length; s++){
                double alphaSum = 0;
                for(int j=0; j<numComp; j++){
                    alphaSum += alpha[s][j];
                    ans += (alpha[s][j]-1)*logY[s][j] - Gamma.logGamma(alpha[s][j]);
                }
                ans += Gamma.logGamma(alphaSum);
            }
            return ans;
        }

        MultivariateVectorFunction gradient(){
            return params -> {
                double rawEta[][] = new double[z.length][numComp];
                double alpha[][] = alphas(params, rawEta);
                double grad[] = new double[params.length];
                for(int s=0; s<z.length; s++){
                    double alphaSum = 0;
                    for(int j=0; j<numComp; j++)
                        alphaSum += alpha[s][j];
                    double digammaSum = Gamma.digamma(alphaSum);

                    for(int j=0; j<numComp; j++){
                        if(Math.abs(rawEta[s][j])>ETA_LIMIT)//clamped: flat in these params
                            continue;
                        //d ll/d eta_sj
                        double dEta = alpha[s][j] * (digammaSum - Gamma.digamma(alpha[s][j]) + logY[s][j]);
                        int offset = j*(numPred+1);
                        grad[offset] += dEta;
                        for(int k=0; k<numPred; k++)
                            grad[offset+k+1] += dEta*z[s][k];
                    }
                }
                return grad;
            };
        }
    }
}
