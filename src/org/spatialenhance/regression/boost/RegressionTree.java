/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.regression.boost;

import cern.colt.matrix.DoubleMatrix2D;
import java.io.Serializable;
import java.util.ArrayList;

/**
 *
 * A regression tree fit to first- and second-order gradients of the loss,
 * using exact greedy split search (every midpoint between adjacent distinct values is a candidate)
 *
 * Leaf values already include the learning rate, so an ensemble's prediction is just
 * the base score plus the sum of its trees' outputs.
 *
 */
@SuppressWarnings("serial")
public class RegressionTree implements Serializable {

    static final double MIN_SPLIT_GAIN = 1e-6;//splits gaining less than this aren't worth a node

    private static class Node implements Serializable {
        int splitDim = -1;//-1 for leaf
        double splitVal;//go left if x[splitDim] < splitVal
        int left=-1, right=-1;
        double leafVal;
    }

    private final ArrayList<Node> nodes = new ArrayList<>();//root is nodes.get(0)
    private int depth = 0;


    private RegressionTree(){}


    /**
     * Grow a tree on samples X (rows), where grad and hess are the loss derivatives wrt the current predictions
     * sortedByDim[d] lists all sample indices in increasing order of dimension d
     */
    static RegressionTree grow(DoubleMatrix2D X, int[][] sortedByDim, double[] grad, double[] hess, BoostingParams params){
        RegressionTree tree = new RegressionTree();
        int allSamples[] = new int[X.rows()];
        for(int s=0; s<allSamples.length; s++)
            allSamples[s] = s;
        tree.growNode(allSamples, 0, X, sortedByDim, grad, hess, params);
        return tree;
    }


    private int growNode(int[] members, int curDepth, DoubleMatrix2D X, int[][] sortedByDim,
            double[] grad, double[] hess, BoostingParams params){

        Node node = new Node();
        int nodeIndex = nodes.size();
        nodes.add(node);
        depth = Math.max(depth, curDepth);

        double G = 0, H = 0;
        for(int s : members){
            G += grad[s];
            H += hess[s];
        }

        SplitCandidate best = null;
        if(curDepth < params.maxDepth)
            best = findBestSplit(members, G, H, X, sortedByDim, grad, hess, params);

        if(best==null){
            node.leafVal = params.eta * leafWeight(G, H, params.lambda);
            return nodeIndex;
        }

        int numLeft = 0;
        for(int s : members){
            if(X.getQuick(s,best.dim) < best.val)
                numLeft++;
        }
        int leftMembers[] = new int[numLeft];
        int rightMembers[] = new int[members.length-numLeft];
        int l=0, r=0;
        for(int s : members){
            if(X.getQuick(s,best.dim) < best.val)
                leftMembers[l++] = s;
            else
                rightMembers[r++] = s;
        }

        node.splitDim = best.dim;
        node.splitVal = best.val;
        node.left = growNode(leftMembers, curDepth+1, X, sortedByDim, grad, hess, params);
        node.right = growNode(rightMembers, curDepth+1, X, sortedByDim, grad, hess, params);
        return nodeIndex;
    }


    private static class SplitCandidate {
        int dim;
        double val;
        double gain;

        SplitCandidate(int dim, double val, double gain) {
            this.dim = dim;
            this.val = val;
            this.gain = gain;
        }
    }


    private static SplitCandidate findBestSplit(int[] members, double G, double H, DoubleMatrix2D X,
            int[][] sortedByDim, double[] grad, double[] hess, BoostingParams params){

        boolean inNode[] = new boolean[X.rows()];
        for(int s : members)
            inNode[s] = true;

        double parentScore = G*G/(H+params.lambda);
        SplitCandidate best = null;

        for(int dim=0; dim<X.columns(); dim++){
            double GL = 0, HL = 0;
            int prev = -1;//previous member in sorted order
            for(int s : sortedByDim[dim]){
                if(!inNode[s])
                    continue;

                if(prev!=-1){
                    double prevVal = X.getQuick(prev,dim);
                    double curVal = X.getQuick(s,dim);
                    //splitting between prev and s: left gets everything up to prev
                    if(curVal > prevVal){
                        double GR = G-GL, HR = H-HL;
                        if(HL>=params.minChildWeight && HR>=params.minChildWeight){
                            double gain = 0.5 * ( GL*GL/(HL+params.lambda) + GR*GR/(HR+params.lambda) - parentScore );
                            if( gain > MIN_SPLIT_GAIN && (best==null || gain > best.gain) )
                                best = new SplitCandidate(dim, 0.5*(prevVal+curVal), gain);
                        }
                    }
                }

                GL += grad[s];
                HL += hess[s];
                prev = s;
            }
        }

        return best;
    }


    static double leafWeight(double G, double H, double lambda){
        return -G/(H+lambda);
    }


    public double predict(DoubleMatrix2D X, int row){
        Node node = nodes.get(0);
        while(node.splitDim!=-1){
            if(X.getQuick(row, node.splitDim) < node.splitVal)
                node = nodes.get(node.left);
            else
                node = nodes.get(node.right);
        }
        return node.leafVal;
    }

    public int numNodes(){
        return nodes.size();
    }

    public int numLeaves(){
        int ans = 0;
        for(Node node : nodes){
            if(node.splitDim==-1)
                ans++;
        }
        return ans;
    }

    public int getDepth(){
        return depth;
    }
}
