/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.control;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 *
 * Parameters read from config files
 * Each line is "KEY value..." (value is the rest of the line); blank lines and lines starting with % or # are ignored.
 * Keys are case-insensitive.  Params added later override earlier ones.
 *
 */
@SuppressWarnings("serial")
public class ParamSet implements Serializable {

    private static final Logger logger = LogManager.getLogger(ParamSet.class);

    private final HashMap<String,String> params = new HashMap<>();//uppercase key -> value


    public ParamSet(){}


    public void addParamsFromFile(String fileName){
        try(InputStream is = new FileInputStream(fileName)){
            addParamsFromStream(is);
        }
        catch(IOException e){
            throw new RuntimeException("ERROR: couldn't read config file "+fileName, e);
        }
    }

    public void addParamsFromResource(String resourceName){
        InputStream is = ParamSet.class.getResourceAsStream(resourceName);
        if(is==null)
            throw new IllegalArgumentException("ERROR: no config resource "+resourceName);
        try(InputStream in = is){
            addParamsFromStream(in);
        }
        catch(IOException e){
            throw new RuntimeException("ERROR: couldn't read config resource "+resourceName, e);
        }
    }

    public void addParamsFromStream(InputStream is) throws IOException {
        BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
        String line;
        while( (line=br.readLine()) != null ){
            line = line.trim();
            if(line.isEmpty() || line.startsWith("%") || line.startsWith("#"))
                continue;

            String[] keyAndVal = line.split("\\s+", 2);
            String val = (keyAndVal.length>1) ? keyAndVal[1].trim() : "";
            setValue(keyAndVal[0], val);
        }
    }

    public void setValue(String key, String val){
        String old = params.put(key.toUpperCase(), val);
        if(old!=null && !old.equals(val))
            logger.debug("Overriding param {}: {} -> {}", key, old, val);
    }


    public boolean isParamSet(String key){
        return params.containsKey(key.toUpperCase());
    }

    public String getValue(String key){
        String val = params.get(key.toUpperCase());
        if(val==null)
            throw new IllegalArgumentException("ERROR: parameter "+key+" not set");
        return val;
    }

    public String getValue(String key, String defaultVal){
        String val = params.get(key.toUpperCase());
        return (val==null) ? defaultVal : val;
    }

    public int getInt(String key, int defaultVal){
        String val = params.get(key.toUpperCase());
        if(val==null)
            return defaultVal;
        try {
            return Integer.parseInt(val);
        }
        catch(NumberFormatException e){
            throw new IllegalArgumentException("ERROR: parameter "+key+" should be an integer, got "+val, e);
        }
    }

    public double getDouble(String key, double defaultVal){
        String val = params.get(key.toUpperCase());
        if(val==null)
            return defaultVal;
        try {
            return Double.parseDouble(val);
        }
        catch(NumberFormatException e){
            throw new IllegalArgumentException("ERROR: parameter "+key+" should be a number, got "+val, e);
        }
    }
}
