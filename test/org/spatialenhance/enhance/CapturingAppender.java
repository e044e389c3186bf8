/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package org.spatialenhance.enhance;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;

/**
 *
 * Collects the events logged by one class's logger, so tests can check what was reported
 * Use with try-with-resources; closing detaches the appender.
 *
 */
class CapturingAppender extends AbstractAppender implements AutoCloseable {

    private final Logger logger;
    private final CopyOnWriteArrayList<Level> levels = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<String> messages = new CopyOnWriteArrayList<>();


    private CapturingAppender(Logger logger){
        super("capture-"+logger.getName(), null, null, true, Property.EMPTY_ARRAY);
        this.logger = logger;
    }

    static CapturingAppender attachTo(Class<?> loggingClass){
        CapturingAppender appender = new CapturingAppender((Logger)LogManager.getLogger(loggingClass));
        appender.start();
        appender.logger.addAppender(appender);
        return appender;
    }


    @Override
    public void append(LogEvent event) {
        levels.add(event.getLevel());
        messages.add(event.getMessage().getFormattedMessage());
    }

    List<String> messagesAt(Level level){
        ArrayList<String> ans = new ArrayList<>();
        for(int i=0; i<levels.size(); i++){
            if(levels.get(i)==level)
                ans.add(messages.get(i));
        }
        return ans;
    }

    @Override
    public void close() {
        logger.removeAppender(this);
        stop();
    }
}
